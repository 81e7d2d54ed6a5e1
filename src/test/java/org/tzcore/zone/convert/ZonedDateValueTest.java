package org.tzcore.zone.convert;

import org.junit.jupiter.api.Test;
import org.tzcore.zone.resolve.TimezoneDescriptor;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ZonedDateValueTest {
    private static final TimezoneDescriptor UTC = TimezoneDescriptor.utc();

    @Test
    void testFactorySplitsNanos() {
        ZonedDateValue value = ZonedDateValue.of(LocalDateTime.of(2024, 2, 29, 23, 59, 59, 987_654_321), UTC);

        assertEquals(LocalDateTime.of(2024, 2, 29, 23, 59, 59), value.getWallTime());
        assertEquals(987, value.getMillisecond());
        assertSame(UTC, value.getTimezone());
    }

    @Test
    void testShiftCrossesDayAndKeepsMillis() {
        ZonedDateValue value = ZonedDateValue.of(LocalDateTime.of(2024, 2, 29, 23, 30, 0, 5_000_000), UTC);
        ZonedDateValue shifted = value.shiftByMinutes(45);

        assertEquals(LocalDateTime.of(2024, 3, 1, 0, 15), shifted.getWallTime());
        assertEquals(5, shifted.getMillisecond());
        assertEquals(value, shifted.shiftByMinutes(-45));
    }

    @Test
    void testWithTimezoneKeepsWallClock() {
        TimezoneDescriptor other = TimezoneDescriptor.builder().fullName("Etc/GMT-2").abbreviation("+02").offsetUtc(120).build();
        ZonedDateValue value = ZonedDateValue.of(LocalDateTime.of(2024, 1, 1, 0, 0), UTC).withTimezone(other);

        assertEquals(LocalDateTime.of(2024, 1, 1, 0, 0), value.getWallTime());
        assertSame(other, value.getTimezone());
    }

    @Test
    void testValidation() {
        LocalDateTime at = LocalDateTime.of(2024, 1, 1, 0, 0);
        assertThrows(IllegalArgumentException.class,
                () -> ZonedDateValue.builder().wallTime(at).millisecond(1000).timezone(UTC).build());
        assertThrows(IllegalArgumentException.class,
                () -> ZonedDateValue.builder().wallTime(at).millisecond(-1).timezone(UTC).build());
        assertThrows(NullPointerException.class,
                () -> ZonedDateValue.builder().wallTime(at).build());
        assertThrows(NullPointerException.class, () -> ZonedDateValue.of(null, UTC));
    }
}
