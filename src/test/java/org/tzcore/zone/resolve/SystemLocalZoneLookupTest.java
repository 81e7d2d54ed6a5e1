package org.tzcore.zone.resolve;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SystemLocalZoneLookupTest {
    private static final LocalDateTime AT = LocalDateTime.of(2024, 1, 15, 12, 0);

    @Test
    void testRegionZoneReportsId() {
        assertEquals("Europe/Berlin", new SystemLocalZoneLookup(() -> ZoneId.of("Europe/Berlin")).lookup(AT));
    }

    @Test
    void testFixedOffsetsReportCompactForm() {
        assertEquals("UTC", new SystemLocalZoneLookup(() -> ZoneOffset.UTC).lookup(AT));
        assertEquals("+0530", new SystemLocalZoneLookup(() -> ZoneOffset.ofHoursMinutes(5, 30)).lookup(AT));
        assertEquals("-0800", new SystemLocalZoneLookup(() -> ZoneOffset.ofHours(-8)).lookup(AT));
    }

    @Test
    void testJvmDefault() {
        assertFalse(new SystemLocalZoneLookup().lookup(AT).isEmpty());
    }

    @Test
    void testNullDefaultZone() {
        assertThrows(NullPointerException.class, () -> new SystemLocalZoneLookup(() -> null).lookup(AT));
    }
}
