package org.tzcore.zone.convert;

import lombok.Builder;
import lombok.Value;
import org.tzcore.zone.resolve.TimezoneDescriptor;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Minimal date/time value: wall clock at second precision, millisecond part, attached zone.
 *
 * <p>Instances are immutable; every change returns a copy.</p>
 */
@Value
public class ZonedDateValue {

    /**
     * Calendar/time component, always truncated to whole seconds.
     */
    LocalDateTime wallTime;

    /**
     * Sub-second component in {@code [0, 999]}.
     */
    int millisecond;

    TimezoneDescriptor timezone;

    @Builder(toBuilder = true)
    private ZonedDateValue(LocalDateTime wallTime, int millisecond, TimezoneDescriptor timezone) {
        this.wallTime = Objects.requireNonNull(wallTime, "wallTime").truncatedTo(ChronoUnit.SECONDS);
        if (millisecond < 0 || millisecond > 999) {
            throw new IllegalArgumentException("millisecond must be in [0, 999]: " + millisecond);
        }
        this.millisecond = millisecond;
        this.timezone = Objects.requireNonNull(timezone, "timezone");
    }

    /**
     * Creates a value, splitting nanoseconds of {@code wallTime} into the millisecond part.
     */
    public static ZonedDateValue of(LocalDateTime wallTime, TimezoneDescriptor timezone) {
        Objects.requireNonNull(wallTime, "wallTime");
        return new ZonedDateValue(wallTime, wallTime.getNano() / 1_000_000, timezone);
    }

    /**
     * Returns a copy with the wall clock moved by the given minutes.
     */
    public ZonedDateValue shiftByMinutes(long minutes) {
        return toBuilder().wallTime(wallTime.plusMinutes(minutes)).build();
    }

    /**
     * Returns a copy tagged with a different timezone, wall clock unchanged.
     */
    public ZonedDateValue withTimezone(TimezoneDescriptor newTimezone) {
        return toBuilder().timezone(newTimezone).build();
    }
}
