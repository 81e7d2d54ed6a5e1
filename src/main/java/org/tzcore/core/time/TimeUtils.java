package org.tzcore.core.time;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Shared deterministic wall-clock helpers for zone resolution and conversion.
 *
 * <p>Wall-clock seconds are calendar/time values counted from 1970-01-01T00:00:00 without any
 * zone normalization applied. All methods are safe for negative values.</p>
 */
public final class TimeUtils {

    private static final long SECONDS_PER_DAY = 86_400L;
    private static final long SECONDS_PER_HOUR = 3600L;
    private static final long SECONDS_PER_MINUTE = 60L;
    private static final int DAYS_PER_WEEK = 7;
    // 1970-01-01 was a Thursday. Offset by +3 to keep Monday = 0.
    private static final int EPOCH_DAY_OFFSET = 3;

    /**
     * Prevents instantiation of this utility class.
     */
    private TimeUtils() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Converts a calendar/time tuple into linear wall-clock seconds.
     *
     * @param wallTime calendar/time value as locally displayed.
     * @return seconds since 1970-01-01T00:00:00 on the same wall clock.
     */
    public static long toWallSeconds(LocalDateTime wallTime) {
        if (wallTime == null) {
            throw new IllegalArgumentException("wallTime cannot be null");
        }
        return wallTime.toEpochSecond(ZoneOffset.UTC);
    }

    /**
     * Converts linear wall-clock seconds back to a calendar/time tuple.
     *
     * @param wallSeconds seconds since 1970-01-01T00:00:00 on the wall clock.
     * @return calendar/time value.
     */
    public static LocalDateTime fromWallSeconds(long wallSeconds) {
        return LocalDateTime.ofEpochSecond(wallSeconds, 0, ZoneOffset.UTC);
    }

    /**
     * Extracts ISO day of week from wall-clock seconds.
     *
     * @param wallSeconds wall-clock seconds.
     * @return day-of-week of the calendar date containing {@code wallSeconds}.
     */
    public static DayOfWeek dayOfWeek(long wallSeconds) {
        long daysSinceEpoch = Math.floorDiv(wallSeconds, SECONDS_PER_DAY);

        // Epoch was Thursday; adjust to Monday=0 convention.
        long dayIndex = Math.floorMod(daysSinceEpoch + EPOCH_DAY_OFFSET, (long) DAYS_PER_WEEK);
        return DayOfWeek.of((int) dayIndex + 1);
    }

    /**
     * Converts offset seconds into whole minutes, truncating toward zero.
     *
     * @param offsetSeconds offset in seconds (can be negative).
     * @return offset in minutes.
     */
    public static int toOffsetMinutes(long offsetSeconds) {
        return Math.toIntExact(offsetSeconds / SECONDS_PER_MINUTE);
    }

    /**
     * Formats a signed minute offset as {@code +HH:mm} / {@code -HH:mm}.
     * Intended for diagnostics and CLI output.
     *
     * @param offsetMinutes offset in minutes.
     * @return formatted offset like {@code -05:00}.
     */
    public static String formatOffset(int offsetMinutes) {
        char sign = offsetMinutes < 0 ? '-' : '+';
        long magnitude = Math.abs((long) offsetMinutes);
        long hours = magnitude / (SECONDS_PER_HOUR / SECONDS_PER_MINUTE);
        long minutes = magnitude % (SECONDS_PER_HOUR / SECONDS_PER_MINUTE);
        return String.format("%c%02d:%02d", sign, hours, minutes);
    }
}
