package org.tzcore.zone.resolve;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.tzcore.core.time.TimeUtils;
import org.tzcore.zone.catalog.PeriodBoundary;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Descriptor validity edge: an unbounded sentinel, or a wall-clock time tagged with its weekday.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BoundaryDate {
    private static final BoundaryDate MIN = new BoundaryDate(PeriodBoundary.Kind.MIN, null, null);
    private static final BoundaryDate MAX = new BoundaryDate(PeriodBoundary.Kind.MAX, null, null);

    PeriodBoundary.Kind kind;

    /**
     * ISO weekday of {@link #wallTime}, {@code null} when unbounded.
     */
    DayOfWeek dayOfWeek;

    /**
     * Wall-clock time, {@code null} when unbounded.
     */
    LocalDateTime wallTime;

    /**
     * Returns the lower unbounded sentinel.
     */
    public static BoundaryDate min() {
        return MIN;
    }

    /**
     * Returns the upper unbounded sentinel.
     */
    public static BoundaryDate max() {
        return MAX;
    }

    /**
     * Returns a bounded edge tagged with the weekday of its calendar date.
     */
    public static BoundaryDate of(LocalDateTime wallTime) {
        Objects.requireNonNull(wallTime, "wallTime");
        return new BoundaryDate(PeriodBoundary.Kind.AT, wallTime.getDayOfWeek(), wallTime);
    }

    /**
     * Converts a catalog period edge; unbounded edges pass through unchanged.
     */
    public static BoundaryDate from(PeriodBoundary boundary) {
        Objects.requireNonNull(boundary, "boundary");
        switch (boundary.getKind()) {
            case MIN:
                return MIN;
            case MAX:
                return MAX;
            default:
                long wallSeconds = boundary.getWallSeconds();
                return new BoundaryDate(
                        PeriodBoundary.Kind.AT,
                        TimeUtils.dayOfWeek(wallSeconds),
                        TimeUtils.fromWallSeconds(wallSeconds)
                );
        }
    }

    /**
     * Returns whether this edge is an unbounded sentinel.
     */
    public boolean isUnbounded() {
        return kind != PeriodBoundary.Kind.AT;
    }

    @Override
    public String toString() {
        return isUnbounded() ? kind.name() : dayOfWeek + " " + wallTime;
    }
}
