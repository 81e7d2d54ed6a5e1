package org.tzcore.zone.catalog;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.tzcore.core.time.TimeUtils;

import java.time.LocalDateTime;

/**
 * One edge of a period validity window: unbounded below, unbounded above, or a wall-clock second.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PeriodBoundary {
    private static final PeriodBoundary MIN = new PeriodBoundary(Kind.MIN, 0L);
    private static final PeriodBoundary MAX = new PeriodBoundary(Kind.MAX, 0L);

    /**
     * Boundary shape.
     */
    public enum Kind {
        MIN,
        AT,
        MAX
    }

    Kind kind;

    /**
     * Wall-clock seconds for {@link Kind#AT}; zero for unbounded edges.
     */
    long wallSeconds;

    /**
     * Returns the boundary that precedes every instant.
     */
    public static PeriodBoundary min() {
        return MIN;
    }

    /**
     * Returns the boundary that follows every instant.
     */
    public static PeriodBoundary max() {
        return MAX;
    }

    /**
     * Returns a concrete boundary at the given wall-clock second.
     */
    public static PeriodBoundary at(long wallSeconds) {
        return new PeriodBoundary(Kind.AT, wallSeconds);
    }

    /**
     * Returns a concrete boundary at the given wall-clock time.
     */
    public static PeriodBoundary at(LocalDateTime wallTime) {
        return at(TimeUtils.toWallSeconds(wallTime));
    }

    /**
     * Returns whether this boundary is one of the unbounded sentinels.
     */
    public boolean isUnbounded() {
        return kind != Kind.AT;
    }

    /**
     * Returns wall-clock time of a concrete boundary.
     *
     * @throws IllegalStateException when this boundary is unbounded.
     */
    public LocalDateTime toWallTime() {
        if (isUnbounded()) {
            throw new IllegalStateException("unbounded boundary has no wall time: " + kind);
        }
        return TimeUtils.fromWallSeconds(wallSeconds);
    }

    @Override
    public String toString() {
        return isUnbounded() ? kind.name() : toWallTime().toString();
    }
}
