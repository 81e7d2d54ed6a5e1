package org.tzcore.zone.catalog;

import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * One read-only entry in a zone's period list.
 *
 * <p>The validity window is half-open {@code [from, until)} on the wall clock. The total offset
 * from UTC is {@code utcOffsetSeconds + stdOffsetSeconds}: the first is the zone's base offset,
 * the second the daylight-saving amount layered on top of it.</p>
 */
@Value
public class RawPeriod {

    /**
     * Inclusive lower window edge.
     */
    PeriodBoundary from;

    /**
     * Exclusive upper window edge.
     */
    PeriodBoundary until;

    /**
     * Base UTC offset in seconds.
     */
    int utcOffsetSeconds;

    /**
     * Daylight-saving component in seconds, zero outside DST.
     */
    int stdOffsetSeconds;

    /**
     * Display abbreviation, possibly empty.
     */
    String abbreviation;

    @Builder
    private RawPeriod(
            PeriodBoundary from,
            PeriodBoundary until,
            int utcOffsetSeconds,
            int stdOffsetSeconds,
            String abbreviation
    ) {
        this.from = from == null ? PeriodBoundary.min() : from;
        this.until = until == null ? PeriodBoundary.max() : until;
        if (this.from.getKind() == PeriodBoundary.Kind.MAX) {
            throw new IllegalArgumentException("period.from cannot be MAX");
        }
        if (this.until.getKind() == PeriodBoundary.Kind.MIN) {
            throw new IllegalArgumentException("period.until cannot be MIN");
        }
        if (!this.from.isUnbounded() && !this.until.isUnbounded()
                && this.from.getWallSeconds() >= this.until.getWallSeconds()) {
            throw new IllegalArgumentException(
                    "period.from must precede period.until: " + this.from + " >= " + this.until);
        }
        this.utcOffsetSeconds = utcOffsetSeconds;
        this.stdOffsetSeconds = stdOffsetSeconds;
        this.abbreviation = Objects.requireNonNull(abbreviation, "abbreviation");
    }

    /**
     * Returns whether the {@code [from, until)} window contains the given wall-clock second.
     *
     * @param wallSeconds wall-clock seconds.
     * @return {@code true} when the instant lies inside this window.
     */
    public boolean contains(long wallSeconds) {
        boolean afterStart = from.isUnbounded() || from.getWallSeconds() <= wallSeconds;
        boolean beforeEnd = until.isUnbounded() || wallSeconds < until.getWallSeconds();
        return afterStart && beforeEnd;
    }

    /**
     * Returns total UTC offset in seconds.
     */
    public int totalOffsetSeconds() {
        return utcOffsetSeconds + stdOffsetSeconds;
    }

    /**
     * Returns whether this period carries a non-empty abbreviation.
     */
    public boolean hasAbbreviation() {
        return !abbreviation.isEmpty();
    }
}
