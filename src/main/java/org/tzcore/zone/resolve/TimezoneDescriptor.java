package org.tzcore.zone.resolve;

import lombok.Builder;
import lombok.Value;
import org.tzcore.core.time.TimeUtils;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Immutable resolved timezone with bounded validity.
 *
 * <p>Offsets are in minutes. The total offset from UTC is {@code offsetUtc + offsetStd}.</p>
 */
@Value
public class TimezoneDescriptor {
    private static final TimezoneDescriptor UTC = TimezoneDescriptor.builder()
            .fullName("UTC")
            .abbreviation("UTC")
            .build();

    /**
     * Canonical zone name, or synthesized name for fixed-offset pseudo-zones.
     */
    String fullName;

    /**
     * Short display code, for example {@code EST}.
     */
    String abbreviation;

    /**
     * Daylight-saving component in minutes.
     */
    int offsetStd;

    /**
     * Base UTC offset in minutes.
     */
    int offsetUtc;

    BoundaryDate validFrom;

    BoundaryDate validUntil;

    @Builder
    private TimezoneDescriptor(
            String fullName,
            String abbreviation,
            int offsetStd,
            int offsetUtc,
            BoundaryDate validFrom,
            BoundaryDate validUntil
    ) {
        this.fullName = Objects.requireNonNull(fullName, "fullName");
        this.abbreviation = Objects.requireNonNull(abbreviation, "abbreviation");
        this.offsetStd = offsetStd;
        this.offsetUtc = offsetUtc;
        this.validFrom = validFrom == null ? BoundaryDate.min() : validFrom;
        this.validUntil = validUntil == null ? BoundaryDate.max() : validUntil;
        if (!this.validFrom.isUnbounded() && !this.validUntil.isUnbounded()
                && !this.validFrom.getWallTime().isBefore(this.validUntil.getWallTime())) {
            throw new IllegalArgumentException(
                    "validFrom must precede validUntil: " + this.validFrom + " >= " + this.validUntil);
        }
    }

    /**
     * Returns the fixed UTC descriptor with unbounded validity.
     */
    public static TimezoneDescriptor utc() {
        return UTC;
    }

    /**
     * Returns total offset from UTC in minutes.
     */
    public int totalOffsetMinutes() {
        return offsetUtc + offsetStd;
    }

    /**
     * Returns whether the validity window contains the wall-clock time.
     *
     * @param wallTime wall-clock time.
     * @return {@code true} when inside {@code [validFrom, validUntil)}.
     */
    public boolean isValidAt(LocalDateTime wallTime) {
        Objects.requireNonNull(wallTime, "wallTime");
        boolean afterStart = validFrom.isUnbounded() || !wallTime.isBefore(validFrom.getWallTime());
        boolean beforeEnd = validUntil.isUnbounded() || wallTime.isBefore(validUntil.getWallTime());
        return afterStart && beforeEnd;
    }

    @Override
    public String toString() {
        return fullName + " (" + abbreviation + ", UTC" + TimeUtils.formatOffset(totalOffsetMinutes())
                + ", valid " + validFrom + " .. " + validUntil + ')';
    }
}
