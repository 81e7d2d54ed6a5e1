package org.tzcore.zone.resolve;

import lombok.experimental.UtilityClass;
import org.tzcore.core.time.TimeUtils;
import org.tzcore.zone.catalog.RawPeriod;

import java.util.Objects;

/**
 * Converts a catalog period and its owning zone into a {@link TimezoneDescriptor}.
 */
@UtilityClass
public class PeriodNormalizer {

    /**
     * Normalizes one period. Offsets are truncated toward zero to whole minutes.
     *
     * @param zoneName owning zone name.
     * @param period catalog period.
     * @return descriptor carrying the period's window.
     */
    public static TimezoneDescriptor normalize(String zoneName, RawPeriod period) {
        Objects.requireNonNull(period, "period");
        return TimezoneDescriptor.builder()
                .fullName(Objects.requireNonNull(zoneName, "zoneName"))
                .abbreviation(period.getAbbreviation())
                .offsetStd(TimeUtils.toOffsetMinutes(period.getStdOffsetSeconds()))
                .offsetUtc(TimeUtils.toOffsetMinutes(period.getUtcOffsetSeconds()))
                .validFrom(BoundaryDate.from(period.getFrom()))
                .validUntil(BoundaryDate.from(period.getUntil()))
                .build();
    }
}
