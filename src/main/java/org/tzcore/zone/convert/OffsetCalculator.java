package org.tzcore.zone.convert;

import org.tzcore.zone.resolve.TimezoneDescriptor;

import java.util.Objects;

/**
 * Computes and applies the wall-clock adjustment between two timezone descriptors.
 */
public final class OffsetCalculator {

    /**
     * Returns minutes to add to {@code date}'s wall clock to express it in {@code target}.
     *
     * <p>When both descriptors share a base UTC offset only the daylight-saving components
     * differ; otherwise the total offsets are compared.</p>
     *
     * @param date tagged date value.
     * @param target destination descriptor.
     * @return signed minute delta.
     */
    public int diff(ZonedDateValue date, TimezoneDescriptor target) {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(target, "target");
        TimezoneDescriptor origin = date.getTimezone();
        if (origin.getOffsetUtc() == target.getOffsetUtc()) {
            return target.getOffsetStd() - origin.getOffsetStd();
        }
        return target.totalOffsetMinutes() - origin.totalOffsetMinutes();
    }

    /**
     * Re-expresses {@code date} in {@code target}; the millisecond part is carried over unchanged.
     *
     * @param date tagged date value.
     * @param target destination descriptor.
     * @return new value tagged with {@code target}.
     */
    public ZonedDateValue convert(ZonedDateValue date, TimezoneDescriptor target) {
        int delta = diff(date, target);
        return date.shiftByMinutes(delta)
                .toBuilder()
                .timezone(target)
                .millisecond(date.getMillisecond())
                .build();
    }
}
