package org.tzcore.zone.search;

import lombok.experimental.UtilityClass;
import org.tzcore.zone.catalog.RawPeriod;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Interval-containment lookup over one zone's period list.
 */
@UtilityClass
public class PeriodSearch {

    /**
     * Selects the first period whose {@code [from, until)} window contains the instant.
     *
     * @param periods ordered period list.
     * @param wallSeconds wall-clock seconds.
     * @return matching period, or empty when no window contains the instant.
     */
    public static Optional<RawPeriod> find(List<RawPeriod> periods, long wallSeconds) {
        Objects.requireNonNull(periods, "periods");
        for (RawPeriod period : periods) {
            if (period.contains(wallSeconds)) {
                return Optional.of(period);
            }
        }
        return Optional.empty();
    }
}
