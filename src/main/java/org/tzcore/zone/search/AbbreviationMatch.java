package org.tzcore.zone.search;

import org.tzcore.zone.catalog.RawPeriod;

import java.util.Objects;

/**
 * Zone and period found by an abbreviation search.
 *
 * @param zoneName owning zone name.
 * @param period matching period.
 */
public record AbbreviationMatch(String zoneName, RawPeriod period) {
    public AbbreviationMatch {
        Objects.requireNonNull(zoneName, "zoneName");
        Objects.requireNonNull(period, "period");
    }
}
