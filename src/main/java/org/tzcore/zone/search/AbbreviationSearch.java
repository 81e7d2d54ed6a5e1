package org.tzcore.zone.search;

import org.tzcore.zone.catalog.RawPeriod;
import org.tzcore.zone.catalog.ZoneCatalog;

import java.util.Objects;
import java.util.Optional;

/**
 * Cross-zone scan for the first period that carries an abbreviation at a wall-clock instant.
 *
 * <p>Zones are visited in catalog order and the scan stops at the first hit. When several zones
 * share an abbreviation at the same instant, the winner is simply the one listed first. Cost is
 * linear in the total number of periods; no results are memoized.</p>
 */
public final class AbbreviationSearch {
    private final ZoneCatalog catalog;

    /**
     * Creates a search bound to one catalog.
     *
     * @param catalog zone catalog.
     */
    public AbbreviationSearch(ZoneCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    /**
     * Finds the first zone period matching abbreviation and instant.
     *
     * @param abbreviation target abbreviation.
     * @param wallSeconds wall-clock seconds.
     * @return first match in catalog order, or empty.
     */
    public Optional<AbbreviationMatch> find(String abbreviation, long wallSeconds) {
        if (abbreviation == null || abbreviation.isEmpty()) {
            return Optional.empty();
        }
        for (String zoneName : catalog.allZoneNames()) {
            for (RawPeriod period : catalog.periodsFor(zoneName)) {
                if (abbreviation.equals(period.getAbbreviation()) && period.contains(wallSeconds)) {
                    return Optional.of(new AbbreviationMatch(zoneName, period));
                }
            }
        }
        return Optional.empty();
    }
}
