package org.tzcore.zone.catalog;

import java.util.List;

/**
 * Read-only view of a timezone database: zones and their ordered offset periods.
 *
 * <p>Implementations must be safe for concurrent reads once constructed.</p>
 */
public interface ZoneCatalog {

    /**
     * Returns whether a zone with this exact name is present.
     *
     * @param zoneName zone name, may be {@code null}.
     * @return {@code true} when the zone exists.
     */
    boolean zoneExists(String zoneName);

    /**
     * Returns the ordered period list of one zone.
     *
     * @param zoneName existing zone name.
     * @return immutable ordered period list.
     * @throws IllegalArgumentException when the zone is unknown.
     */
    List<RawPeriod> periodsFor(String zoneName);

    /**
     * Returns periods of one zone active at a wall-clock instant, most specific first.
     *
     * <p>Several periods can be returned around transitions where the wall clock repeats.</p>
     *
     * @param zoneName existing zone name.
     * @param wallSeconds wall-clock seconds.
     * @return immutable list, empty only on catalog data defects.
     */
    default List<RawPeriod> periodsActiveAt(String zoneName, long wallSeconds) {
        return periodsFor(zoneName).stream()
                .filter(period -> period.contains(wallSeconds))
                .toList();
    }

    /**
     * Returns all zone names in canonical catalog order.
     *
     * @return immutable ordered zone names.
     */
    List<String> allZoneNames();
}
