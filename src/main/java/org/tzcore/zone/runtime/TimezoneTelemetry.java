package org.tzcore.zone.runtime;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable startup telemetry for a bound timezone runtime.
 */
@Value
@Builder
public class TimezoneTelemetry {

    /**
     * Catalog implementation description.
     */
    String catalogDescription;

    /**
     * Number of zones in the catalog.
     */
    int zoneCount;

    /**
     * Distinct abbreviations, or {@code -1} when the index is still unbuilt.
     */
    int abbreviationCount;

    /**
     * Materialization horizon, or {@code -1} for catalogs without one.
     */
    int horizonYear;

    /**
     * Abbreviation locale tag.
     */
    String abbreviationLocale;
}
