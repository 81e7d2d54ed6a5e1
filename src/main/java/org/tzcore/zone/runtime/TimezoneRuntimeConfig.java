package org.tzcore.zone.runtime;

import lombok.Builder;
import lombok.Value;
import org.tzcore.zone.catalog.JdkZoneCatalog;
import org.tzcore.zone.resolve.LocalZoneLookup;
import org.tzcore.zone.resolve.SystemLocalZoneLookup;

import java.time.Clock;
import java.util.Locale;

/**
 * Runtime configuration bound once at startup by {@link TimezoneRuntimeBinder}.
 */
@Value
@Builder(toBuilder = true)
public class TimezoneRuntimeConfig {

    /**
     * Last year whose transitions the JDK-backed catalog materializes.
     */
    @Builder.Default
    int horizonYear = JdkZoneCatalog.DEFAULT_HORIZON_YEAR;

    /**
     * Locale used to render period abbreviations in the JDK-backed catalog.
     */
    @Builder.Default
    Locale abbreviationLocale = Locale.ENGLISH;

    /**
     * Builds the abbreviation index during binding instead of on first abbreviation query.
     */
    boolean eagerAbbreviationIndex;

    /**
     * Local-zone collaborator used by {@code local(...)} lookups.
     */
    @Builder.Default
    LocalZoneLookup localZoneLookup = new SystemLocalZoneLookup();

    /**
     * Clock supplying "now" for instant-less lookups.
     */
    @Builder.Default
    Clock clock = Clock.systemUTC();

    /**
     * Returns default runtime config: JDK catalog to 2100, English abbreviations, lazy index.
     */
    public static TimezoneRuntimeConfig defaults() {
        return TimezoneRuntimeConfig.builder().build();
    }
}
