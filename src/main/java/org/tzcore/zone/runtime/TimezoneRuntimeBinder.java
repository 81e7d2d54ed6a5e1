package org.tzcore.zone.runtime;

import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tzcore.core.error.ReasonCode;
import org.tzcore.core.error.TimezoneException;
import org.tzcore.zone.catalog.JdkZoneCatalog;
import org.tzcore.zone.catalog.ZoneCatalog;
import org.tzcore.zone.convert.OffsetCalculator;
import org.tzcore.zone.index.AbbreviationIndex;
import org.tzcore.zone.resolve.ZoneResolver;

import java.util.Objects;

/**
 * Startup-only timezone runtime binder.
 *
 * <p>Validates one runtime config, builds the catalog and abbreviation index once, and
 * constructs the immutable resolver and offset calculator shared by all callers.</p>
 */
public final class TimezoneRuntimeBinder {
    private static final Logger LOG = LoggerFactory.getLogger(TimezoneRuntimeBinder.class);

    /**
     * Binds a runtime over the JDK-bundled tz database.
     *
     * @param runtimeConfig runtime configuration.
     * @return immutable runtime binding.
     */
    public Binding bind(TimezoneRuntimeConfig runtimeConfig) {
        TimezoneRuntimeConfig config = requireConfig(runtimeConfig);
        if (config.getAbbreviationLocale() == null) {
            throw new TimezoneException(ReasonCode.CONFIG_INVALID, "abbreviationLocale must be provided");
        }
        JdkZoneCatalog catalog;
        try {
            catalog = new JdkZoneCatalog(config.getHorizonYear(), config.getAbbreviationLocale());
        } catch (IllegalArgumentException ex) {
            throw new TimezoneException(ReasonCode.CONFIG_INVALID, ex.getMessage(), ex);
        }
        return bind(config, catalog);
    }

    /**
     * Binds a runtime over a caller-supplied catalog.
     *
     * @param runtimeConfig runtime configuration; catalog-specific fields are ignored.
     * @param catalog zone catalog.
     * @return immutable runtime binding.
     */
    public Binding bind(TimezoneRuntimeConfig runtimeConfig, ZoneCatalog catalog) {
        TimezoneRuntimeConfig config = requireConfig(runtimeConfig);
        ZoneCatalog nonNullCatalog = Objects.requireNonNull(catalog, "catalog");
        if (config.getLocalZoneLookup() == null) {
            throw new TimezoneException(ReasonCode.CONFIG_INVALID, "localZoneLookup must be provided");
        }
        if (config.getClock() == null) {
            throw new TimezoneException(ReasonCode.CONFIG_INVALID, "clock must be provided");
        }

        AbbreviationIndex index = config.isEagerAbbreviationIndex()
                ? AbbreviationIndex.eager(nonNullCatalog)
                : AbbreviationIndex.lazy(nonNullCatalog);
        ZoneResolver resolver = new ZoneResolver(nonNullCatalog, index, config.getLocalZoneLookup(), config.getClock());

        TimezoneTelemetry telemetry = TimezoneTelemetry.builder()
                .catalogDescription(nonNullCatalog.toString())
                .zoneCount(nonNullCatalog.allZoneNames().size())
                .abbreviationCount(index.isBuilt() ? index.size() : -1)
                .horizonYear(nonNullCatalog instanceof JdkZoneCatalog jdk ? jdk.horizonYear() : -1)
                .abbreviationLocale(config.getAbbreviationLocale() == null
                        ? null
                        : config.getAbbreviationLocale().toLanguageTag())
                .build();
        LOG.info("bound timezone runtime: {} zones, abbreviation index {}",
                telemetry.getZoneCount(),
                index.isBuilt() ? telemetry.getAbbreviationCount() + " entries" : "deferred");

        return Binding.builder()
                .catalog(nonNullCatalog)
                .abbreviationIndex(index)
                .zoneResolver(resolver)
                .offsetCalculator(new OffsetCalculator())
                .telemetry(telemetry)
                .build();
    }

    private static TimezoneRuntimeConfig requireConfig(TimezoneRuntimeConfig runtimeConfig) {
        if (runtimeConfig == null) {
            throw new TimezoneException(ReasonCode.CONFIG_INVALID, "timezoneRuntimeConfig must be provided at startup");
        }
        return runtimeConfig;
    }

    /**
     * Immutable timezone runtime binding output.
     */
    @Value
    @Builder
    public static class Binding {
        ZoneCatalog catalog;

        AbbreviationIndex abbreviationIndex;

        /**
         * Shared resolver for identifier lookups.
         */
        ZoneResolver zoneResolver;

        /**
         * Shared calculator for zone conversion.
         */
        OffsetCalculator offsetCalculator;

        /**
         * Startup telemetry for the bound runtime.
         */
        TimezoneTelemetry telemetry;
    }
}
