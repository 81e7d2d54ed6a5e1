package org.tzcore.zone.resolve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tzcore.core.time.TimeUtils;
import org.tzcore.zone.catalog.CatalogInconsistencyException;
import org.tzcore.zone.catalog.RawPeriod;
import org.tzcore.zone.catalog.ZoneCatalog;
import org.tzcore.zone.convert.ZonedDateValue;
import org.tzcore.zone.index.AbbreviationIndex;
import org.tzcore.zone.query.ZoneQuery;
import org.tzcore.zone.query.ZoneQueryParser;
import org.tzcore.zone.search.AbbreviationMatch;
import org.tzcore.zone.search.AbbreviationSearch;
import org.tzcore.zone.search.PeriodSearch;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves a zone identifier plus a wall-clock instant into a {@link TimezoneDescriptor}.
 *
 * <p>Identifiers are classified by {@link ZoneQueryParser}; offsets are rewritten to
 * {@code Etc/GMT} pseudo-zone names and resolved like any catalog zone. {@code lookup} methods
 * return a {@link ZoneLookupResult}; {@code resolve} methods raise {@link ZoneNotFoundException}.
 * Instances are immutable and safe to share.</p>
 */
public final class ZoneResolver {
    private static final Logger LOG = LoggerFactory.getLogger(ZoneResolver.class);

    static final String UTC_ZONE_NAME = "UTC";

    private final ZoneCatalog catalog;
    private final AbbreviationIndex abbreviationIndex;
    private final ZoneQueryParser parser;
    private final AbbreviationSearch abbreviationSearch;
    private final LocalZoneLookup localZoneLookup;
    private final Clock clock;

    /**
     * Creates a resolver with the JVM default local-zone lookup and the system UTC clock.
     */
    public ZoneResolver(ZoneCatalog catalog, AbbreviationIndex abbreviationIndex) {
        this(catalog, abbreviationIndex, new SystemLocalZoneLookup(), Clock.systemUTC());
    }

    /**
     * Creates a resolver.
     *
     * @param catalog zone catalog.
     * @param abbreviationIndex abbreviation index built over {@code catalog}.
     * @param localZoneLookup local-zone collaborator.
     * @param clock clock supplying "now" for instant-less calls.
     */
    public ZoneResolver(
            ZoneCatalog catalog,
            AbbreviationIndex abbreviationIndex,
            LocalZoneLookup localZoneLookup,
            Clock clock
    ) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.abbreviationIndex = Objects.requireNonNull(abbreviationIndex, "abbreviationIndex");
        this.localZoneLookup = Objects.requireNonNull(localZoneLookup, "localZoneLookup");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.parser = new ZoneQueryParser(catalog, abbreviationIndex);
        this.abbreviationSearch = new AbbreviationSearch(catalog);
    }

    /**
     * Returns whether the identifier names a catalog zone or an indexed abbreviation.
     */
    public boolean exists(String identifier) {
        return catalog.zoneExists(identifier) || abbreviationIndex.contains(identifier);
    }

    /**
     * Looks up a textual identifier at a wall-clock time.
     */
    public ZoneLookupResult lookup(String identifier, LocalDateTime wallTime) {
        Objects.requireNonNull(identifier, "identifier");
        return dispatch(parser.parse(identifier), TimeUtils.toWallSeconds(wallTime), identifier);
    }

    /**
     * Looks up a textual identifier at the wall-clock time of a tagged date.
     */
    public ZoneLookupResult lookup(String identifier, ZonedDateValue date) {
        return lookup(identifier, Objects.requireNonNull(date, "date").getWallTime());
    }

    /**
     * Looks up a textual identifier at the current UTC wall-clock time.
     */
    public ZoneLookupResult lookup(String identifier) {
        return lookup(identifier, LocalDateTime.now(clock));
    }

    /**
     * Looks up a signed whole-hour offset at a wall-clock time.
     */
    public ZoneLookupResult lookup(int offsetHours, LocalDateTime wallTime) {
        ZoneQuery query = ZoneQuery.ofOffsetHours(offsetHours);
        return dispatch(query, TimeUtils.toWallSeconds(wallTime), query.identifier());
    }

    /**
     * Looks up a signed whole-hour offset at the wall-clock time of a tagged date.
     */
    public ZoneLookupResult lookup(int offsetHours, ZonedDateValue date) {
        return lookup(offsetHours, Objects.requireNonNull(date, "date").getWallTime());
    }

    /**
     * Resolves a textual identifier at a wall-clock time.
     *
     * @throws ZoneNotFoundException when the identifier cannot be resolved.
     */
    public TimezoneDescriptor resolve(String identifier, LocalDateTime wallTime) {
        return lookup(identifier, wallTime).orElseThrow();
    }

    /**
     * Resolves a textual identifier at the wall-clock time of a tagged date.
     *
     * @throws ZoneNotFoundException when the identifier cannot be resolved.
     */
    public TimezoneDescriptor resolve(String identifier, ZonedDateValue date) {
        return lookup(identifier, date).orElseThrow();
    }

    /**
     * Resolves a textual identifier at the current UTC wall-clock time.
     *
     * @throws ZoneNotFoundException when the identifier cannot be resolved.
     */
    public TimezoneDescriptor resolve(String identifier) {
        return lookup(identifier).orElseThrow();
    }

    /**
     * Resolves a signed whole-hour offset at a wall-clock time.
     *
     * @throws ZoneNotFoundException when no {@code Etc/GMT} zone exists for the offset.
     */
    public TimezoneDescriptor resolve(int offsetHours, LocalDateTime wallTime) {
        return lookup(offsetHours, wallTime).orElseThrow();
    }

    /**
     * Resolves a signed whole-hour offset at the wall-clock time of a tagged date.
     *
     * @throws ZoneNotFoundException when no {@code Etc/GMT} zone exists for the offset.
     */
    public TimezoneDescriptor resolve(int offsetHours, ZonedDateValue date) {
        return lookup(offsetHours, date).orElseThrow();
    }

    /**
     * Resolves the host's local zone at a wall-clock time.
     *
     * @throws ZoneNotFoundException when the reported local zone is not resolvable.
     */
    public TimezoneDescriptor local(LocalDateTime wallTime) {
        Objects.requireNonNull(wallTime, "wallTime");
        return resolve(localZoneLookup.lookup(wallTime), wallTime);
    }

    /**
     * Resolves the host's local zone at the wall-clock time of a tagged date.
     */
    public TimezoneDescriptor local(ZonedDateValue date) {
        return local(Objects.requireNonNull(date, "date").getWallTime());
    }

    /**
     * Resolves the host's local zone at the current UTC wall-clock time.
     */
    public TimezoneDescriptor local() {
        return local(LocalDateTime.now(clock));
    }

    /**
     * Returns the {@code Etc/GMT} zone name for a whole-hour offset.
     *
     * <p>POSIX naming inverts the sign: {@code +5} hours east of UTC is {@code Etc/GMT-5}.</p>
     */
    public static String fixedOffsetZoneName(int offsetHours) {
        if (offsetHours > 0) {
            return "Etc/GMT-" + offsetHours;
        }
        return "Etc/GMT+" + -(long) offsetHours;
    }

    private ZoneLookupResult dispatch(ZoneQuery query, long wallSeconds, String originalIdentifier) {
        switch (query.kind()) {
            case UTC_SHORTCUT:
                return ZoneLookupResult.found(originalIdentifier, TimezoneDescriptor.utc());
            case LETTER_CODE:
            case COMPACT_OFFSET:
                return dispatch(ZoneQuery.ofOffsetHours(query.offsetHours()), wallSeconds, originalIdentifier);
            case NUMERIC_OFFSET:
                String zoneName = query.offsetHours() == 0
                        ? UTC_ZONE_NAME
                        : fixedOffsetZoneName(query.offsetHours());
                return dispatch(parser.parse(zoneName), wallSeconds, originalIdentifier);
            case NAMED:
                return ZoneLookupResult.found(originalIdentifier, resolveNamed(query.identifier(), wallSeconds));
            case ABBREVIATION:
                return resolveAbbreviation(query.identifier(), wallSeconds, originalIdentifier);
            case UNKNOWN:
                return notFound(originalIdentifier);
            default:
                throw new IllegalStateException("unhandled zone query kind: " + query.kind());
        }
    }

    private TimezoneDescriptor resolveNamed(String zoneName, long wallSeconds) {
        Optional<RawPeriod> period = PeriodSearch.find(catalog.periodsFor(zoneName), wallSeconds);
        if (period.isEmpty()) {
            throw new CatalogInconsistencyException(
                    "zone " + zoneName + " has no period covering wall time "
                            + TimeUtils.fromWallSeconds(wallSeconds)
            );
        }
        return PeriodNormalizer.normalize(zoneName, period.get());
    }

    private ZoneLookupResult resolveAbbreviation(String abbreviation, long wallSeconds, String originalIdentifier) {
        Optional<AbbreviationMatch> match = abbreviationSearch.find(abbreviation, wallSeconds);
        if (match.isEmpty()) {
            return notFound(originalIdentifier);
        }
        AbbreviationMatch hit = match.get();
        return ZoneLookupResult.found(originalIdentifier, PeriodNormalizer.normalize(hit.zoneName(), hit.period()));
    }

    private static ZoneLookupResult notFound(String identifier) {
        LOG.debug("no timezone found for identifier '{}'", identifier);
        return ZoneLookupResult.notFound(identifier);
    }
}
