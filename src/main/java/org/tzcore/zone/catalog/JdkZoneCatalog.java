package org.tzcore.zone.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.zone.ZoneOffsetTransition;
import java.time.zone.ZoneRules;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Zone catalog backed by the tz database bundled with the JDK.
 *
 * <p>Periods are derived from {@link ZoneRules} offset transitions up to a horizon year; the
 * period open at the horizon stays valid forever. Each zone's period list is materialized on
 * first use and cached.</p>
 *
 * <p>Window edges on the wall clock: a period starts at the earlier of the two wall-clock
 * readings around its opening transition and ends at the reading just before its closing
 * transition. Gaps therefore resolve to the later offset and overlaps list the earlier offset
 * first. A period is also cut where only the standard offset changes, for example a zone moving
 * from daylight time in one region to standard time in the next without touching the clock.</p>
 */
public final class JdkZoneCatalog implements ZoneCatalog {
    private static final Logger LOG = LoggerFactory.getLogger(JdkZoneCatalog.class);

    public static final int DEFAULT_HORIZON_YEAR = 2100;

    static final String LOCAL_MEAN_TIME = "LMT";
    // Standard offsets are whole quarter hours; anything else before the first transition is solar time.
    private static final int LMT_DETECTION_SECONDS = 900;
    private static final Duration STANDARD_SCAN_STEP = Duration.ofDays(30);

    private final int horizonYear;
    private final Instant horizon;
    private final DateTimeFormatter abbreviationFormatter;
    private final List<String> zoneNames;
    private final ConcurrentMap<String, List<RawPeriod>> periodsByZone = new ConcurrentHashMap<>();

    /**
     * Creates a catalog with the default horizon and English abbreviations.
     */
    public JdkZoneCatalog() {
        this(DEFAULT_HORIZON_YEAR, Locale.ENGLISH);
    }

    /**
     * Creates a catalog.
     *
     * @param horizonYear last year whose transitions are materialized.
     * @param abbreviationLocale locale used to render period abbreviations.
     */
    public JdkZoneCatalog(int horizonYear, Locale abbreviationLocale) {
        if (horizonYear < 1900 || horizonYear > 9999) {
            throw new IllegalArgumentException("horizonYear must be in [1900, 9999]: " + horizonYear);
        }
        this.horizonYear = horizonYear;
        this.horizon = LocalDateTime.of(horizonYear + 1, 1, 1, 0, 0).toInstant(ZoneOffset.UTC);
        this.abbreviationFormatter = DateTimeFormatter.ofPattern("zzz",
                Objects.requireNonNull(abbreviationLocale, "abbreviationLocale"));
        this.zoneNames = List.copyOf(new TreeSet<>(ZoneId.getAvailableZoneIds()));
    }

    /**
     * Returns the last year whose transitions are materialized.
     */
    public int horizonYear() {
        return horizonYear;
    }

    @Override
    public boolean zoneExists(String zoneName) {
        return zoneName != null && Collections.binarySearch(zoneNames, zoneName) >= 0;
    }

    @Override
    public List<RawPeriod> periodsFor(String zoneName) {
        if (!zoneExists(zoneName)) {
            throw new IllegalArgumentException("unknown zone: " + zoneName);
        }
        return periodsByZone.computeIfAbsent(zoneName, this::buildPeriods);
    }

    @Override
    public List<String> allZoneNames() {
        return zoneNames;
    }

    /**
     * Returns number of zones whose periods have been materialized.
     */
    public int materializedZones() {
        return periodsByZone.size();
    }

    private List<RawPeriod> buildPeriods(String zoneName) {
        ZoneId zoneId = ZoneId.of(zoneName);
        ZoneRules rules = zoneId.getRules();

        List<Piece> pieces = new ArrayList<>();
        PeriodBoundary from = PeriodBoundary.min();
        Instant start = null;
        ZoneOffsetTransition transition = rules.nextTransition(Instant.MIN);
        boolean hasTransitions = transition != null;
        Instant firstTransition = hasTransitions ? transition.getInstant() : null;
        while (transition != null && transition.getInstant().isBefore(horizon)) {
            PeriodBoundary until = PeriodBoundary.at(transition.getDateTimeBefore());
            Instant end = transition.getInstant();
            // Before the first transition only the last second is sampled.
            appendPieces(pieces, from, until, start == null ? end.minusSeconds(1) : start, end, rules);

            LocalDateTime before = transition.getDateTimeBefore();
            LocalDateTime after = transition.getDateTimeAfter();
            from = PeriodBoundary.at(before.isBefore(after) ? before : after);
            start = transition.getInstant();
            transition = rules.nextTransition(transition.getInstant());
        }
        Instant openStart = start;
        if (openStart == null) {
            openStart = hasTransitions ? firstTransition.minusSeconds(1) : Instant.EPOCH;
        }
        appendPieces(pieces, from, PeriodBoundary.max(), openStart, horizon, rules);

        List<RawPeriod> periods = name(pieces, hasTransitions, new AbbreviationRenderer(zoneId));
        LOG.debug("materialized {} periods for zone {} (horizon {})", periods.size(), zoneName, horizonYear);
        return Collections.unmodifiableList(periods);
    }

    /**
     * Appends the wall window between two offset transitions, split wherever the standard offset
     * changes while the total offset stays put.
     */
    private static void appendPieces(
            List<Piece> pieces,
            PeriodBoundary from,
            PeriodBoundary until,
            Instant start,
            Instant end,
            ZoneRules rules
    ) {
        PeriodBoundary pieceFrom = from;
        Instant pieceStart = start;
        ZoneOffset standard = rules.getStandardOffset(start);
        Instant last = end.minusSeconds(1);
        Instant cursor = start;
        while (cursor.isBefore(last)) {
            Instant next = cursor.plus(STANDARD_SCAN_STEP);
            if (next.isAfter(last)) {
                next = last;
            }
            if (rules.getStandardOffset(next).equals(standard)) {
                cursor = next;
                continue;
            }
            Instant change = firstStandardChange(rules, cursor, next, standard);
            PeriodBoundary boundary = PeriodBoundary.at(
                    change.getEpochSecond() + rules.getOffset(change).getTotalSeconds());
            addPiece(pieces, pieceFrom, boundary, pieceStart, rules);
            pieceFrom = boundary;
            pieceStart = change;
            standard = rules.getStandardOffset(change);
            cursor = change;
        }
        addPiece(pieces, pieceFrom, until, pieceStart, rules);
    }

    /**
     * Returns the first second in {@code (low, high]} whose standard offset differs from
     * {@code standard}; {@code high} must already differ.
     */
    private static Instant firstStandardChange(ZoneRules rules, Instant low, Instant high, ZoneOffset standard) {
        long lo = low.getEpochSecond();
        long hi = high.getEpochSecond();
        while (hi - lo > 1) {
            long mid = lo + (hi - lo) / 2;
            if (rules.getStandardOffset(Instant.ofEpochSecond(mid)).equals(standard)) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        return Instant.ofEpochSecond(hi);
    }

    private static void addPiece(
            List<Piece> pieces,
            PeriodBoundary from,
            PeriodBoundary until,
            Instant sample,
            ZoneRules rules
    ) {
        // Back-to-back transitions can leave a window that is empty on the wall clock.
        if (!from.isUnbounded() && !until.isUnbounded() && from.getWallSeconds() >= until.getWallSeconds()) {
            return;
        }
        pieces.add(new Piece(
                from,
                until,
                sample,
                rules.getStandardOffset(sample).getTotalSeconds(),
                rules.getOffset(sample).getTotalSeconds()
        ));
    }

    /**
     * Assigns abbreviations. Display names only describe the zone's current offsets, so they
     * are used for pieces matching those offsets; local mean time gets {@code LMT} and any
     * other historical offset gets a numeric abbreviation such as {@code -0430}.
     */
    private static List<RawPeriod> name(List<Piece> pieces, boolean hasTransitions, AbbreviationRenderer renderer) {
        int currentStandard = pieces.get(pieces.size() - 1).standardSeconds();
        Integer currentDaylightTotal = null;
        for (int i = pieces.size() - 1; i >= 0; i--) {
            Piece piece = pieces.get(i);
            if (piece.isDaylight() && piece.standardSeconds() == currentStandard) {
                currentDaylightTotal = piece.totalSeconds();
                break;
            }
        }

        List<RawPeriod> periods = new ArrayList<>(pieces.size());
        for (int i = 0; i < pieces.size(); i++) {
            Piece piece = pieces.get(i);
            String abbreviation;
            if (i == 0 && hasTransitions && piece.totalSeconds() % LMT_DETECTION_SECONDS != 0) {
                abbreviation = LOCAL_MEAN_TIME;
            } else if (piece.standardSeconds() == currentStandard && !piece.isDaylight()) {
                abbreviation = renderer.render(piece.sample(), false);
            } else if (piece.standardSeconds() == currentStandard
                    && currentDaylightTotal != null
                    && piece.totalSeconds() == currentDaylightTotal) {
                abbreviation = renderer.render(piece.sample(), true);
            } else {
                abbreviation = numericAbbreviation(piece.totalSeconds());
            }
            periods.add(RawPeriod.builder()
                    .from(piece.from())
                    .until(piece.until())
                    .utcOffsetSeconds(piece.standardSeconds())
                    .stdOffsetSeconds(piece.totalSeconds() - piece.standardSeconds())
                    .abbreviation(abbreviation)
                    .build());
        }
        return periods;
    }

    static String numericAbbreviation(int totalSeconds) {
        char sign = totalSeconds < 0 ? '-' : '+';
        int minutes = Math.abs(totalSeconds) / 60;
        if (minutes % 60 == 0) {
            return String.format("%c%02d", sign, minutes / 60);
        }
        return String.format("%c%02d%02d", sign, minutes / 60, minutes % 60);
    }

    private record Piece(PeriodBoundary from, PeriodBoundary until, Instant sample, int standardSeconds, int totalSeconds) {
        boolean isDaylight() {
            return totalSeconds != standardSeconds;
        }
    }

    /**
     * Renders the zone's standard and daylight display names once each.
     */
    private final class AbbreviationRenderer {
        private final ZoneId zoneId;
        private String standard;
        private String daylight;

        private AbbreviationRenderer(ZoneId zoneId) {
            this.zoneId = zoneId;
        }

        String render(Instant sample, boolean daylightSaving) {
            if (daylightSaving) {
                if (daylight == null) {
                    daylight = format(sample);
                }
                return daylight;
            }
            if (standard == null) {
                standard = format(sample);
            }
            return standard;
        }

        private String format(Instant sample) {
            return abbreviationFormatter.format(ZonedDateTime.ofInstant(sample, zoneId));
        }
    }

    @Override
    public String toString() {
        return "JdkZoneCatalog{zones=" + zoneNames.size() + ", horizonYear=" + horizonYear + '}';
    }
}
