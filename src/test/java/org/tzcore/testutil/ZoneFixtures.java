package org.tzcore.testutil;

import org.tzcore.zone.catalog.PeriodBoundary;
import org.tzcore.zone.catalog.RawPeriod;
import org.tzcore.zone.catalog.StaticZoneCatalog;

import java.time.LocalDateTime;

/**
 * Small deterministic zone catalogs for resolver and search tests.
 *
 * <p>New York and Berlin carry 2024 transitions only; everything else is a single fixed period.</p>
 */
public final class ZoneFixtures {
    public static final LocalDateTime NY_SPRING_FORWARD = LocalDateTime.of(2024, 3, 10, 2, 0);
    public static final LocalDateTime NY_FALL_BACK = LocalDateTime.of(2024, 11, 3, 2, 0);
    public static final LocalDateTime NY_FALL_BACK_REPEAT = LocalDateTime.of(2024, 11, 3, 1, 0);
    public static final LocalDateTime BERLIN_SPRING_FORWARD = LocalDateTime.of(2024, 3, 31, 2, 0);
    public static final LocalDateTime BERLIN_FALL_BACK = LocalDateTime.of(2024, 10, 27, 3, 0);
    public static final LocalDateTime BERLIN_FALL_BACK_REPEAT = LocalDateTime.of(2024, 10, 27, 2, 0);

    public static final LocalDateTime WINTER_2024 = LocalDateTime.of(2024, 1, 15, 12, 0);
    public static final LocalDateTime SUMMER_2024 = LocalDateTime.of(2024, 7, 15, 12, 0);

    private static final StaticZoneCatalog STANDARD = standardBuilder().build();
    private static final StaticZoneCatalog WITHOUT_YEAR_ROUND_EST = withoutYearRoundEstBuilder().build();

    private ZoneFixtures() {
    }

    /**
     * Returns the shared fixture catalog.
     */
    public static StaticZoneCatalog standardCatalog() {
        return STANDARD;
    }

    /**
     * Returns the fixture catalog without any zone that keeps EST all year.
     */
    public static StaticZoneCatalog catalogWithoutYearRoundEst() {
        return WITHOUT_YEAR_ROUND_EST;
    }

    public static StaticZoneCatalog.Builder standardBuilder() {
        return withoutYearRoundEstBuilder()
                .zone("America/Panama", fixed(-5 * 3600, "EST"));
    }

    private static StaticZoneCatalog.Builder withoutYearRoundEstBuilder() {
        return StaticZoneCatalog.builder()
                .zone("UTC", fixed(0, "UTC"))
                .zone("America/New_York",
                        period(null, NY_SPRING_FORWARD, -5 * 3600, 0, "EST"),
                        period(NY_SPRING_FORWARD, NY_FALL_BACK, -5 * 3600, 3600, "EDT"),
                        period(NY_FALL_BACK_REPEAT, null, -5 * 3600, 0, "EST"))
                .zone("Europe/Berlin",
                        period(null, BERLIN_SPRING_FORWARD, 3600, 0, "CET"),
                        period(BERLIN_SPRING_FORWARD, BERLIN_FALL_BACK, 3600, 3600, "CEST"),
                        period(BERLIN_FALL_BACK_REPEAT, null, 3600, 0, "CET"))
                .zone("Etc/Unnamed",
                        period(null, LocalDateTime.of(2000, 1, 1, 0, 0), 7200, 0, ""),
                        period(LocalDateTime.of(2000, 1, 1, 0, 0), null, 7200, 0, "UNX"))
                .zone("Etc/GMT-1", fixed(3600, "+01"))
                .zone("Etc/GMT-2", fixed(2 * 3600, "+02"))
                .zone("Etc/GMT-5", fixed(5 * 3600, "+05"))
                .zone("Etc/GMT-12", fixed(12 * 3600, "+12"))
                .zone("Etc/GMT+1", fixed(-3600, "-01"))
                .zone("Etc/GMT+5", fixed(-5 * 3600, "-05"))
                .zone("Etc/GMT+8", fixed(-8 * 3600, "-08"))
                .zone("Etc/GMT+12", fixed(-12 * 3600, "-12"));
    }

    /**
     * Creates one period; {@code null} edges are unbounded.
     */
    public static RawPeriod period(
            LocalDateTime from,
            LocalDateTime until,
            int utcOffsetSeconds,
            int stdOffsetSeconds,
            String abbreviation
    ) {
        return RawPeriod.builder()
                .from(from == null ? PeriodBoundary.min() : PeriodBoundary.at(from))
                .until(until == null ? PeriodBoundary.max() : PeriodBoundary.at(until))
                .utcOffsetSeconds(utcOffsetSeconds)
                .stdOffsetSeconds(stdOffsetSeconds)
                .abbreviation(abbreviation)
                .build();
    }

    /**
     * Creates an always-valid period.
     */
    public static RawPeriod fixed(int utcOffsetSeconds, String abbreviation) {
        return period(null, null, utcOffsetSeconds, 0, abbreviation);
    }
}
