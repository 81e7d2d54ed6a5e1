package org.tzcore.zone.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tzcore.core.time.TimeUtils;
import org.tzcore.testutil.ZoneFixtures;
import org.tzcore.zone.catalog.RawPeriod;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("PeriodSearch Tests")
class PeriodSearchTest {
    private static final List<RawPeriod> NEW_YORK = ZoneFixtures.standardCatalog().periodsFor("America/New_York");

    private static String abbreviationAt(LocalDateTime wallTime) {
        return PeriodSearch.find(NEW_YORK, TimeUtils.toWallSeconds(wallTime))
                .map(RawPeriod::getAbbreviation)
                .orElseThrow();
    }

    @Test
    @DisplayName("Selects the period whose window contains the instant")
    void testContainment() {
        assertEquals("EST", abbreviationAt(ZoneFixtures.WINTER_2024));
        assertEquals("EDT", abbreviationAt(ZoneFixtures.SUMMER_2024));
        assertEquals("EST", abbreviationAt(LocalDateTime.of(2024, 12, 25, 0, 0)));
    }

    @Test
    @DisplayName("Window start is inclusive and end is exclusive")
    void testHalfOpenEdges() {
        assertEquals("EDT", abbreviationAt(ZoneFixtures.NY_SPRING_FORWARD));
        assertEquals("EST", abbreviationAt(ZoneFixtures.NY_SPRING_FORWARD.minusSeconds(1)));
        assertEquals("EST", abbreviationAt(ZoneFixtures.NY_FALL_BACK));
    }

    @Test
    @DisplayName("Overlapping candidates resolve to the first in list order")
    void testFirstCandidateWins() {
        assertEquals("EDT", abbreviationAt(ZoneFixtures.NY_FALL_BACK_REPEAT.plusMinutes(15)));
    }

    @Test
    @DisplayName("Unbounded windows match extreme instants")
    void testUnboundedExtremes() {
        assertEquals("EST", PeriodSearch.find(NEW_YORK, Long.MIN_VALUE).orElseThrow().getAbbreviation());
        assertEquals("EST", PeriodSearch.find(NEW_YORK, Long.MAX_VALUE).orElseThrow().getAbbreviation());
    }

    @Test
    @DisplayName("No match yields empty")
    void testNoMatch() {
        List<RawPeriod> bounded = List.of(ZoneFixtures.period(
                ZoneFixtures.WINTER_2024, ZoneFixtures.SUMMER_2024, 0, 0, "X"));
        Optional<RawPeriod> result = PeriodSearch.find(bounded, TimeUtils.toWallSeconds(ZoneFixtures.SUMMER_2024));
        assertTrue(result.isEmpty());
        assertTrue(PeriodSearch.find(List.of(), 0L).isEmpty());
        assertThrows(NullPointerException.class, () -> PeriodSearch.find(null, 0L));
    }
}
