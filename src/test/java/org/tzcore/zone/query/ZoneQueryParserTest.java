package org.tzcore.zone.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.tzcore.testutil.ZoneFixtures;
import org.tzcore.zone.catalog.StaticZoneCatalog;
import org.tzcore.zone.index.AbbreviationIndex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("ZoneQueryParser Tests")
class ZoneQueryParserTest {
    private static final StaticZoneCatalog CATALOG = ZoneFixtures.standardCatalog();
    private static final ZoneQueryParser PARSER = new ZoneQueryParser(CATALOG, AbbreviationIndex.lazy(CATALOG));

    @ParameterizedTest
    @ValueSource(strings = {"Z", "UT", "GMT"})
    void testUtcShortcuts(String identifier) {
        assertEquals(ZoneQueryKind.UTC_SHORTCUT, PARSER.parse(identifier).kind());
    }

    @ParameterizedTest
    @CsvSource({
            "A, 1",
            "M, 12",
            "N, -1",
            "Y, -12"
    })
    void testLetterCodes(String identifier, int expectedHours) {
        ZoneQuery query = PARSER.parse(identifier);
        assertEquals(ZoneQueryKind.LETTER_CODE, query.kind());
        assertEquals(expectedHours, query.offsetHours());
        assertEquals(identifier, query.identifier());
    }

    @ParameterizedTest
    @CsvSource({
            "+0200, 2",
            "-0200, -2",
            "+2, 2",
            "-5, -5",
            "+12, 12",
            "+100, 100",
            "+0530, 5",
            "-0930, -9",
            "+150, 1",
            "+1200, 12",
            "-0000, 0",
            "+05:30, 5"
    })
    void testCompactOffsets(String identifier, int expectedHours) {
        ZoneQuery query = PARSER.parse(identifier);
        assertEquals(ZoneQueryKind.COMPACT_OFFSET, query.kind());
        assertEquals(expectedHours, query.offsetHours());
    }

    @Test
    @DisplayName("Catalog names and indexed abbreviations are classified against the catalog")
    void testNamedAndAbbreviation() {
        assertEquals(ZoneQueryKind.NAMED, PARSER.parse("America/New_York").kind());
        assertEquals(ZoneQueryKind.NAMED, PARSER.parse("UTC").kind());
        assertEquals(ZoneQueryKind.ABBREVIATION, PARSER.parse("CEST").kind());
        assertEquals(ZoneQueryKind.ABBREVIATION, PARSER.parse("EST").kind());
    }

    @ParameterizedTest
    @ValueSource(strings = {"Mars/Olympus", "XYZ", "", "+", "-", "+abc", "B", "z", "gmt"})
    void testUnknown(String identifier) {
        assertEquals(ZoneQueryKind.UNKNOWN, PARSER.parse(identifier).kind());
    }

    @Test
    @DisplayName("Numeric offset queries carry their hours")
    void testOfOffsetHours() {
        ZoneQuery query = ZoneQuery.ofOffsetHours(-5);
        assertEquals(ZoneQueryKind.NUMERIC_OFFSET, query.kind());
        assertEquals(-5, query.offsetHours());
        assertEquals("-5", query.identifier());
    }

    @Test
    @DisplayName("Compact parser ignores non-offset text and overflow")
    void testCompactParserRejects() {
        assertNull(ZoneQueryParser.parseCompactOffsetHours("0200"));
        assertNull(ZoneQueryParser.parseCompactOffsetHours("+"));
        assertNull(ZoneQueryParser.parseCompactOffsetHours("+99999999999999999999999"));
    }

    @Test
    @DisplayName("Null identifier is rejected")
    void testNullIdentifier() {
        assertThrows(NullPointerException.class, () -> PARSER.parse(null));
    }
}
