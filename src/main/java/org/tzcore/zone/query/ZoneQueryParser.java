package org.tzcore.zone.query;

import org.tzcore.zone.catalog.ZoneCatalog;
import org.tzcore.zone.index.AbbreviationIndex;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Classifies textual zone identifiers into {@link ZoneQuery} variants.
 *
 * <p>Checks run in precedence order: UTC shortcuts, military letters, compact signed offsets,
 * catalog zone names, indexed abbreviations. Text matching none of them is {@code UNKNOWN}.</p>
 */
public final class ZoneQueryParser {
    private static final Set<String> UTC_SHORTCUTS = Set.of("Z", "UT", "GMT");
    private static final Map<String, Integer> LETTER_OFFSETS = Map.of(
            "A", 1,
            "M", 12,
            "N", -1,
            "Y", -12
    );
    // Compact offsets above this magnitude carry minutes in their last two digits.
    private static final int COMPACT_HOURS_THRESHOLD = 100;
    private static final int MINUTE_DIGITS_DIVISOR = 100;

    private final ZoneCatalog catalog;
    private final AbbreviationIndex abbreviationIndex;

    /**
     * Creates a parser bound to one catalog and its abbreviation index.
     */
    public ZoneQueryParser(ZoneCatalog catalog, AbbreviationIndex abbreviationIndex) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.abbreviationIndex = Objects.requireNonNull(abbreviationIndex, "abbreviationIndex");
    }

    /**
     * Classifies one identifier.
     *
     * @param identifier raw identifier text.
     * @return parsed query.
     */
    public ZoneQuery parse(String identifier) {
        Objects.requireNonNull(identifier, "identifier");
        if (UTC_SHORTCUTS.contains(identifier)) {
            return ZoneQuery.of(ZoneQueryKind.UTC_SHORTCUT, identifier);
        }
        Integer letterOffset = LETTER_OFFSETS.get(identifier);
        if (letterOffset != null) {
            return new ZoneQuery(ZoneQueryKind.LETTER_CODE, identifier, letterOffset);
        }
        Integer compactHours = parseCompactOffsetHours(identifier);
        if (compactHours != null) {
            return new ZoneQuery(ZoneQueryKind.COMPACT_OFFSET, identifier, compactHours);
        }
        if (catalog.zoneExists(identifier)) {
            return ZoneQuery.of(ZoneQueryKind.NAMED, identifier);
        }
        if (abbreviationIndex.contains(identifier)) {
            return ZoneQuery.of(ZoneQueryKind.ABBREVIATION, identifier);
        }
        return ZoneQuery.of(ZoneQueryKind.UNKNOWN, identifier);
    }

    /**
     * Parses {@code ±HHMM} / {@code ±H} text into signed whole hours.
     *
     * <p>Only the leading digit run after the sign is read. Magnitudes above 100 are divided by
     * 100 and truncated, so {@code +0530} is 5 hours and {@code +150} is 1 hour.</p>
     *
     * @param identifier candidate text.
     * @return signed hours, or {@code null} when the text is not a compact offset.
     */
    static Integer parseCompactOffsetHours(String identifier) {
        if (identifier.length() < 2) {
            return null;
        }
        char sign = identifier.charAt(0);
        if (sign != '+' && sign != '-') {
            return null;
        }
        int end = 1;
        while (end < identifier.length() && Character.isDigit(identifier.charAt(end))) {
            end++;
        }
        if (end == 1) {
            return null;
        }
        long magnitude;
        try {
            magnitude = Long.parseLong(identifier.substring(1, end));
        } catch (NumberFormatException ex) {
            // Non-ASCII digits or overflow: not an offset we understand.
            return null;
        }
        long hours = magnitude > COMPACT_HOURS_THRESHOLD ? magnitude / MINUTE_DIGITS_DIVISOR : magnitude;
        if (hours > Integer.MAX_VALUE) {
            return null;
        }
        return sign == '-' ? (int) -hours : (int) hours;
    }
}
