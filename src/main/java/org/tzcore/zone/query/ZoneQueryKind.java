package org.tzcore.zone.query;

/**
 * Identifier shapes understood by the zone resolver, in dispatch precedence order.
 */
public enum ZoneQueryKind {
    /** {@code Z}, {@code UT} or {@code GMT}. */
    UTC_SHORTCUT,
    /** Military letter {@code A}, {@code M}, {@code N} or {@code Y}. */
    LETTER_CODE,
    /** Signed whole-hour offset. */
    NUMERIC_OFFSET,
    /** Signed compact offset text such as {@code +0200} or {@code -5}. */
    COMPACT_OFFSET,
    /** Zone name present in the catalog. */
    NAMED,
    /** Abbreviation present in the abbreviation index. */
    ABBREVIATION,
    /** Anything else. */
    UNKNOWN
}
