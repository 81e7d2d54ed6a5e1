package org.tzcore.zone.query;

import java.util.Objects;

/**
 * Parsed zone identifier.
 *
 * @param kind identifier shape.
 * @param identifier original identifier text, or the decimal offset for numeric queries.
 * @param offsetHours signed hour offset for offset-bearing kinds, otherwise zero.
 */
public record ZoneQuery(ZoneQueryKind kind, String identifier, int offsetHours) {

    public ZoneQuery {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(identifier, "identifier");
    }

    /**
     * Creates a numeric whole-hour offset query.
     */
    public static ZoneQuery ofOffsetHours(int offsetHours) {
        return new ZoneQuery(ZoneQueryKind.NUMERIC_OFFSET, Integer.toString(offsetHours), offsetHours);
    }

    static ZoneQuery of(ZoneQueryKind kind, String identifier) {
        return new ZoneQuery(kind, identifier, 0);
    }
}
