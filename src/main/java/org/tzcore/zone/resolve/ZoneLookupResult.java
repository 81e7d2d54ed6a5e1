package org.tzcore.zone.resolve;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Objects;

/**
 * Outcome of a zone lookup: a descriptor, or the identifier that could not be resolved.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ZoneLookupResult {

    /**
     * Identifier exactly as supplied by the caller.
     */
    String identifier;

    /**
     * Resolved descriptor, {@code null} when not found.
     */
    TimezoneDescriptor descriptor;

    static ZoneLookupResult found(String identifier, TimezoneDescriptor descriptor) {
        return new ZoneLookupResult(identifier, Objects.requireNonNull(descriptor, "descriptor"));
    }

    static ZoneLookupResult notFound(String identifier) {
        return new ZoneLookupResult(identifier, null);
    }

    /**
     * Returns whether a descriptor was resolved.
     */
    public boolean isFound() {
        return descriptor != null;
    }

    /**
     * Returns the descriptor or raises the not-found failure.
     *
     * @throws ZoneNotFoundException when the identifier was not resolved.
     */
    public TimezoneDescriptor orElseThrow() {
        if (descriptor == null) {
            throw new ZoneNotFoundException(identifier);
        }
        return descriptor;
    }
}
