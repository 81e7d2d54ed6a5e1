package org.tzcore.zone.resolve;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.tzcore.core.error.ReasonCode;
import org.tzcore.core.error.TimezoneException;

/**
 * Raised when an identifier cannot be resolved to a timezone descriptor.
 */
@Getter
@Accessors(fluent = true)
public final class ZoneNotFoundException extends TimezoneException {
    private final String identifier;

    /**
     * Creates a not-found failure for the given identifier.
     *
     * @param identifier identifier exactly as supplied by the caller.
     */
    public ZoneNotFoundException(String identifier) {
        super(ReasonCode.ZONE_NOT_FOUND, "No timezone found for: " + identifier);
        this.identifier = identifier;
    }
}
