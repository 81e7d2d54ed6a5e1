package org.tzcore.core.error;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Failure categories carried by {@link TimezoneException}.
 */
@Getter
@Accessors(fluent = true)
public enum ReasonCode {
    ZONE_NOT_FOUND("TZ_ZONE_NOT_FOUND", false),
    CATALOG_INCONSISTENT("TZ_CATALOG_INCONSISTENT", true),
    CONFIG_INVALID("TZ_CONFIG_INVALID", true);

    /**
     * Stable code printed in exception messages.
     */
    private final String code;

    /**
     * Whether the failure points at broken data or setup rather than at caller input.
     */
    private final boolean fatal;

    ReasonCode(String code, boolean fatal) {
        this.code = code;
        this.fatal = fatal;
    }
}
