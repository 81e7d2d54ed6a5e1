package org.tzcore.core.error;

import lombok.Getter;

import java.util.Objects;

/**
 * Unchecked failure raised by zone resolution, catalog access and runtime binding.
 *
 * <p>Messages read {@code [TZ_...] detail} so log lines stay greppable by category.</p>
 */
@Getter
public class TimezoneException extends RuntimeException {
    private final ReasonCode reasonCode;

    public TimezoneException(ReasonCode reasonCode, String message) {
        this(reasonCode, message, null);
    }

    public TimezoneException(ReasonCode reasonCode, String message, Throwable cause) {
        super("[" + Objects.requireNonNull(reasonCode, "reasonCode").code() + "] "
                + Objects.requireNonNull(message, "message"), cause);
        this.reasonCode = reasonCode;
    }

    /**
     * Returns whether this failure should abort the caller instead of being reported per lookup.
     */
    public boolean isFatal() {
        return reasonCode.fatal();
    }
}
