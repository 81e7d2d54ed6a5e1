package org.tzcore.core.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tzcore.zone.catalog.CatalogInconsistencyException;
import org.tzcore.zone.resolve.ZoneNotFoundException;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("TimezoneException Tests")
class TimezoneExceptionTest {

    @Test
    @DisplayName("Message is prefixed with the stable reason code")
    void testMessagePrefix() {
        TimezoneException ex = new TimezoneException(ReasonCode.CONFIG_INVALID, "bad horizon");
        assertEquals("[TZ_CONFIG_INVALID] bad horizon", ex.getMessage());
        assertSame(ReasonCode.CONFIG_INVALID, ex.getReasonCode());
    }

    @Test
    @DisplayName("Cause is preserved")
    void testCausePreserved() {
        IllegalArgumentException cause = new IllegalArgumentException("root");
        TimezoneException ex = new TimezoneException(ReasonCode.CONFIG_INVALID, "wrapped", cause);
        assertSame(cause, ex.getCause());
    }

    @Test
    @DisplayName("Only data and setup failures are fatal")
    void testFatalClassification() {
        assertFalse(new ZoneNotFoundException("Mars/Olympus").isFatal());
        assertTrue(new CatalogInconsistencyException("hole").isFatal());
        assertTrue(new TimezoneException(ReasonCode.CONFIG_INVALID, "bad").isFatal());
    }

    @Test
    @DisplayName("Codes are unique")
    void testCodesUnique() {
        assertEquals(ReasonCode.values().length,
                Arrays.stream(ReasonCode.values()).map(ReasonCode::code).distinct().count());
    }

    @Test
    @DisplayName("Null reason code and message are rejected")
    void testNullArguments() {
        assertThrows(NullPointerException.class, () -> new TimezoneException(null, "message"));
        assertThrows(NullPointerException.class, () -> new TimezoneException(ReasonCode.ZONE_NOT_FOUND, null));
    }
}
