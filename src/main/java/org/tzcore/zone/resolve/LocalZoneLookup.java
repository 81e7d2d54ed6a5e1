package org.tzcore.zone.resolve;

import java.time.LocalDateTime;

/**
 * Reports the identifier of the host's configured local zone.
 */
@FunctionalInterface
public interface LocalZoneLookup {

    /**
     * Returns the local zone identifier in effect at the given wall-clock time.
     *
     * @param wallTime wall-clock time of interest.
     * @return zone identifier understood by {@link ZoneResolver}.
     */
    String lookup(LocalDateTime wallTime);
}
