package org.tzcore.zone.resolve;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Local-zone lookup backed by the JVM default zone.
 */
public final class SystemLocalZoneLookup implements LocalZoneLookup {
    private final Supplier<ZoneId> defaultZone;

    public SystemLocalZoneLookup() {
        this(ZoneId::systemDefault);
    }

    SystemLocalZoneLookup(Supplier<ZoneId> defaultZone) {
        this.defaultZone = Objects.requireNonNull(defaultZone, "defaultZone");
    }

    @Override
    public String lookup(LocalDateTime wallTime) {
        ZoneId zone = Objects.requireNonNull(defaultZone.get(), "default zone");
        // Fixed offsets have no catalog entry; report them in compact offset form.
        if (zone instanceof ZoneOffset offset) {
            return offset.getTotalSeconds() == 0 ? "UTC" : compactOffset(offset.getTotalSeconds());
        }
        return zone.getId();
    }

    private static String compactOffset(int totalSeconds) {
        int minutes = Math.abs(totalSeconds) / 60;
        return String.format("%c%02d%02d", totalSeconds < 0 ? '-' : '+', minutes / 60, minutes % 60);
    }
}
