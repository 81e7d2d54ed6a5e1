package org.tzcore.zone.catalog;

import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable in-memory zone catalog assembled from explicit period lists.
 *
 * <p>Catalog order is insertion order. This class is thread-safe for concurrent reads.</p>
 */
public final class StaticZoneCatalog implements ZoneCatalog {

    private final Object2ObjectLinkedOpenHashMap<String, List<RawPeriod>> periodsByZone;
    private final List<String> zoneNames;

    private StaticZoneCatalog(Object2ObjectLinkedOpenHashMap<String, List<RawPeriod>> periodsByZone) {
        this.periodsByZone = periodsByZone;
        this.periodsByZone.trim();
        this.zoneNames = List.copyOf(periodsByZone.keySet());
    }

    /**
     * Returns a new catalog builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean zoneExists(String zoneName) {
        return zoneName != null && periodsByZone.containsKey(zoneName);
    }

    @Override
    public List<RawPeriod> periodsFor(String zoneName) {
        List<RawPeriod> periods = zoneName == null ? null : periodsByZone.get(zoneName);
        if (periods == null) {
            throw new IllegalArgumentException("unknown zone: " + zoneName);
        }
        return periods;
    }

    @Override
    public List<String> allZoneNames() {
        return zoneNames;
    }

    @Override
    public String toString() {
        return "StaticZoneCatalog{zones=" + zoneNames.size() + '}';
    }

    /**
     * Mutable builder; each zone may be added once.
     */
    public static final class Builder {
        private final Object2ObjectLinkedOpenHashMap<String, List<RawPeriod>> periodsByZone =
                new Object2ObjectLinkedOpenHashMap<>();

        private Builder() {
        }

        /**
         * Adds one zone with its ordered periods.
         *
         * @param zoneName non-blank zone name.
         * @param periods non-empty ordered period list.
         * @return this builder.
         */
        public Builder zone(String zoneName, List<RawPeriod> periods) {
            String name = Objects.requireNonNull(zoneName, "zoneName").trim();
            if (name.isEmpty()) {
                throw new IllegalArgumentException("zoneName must be non-blank");
            }
            Objects.requireNonNull(periods, "periods");
            if (periods.isEmpty()) {
                throw new IllegalArgumentException("zone " + name + " must have at least one period");
            }
            if (periodsByZone.containsKey(name)) {
                throw new IllegalArgumentException("duplicate zone: " + name);
            }
            List<RawPeriod> copy = new ArrayList<>(periods.size());
            for (RawPeriod period : periods) {
                copy.add(Objects.requireNonNull(period, "period"));
            }
            periodsByZone.put(name, Collections.unmodifiableList(copy));
            return this;
        }

        /**
         * Adds one zone with its ordered periods.
         */
        public Builder zone(String zoneName, RawPeriod... periods) {
            return zone(zoneName, List.of(periods));
        }

        /**
         * Builds the immutable catalog.
         */
        public StaticZoneCatalog build() {
            return new StaticZoneCatalog(new Object2ObjectLinkedOpenHashMap<>(periodsByZone));
        }
    }
}
