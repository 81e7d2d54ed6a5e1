package org.tzcore.zone.index;

import it.unimi.dsi.fastutil.objects.ObjectLinkedOpenHashSet;
import it.unimi.dsi.fastutil.objects.ObjectSet;
import it.unimi.dsi.fastutil.objects.ObjectSets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tzcore.zone.catalog.RawPeriod;
import org.tzcore.zone.catalog.ZoneCatalog;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Deduplicated set of every non-empty abbreviation used by any period of any catalog zone.
 *
 * <p>The set is computed at most once, either at construction ({@link #eager}) or on first
 * query ({@link #lazy}), and is read-only afterwards. Safe for concurrent readers.</p>
 */
public final class AbbreviationIndex {
    private static final Logger LOG = LoggerFactory.getLogger(AbbreviationIndex.class);

    private final ZoneCatalog catalog;
    private volatile ObjectSet<String> abbreviations;

    private AbbreviationIndex(ZoneCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    /**
     * Builds the index immediately.
     *
     * @param catalog source catalog.
     * @return populated index.
     */
    public static AbbreviationIndex eager(ZoneCatalog catalog) {
        AbbreviationIndex index = new AbbreviationIndex(catalog);
        index.abbreviations();
        return index;
    }

    /**
     * Creates an index that is populated on first query.
     *
     * @param catalog source catalog.
     * @return unpopulated index.
     */
    public static AbbreviationIndex lazy(ZoneCatalog catalog) {
        return new AbbreviationIndex(catalog);
    }

    /**
     * Returns whether the abbreviation appears in any catalog period.
     *
     * @param abbreviation candidate abbreviation, may be {@code null}.
     * @return {@code true} when indexed.
     */
    public boolean contains(String abbreviation) {
        if (abbreviation == null || abbreviation.isEmpty()) {
            return false;
        }
        return abbreviations().contains(abbreviation);
    }

    /**
     * Returns number of distinct abbreviations.
     */
    public int size() {
        return abbreviations().size();
    }

    /**
     * Returns whether the set has been computed.
     */
    public boolean isBuilt() {
        return abbreviations != null;
    }

    /**
     * Returns the immutable abbreviation set in first-seen catalog order.
     */
    public Set<String> abbreviations() {
        ObjectSet<String> current = abbreviations;
        if (current == null) {
            synchronized (this) {
                current = abbreviations;
                if (current == null) {
                    current = build(catalog);
                    abbreviations = current;
                }
            }
        }
        return current;
    }

    private static ObjectSet<String> build(ZoneCatalog catalog) {
        long startNanos = System.nanoTime();
        ObjectLinkedOpenHashSet<String> seen = new ObjectLinkedOpenHashSet<>();
        List<String> zoneNames = catalog.allZoneNames();
        for (String zoneName : zoneNames) {
            for (RawPeriod period : catalog.periodsFor(zoneName)) {
                if (period.hasAbbreviation()) {
                    seen.add(period.getAbbreviation());
                }
            }
        }
        seen.trim();
        long elapsedMillis = (System.nanoTime() - startNanos) / 1_000_000L;
        LOG.info("built abbreviation index: {} abbreviations from {} zones in {} ms",
                seen.size(), zoneNames.size(), elapsedMillis);
        return ObjectSets.unmodifiable(seen);
    }
}
