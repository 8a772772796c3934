package com.courtrag.service.index;

import com.courtrag.model.MetadataField;
import com.courtrag.model.MetadataRecord;
import com.courtrag.util.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.text.Collator;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Distinct known values per metadata field, each counted by the number of
 * published documents backing it. A value disappears when its last document is
 * released.
 *
 * <p>Values are keyed by their folded form, so spellings that differ only in
 * case or spacing count as one value. The first mixed-case spelling seen is
 * the one displayed.</p>
 */
@Slf4j
@Component
public class FacetCache {

    private final Map<MetadataField, ConcurrentHashMap<String, FacetValue>> counts = new EnumMap<>(MetadataField.class);

    // register/release/replace share the read lock; rebuild needs exclusive access
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public FacetCache() {
        for (MetadataField field : MetadataField.values()) {
            counts.put(field, new ConcurrentHashMap<>());
        }
    }

    public void register(MetadataRecord metadata) {
        replace(null, metadata, () -> { });
    }

    public void release(MetadataRecord metadata) {
        replace(metadata, null, () -> { });
    }

    /**
     * Release {@code previous}, run {@code change} and register {@code next}
     * without a rebuild interleaving. Either snapshot may be null.
     */
    public void replace(MetadataRecord previous, MetadataRecord next, Runnable change) {
        lock.readLock().lock();
        try {
            apply(previous, -1);
            change.run();
            apply(next, 1);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Destructive rebuild. The snapshots are read after every in-flight
     * {@link #replace} has finished and before any new one starts. Only used
     * by an explicit reindex.
     */
    public void rebuild(Supplier<? extends Collection<MetadataRecord>> snapshots) {
        lock.writeLock().lock();
        try {
            Collection<MetadataRecord> current = snapshots.get();
            counts.values().forEach(Map::clear);
            current.forEach(snapshot -> apply(snapshot, 1));
            log.info("Facet cache rebuilt from {} documents", current.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Sorted distinct values of every field; fields without values map to an
     * empty list.
     */
    public Map<MetadataField, List<String>> snapshot() {
        Map<MetadataField, List<String>> snapshot = new EnumMap<>(MetadataField.class);
        for (MetadataField field : MetadataField.values()) {
            snapshot.put(field, values(field));
        }
        return snapshot;
    }

    public List<String> values(MetadataField field) {
        Collator collator = Collator.getInstance(TextNormalizer.AZERBAIJANI);
        return counts.get(field).values().stream()
            .map(FacetValue::display)
            .sorted(collator)
            .collect(Collectors.toList());
    }

    public int documentCount(MetadataField field, String value) {
        FacetValue facet = counts.get(field).get(TextNormalizer.fold(value));
        return facet == null ? 0 : facet.count();
    }

    public int size(MetadataField field) {
        return counts.get(field).size();
    }

    private void apply(MetadataRecord metadata, int delta) {
        if (metadata == null) {
            return;
        }
        for (MetadataField field : MetadataField.values()) {
            for (String value : metadata.values(field)) {
                counts.get(field).compute(TextNormalizer.fold(value), (key, facet) -> {
                    if (facet == null) {
                        return delta > 0 ? new FacetValue(value, delta) : null;
                    }
                    int next = facet.count() + delta;
                    if (next <= 0) {
                        return null;
                    }
                    return new FacetValue(preferredSpelling(facet.display(), value), next);
                });
            }
        }
    }

    private static String preferredSpelling(String current, String candidate) {
        boolean currentShouts = current.equals(current.toUpperCase(TextNormalizer.AZERBAIJANI));
        boolean candidateShouts = candidate.equals(candidate.toUpperCase(TextNormalizer.AZERBAIJANI));
        return currentShouts && !candidateShouts ? candidate : current;
    }

    private record FacetValue(String display, int count) {
    }
}
