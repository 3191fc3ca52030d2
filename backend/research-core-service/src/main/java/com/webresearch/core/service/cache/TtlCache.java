package com.webresearch.core.service.cache;

import com.webresearch.core.dto.cache.CacheEntry;
import com.webresearch.core.dto.cache.CacheStats;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Capacity-bounded TTL cache.
 *
 * <p>When full, inserting a new key evicts the entry with the fewest hits (least frequently used,
 * not least recently used). Ties go to the earliest inserted entry. Expired entries behave as
 * misses and are dropped on access.
 */
@Slf4j
public class TtlCache<T> {

    private static final int ENTRY_VERSION = 1;

    private final String name;
    private final int maxSize;
    private final Duration defaultTtl;
    private final Clock clock;
    private final Map<String, CacheEntry<T>> entries = new LinkedHashMap<>();

    public TtlCache(String name, int maxSize, Duration defaultTtl, Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("Cache '" + name + "' needs a positive capacity");
        }
        this.name = name;
        this.maxSize = maxSize;
        this.defaultTtl = defaultTtl;
        this.clock = clock;
    }

    public synchronized Optional<T> get(String key) {
        CacheEntry<T> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.millis())) {
            entries.remove(key);
            return Optional.empty();
        }
        entry.setHits(entry.getHits() + 1);
        return Optional.ofNullable(entry.getValue());
    }

    public void set(String key, T value) {
        set(key, value, defaultTtl);
    }

    public synchronized void set(String key, T value, Duration ttl) {
        if (!entries.containsKey(key) && entries.size() >= maxSize) {
            evictOne();
        }
        long now = clock.millis();
        Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
        entries.put(key, CacheEntry.<T>builder()
                .key(key)
                .value(value)
                .createdAt(now)
                .expiresAt(now + effectiveTtl.toMillis())
                .version(ENTRY_VERSION)
                .hits(0)
                .build());
    }

    public synchronized boolean has(String key) {
        CacheEntry<T> entry = entries.get(key);
        if (entry == null) {
            return false;
        }
        if (entry.isExpired(clock.millis())) {
            entries.remove(key);
            return false;
        }
        return true;
    }

    public synchronized boolean delete(String key) {
        return entries.remove(key) != null;
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * Remove expired entries.
     *
     * @return number of entries removed
     */
    public synchronized int cleanup() {
        long now = clock.millis();
        int removed = 0;
        Iterator<CacheEntry<T>> iterator = entries.values().iterator();
        while (iterator.hasNext()) {
            if (iterator.next().isExpired(now)) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    public synchronized CacheStats stats() {
        long now = clock.millis();
        long totalHits = 0;
        long totalAge = 0;
        for (CacheEntry<T> entry : entries.values()) {
            totalHits += entry.getHits();
            totalAge += now - entry.getCreatedAt();
        }
        int size = entries.size();
        return new CacheStats(
                size,
                size > 0 ? (double) totalHits / size : 0,
                size > 0 ? (double) totalAge / size : 0
        );
    }

    /**
     * Live entries, copied.
     */
    public synchronized List<CacheEntry<T>> export() {
        long now = clock.millis();
        List<CacheEntry<T>> exported = new ArrayList<>();
        for (CacheEntry<T> entry : entries.values()) {
            if (!entry.isExpired(now)) {
                exported.add(new CacheEntry<>(entry.getKey(), entry.getValue(), entry.getCreatedAt(),
                        entry.getExpiresAt(), entry.getVersion(), entry.getHits()));
            }
        }
        return exported;
    }

    /**
     * Load persisted entries, silently dropping those already expired.
     */
    public synchronized int importEntries(List<CacheEntry<T>> imported) {
        if (imported == null) {
            return 0;
        }
        long now = clock.millis();
        int loaded = 0;
        for (CacheEntry<T> entry : imported) {
            if (entry == null || entry.getKey() == null || entry.isExpired(now)) {
                continue;
            }
            if (!entries.containsKey(entry.getKey()) && entries.size() >= maxSize) {
                evictOne();
            }
            entries.put(entry.getKey(), new CacheEntry<>(entry.getKey(), entry.getValue(),
                    entry.getCreatedAt(), entry.getExpiresAt(), entry.getVersion(), entry.getHits()));
            loaded++;
        }
        return loaded;
    }

    private void evictOne() {
        String minKey = null;
        int minHits = Integer.MAX_VALUE;
        for (CacheEntry<T> entry : entries.values()) {
            if (entry.getHits() < minHits) {
                minHits = entry.getHits();
                minKey = entry.getKey();
            }
        }
        if (minKey != null) {
            entries.remove(minKey);
            log.debug("Evicted '{}' from {} cache (hits={})", minKey, name, minHits);
        }
    }
}
