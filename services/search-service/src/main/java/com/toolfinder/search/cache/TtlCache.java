package com.toolfinder.search.cache;

import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded TTL cache. Entries leave in insertion order once {@code maxEntries} is exceeded.
 */
public class TtlCache<V> {
    private final LinkedHashMap<String, CacheEntry<V>> entries = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final int maxEntries;
    private final Clock clock;

    public TtlCache(int maxEntries) {
        this(maxEntries, Clock.systemUTC());
    }

    public TtlCache(int maxEntries, Clock clock) {
        this.maxEntries = Math.max(1, maxEntries);
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public Optional<CacheEntry<V>> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry.isExpiredAt(clock.millis())) {
                entries.remove(key);
                return Optional.empty();
            }
            return Optional.of(entry);
        } finally {
            lock.unlock();
        }
    }

    public void put(String key, V value, long ttlMs) {
        if (key == null || value == null || ttlMs <= 0) {
            return;
        }
        long now = clock.millis();
        lock.lock();
        try {
            entries.remove(key);
            entries.put(key, new CacheEntry<>(value, now, now + ttlMs));
            Iterator<String> oldest = entries.keySet().iterator();
            while (entries.size() > maxEntries && oldest.hasNext()) {
                oldest.next();
                oldest.remove();
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean remove(String key) {
        lock.lock();
        try {
            return entries.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    public int purgeExpired() {
        long now = clock.millis();
        lock.lock();
        try {
            int removed = 0;
            Iterator<Map.Entry<String, CacheEntry<V>>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                if (it.next().getValue().isExpiredAt(now)) {
                    it.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }
}
