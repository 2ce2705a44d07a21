package com.toolfinder.search.embed;

import com.toolfinder.search.cache.CacheKeyUtil;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Long-lived embedding store shared by concurrent requests.
 *
 * <p>Lookups try the exact key first and, when a query vector is supplied, fall back to the most
 * similar live entry above the configured cosine threshold. Entries earn longer TTLs as they are
 * reused, are optionally stored GZIP-compressed, and are evicted one at a time on insert when the
 * cache is full. Every read and write of entry state happens under a single lock.
 */
public class EmbeddingCache implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingCache.class);
    private static final int TOP_ENTRIES = 10;
    private static final double MIN_AGE_HOURS = 1.0 / 3600.0;

    private final EmbeddingProperties.Cache settings;
    private final EmbeddingCompressor compressor;
    private final AdaptiveTtlPolicy ttlPolicy;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, EmbeddingCacheEntry> entries = new LinkedHashMap<>();
    private final ScheduledExecutorService scheduler;

    private EvictionPolicy evictionPolicy;
    private long sequence;
    private long hits;
    private long misses;
    private long semanticHits;
    private long evictions;
    private long expirations;
    private long compressions;
    private long decompressions;
    private long totalRequests;
    private ScheduledFuture<?> warmingTask;
    private volatile boolean closed;

    public EmbeddingCache(EmbeddingProperties.Cache settings, EmbeddingCompressor compressor, Clock clock) {
        this.settings = settings == null ? new EmbeddingProperties.Cache() : settings;
        this.compressor = compressor == null ? new EmbeddingCompressor(null) : compressor;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.ttlPolicy = new AdaptiveTtlPolicy(
            this.settings.getMinTtlSeconds(),
            this.settings.getMaxTtlSeconds(),
            this.settings.isAdaptiveTtlEnabled()
        );
        this.evictionPolicy = this.settings.getEvictionPolicy() == null
            ? EvictionPolicy.ADAPTIVE
            : this.settings.getEvictionPolicy();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "embedding-cache-maintenance");
            thread.setDaemon(true);
            return thread;
        });
        long cleanupInterval = this.settings.getCleanupIntervalMs();
        if (cleanupInterval > 0) {
            scheduler.scheduleWithFixedDelay(
                guarded("cleanup", this::cleanup),
                cleanupInterval,
                cleanupInterval,
                TimeUnit.MILLISECONDS
            );
        }
    }

    public Optional<List<Double>> get(String key) {
        return get(key, null);
    }

    public Optional<List<Double>> get(String key, List<Double> queryEmbedding) {
        lock.lock();
        try {
            totalRequests++;
            if (!settings.isEnabled() || key == null) {
                misses++;
                return Optional.empty();
            }
            long now = clock.millis();
            EmbeddingCacheEntry entry = entries.get(key);
            if (entry != null) {
                if (entry.isExpiredAt(now)) {
                    entries.remove(key);
                    expirations++;
                } else {
                    List<Double> embedding = read(key, entry);
                    if (embedding != null) {
                        entry.recordAccess(now, ++sequence);
                        entry.setTtlSeconds(
                            ttlPolicy.compute(entry.getBaseTtlSeconds(), entry.getAccessCount(), entry.ageSeconds(now))
                        );
                        hits++;
                        return Optional.of(embedding);
                    }
                    entries.remove(key);
                }
            }
            if (queryEmbedding != null && !queryEmbedding.isEmpty() && settings.isSemanticFallbackEnabled()) {
                Optional<List<Double>> similar = findSimilar(queryEmbedding, now);
                if (similar.isPresent()) {
                    semanticHits++;
                    return similar;
                }
            }
            misses++;
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public void set(String key, List<Double> embedding) {
        set(key, embedding, CacheWriteOptions.defaults());
    }

    public void set(String key, List<Double> embedding, CacheWriteOptions options) {
        if (!settings.isEnabled() || key == null || embedding == null || embedding.isEmpty()) {
            return;
        }
        CacheWriteOptions resolved = options == null ? CacheWriteOptions.defaults() : options;
        List<Double> copy = List.copyOf(embedding);
        long baseTtl = resolved.getCustomTtlSeconds() != null
            ? resolved.getCustomTtlSeconds()
            : settings.getTtlSeconds();
        lock.lock();
        try {
            long now = clock.millis();
            byte[] compressed = null;
            if (settings.isCompressionEnabled()) {
                try {
                    compressed = compressor.compress(copy);
                    compressions++;
                } catch (CacheException e) {
                    log.warn("embedding_cache_compress_failed key={}", key, e);
                }
            }
            if (!entries.containsKey(key)) {
                int capacity = Math.max(1, settings.getMaxEntries());
                while (entries.size() >= capacity) {
                    if (!evictOne(now)) {
                        break;
                    }
                }
            } else {
                entries.remove(key);
            }
            EmbeddingCacheEntry entry = new EmbeddingCacheEntry(
                compressed == null ? copy : null,
                compressed,
                copy.size(),
                now,
                baseTtl,
                resolved.getPriority(),
                resolved.getSource(),
                CacheKeyUtil.sha256(copy.toString()),
                VectorMath.semanticHash(copy)
            );
            entry.markWritten(++sequence);
            entries.put(key, entry);
        } finally {
            lock.unlock();
        }
    }

    public boolean has(String key) {
        if (!settings.isEnabled() || key == null) {
            return false;
        }
        lock.lock();
        try {
            EmbeddingCacheEntry entry = entries.get(key);
            if (entry == null) {
                return false;
            }
            if (entry.isExpiredAt(clock.millis())) {
                entries.remove(key);
                expirations++;
                return false;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean delete(String key) {
        lock.lock();
        try {
            return entries.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops every entry and resets the counters.
     */
    public void clear() {
        lock.lock();
        try {
            entries.clear();
            hits = 0;
            misses = 0;
            semanticHits = 0;
            evictions = 0;
            expirations = 0;
            compressions = 0;
            decompressions = 0;
            totalRequests = 0;
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Optional<List<Double>>> getBatch(List<String> keys) {
        return getBatch(keys, null);
    }

    public Map<String, Optional<List<Double>>> getBatch(List<String> keys, List<List<Double>> queryEmbeddings) {
        Map<String, Optional<List<Double>>> results = new LinkedHashMap<>();
        if (keys == null) {
            return results;
        }
        for (int i = 0; i < keys.size(); i++) {
            List<Double> queryEmbedding = queryEmbeddings != null && i < queryEmbeddings.size()
                ? queryEmbeddings.get(i)
                : null;
            results.put(keys.get(i), get(keys.get(i), queryEmbedding));
        }
        return results;
    }

    public void setBatch(Map<String, List<Double>> embeddings, CacheWriteOptions options) {
        if (embeddings == null) {
            return;
        }
        embeddings.forEach((key, embedding) -> set(key, embedding, options));
    }

    /**
     * Removes expired entries and returns how many were dropped.
     */
    public int cleanup() {
        lock.lock();
        try {
            long now = clock.millis();
            int removed = 0;
            Iterator<EmbeddingCacheEntry> it = entries.values().iterator();
            while (it.hasNext()) {
                if (it.next().isExpiredAt(now)) {
                    it.remove();
                    removed++;
                }
            }
            expirations += removed;
            if (removed > 0) {
                log.debug("embedding_cache_cleanup removed={} remaining={}", removed, entries.size());
            }
            return removed;
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

    public EmbeddingCacheMetrics getMetrics() {
        lock.lock();
        try {
            return snapshotMetrics();
        } finally {
            lock.unlock();
        }
    }

    public EmbeddingCacheStats getStats() {
        lock.lock();
        try {
            long now = clock.millis();
            List<EmbeddingCacheStats.EntrySummary> summaries = new ArrayList<>(entries.size());
            for (Map.Entry<String, EmbeddingCacheEntry> item : entries.entrySet()) {
                EmbeddingCacheEntry entry = item.getValue();
                summaries.add(
                    new EmbeddingCacheStats.EntrySummary(
                        item.getKey(),
                        entry.getAccessCount(),
                        entry.getLastAccessed(),
                        entry.getTtlSeconds(),
                        priorityScore(entry, now),
                        entry.getSource()
                    )
                );
            }
            summaries.sort(Comparator.comparingDouble(EmbeddingCacheStats.EntrySummary::getPriorityScore).reversed());
            List<EmbeddingCacheStats.EntrySummary> top = summaries.subList(0, Math.min(TOP_ENTRIES, summaries.size()));
            return new EmbeddingCacheStats(snapshotMetrics(), top);
        } finally {
            lock.unlock();
        }
    }

    public EvictionPolicy getEvictionPolicy() {
        lock.lock();
        try {
            return evictionPolicy;
        } finally {
            lock.unlock();
        }
    }

    public void setEvictionPolicy(EvictionPolicy evictionPolicy) {
        if (evictionPolicy == null) {
            throw new IllegalArgumentException("eviction policy is required");
        }
        lock.lock();
        try {
            this.evictionPolicy = evictionPolicy;
        } finally {
            lock.unlock();
        }
    }

    public long adaptiveTtlSeconds(long accessCount, double ageSeconds) {
        return ttlPolicy.compute(settings.getTtlSeconds(), accessCount, ageSeconds);
    }

    /**
     * Live entries in their decompressed form, oldest first.
     */
    public List<ExportedEmbedding> export() {
        lock.lock();
        try {
            long now = clock.millis();
            List<ExportedEmbedding> exported = new ArrayList<>(entries.size());
            for (Map.Entry<String, EmbeddingCacheEntry> item : entries.entrySet()) {
                EmbeddingCacheEntry entry = item.getValue();
                if (entry.isExpiredAt(now)) {
                    continue;
                }
                List<Double> embedding = read(item.getKey(), entry);
                if (embedding == null) {
                    continue;
                }
                exported.add(
                    new ExportedEmbedding(
                        item.getKey(),
                        embedding,
                        entry.getCreatedAt(),
                        entry.getTtlSeconds(),
                        entry.getPriority(),
                        entry.getSource()
                    )
                );
            }
            return exported;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the cache content. Each entry keeps its exported TTL as a custom TTL.
     */
    public int importEntries(Collection<ExportedEmbedding> exported) {
        clear();
        if (exported == null) {
            return 0;
        }
        int imported = 0;
        for (ExportedEmbedding item : exported) {
            if (item == null || item.getKey() == null || item.getEmbedding() == null || item.getEmbedding().isEmpty()) {
                continue;
            }
            Long ttl = item.getTtlSeconds() > 0 ? item.getTtlSeconds() : null;
            set(item.getKey(), item.getEmbedding(), new CacheWriteOptions(item.getPriority(), item.getSource(), ttl));
            imported++;
        }
        return imported;
    }

    /**
     * Runs {@code task} on the maintenance thread every {@code intervalMs}, replacing any previous warming task.
     */
    public void scheduleWarming(Runnable task, long intervalMs) {
        if (task == null || intervalMs <= 0 || closed) {
            return;
        }
        lock.lock();
        try {
            if (warmingTask != null) {
                warmingTask.cancel(false);
            }
            warmingTask = scheduler.scheduleWithFixedDelay(guarded("warming", task), 0L, intervalMs, TimeUnit.MILLISECONDS);
        } finally {
            lock.unlock();
        }
    }

    public void stopWarming() {
        lock.lock();
        try {
            if (warmingTask != null) {
                warmingTask.cancel(false);
                warmingTask = null;
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        stopWarming();
        scheduler.shutdownNow();
    }

    private List<Double> read(String key, EmbeddingCacheEntry entry) {
        if (!entry.isCompressed()) {
            return entry.getRawEmbedding();
        }
        try {
            List<Double> embedding = compressor.decompress(entry.getCompressedEmbedding());
            decompressions++;
            return embedding;
        } catch (CacheException e) {
            log.warn("embedding_cache_decompress_failed key={}", key, e);
            return null;
        }
    }

    private Optional<List<Double>> findSimilar(List<Double> queryEmbedding, long now) {
        double threshold = settings.getSemanticSimilarityThreshold();
        EmbeddingCacheEntry best = null;
        List<Double> bestEmbedding = null;
        double bestSimilarity = threshold;
        for (Map.Entry<String, EmbeddingCacheEntry> item : entries.entrySet()) {
            EmbeddingCacheEntry entry = item.getValue();
            if (entry.isExpiredAt(now)) {
                continue;
            }
            List<Double> candidate = read(item.getKey(), entry);
            if (candidate == null) {
                continue;
            }
            double similarity = VectorMath.cosineSimilarity(queryEmbedding, candidate);
            if (similarity > bestSimilarity) {
                best = entry;
                bestEmbedding = candidate;
                bestSimilarity = similarity;
            }
        }
        if (best == null) {
            return Optional.empty();
        }
        best.recordAccess(now, ++sequence);
        return Optional.of(bestEmbedding);
    }

    private boolean evictOne(long now) {
        Comparator<EmbeddingCacheEntry> order = evictionOrder(now);
        String victimKey = null;
        EmbeddingCacheEntry victim = null;
        for (Map.Entry<String, EmbeddingCacheEntry> item : entries.entrySet()) {
            if (victim == null || order.compare(item.getValue(), victim) < 0) {
                victimKey = item.getKey();
                victim = item.getValue();
            }
        }
        if (victimKey == null) {
            return false;
        }
        entries.remove(victimKey);
        evictions++;
        log.debug("embedding_cache_evict key={} policy={}", victimKey, evictionPolicy);
        return true;
    }

    private Comparator<EmbeddingCacheEntry> evictionOrder(long now) {
        switch (evictionPolicy) {
            case LFU:
                return Comparator.comparingLong(EmbeddingCacheEntry::getAccessCount)
                    .thenComparingLong(EmbeddingCacheEntry::getAccessSequence);
            case PRIORITY:
            case ADAPTIVE:
                return Comparator.<EmbeddingCacheEntry>comparingDouble(entry -> priorityScore(entry, now))
                    .thenComparingLong(EmbeddingCacheEntry::getAccessSequence);
            case LRU:
            default:
                return Comparator.comparingLong(EmbeddingCacheEntry::getLastAccessed)
                    .thenComparingLong(EmbeddingCacheEntry::getAccessSequence);
        }
    }

    double priorityScore(EmbeddingCacheEntry entry, long now) {
        double ageSeconds = entry.ageSeconds(now);
        double ageHours = ageSeconds / 3600.0;
        double recencyFactor = 1.0 / Math.max(ageHours, MIN_AGE_HOURS);
        double accessesPerSecond = entry.getAccessCount() / Math.max(ageSeconds, 1.0);
        double frequencyFactor = Math.log(accessesPerSecond + 1.0);
        return recencyFactor * frequencyFactor * entry.getPriority();
    }

    private EmbeddingCacheMetrics snapshotMetrics() {
        long memoryUsage = 0L;
        long compressedBytes = 0L;
        long compressedRawBytes = 0L;
        long ttlTotal = 0L;
        for (EmbeddingCacheEntry entry : entries.values()) {
            memoryUsage += entry.getRawSizeBytes();
            ttlTotal += entry.getTtlSeconds();
            if (entry.isCompressed()) {
                compressedBytes += entry.getSizeBytes();
                compressedRawBytes += entry.getRawSizeBytes();
            }
        }
        double averageTtl = entries.isEmpty() ? settings.getTtlSeconds() : (double) ttlTotal / entries.size();
        double compressionRatio = compressedRawBytes == 0 ? 0.0 : 1.0 - ((double) compressedBytes / compressedRawBytes);
        return new EmbeddingCacheMetrics(
            hits,
            misses,
            semanticHits,
            evictions,
            expirations,
            compressions,
            decompressions,
            totalRequests,
            entries.size(),
            memoryUsage,
            averageTtl,
            compressionRatio,
            evictionPolicy
        );
    }

    private Runnable guarded(String taskName, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.warn("embedding_cache_{}_failed", taskName, e);
            }
        };
    }
}
