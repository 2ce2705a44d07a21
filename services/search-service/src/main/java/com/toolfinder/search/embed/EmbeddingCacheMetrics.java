package com.toolfinder.search.embed;

public class EmbeddingCacheMetrics {
    private final long hits;
    private final long misses;
    private final long semanticHits;
    private final long evictions;
    private final long expirations;
    private final long compressions;
    private final long decompressions;
    private final long totalRequests;
    private final int size;
    private final long memoryUsageBytes;
    private final double averageTtlSeconds;
    private final double compressionRatio;
    private final EvictionPolicy evictionPolicy;

    public EmbeddingCacheMetrics(
        long hits,
        long misses,
        long semanticHits,
        long evictions,
        long expirations,
        long compressions,
        long decompressions,
        long totalRequests,
        int size,
        long memoryUsageBytes,
        double averageTtlSeconds,
        double compressionRatio,
        EvictionPolicy evictionPolicy
    ) {
        this.hits = hits;
        this.misses = misses;
        this.semanticHits = semanticHits;
        this.evictions = evictions;
        this.expirations = expirations;
        this.compressions = compressions;
        this.decompressions = decompressions;
        this.totalRequests = totalRequests;
        this.size = size;
        this.memoryUsageBytes = memoryUsageBytes;
        this.averageTtlSeconds = averageTtlSeconds;
        this.compressionRatio = compressionRatio;
        this.evictionPolicy = evictionPolicy;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    public long getSemanticHits() {
        return semanticHits;
    }

    public long getEvictions() {
        return evictions;
    }

    public long getExpirations() {
        return expirations;
    }

    public long getCompressions() {
        return compressions;
    }

    public long getDecompressions() {
        return decompressions;
    }

    public long getTotalRequests() {
        return totalRequests;
    }

    public double getHitRate() {
        return totalRequests == 0 ? 0.0 : (double) hits / totalRequests;
    }

    public double getSemanticHitRate() {
        return totalRequests == 0 ? 0.0 : (double) semanticHits / totalRequests;
    }

    public int getSize() {
        return size;
    }

    public long getMemoryUsageBytes() {
        return memoryUsageBytes;
    }

    public double getAverageTtlSeconds() {
        return averageTtlSeconds;
    }

    public double getCompressionRatio() {
        return compressionRatio;
    }

    public EvictionPolicy getEvictionPolicy() {
        return evictionPolicy;
    }
}
