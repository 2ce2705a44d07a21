package com.toolfinder.search.embed;

import java.util.List;

public class EmbeddingCacheEntry {
    static final int BYTES_PER_DIMENSION = 8;

    private final List<Double> embedding;
    private final byte[] compressedEmbedding;
    private final int dimensions;
    private final long createdAt;
    private final long baseTtlSeconds;
    private final double priority;
    private final String source;
    private final String contentHash;
    private final String semanticHash;
    private long lastAccessed;
    private long accessSequence;
    private long accessCount;
    private long ttlSeconds;

    EmbeddingCacheEntry(
        List<Double> embedding,
        byte[] compressedEmbedding,
        int dimensions,
        long createdAt,
        long baseTtlSeconds,
        double priority,
        String source,
        String contentHash,
        String semanticHash
    ) {
        this.embedding = embedding;
        this.compressedEmbedding = compressedEmbedding;
        this.dimensions = dimensions;
        this.createdAt = createdAt;
        this.baseTtlSeconds = baseTtlSeconds;
        this.priority = priority;
        this.source = source;
        this.contentHash = contentHash;
        this.semanticHash = semanticHash;
        this.lastAccessed = createdAt;
        this.accessCount = 1;
        this.ttlSeconds = baseTtlSeconds;
    }

    public boolean isCompressed() {
        return compressedEmbedding != null;
    }

    List<Double> getRawEmbedding() {
        return embedding;
    }

    byte[] getCompressedEmbedding() {
        return compressedEmbedding;
    }

    public int getDimensions() {
        return dimensions;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getLastAccessed() {
        return lastAccessed;
    }

    long getAccessSequence() {
        return accessSequence;
    }

    public long getAccessCount() {
        return accessCount;
    }

    public long getBaseTtlSeconds() {
        return baseTtlSeconds;
    }

    public long getTtlSeconds() {
        return ttlSeconds;
    }

    public double getPriority() {
        return priority;
    }

    public String getSource() {
        return source;
    }

    public String getContentHash() {
        return contentHash;
    }

    public String getSemanticHash() {
        return semanticHash;
    }

    public long getRawSizeBytes() {
        return (long) dimensions * BYTES_PER_DIMENSION;
    }

    public long getSizeBytes() {
        return isCompressed() ? compressedEmbedding.length : getRawSizeBytes();
    }

    public double ageSeconds(long nowMs) {
        return Math.max(0L, nowMs - createdAt) / 1000.0;
    }

    public boolean isExpiredAt(long nowMs) {
        return ageSeconds(nowMs) > ttlSeconds;
    }

    void recordAccess(long nowMs, long sequence) {
        lastAccessed = nowMs;
        accessSequence = sequence;
        accessCount++;
    }

    void markWritten(long sequence) {
        accessSequence = sequence;
    }

    void setTtlSeconds(long ttlSeconds) {
        this.ttlSeconds = ttlSeconds;
    }
}
