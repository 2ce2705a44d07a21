package com.toolfinder.search.service;

public class SearchTimings {
    private final long embeddingMs;
    private final long retrievalMs;
    private final long mergeMs;
    private final long dedupMs;
    private final long totalMs;

    public SearchTimings(long embeddingMs, long retrievalMs, long mergeMs, long dedupMs, long totalMs) {
        this.embeddingMs = embeddingMs;
        this.retrievalMs = retrievalMs;
        this.mergeMs = mergeMs;
        this.dedupMs = dedupMs;
        this.totalMs = totalMs;
    }

    public long getEmbeddingMs() {
        return embeddingMs;
    }

    public long getRetrievalMs() {
        return retrievalMs;
    }

    public long getMergeMs() {
        return mergeMs;
    }

    public long getDedupMs() {
        return dedupMs;
    }

    public long getTotalMs() {
        return totalMs;
    }
}
