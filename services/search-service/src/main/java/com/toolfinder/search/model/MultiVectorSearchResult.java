package com.toolfinder.search.model;

import com.toolfinder.search.merge.MergeStrategy;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class MultiVectorSearchResult {
    private final List<MergedItem> items;
    private final Map<String, VectorTypeMetrics> perTypeMetrics;
    private final long totalTimeMs;
    private final MergeStrategy mergeStrategy;
    private final boolean cacheHit;

    public MultiVectorSearchResult(
        List<MergedItem> items,
        Map<String, VectorTypeMetrics> perTypeMetrics,
        long totalTimeMs,
        MergeStrategy mergeStrategy,
        boolean cacheHit
    ) {
        this.items = items == null ? List.of() : Collections.unmodifiableList(items);
        this.perTypeMetrics = perTypeMetrics == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(perTypeMetrics));
        this.totalTimeMs = totalTimeMs;
        this.mergeStrategy = mergeStrategy;
        this.cacheHit = cacheHit;
    }

    public MultiVectorSearchResult asCacheHit(long tookMs) {
        return new MultiVectorSearchResult(items, perTypeMetrics, tookMs, mergeStrategy, true);
    }

    public List<MergedItem> getItems() {
        return items;
    }

    public Map<String, VectorTypeMetrics> getPerTypeMetrics() {
        return perTypeMetrics;
    }

    public long getTotalTimeMs() {
        return totalTimeMs;
    }

    public MergeStrategy getMergeStrategy() {
        return mergeStrategy;
    }

    public boolean isCacheHit() {
        return cacheHit;
    }
}
