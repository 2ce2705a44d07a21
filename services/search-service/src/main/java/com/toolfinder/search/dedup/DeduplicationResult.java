package com.toolfinder.search.dedup;

import com.toolfinder.search.model.MergedItem;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class DeduplicationResult {
    private final List<MergedItem> uniqueItems;
    private final int duplicatesRemoved;
    private final int totalProcessed;
    private final double averageCombinedScore;
    private final long processingTimeMs;
    private final Map<String, Integer> detectionsByStrategy;

    public DeduplicationResult(
        List<MergedItem> uniqueItems,
        int duplicatesRemoved,
        int totalProcessed,
        double averageCombinedScore,
        long processingTimeMs,
        Map<String, Integer> detectionsByStrategy
    ) {
        this.uniqueItems = uniqueItems == null ? List.of() : Collections.unmodifiableList(uniqueItems);
        this.duplicatesRemoved = duplicatesRemoved;
        this.totalProcessed = totalProcessed;
        this.averageCombinedScore = averageCombinedScore;
        this.processingTimeMs = processingTimeMs;
        this.detectionsByStrategy = detectionsByStrategy == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(detectionsByStrategy));
    }

    public List<MergedItem> getUniqueItems() {
        return uniqueItems;
    }

    public int getDuplicatesRemoved() {
        return duplicatesRemoved;
    }

    public int getTotalProcessed() {
        return totalProcessed;
    }

    public double getAverageCombinedScore() {
        return averageCombinedScore;
    }

    public long getProcessingTimeMs() {
        return processingTimeMs;
    }

    public Map<String, Integer> getDetectionsByStrategy() {
        return detectionsByStrategy;
    }

    public double getDuplicateRate() {
        return totalProcessed == 0 ? 0.0 : (double) duplicatesRemoved / totalProcessed;
    }
}
