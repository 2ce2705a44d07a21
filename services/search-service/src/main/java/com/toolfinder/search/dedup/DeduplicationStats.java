package com.toolfinder.search.dedup;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class DeduplicationStats {
    private final long runs;
    private final long totalProcessed;
    private final long totalDuplicatesRemoved;
    private final double averageProcessingTimeMs;
    private final double averageDuplicateRate;
    private final Map<String, Long> detectionsByStrategy;
    private final DeduplicationResult lastRun;

    public DeduplicationStats(
        long runs,
        long totalProcessed,
        long totalDuplicatesRemoved,
        double averageProcessingTimeMs,
        double averageDuplicateRate,
        Map<String, Long> detectionsByStrategy,
        DeduplicationResult lastRun
    ) {
        this.runs = runs;
        this.totalProcessed = totalProcessed;
        this.totalDuplicatesRemoved = totalDuplicatesRemoved;
        this.averageProcessingTimeMs = averageProcessingTimeMs;
        this.averageDuplicateRate = averageDuplicateRate;
        this.detectionsByStrategy = detectionsByStrategy == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(detectionsByStrategy));
        this.lastRun = lastRun;
    }

    public long getRuns() {
        return runs;
    }

    public long getTotalProcessed() {
        return totalProcessed;
    }

    public long getTotalDuplicatesRemoved() {
        return totalDuplicatesRemoved;
    }

    /**
     * Averaged over the most recent runs only.
     */
    public double getAverageProcessingTimeMs() {
        return averageProcessingTimeMs;
    }

    public double getAverageDuplicateRate() {
        return averageDuplicateRate;
    }

    public Map<String, Long> getDetectionsByStrategy() {
        return detectionsByStrategy;
    }

    public DeduplicationResult getLastRun() {
        return lastRun;
    }
}
