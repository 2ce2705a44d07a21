package com.toolfinder.search.embed;

import java.util.List;

public class EmbeddingCacheStats {
    private final EmbeddingCacheMetrics metrics;
    private final List<EntrySummary> topEntries;

    public EmbeddingCacheStats(EmbeddingCacheMetrics metrics, List<EntrySummary> topEntries) {
        this.metrics = metrics;
        this.topEntries = topEntries == null ? List.of() : List.copyOf(topEntries);
    }

    public EmbeddingCacheMetrics getMetrics() {
        return metrics;
    }

    public List<EntrySummary> getTopEntries() {
        return topEntries;
    }

    public static class EntrySummary {
        private final String key;
        private final long accessCount;
        private final long lastAccessed;
        private final long ttlSeconds;
        private final double priorityScore;
        private final String source;

        public EntrySummary(
            String key,
            long accessCount,
            long lastAccessed,
            long ttlSeconds,
            double priorityScore,
            String source
        ) {
            this.key = key;
            this.accessCount = accessCount;
            this.lastAccessed = lastAccessed;
            this.ttlSeconds = ttlSeconds;
            this.priorityScore = priorityScore;
            this.source = source;
        }

        public String getKey() {
            return key;
        }

        public long getAccessCount() {
            return accessCount;
        }

        public long getLastAccessed() {
            return lastAccessed;
        }

        public long getTtlSeconds() {
            return ttlSeconds;
        }

        public double getPriorityScore() {
            return priorityScore;
        }

        public String getSource() {
            return source;
        }
    }
}
