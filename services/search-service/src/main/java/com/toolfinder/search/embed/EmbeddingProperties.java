package com.toolfinder.search.embed;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "embedding")
public class EmbeddingProperties {
    private String baseUrl;
    private String model;
    private int timeoutMs = 30000;
    private int retryCount = 1;
    private Cache cache = new Cache();
    private Warming warming = new Warming();

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(int timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Warming getWarming() {
        return warming;
    }

    public void setWarming(Warming warming) {
        this.warming = warming;
    }

    public static class Cache {
        private boolean enabled = true;
        private int maxEntries = 1000;
        private long ttlSeconds = 3600;
        private long minTtlSeconds = 300;
        private long maxTtlSeconds = 7200;
        private boolean adaptiveTtlEnabled = true;
        private boolean semanticFallbackEnabled = true;
        private double semanticSimilarityThreshold = 0.8;
        private boolean compressionEnabled = true;
        private EvictionPolicy evictionPolicy = EvictionPolicy.ADAPTIVE;
        private long cleanupIntervalMs = 60000;
        private boolean normalize = true;
        private int maxTextLength = 0;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }

        public long getTtlSeconds() {
            return ttlSeconds;
        }

        public void setTtlSeconds(long ttlSeconds) {
            this.ttlSeconds = ttlSeconds;
        }

        public long getMinTtlSeconds() {
            return minTtlSeconds;
        }

        public void setMinTtlSeconds(long minTtlSeconds) {
            this.minTtlSeconds = minTtlSeconds;
        }

        public long getMaxTtlSeconds() {
            return maxTtlSeconds;
        }

        public void setMaxTtlSeconds(long maxTtlSeconds) {
            this.maxTtlSeconds = maxTtlSeconds;
        }

        public boolean isAdaptiveTtlEnabled() {
            return adaptiveTtlEnabled;
        }

        public void setAdaptiveTtlEnabled(boolean adaptiveTtlEnabled) {
            this.adaptiveTtlEnabled = adaptiveTtlEnabled;
        }

        public boolean isSemanticFallbackEnabled() {
            return semanticFallbackEnabled;
        }

        public void setSemanticFallbackEnabled(boolean semanticFallbackEnabled) {
            this.semanticFallbackEnabled = semanticFallbackEnabled;
        }

        public double getSemanticSimilarityThreshold() {
            return semanticSimilarityThreshold;
        }

        public void setSemanticSimilarityThreshold(double semanticSimilarityThreshold) {
            this.semanticSimilarityThreshold = semanticSimilarityThreshold;
        }

        public boolean isCompressionEnabled() {
            return compressionEnabled;
        }

        public void setCompressionEnabled(boolean compressionEnabled) {
            this.compressionEnabled = compressionEnabled;
        }

        public EvictionPolicy getEvictionPolicy() {
            return evictionPolicy;
        }

        public void setEvictionPolicy(EvictionPolicy evictionPolicy) {
            this.evictionPolicy = evictionPolicy;
        }

        public long getCleanupIntervalMs() {
            return cleanupIntervalMs;
        }

        public void setCleanupIntervalMs(long cleanupIntervalMs) {
            this.cleanupIntervalMs = cleanupIntervalMs;
        }

        public boolean isNormalize() {
            return normalize;
        }

        public void setNormalize(boolean normalize) {
            this.normalize = normalize;
        }

        public int getMaxTextLength() {
            return maxTextLength;
        }

        public void setMaxTextLength(int maxTextLength) {
            this.maxTextLength = maxTextLength;
        }
    }

    public static class Warming {
        private boolean enabled = false;
        private long intervalMs = 300000;
        private int maxWarmupSize = 100;
        private List<String> queries = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public int getMaxWarmupSize() {
            return maxWarmupSize;
        }

        public void setMaxWarmupSize(int maxWarmupSize) {
            this.maxWarmupSize = maxWarmupSize;
        }

        public List<String> getQueries() {
            return queries;
        }

        public void setQueries(List<String> queries) {
            this.queries = queries;
        }
    }
}
