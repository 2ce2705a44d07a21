package com.toolfinder.search.resilience;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search.resilience")
public class SearchResilienceProperties {
    private Breaker embedding = new Breaker(8, 60000, 30000);
    private Breaker vectorStore = new Breaker(5, 30000, 10000);
    private Breaker documentStore = new Breaker(5, 30000, 5000);

    public Breaker getEmbedding() {
        return embedding;
    }

    public void setEmbedding(Breaker embedding) {
        this.embedding = embedding;
    }

    public Breaker getVectorStore() {
        return vectorStore;
    }

    public void setVectorStore(Breaker vectorStore) {
        this.vectorStore = vectorStore;
    }

    public Breaker getDocumentStore() {
        return documentStore;
    }

    public void setDocumentStore(Breaker documentStore) {
        this.documentStore = documentStore;
    }

    public static class Breaker {
        private int failureThreshold;
        private long resetTimeoutMs;
        private long callTimeoutMs;

        public Breaker() {
            this(5, 30000, 10000);
        }

        public Breaker(int failureThreshold, long resetTimeoutMs, long callTimeoutMs) {
            this.failureThreshold = failureThreshold;
            this.resetTimeoutMs = resetTimeoutMs;
            this.callTimeoutMs = callTimeoutMs;
        }

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public long getResetTimeoutMs() {
            return resetTimeoutMs;
        }

        public void setResetTimeoutMs(long resetTimeoutMs) {
            this.resetTimeoutMs = resetTimeoutMs;
        }

        public long getCallTimeoutMs() {
            return callTimeoutMs;
        }

        public void setCallTimeoutMs(long callTimeoutMs) {
            this.callTimeoutMs = callTimeoutMs;
        }
    }
}
