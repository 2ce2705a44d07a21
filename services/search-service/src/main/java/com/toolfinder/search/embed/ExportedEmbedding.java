package com.toolfinder.search.embed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ExportedEmbedding {
    private String key;
    private List<Double> embedding;
    private long createdAt;
    private long ttlSeconds;
    private double priority = 1.0;
    private String source;

    public ExportedEmbedding() {
    }

    public ExportedEmbedding(String key, List<Double> embedding, long createdAt, long ttlSeconds, double priority, String source) {
        this.key = key;
        this.embedding = embedding;
        this.createdAt = createdAt;
        this.ttlSeconds = ttlSeconds;
        this.priority = priority;
        this.source = source;
    }

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public List<Double> getEmbedding() {
        return embedding;
    }

    public void setEmbedding(List<Double> embedding) {
        this.embedding = embedding;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    public long getTtlSeconds() {
        return ttlSeconds;
    }

    public void setTtlSeconds(long ttlSeconds) {
        this.ttlSeconds = ttlSeconds;
    }

    public double getPriority() {
        return priority;
    }

    public void setPriority(double priority) {
        this.priority = priority;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }
}
