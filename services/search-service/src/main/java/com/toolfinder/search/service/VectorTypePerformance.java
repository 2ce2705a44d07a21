package com.toolfinder.search.service;

public class VectorTypePerformance {
    private final String vectorType;
    private final long searches;
    private final long errors;
    private final long timeouts;
    private final double averageLatencyMs;
    private final double averageResultCount;
    private final double averageScore;

    public VectorTypePerformance(
        String vectorType,
        long searches,
        long errors,
        long timeouts,
        double averageLatencyMs,
        double averageResultCount,
        double averageScore
    ) {
        this.vectorType = vectorType;
        this.searches = searches;
        this.errors = errors;
        this.timeouts = timeouts;
        this.averageLatencyMs = averageLatencyMs;
        this.averageResultCount = averageResultCount;
        this.averageScore = averageScore;
    }

    public String getVectorType() {
        return vectorType;
    }

    public long getSearches() {
        return searches;
    }

    public long getErrors() {
        return errors;
    }

    public long getTimeouts() {
        return timeouts;
    }

    public double getAverageLatencyMs() {
        return averageLatencyMs;
    }

    public double getAverageResultCount() {
        return averageResultCount;
    }

    public double getAverageScore() {
        return averageScore;
    }

    public double getErrorRate() {
        return searches == 0 ? 0.0 : (double) (errors + timeouts) / searches;
    }
}
