package com.toolfinder.search.model;

public class VectorTypeMetrics {
    private final String vectorType;
    private final int resultCount;
    private final long latencyMs;
    private final double averageScore;
    private final VectorTypeStatus status;
    private final String errorMessage;

    public VectorTypeMetrics(
        String vectorType,
        int resultCount,
        long latencyMs,
        double averageScore,
        VectorTypeStatus status,
        String errorMessage
    ) {
        this.vectorType = vectorType;
        this.resultCount = resultCount;
        this.latencyMs = latencyMs;
        this.averageScore = averageScore;
        this.status = status;
        this.errorMessage = errorMessage;
    }

    public String getVectorType() {
        return vectorType;
    }

    public int getResultCount() {
        return resultCount;
    }

    public long getLatencyMs() {
        return latencyMs;
    }

    public double getAverageScore() {
        return averageScore;
    }

    public VectorTypeStatus getStatus() {
        return status;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public boolean isDegraded() {
        return status != null && status.isDegraded();
    }
}
