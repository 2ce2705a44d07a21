package com.toolfinder.search.resilience;

public class CircuitBreakerStats {
    private final String name;
    private final CircuitState state;
    private final int consecutiveFailures;
    private final long lastFailureAt;
    private final long successTotal;
    private final long failureTotal;
    private final long rejectedTotal;
    private final long openedTotal;

    public CircuitBreakerStats(
        String name,
        CircuitState state,
        int consecutiveFailures,
        long lastFailureAt,
        long successTotal,
        long failureTotal,
        long rejectedTotal,
        long openedTotal
    ) {
        this.name = name;
        this.state = state;
        this.consecutiveFailures = consecutiveFailures;
        this.lastFailureAt = lastFailureAt;
        this.successTotal = successTotal;
        this.failureTotal = failureTotal;
        this.rejectedTotal = rejectedTotal;
        this.openedTotal = openedTotal;
    }

    public String getName() {
        return name;
    }

    public CircuitState getState() {
        return state;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public long getLastFailureAt() {
        return lastFailureAt;
    }

    public long getSuccessTotal() {
        return successTotal;
    }

    public long getFailureTotal() {
        return failureTotal;
    }

    public long getRejectedTotal() {
        return rejectedTotal;
    }

    public long getOpenedTotal() {
        return openedTotal;
    }
}
