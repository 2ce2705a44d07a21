package com.toolfinder.search.resilience;

public class CircuitOpenException extends RuntimeException {
    private final String breakerName;

    public CircuitOpenException(String breakerName) {
        super(breakerName + "_circuit_open");
        this.breakerName = breakerName;
    }

    public String getBreakerName() {
        return breakerName;
    }
}
