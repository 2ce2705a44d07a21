package com.toolfinder.search.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
