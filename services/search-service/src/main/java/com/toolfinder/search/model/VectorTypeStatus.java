package com.toolfinder.search.model;

public enum VectorTypeStatus {
    OK,
    ERROR,
    TIMEOUT,
    CIRCUIT_OPEN;

    public boolean isDegraded() {
        return this != OK;
    }
}
