package com.toolfinder.search.vector;

public class VectorStoreException extends RuntimeException {
    private final String vectorType;

    public VectorStoreException(String vectorType, String message) {
        super(message);
        this.vectorType = vectorType;
    }

    public VectorStoreException(String vectorType, String message, Throwable cause) {
        super(message, cause);
        this.vectorType = vectorType;
    }

    public String getVectorType() {
        return vectorType;
    }
}
