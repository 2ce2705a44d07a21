package com.toolfinder.search.embed;

public class EmbeddingUnavailableException extends RuntimeException {
    public EmbeddingUnavailableException(String reason) {
        super(reason);
    }

    public EmbeddingUnavailableException(String reason, Throwable cause) {
        super(reason, cause);
    }
}
