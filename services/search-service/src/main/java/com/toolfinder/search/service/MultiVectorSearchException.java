package com.toolfinder.search.service;

import com.toolfinder.search.model.VectorTypeMetrics;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Terminal search failure: no query embedding, or every requested vector type failed.
 */
public class MultiVectorSearchException extends RuntimeException {
    private final Map<String, VectorTypeMetrics> perTypeMetrics;

    public MultiVectorSearchException(String message, Map<String, VectorTypeMetrics> perTypeMetrics, Throwable cause) {
        super(message, cause);
        this.perTypeMetrics = perTypeMetrics == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(perTypeMetrics));
    }

    public MultiVectorSearchException(String message, Map<String, VectorTypeMetrics> perTypeMetrics) {
        this(message, perTypeMetrics, null);
    }

    public Map<String, VectorTypeMetrics> getPerTypeMetrics() {
        return perTypeMetrics;
    }
}
