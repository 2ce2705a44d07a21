package com.toolfinder.search.resilience;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class SearchResilienceRegistry {
    public static final String EMBEDDING = "embedding";
    public static final String VECTOR_STORE = "vector-store";
    public static final String DOCUMENT_STORE = "document-store";

    private final SearchResilienceProperties properties;
    private final Map<String, CircuitBreaker> breakers = new LinkedHashMap<>();

    public SearchResilienceRegistry(SearchResilienceProperties properties, Clock clock, MeterRegistry meterRegistry) {
        this.properties = properties;
        register(EMBEDDING, properties.getEmbedding(), clock, meterRegistry);
        register(VECTOR_STORE, properties.getVectorStore(), clock, meterRegistry);
        register(DOCUMENT_STORE, properties.getDocumentStore(), clock, meterRegistry);
    }

    public CircuitBreaker getEmbeddingBreaker() {
        return breakers.get(EMBEDDING);
    }

    public CircuitBreaker getVectorStoreBreaker() {
        return breakers.get(VECTOR_STORE);
    }

    /**
     * Not used by the search path itself; exposed for the host service's document-store lookups
     * so their failures are tracked and reported alongside the other breakers.
     */
    public CircuitBreaker getDocumentStoreBreaker() {
        return breakers.get(DOCUMENT_STORE);
    }

    public CircuitBreaker getBreaker(String name) {
        CircuitBreaker breaker = breakers.get(name);
        if (breaker == null) {
            throw new IllegalArgumentException("unknown circuit breaker: " + name);
        }
        return breaker;
    }

    public Collection<CircuitBreaker> getBreakers() {
        return Collections.unmodifiableCollection(breakers.values());
    }

    public SearchResilienceProperties getProperties() {
        return properties;
    }

    private void register(String name, SearchResilienceProperties.Breaker settings, Clock clock, MeterRegistry meterRegistry) {
        SearchResilienceProperties.Breaker resolved = settings == null ? new SearchResilienceProperties.Breaker() : settings;
        breakers.put(
            name,
            new CircuitBreaker(name, resolved.getFailureThreshold(), resolved.getResetTimeoutMs(), clock, meterRegistry)
        );
    }
}
