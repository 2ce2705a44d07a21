package com.toolfinder.search.resilience;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import org.junit.jupiter.api.Test;

class SearchResilienceRegistryTest {

    @Test
    void createsOneBreakerPerDependencyFromProperties() {
        SearchResilienceProperties properties = new SearchResilienceProperties();
        properties.getVectorStore().setFailureThreshold(2);

        SearchResilienceRegistry registry = new SearchResilienceRegistry(properties, Clock.systemUTC(), new SimpleMeterRegistry());

        assertThat(registry.getBreakers()).hasSize(3);
        assertThat(registry.getBreaker(SearchResilienceRegistry.EMBEDDING)).isSameAs(registry.getEmbeddingBreaker());
        assertThat(registry.getDocumentStoreBreaker().getName()).isEqualTo("document-store");

        CircuitBreaker vectorStore = registry.getVectorStoreBreaker();
        vectorStore.recordFailure();
        vectorStore.recordFailure();
        assertThat(vectorStore.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(registry.getEmbeddingBreaker().getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void unknownBreakerNameIsRejected() {
        SearchResilienceRegistry registry = new SearchResilienceRegistry(
            new SearchResilienceProperties(),
            Clock.systemUTC(),
            new SimpleMeterRegistry()
        );

        assertThatThrownBy(() -> registry.getBreaker("llm")).isInstanceOf(IllegalArgumentException.class);
    }
}
