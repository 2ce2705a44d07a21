package com.toolfinder.search.embed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolfinder.search.resilience.CircuitOpenException;
import com.toolfinder.search.resilience.CircuitState;
import com.toolfinder.search.resilience.SearchResilienceProperties;
import com.toolfinder.search.resilience.SearchResilienceRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EmbeddingServiceTest {

    @Mock
    private EmbeddingProvider embeddingProvider;

    private EmbeddingProperties properties;
    private EmbeddingCache cache;
    private SearchResilienceRegistry resilienceRegistry;
    private SimpleMeterRegistry meterRegistry;
    private EmbeddingService service;

    @BeforeEach
    void setUp() {
        properties = new EmbeddingProperties();
        properties.setModel("toy-embed-v1");
        properties.getCache().setCleanupIntervalMs(0);
        cache = new EmbeddingCache(properties.getCache(), new EmbeddingCompressor(new ObjectMapper()), Clock.systemUTC());
        SearchResilienceProperties resilience = new SearchResilienceProperties();
        resilience.getEmbedding().setFailureThreshold(1);
        resilienceRegistry = new SearchResilienceRegistry(resilience, Clock.systemUTC(), new SimpleMeterRegistry());
        meterRegistry = new SimpleMeterRegistry();
        service = new EmbeddingService(properties, embeddingProvider, cache, resilienceRegistry, meterRegistry);
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    @Test
    void repeatedQueriesAreServedFromCache() {
        when(embeddingProvider.embed(anyString(), any())).thenReturn(List.of(0.1, 0.2));

        List<Double> first = service.embedQuery("Image Editor");
        List<Double> second = service.embedQuery("  image   editor ");

        assertEquals(first, second);
        verify(embeddingProvider, times(1)).embed(anyString(), any());
        assertEquals(1.0, meterRegistry.counter("mvs_embedding_cache_hit_total").count());
        assertEquals(1.0, meterRegistry.counter("mvs_embedding_cache_miss_total").count());
    }

    @Test
    void openBreakerRejectsWithoutCallingProvider() {
        when(embeddingProvider.embed(anyString(), any())).thenThrow(new EmbeddingUnavailableException("embed_timeout"));

        assertThatThrownBy(() -> service.embedQuery("image editor"))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessage("embed_timeout");
        assertEquals(CircuitState.OPEN, resilienceRegistry.getEmbeddingBreaker().getState());

        assertThatThrownBy(() -> service.embedQuery("vector database"))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessage("embed_circuit_open")
            .hasCauseInstanceOf(CircuitOpenException.class);
        verify(embeddingProvider, times(1)).embed(anyString(), any());
    }

    @Test
    void unexpectedProviderErrorsAreWrapped() {
        when(embeddingProvider.embed(anyString(), any())).thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> service.embedQuery("image editor"))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessage("embed_failed")
            .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void warmStoresOnlyMissingVectors() {
        when(embeddingProvider.embed(anyString(), any())).thenReturn(List.of(0.3, 0.4));

        assertTrue(service.warm("kanban board"));
        assertFalse(service.warm("Kanban Board"));
        assertThat(cache.getStats().getTopEntries()).extracting(EmbeddingCacheStats.EntrySummary::getSource)
            .containsExactly("warmup");
    }

    @Test
    void cacheKeyDependsOnModelAndNormalizedText() {
        String key = service.cacheKey("Image  Editor");

        assertEquals(key, service.cacheKey("image editor"));
        assertThat(key).startsWith("embed:toy-embed-v1:");
        assertThat(service.cacheKey("   ")).isNull();
    }
}
