package com.toolfinder.search.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolfinder.search.cache.SearchResultCacheProperties;
import com.toolfinder.search.cache.SearchResultCacheService;
import com.toolfinder.search.dedup.DeduplicationProperties;
import com.toolfinder.search.dedup.ResultDeduplicator;
import com.toolfinder.search.embed.EmbeddingCache;
import com.toolfinder.search.embed.EmbeddingCompressor;
import com.toolfinder.search.embed.EmbeddingProperties;
import com.toolfinder.search.embed.EmbeddingProvider;
import com.toolfinder.search.embed.EmbeddingService;
import com.toolfinder.search.embed.EmbeddingUnavailableException;
import com.toolfinder.search.merge.CustomMerger;
import com.toolfinder.search.merge.HybridMerger;
import com.toolfinder.search.merge.MergeStrategy;
import com.toolfinder.search.merge.ResultMergeService;
import com.toolfinder.search.merge.RrfMerger;
import com.toolfinder.search.merge.WeightedAverageMerger;
import com.toolfinder.search.model.MergedItem;
import com.toolfinder.search.model.MultiVectorSearchResult;
import com.toolfinder.search.model.SearchQuery;
import com.toolfinder.search.model.VectorTypeMetrics;
import com.toolfinder.search.model.VectorTypeStatus;
import com.toolfinder.search.resilience.CircuitBreakerStats;
import com.toolfinder.search.resilience.CircuitState;
import com.toolfinder.search.resilience.SearchResilienceProperties;
import com.toolfinder.search.resilience.SearchResilienceRegistry;
import com.toolfinder.search.retrieval.VectorTypeRetriever;
import com.toolfinder.search.vector.VectorHit;
import com.toolfinder.search.vector.VectorSearchGateway;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MultiVectorSearchServiceTest {
    private static final List<Double> EMBEDDING = List.of(0.1, 0.2, 0.3);
    private static final List<String> TYPES = List.of("semantic", "categories");

    @Mock
    private EmbeddingProvider embeddingProvider;

    @Mock
    private VectorSearchGateway vectorSearchGateway;

    private ExecutorService executor;
    private EmbeddingCache embeddingCache;
    private MultiVectorSearchProperties properties;
    private SearchResilienceProperties resilienceProperties;
    private SimpleMeterRegistry meterRegistry;
    private MultiVectorSearchService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        properties = new MultiVectorSearchProperties();
        resilienceProperties = new SearchResilienceProperties();
        meterRegistry = new SimpleMeterRegistry();
        EmbeddingProperties embeddingProperties = new EmbeddingProperties();
        embeddingProperties.getCache().setCleanupIntervalMs(0);
        embeddingCache = new EmbeddingCache(
            embeddingProperties.getCache(),
            new EmbeddingCompressor(new ObjectMapper()),
            Clock.systemUTC()
        );
        service = newService(embeddingProperties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        embeddingCache.close();
    }

    @Test
    void mergesVectorTypesInCanonicalOrder() {
        stubEmbedding();
        when(vectorSearchGateway.searchVectorType(any(), eq("semantic"), anyInt(), any()))
            .thenReturn(List.of(hit("figma", "Figma", 0.9), hit("sketch", "Sketch", 0.8)));
        when(vectorSearchGateway.searchVectorType(any(), eq("categories"), anyInt(), any()))
            .thenReturn(List.of(hit("canva", "Canva", 0.7), hit("figma", "Figma", 0.6)));

        MultiVectorSearchResult result = service.search(SearchQuery.of("design tool", List.of("categories", "semantic"), 5));

        assertFalse(result.isCacheHit());
        assertEquals(MergeStrategy.RECIPROCAL_RANK_FUSION, result.getMergeStrategy());
        assertThat(result.getPerTypeMetrics().keySet()).containsExactly("semantic", "categories");
        MergedItem top = result.getItems().get(0);
        assertEquals("figma", top.getId());
        assertEquals(2, top.getMergedFromCount());
        assertEquals(1.0 / 61 + 1.0 / 62, top.getCombinedScore(), 1e-12);
        assertThat(result.getItems()).extracting(MergedItem::getId).containsExactly("figma", "canva", "sketch");
        verify(vectorSearchGateway).searchVectorType(EMBEDDING, "semantic", 10, Map.of());
        assertTrue(service.getLastSearchMetrics().isPresent());
        assertThat(service.getVectorTypePerformance()).containsKeys("semantic", "categories");
    }

    @Test
    void repeatedQueryIsServedFromResultCache() {
        stubEmbedding();
        stubType("semantic", List.of(hit("figma", "Figma", 0.9)));
        stubType("categories", List.of(hit("canva", "Canva", 0.7)));

        MultiVectorSearchResult first = service.search(SearchQuery.of("Design Tool", TYPES, 5));
        MultiVectorSearchResult second = service.search(SearchQuery.of("design tool", List.of("categories", "semantic"), 5));

        assertFalse(first.isCacheHit());
        assertTrue(second.isCacheHit());
        assertThat(second.getItems()).extracting(MergedItem::getId)
            .containsExactlyElementsOf(first.getItems().stream().map(MergedItem::getId).toList());
        verify(vectorSearchGateway, times(1)).searchVectorType(any(), eq("semantic"), anyInt(), any());
        assertEquals(1L, service.getResultCache().getHits());
    }

    @Test
    void failingVectorTypeOnlyShowsUpInMetrics() {
        stubEmbedding();
        stubType("semantic", List.of(hit("figma", "Figma", 0.9)));
        when(vectorSearchGateway.searchVectorType(any(), eq("categories"), anyInt(), any()))
            .thenThrow(new IllegalStateException("shard unavailable"));

        MultiVectorSearchResult result = service.search(SearchQuery.of("design tool", TYPES, 5));

        assertThat(result.getItems()).extracting(MergedItem::getId).containsExactly("figma");
        VectorTypeMetrics categories = result.getPerTypeMetrics().get("categories");
        assertEquals(VectorTypeStatus.ERROR, categories.getStatus());
        assertThat(categories.getErrorMessage()).contains("shard unavailable");
        assertEquals(VectorTypeStatus.OK, result.getPerTypeMetrics().get("semantic").getStatus());
        assertEquals(
            1.0,
            meterRegistry.counter("mvs_vector_type_error_total", "vector_type", "categories", "status", "error").count()
        );
        assertEquals(0, service.getResultCache().size());
    }

    @Test
    void slowVectorTypeTimesOutWithoutBlockingSiblings() {
        properties.setSearchTimeoutMs(200);
        stubEmbedding();
        stubType("semantic", List.of(hit("figma", "Figma", 0.9)));
        when(vectorSearchGateway.searchVectorType(any(), eq("categories"), anyInt(), any())).thenAnswer(invocation -> {
            Thread.sleep(2_000L);
            return List.of(hit("canva", "Canva", 0.7));
        });

        MultiVectorSearchResult result = service.search(SearchQuery.of("design tool", TYPES, 5));

        assertEquals(VectorTypeStatus.TIMEOUT, result.getPerTypeMetrics().get("categories").getStatus());
        assertThat(result.getItems()).extracting(MergedItem::getId).containsExactly("figma");
        assertThat(result.getTotalTimeMs()).isLessThan(2_000L);
    }

    @Test
    void everyVectorTypeFailingRaisesWithMetrics() {
        stubEmbedding();
        when(vectorSearchGateway.searchVectorType(any(), anyString(), anyInt(), any()))
            .thenThrow(new IllegalStateException("cluster down"));

        assertThatThrownBy(() -> service.search(SearchQuery.of("design tool", TYPES, 5)))
            .isInstanceOfSatisfying(MultiVectorSearchException.class, e -> {
                assertThat(e.getPerTypeMetrics()).containsOnlyKeys("semantic", "categories");
                assertThat(e.getPerTypeMetrics().values()).extracting(VectorTypeMetrics::getStatus)
                    .containsOnly(VectorTypeStatus.ERROR);
            });
    }

    @Test
    void embeddingFailureAbortsBeforeVectorSearch() {
        when(embeddingProvider.embed(anyString(), any())).thenThrow(new EmbeddingUnavailableException("embed_timeout"));

        assertThatThrownBy(() -> service.search(SearchQuery.of("design tool", TYPES, 5)))
            .isInstanceOf(MultiVectorSearchException.class)
            .hasCauseInstanceOf(EmbeddingUnavailableException.class)
            .hasMessageContaining("embed_timeout");
        verifyNoInteractions(vectorSearchGateway);
    }

    @Test
    void openVectorStoreBreakerSkipsSearches() {
        resilienceProperties.getVectorStore().setFailureThreshold(1);
        EmbeddingProperties embeddingProperties = new EmbeddingProperties();
        embeddingProperties.getCache().setCleanupIntervalMs(0);
        service = newService(embeddingProperties);
        stubEmbedding();
        when(vectorSearchGateway.searchVectorType(any(), anyString(), anyInt(), any()))
            .thenThrow(new IllegalStateException("cluster down"));

        assertThatThrownBy(() -> service.search(SearchQuery.of("design tool", List.of("semantic"), 5)))
            .isInstanceOf(MultiVectorSearchException.class);
        assertThatThrownBy(() -> service.search(SearchQuery.of("design tool", List.of("semantic"), 5)))
            .isInstanceOfSatisfying(MultiVectorSearchException.class, e ->
                assertEquals(VectorTypeStatus.CIRCUIT_OPEN, e.getPerTypeMetrics().get("semantic").getStatus())
            );
        verify(vectorSearchGateway, times(1)).searchVectorType(any(), anyString(), anyInt(), any());
    }

    @Test
    void resultsAreTruncatedToLimit() {
        stubEmbedding();
        stubType("semantic", List.of(
            hit("figma", "Figma", 0.9),
            hit("sketch", "Sketch", 0.8),
            hit("canva", "Canva", 0.7),
            hit("penpot", "Penpot", 0.6)
        ));

        MultiVectorSearchResult result = service.search(SearchQuery.of("design tool", List.of("semantic"), 2));

        assertThat(result.getItems()).extracting(MergedItem::getId).containsExactly("figma", "sketch");
        verify(vectorSearchGateway).searchVectorType(EMBEDDING, "semantic", 4, Map.of());
    }

    @Test
    void sequentialModeProducesSameResult() {
        properties.setParallelSearchEnabled(false);
        stubEmbedding();
        stubType("semantic", List.of(hit("figma", "Figma", 0.9)));
        stubType("categories", List.of(hit("figma", "Figma", 0.8)));

        MultiVectorSearchResult result = service.search(SearchQuery.of("design tool", TYPES, 5));

        assertEquals(1, result.getItems().size());
        assertEquals(2, result.getItems().get(0).getMergedFromCount());
    }

    @Test
    void lateSuccessDoesNotCloseBreakerTrippedBySiblings() {
        resilienceProperties.getVectorStore().setFailureThreshold(2);
        EmbeddingProperties embeddingProperties = new EmbeddingProperties();
        embeddingProperties.getCache().setCleanupIntervalMs(0);
        service = newService(embeddingProperties);
        stubEmbedding();
        when(vectorSearchGateway.searchVectorType(any(), eq("semantic"), anyInt(), any()))
            .thenThrow(new IllegalStateException("shard unavailable"));
        when(vectorSearchGateway.searchVectorType(any(), eq("categories"), anyInt(), any()))
            .thenThrow(new IllegalStateException("shard unavailable"));
        when(vectorSearchGateway.searchVectorType(any(), eq("functionality"), anyInt(), any())).thenAnswer(invocation -> {
            Thread.sleep(200L);
            return List.of(hit("figma", "Figma", 0.9));
        });

        MultiVectorSearchResult result = service.search(
            SearchQuery.of("design tool", List.of("semantic", "categories", "functionality"), 5)
        );

        assertThat(result.getItems()).extracting(MergedItem::getId).containsExactly("figma");
        CircuitBreakerStats vectorStore = service.getCircuitBreakerStats().stream()
            .filter(stats -> stats.getName().equals(SearchResilienceRegistry.VECTOR_STORE))
            .findFirst()
            .orElseThrow();
        assertEquals(1L, vectorStore.getOpenedTotal());
        assertEquals(CircuitState.OPEN, vectorStore.getState());
        assertEquals(1L, vectorStore.getSuccessTotal());
    }

    @Test
    void hugeLimitStillRequestsConfiguredMaximumPerType() {
        stubEmbedding();
        stubType("semantic", List.of(hit("figma", "Figma", 0.9)));

        MultiVectorSearchResult result = service.search(SearchQuery.of("design tool", List.of("semantic"), Integer.MAX_VALUE));

        assertThat(result.getItems()).extracting(MergedItem::getId).containsExactly("figma");
        verify(vectorSearchGateway).searchVectorType(EMBEDDING, "semantic", 20, Map.of());
    }

    @Test
    void configuredTypesComeFirstThenAlphabetical() {
        assertThat(service.orderVectorTypes(List.of("zeta", "categories", "alpha", "semantic")))
            .containsExactly("semantic", "categories", "alpha", "zeta");
    }

    private MultiVectorSearchService newService(EmbeddingProperties embeddingProperties) {
        SearchResilienceRegistry resilienceRegistry = new SearchResilienceRegistry(resilienceProperties, Clock.systemUTC(), meterRegistry);
        EmbeddingService embeddingService = new EmbeddingService(
            embeddingProperties,
            embeddingProvider,
            embeddingCache,
            resilienceRegistry,
            meterRegistry
        );
        RrfMerger rrfMerger = new RrfMerger();
        ResultMergeService mergeService = new ResultMergeService(
            List.of(rrfMerger, new WeightedAverageMerger(), new HybridMerger(), new CustomMerger(rrfMerger))
        );
        SearchResultCacheService resultCache = new SearchResultCacheService(
            new SearchResultCacheProperties(),
            new ObjectMapper(),
            meterRegistry,
            Clock.systemUTC()
        );
        return new MultiVectorSearchService(
            properties,
            embeddingService,
            new VectorTypeRetriever(vectorSearchGateway),
            mergeService,
            new ResultDeduplicator(new DeduplicationProperties()),
            new DiversityFilter(),
            resultCache,
            resilienceRegistry,
            new VectorTypePerformanceTracker(properties),
            meterRegistry,
            executor
        );
    }

    private void stubEmbedding() {
        when(embeddingProvider.embed(anyString(), any())).thenReturn(EMBEDDING);
    }

    private void stubType(String vectorType, List<VectorHit> hits) {
        when(vectorSearchGateway.searchVectorType(any(), eq(vectorType), anyInt(), any())).thenReturn(hits);
    }

    private static VectorHit hit(String id, String name, double score) {
        return new VectorHit(id, score, Map.of("name", name));
    }
}
