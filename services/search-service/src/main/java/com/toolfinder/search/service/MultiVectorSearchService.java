package com.toolfinder.search.service;

import com.toolfinder.search.cache.SearchResultCacheService;
import com.toolfinder.search.dedup.DeduplicationResult;
import com.toolfinder.search.dedup.ResultDeduplicator;
import com.toolfinder.search.embed.EmbeddingService;
import com.toolfinder.search.embed.EmbeddingUnavailableException;
import com.toolfinder.search.merge.MergeContext;
import com.toolfinder.search.merge.MergeStrategy;
import com.toolfinder.search.merge.ResultMergeService;
import com.toolfinder.search.merge.VectorTypeWeights;
import com.toolfinder.search.model.MergedItem;
import com.toolfinder.search.model.MultiVectorSearchResult;
import com.toolfinder.search.model.ScoredItem;
import com.toolfinder.search.model.SearchQuery;
import com.toolfinder.search.model.VectorTypeMetrics;
import com.toolfinder.search.resilience.CircuitBreaker;
import com.toolfinder.search.resilience.CircuitBreakerStats;
import com.toolfinder.search.resilience.SearchResilienceRegistry;
import com.toolfinder.search.retrieval.RetrievalStageResult;
import com.toolfinder.search.retrieval.VectorTypeRetriever;
import com.toolfinder.search.retrieval.VectorTypeSearchContext;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Fans a query out across vector types, then merges, deduplicates and diversifies the combined list.
 * A failing vector type only shows up in the per-type metrics unless every type fails.
 */
@Service
public class MultiVectorSearchService {
    private static final Logger log = LoggerFactory.getLogger(MultiVectorSearchService.class);

    private final MultiVectorSearchProperties properties;
    private final EmbeddingService embeddingService;
    private final VectorTypeRetriever retriever;
    private final ResultMergeService mergeService;
    private final ResultDeduplicator deduplicator;
    private final DiversityFilter diversityFilter;
    private final SearchResultCacheService resultCache;
    private final SearchResilienceRegistry resilienceRegistry;
    private final VectorTypePerformanceTracker performanceTracker;
    private final MeterRegistry meterRegistry;
    private final ExecutorService searchExecutor;
    private final VectorTypeWeights weights;
    private volatile SearchTimings lastSearchTimings;

    public MultiVectorSearchService(
        MultiVectorSearchProperties properties,
        EmbeddingService embeddingService,
        VectorTypeRetriever retriever,
        ResultMergeService mergeService,
        ResultDeduplicator deduplicator,
        DiversityFilter diversityFilter,
        SearchResultCacheService resultCache,
        SearchResilienceRegistry resilienceRegistry,
        VectorTypePerformanceTracker performanceTracker,
        MeterRegistry meterRegistry,
        @Qualifier("searchExecutor") ExecutorService searchExecutor
    ) {
        this.properties = properties;
        this.embeddingService = embeddingService;
        this.retriever = retriever;
        this.mergeService = mergeService;
        this.deduplicator = deduplicator;
        this.diversityFilter = diversityFilter;
        this.resultCache = resultCache;
        this.resilienceRegistry = resilienceRegistry;
        this.performanceTracker = performanceTracker;
        this.meterRegistry = meterRegistry;
        this.searchExecutor = searchExecutor;
        this.weights = new VectorTypeWeights(properties.getWeights());
    }

    public MultiVectorSearchResult search(String text, int limit) {
        return search(SearchQuery.of(text, properties.getVectorTypes(), limit));
    }

    public MultiVectorSearchResult search(SearchQuery query) {
        long started = System.nanoTime();
        MergeStrategy strategy = resolveStrategy(query);
        int rrfK = query.getRrfK() != null ? query.getRrfK() : properties.getRrfK();
        List<String> vectorTypes = orderVectorTypes(query.getVectorTypes());

        String cacheKey = resultCache.buildKey(query, vectorTypes, strategy, rrfK);
        Optional<MultiVectorSearchResult> cached = resultCache.get(cacheKey);
        if (cached.isPresent()) {
            long tookMs = elapsedMs(started);
            log.debug("multi_vector_search_cache_hit took_ms={}", tookMs);
            return cached.get().asCacheHit(tookMs);
        }

        List<Double> embedding;
        try {
            embedding = embeddingService.embedQuery(query.getText());
        } catch (EmbeddingUnavailableException e) {
            meterRegistry.counter("mvs_embedding_failure_total").increment();
            log.warn("multi_vector_search_embedding_failed reason={}", e.getMessage());
            throw new MultiVectorSearchException("embedding_failed: " + e.getMessage(), Map.of(), e);
        }
        long embeddingMs = elapsedMs(started);

        long retrievalStarted = System.nanoTime();
        int perTypeLimit = (int) Math.max(1L, Math.min((long) query.getLimit() * 2, properties.getMaxResultsPerVector()));
        Map<String, RetrievalStageResult> stages = retrieveAll(vectorTypes, embedding, perTypeLimit, query.getFilter());
        long retrievalMs = elapsedMs(retrievalStarted);

        Map<String, VectorTypeMetrics> metrics = new LinkedHashMap<>();
        Map<String, List<ScoredItem>> byType = new LinkedHashMap<>();
        boolean degraded = false;
        for (Map.Entry<String, RetrievalStageResult> entry : stages.entrySet()) {
            RetrievalStageResult stage = entry.getValue();
            VectorTypeMetrics typeMetrics = new VectorTypeMetrics(
                entry.getKey(),
                stage.getItems().size(),
                stage.getTookMs(),
                stage.averageScore(),
                stage.getStatus(),
                stage.getErrorMessage()
            );
            metrics.put(entry.getKey(), typeMetrics);
            performanceTracker.record(typeMetrics);
            if (stage.isError()) {
                degraded = true;
                meterRegistry.counter(
                    "mvs_vector_type_error_total",
                    "vector_type",
                    entry.getKey(),
                    "status",
                    stage.getStatus().name().toLowerCase(Locale.ROOT)
                ).increment();
                log.warn(
                    "vector_type_degraded vector_type={} status={} reason={}",
                    entry.getKey(),
                    stage.getStatus(),
                    stage.getErrorMessage()
                );
            } else {
                byType.put(entry.getKey(), stage.getItems());
            }
        }
        if (byType.isEmpty()) {
            throw new MultiVectorSearchException("all_vector_types_failed", metrics);
        }

        long mergeStarted = System.nanoTime();
        List<MergedItem> merged = mergeService.merge(strategy, byType, new MergeContext(rrfK, weights));
        long mergeMs = elapsedMs(mergeStarted);

        long dedupStarted = System.nanoTime();
        DeduplicationResult deduplicated = deduplicator.detectDuplicates(merged, strategy);
        long dedupMs = elapsedMs(dedupStarted);

        List<MergedItem> items = deduplicated.getUniqueItems();
        if (properties.isDiversityEnabled()) {
            items = diversityFilter.apply(items, properties.getDiversityThreshold());
        }
        if (items.size() > query.getLimit()) {
            items = new ArrayList<>(items.subList(0, query.getLimit()));
        }

        long totalMs = elapsedMs(started);
        MultiVectorSearchResult result = new MultiVectorSearchResult(items, metrics, totalMs, strategy, false);
        if (!degraded || properties.isCacheDegradedResults()) {
            resultCache.put(cacheKey, result);
        }
        lastSearchTimings = new SearchTimings(embeddingMs, retrievalMs, mergeMs, dedupMs, totalMs);
        meterRegistry.timer("mvs_search_latency", "strategy", strategy.tag()).record(totalMs, TimeUnit.MILLISECONDS);
        log.info(
            "multi_vector_search_done total_ms={} merge_ms={} dedup_ms={} strategy={} types={} merged={} duplicates={} returned={}",
            totalMs,
            mergeMs,
            dedupMs,
            strategy.tag(),
            vectorTypes.size(),
            merged.size(),
            deduplicated.getDuplicatesRemoved(),
            items.size()
        );
        return result;
    }

    public Map<String, VectorTypePerformance> getVectorTypePerformance() {
        return performanceTracker.snapshot();
    }

    public void resetPerformance() {
        performanceTracker.reset();
    }

    public Optional<SearchTimings> getLastSearchMetrics() {
        return Optional.ofNullable(lastSearchTimings);
    }

    public List<CircuitBreakerStats> getCircuitBreakerStats() {
        List<CircuitBreakerStats> stats = new ArrayList<>();
        for (CircuitBreaker breaker : resilienceRegistry.getBreakers()) {
            stats.add(breaker.getStats());
        }
        return stats;
    }

    public SearchResultCacheService getResultCache() {
        return resultCache;
    }

    public void clearCache() {
        resultCache.clear();
        log.info("multi_vector_result_cache_cleared");
    }

    /**
     * Configured vector types keep their configured order; anything else requested follows alphabetically.
     */
    List<String> orderVectorTypes(List<String> requested) {
        Set<String> remaining = new TreeSet<>(requested);
        Set<String> ordered = new LinkedHashSet<>();
        if (properties.getVectorTypes() != null) {
            for (String configured : properties.getVectorTypes()) {
                if (remaining.remove(configured)) {
                    ordered.add(configured);
                }
            }
        }
        ordered.addAll(remaining);
        return new ArrayList<>(ordered);
    }

    private MergeStrategy resolveStrategy(SearchQuery query) {
        if (query.getMergeStrategy() != null) {
            return query.getMergeStrategy();
        }
        return properties.getMergeStrategy() == null ? MergeStrategy.RECIPROCAL_RANK_FUSION : properties.getMergeStrategy();
    }

    private Map<String, RetrievalStageResult> retrieveAll(
        List<String> vectorTypes,
        List<Double> embedding,
        int perTypeLimit,
        Map<String, Object> filter
    ) {
        CircuitBreaker breaker = resilienceRegistry.getVectorStoreBreaker();
        long timeoutMs = properties.getSearchTimeoutMs();
        Map<String, RetrievalStageResult> results = new LinkedHashMap<>();
        if (!properties.isParallelSearchEnabled()) {
            for (String vectorType : vectorTypes) {
                long startedNanos = System.nanoTime();
                PendingStage pending = dispatch(breaker, vectorType, embedding, perTypeLimit, filter);
                results.put(vectorType, awaitStage(breaker, vectorType, pending, timeoutMs, startedNanos));
            }
            return results;
        }

        long dispatchedAt = System.nanoTime();
        Map<String, PendingStage> pendingStages = new LinkedHashMap<>();
        for (String vectorType : vectorTypes) {
            pendingStages.put(vectorType, dispatch(breaker, vectorType, embedding, perTypeLimit, filter));
        }
        long deadline = dispatchedAt + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        for (Map.Entry<String, PendingStage> entry : pendingStages.entrySet()) {
            long remainingMs = Math.max(0L, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime()));
            results.put(entry.getKey(), awaitStage(breaker, entry.getKey(), entry.getValue(), remainingMs, dispatchedAt));
        }
        return results;
    }

    private PendingStage dispatch(
        CircuitBreaker breaker,
        String vectorType,
        List<Double> embedding,
        int perTypeLimit,
        Map<String, Object> filter
    ) {
        long permit = breaker.acquirePermit();
        if (permit == CircuitBreaker.NO_PERMIT) {
            return new PendingStage(CompletableFuture.completedFuture(RetrievalStageResult.circuitOpen(vectorType)), permit);
        }
        VectorTypeSearchContext context = new VectorTypeSearchContext(vectorType, embedding, perTypeLimit, filter);
        return new PendingStage(CompletableFuture.supplyAsync(() -> retriever.retrieve(context), searchExecutor), permit);
    }

    private RetrievalStageResult awaitStage(
        CircuitBreaker breaker,
        String vectorType,
        PendingStage pending,
        long timeoutMs,
        long startedNanos
    ) {
        CompletableFuture<RetrievalStageResult> future = pending.future;
        RetrievalStageResult result;
        try {
            result = timeoutMs > 0
                ? future.get(timeoutMs, TimeUnit.MILLISECONDS)
                : future.getNow(null);
            if (result == null) {
                future.cancel(true);
                result = RetrievalStageResult.timedOut(vectorType, elapsedMs(startedNanos));
            }
        } catch (TimeoutException e) {
            future.cancel(true);
            result = RetrievalStageResult.timedOut(vectorType, elapsedMs(startedNanos));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.debug("vector_type_search_failed vector_type={}", vectorType, cause);
            result = RetrievalStageResult.error(vectorType, cause.getMessage(), elapsedMs(startedNanos));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            result = RetrievalStageResult.error(vectorType, "interrupted", elapsedMs(startedNanos));
        }
        if (result.isSkipped()) {
            return result;
        }
        // outcomes are reported against the generation the call was admitted in
        if (result.isError()) {
            breaker.recordFailure(pending.permit);
        } else {
            breaker.recordSuccess(pending.permit);
        }
        return result;
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }

    private static final class PendingStage {
        private final CompletableFuture<RetrievalStageResult> future;
        private final long permit;

        private PendingStage(CompletableFuture<RetrievalStageResult> future, long permit) {
            this.future = future;
            this.permit = permit;
        }
    }
}
