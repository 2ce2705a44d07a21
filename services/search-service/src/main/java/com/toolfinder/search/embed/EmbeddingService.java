package com.toolfinder.search.embed;

import com.toolfinder.search.cache.CacheKeyUtil;
import com.toolfinder.search.resilience.CircuitBreaker;
import com.toolfinder.search.resilience.CircuitOpenException;
import com.toolfinder.search.resilience.SearchResilienceRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Query vectors backed by the shared {@link EmbeddingCache}. Lookups here are exact-text only;
 * a paraphrase never reuses another query's vector.
 */
@Service
public class EmbeddingService {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);
    private static final String WARMUP_SOURCE = "warmup";
    private static final String QUERY_SOURCE = "query";

    private final EmbeddingProperties properties;
    private final EmbeddingProvider embeddingProvider;
    private final EmbeddingCache cache;
    private final SearchResilienceRegistry resilienceRegistry;
    private final MeterRegistry meterRegistry;

    public EmbeddingService(
        EmbeddingProperties properties,
        EmbeddingProvider embeddingProvider,
        EmbeddingCache cache,
        SearchResilienceRegistry resilienceRegistry,
        MeterRegistry meterRegistry
    ) {
        this.properties = properties;
        this.embeddingProvider = embeddingProvider;
        this.cache = cache;
        this.resilienceRegistry = resilienceRegistry;
        this.meterRegistry = meterRegistry;
    }

    public List<Double> embedQuery(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingUnavailableException("embed_empty_text");
        }
        String key = cacheKey(text);
        if (key != null) {
            Optional<List<Double>> cached = cache.get(key);
            if (cached.isPresent()) {
                meterRegistry.counter("mvs_embedding_cache_hit_total").increment();
                return cached.get();
            }
            meterRegistry.counter("mvs_embedding_cache_miss_total").increment();
        }
        List<Double> vector = fetch(text);
        if (key != null) {
            cache.set(key, vector, CacheWriteOptions.fromSource(QUERY_SOURCE));
        }
        return vector;
    }

    /**
     * Generates and stores the vector for {@code text} unless it is already cached.
     *
     * @return true when a new vector was stored
     */
    public boolean warm(String text) {
        String key = cacheKey(text);
        if (key == null || cache.has(key)) {
            return false;
        }
        List<Double> vector = fetch(text);
        cache.set(key, vector, CacheWriteOptions.fromSource(WARMUP_SOURCE));
        return true;
    }

    public String cacheKey(String text) {
        if (text == null) {
            return null;
        }
        String normalized = normalize(text);
        if (normalized.isBlank()) {
            return null;
        }
        int maxLen = properties.getCache() == null ? 0 : properties.getCache().getMaxTextLength();
        if (maxLen > 0 && normalized.length() > maxLen) {
            return null;
        }
        String model = properties.getModel() == null ? "" : properties.getModel();
        return "embed:" + model + ":" + CacheKeyUtil.sha256(normalized);
    }

    String normalize(String text) {
        String value = text.trim();
        if (properties.getCache() == null || properties.getCache().isNormalize()) {
            value = value.replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        }
        return value;
    }

    private List<Double> fetch(String text) {
        CircuitBreaker breaker = resilienceRegistry.getEmbeddingBreaker();
        long permit = breaker.acquirePermit();
        if (permit == CircuitBreaker.NO_PERMIT) {
            throw new EmbeddingUnavailableException("embed_circuit_open", new CircuitOpenException(breaker.getName()));
        }
        long callTimeoutMs = resilienceRegistry.getProperties().getEmbedding().getCallTimeoutMs();
        Integer budget = callTimeoutMs > 0 ? (int) Math.min(Integer.MAX_VALUE, callTimeoutMs) : null;
        List<Double> vector;
        try {
            vector = embeddingProvider.embed(text, budget);
        } catch (EmbeddingUnavailableException e) {
            breaker.recordFailure(permit);
            log.debug("embedding call failed reason={}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            breaker.recordFailure(permit);
            throw new EmbeddingUnavailableException("embed_failed", e);
        }
        if (vector == null || vector.isEmpty()) {
            breaker.recordFailure(permit);
            throw new EmbeddingUnavailableException("embed_empty_vector");
        }
        breaker.recordSuccess(permit);
        return vector;
    }
}
