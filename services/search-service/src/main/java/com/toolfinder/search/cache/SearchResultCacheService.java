package com.toolfinder.search.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolfinder.search.merge.MergeStrategy;
import com.toolfinder.search.model.MultiVectorSearchResult;
import com.toolfinder.search.model.SearchQuery;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Service;

@Service
public class SearchResultCacheService {
    private final SearchResultCacheProperties properties;
    private final ObjectMapper canonicalMapper;
    private final MeterRegistry meterRegistry;
    private final TtlCache<MultiVectorSearchResult> cache;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public SearchResultCacheService(
        SearchResultCacheProperties properties,
        ObjectMapper objectMapper,
        MeterRegistry meterRegistry,
        Clock clock
    ) {
        this.properties = properties;
        this.canonicalMapper = CacheKeyUtil.canonicalMapper(objectMapper);
        this.meterRegistry = meterRegistry;
        this.cache = new TtlCache<>(properties.getMaxEntries(), clock);
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    public Optional<MultiVectorSearchResult> get(String key) {
        if (!properties.isEnabled() || key == null) {
            return Optional.empty();
        }
        Optional<MultiVectorSearchResult> cached = cache.get(key).map(CacheEntry::getValue);
        if (cached.isPresent()) {
            hits.incrementAndGet();
            meterRegistry.counter("mvs_result_cache_hit_total").increment();
        } else {
            misses.incrementAndGet();
            meterRegistry.counter("mvs_result_cache_miss_total").increment();
        }
        return cached;
    }

    public void put(String key, MultiVectorSearchResult result) {
        if (!properties.isEnabled() || key == null || result == null) {
            return;
        }
        cache.put(key, result, properties.getTtlMs());
    }

    public String buildKey(SearchQuery query, List<String> vectorTypes, MergeStrategy strategy, int rrfK) {
        if (query == null) {
            return null;
        }
        List<String> sortedTypes = new ArrayList<>(vectorTypes == null ? query.getVectorTypes() : vectorTypes);
        Collections.sort(sortedTypes);
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("q", CacheKeyUtil.normalizeText(query.getText()));
        fields.put("limit", query.getLimit());
        fields.put("vector_types", sortedTypes);
        fields.put("strategy", strategy == null ? null : strategy.tag());
        fields.put("rrf_k", rrfK);
        if (!query.getFilter().isEmpty()) {
            fields.put("filter", query.getFilter());
        }
        String hash = CacheKeyUtil.hashJson(canonicalMapper, fields);
        if (hash == null) {
            return null;
        }
        return properties.getKeyPrefix() + hash;
    }

    public void clear() {
        cache.clear();
    }

    public int size() {
        return cache.size();
    }

    public int purgeExpired() {
        return cache.purgeExpired();
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public double getHitRate() {
        long total = hits.get() + misses.get();
        return total == 0 ? 0.0 : (double) hits.get() / total;
    }
}
