package com.toolfinder.search.embed;

import jakarta.annotation.PostConstruct;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Keeps the configured warm-up queries resident in the embedding cache.
 */
@Component
public class EmbeddingCacheWarmer {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingCacheWarmer.class);

    private final EmbeddingProperties properties;
    private final EmbeddingService embeddingService;
    private final EmbeddingCache cache;

    public EmbeddingCacheWarmer(EmbeddingProperties properties, EmbeddingService embeddingService, EmbeddingCache cache) {
        this.properties = properties;
        this.embeddingService = embeddingService;
        this.cache = cache;
    }

    @PostConstruct
    public void init() {
        EmbeddingProperties.Warming warming = properties.getWarming();
        if (warming == null || !warming.isEnabled() || warming.getQueries() == null || warming.getQueries().isEmpty()) {
            return;
        }
        cache.scheduleWarming(this::warm, warming.getIntervalMs());
        log.info("embedding cache warming scheduled queries={} interval_ms={}", warming.getQueries().size(), warming.getIntervalMs());
    }

    public int warm() {
        EmbeddingProperties.Warming warming = properties.getWarming();
        if (warming == null || warming.getQueries() == null) {
            return 0;
        }
        List<String> queries = warming.getQueries();
        int limit = Math.min(queries.size(), Math.max(0, warming.getMaxWarmupSize()));
        int warmed = 0;
        for (int i = 0; i < limit; i++) {
            String query = queries.get(i);
            if (query == null || query.isBlank()) {
                continue;
            }
            try {
                if (embeddingService.warm(query)) {
                    warmed++;
                }
            } catch (EmbeddingUnavailableException e) {
                log.warn("embedding cache warming stopped reason={} warmed={}", e.getMessage(), warmed);
                break;
            }
        }
        if (warmed > 0) {
            log.info("embedding cache warmed entries={} size={}", warmed, cache.size());
        }
        return warmed;
    }
}
