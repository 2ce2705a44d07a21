package com.toolfinder.search.retrieval;

import com.toolfinder.search.model.ItemPayload;
import com.toolfinder.search.model.ScoredItem;
import com.toolfinder.search.vector.VectorHit;
import com.toolfinder.search.vector.VectorSearchGateway;
import com.toolfinder.search.vector.VectorStoreException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs one vector type's search and ranks the hits in the order the store returned them.
 */
@Component
public class VectorTypeRetriever {
    private static final Logger log = LoggerFactory.getLogger(VectorTypeRetriever.class);

    private final VectorSearchGateway vectorSearchGateway;

    public VectorTypeRetriever(VectorSearchGateway vectorSearchGateway) {
        this.vectorSearchGateway = vectorSearchGateway;
    }

    public RetrievalStageResult retrieve(VectorTypeSearchContext context) {
        long started = System.nanoTime();
        String vectorType = context.getVectorType();
        if (context.getTopK() <= 0 || context.getEmbedding() == null || context.getEmbedding().isEmpty()) {
            return RetrievalStageResult.success(vectorType, List.of(), 0L);
        }
        List<VectorHit> hits;
        try {
            hits = vectorSearchGateway.searchVectorType(
                context.getEmbedding(),
                vectorType,
                context.getTopK(),
                context.getFilter()
            );
        } catch (VectorStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new VectorStoreException(vectorType, "vector_search_failed: " + e.getMessage(), e);
        }
        List<ScoredItem> ranked = new ArrayList<>();
        if (hits != null) {
            for (VectorHit hit : hits) {
                if (hit == null || hit.getId() == null || hit.getId().isBlank()) {
                    log.debug("vector hit without id dropped vector_type={}", vectorType);
                    continue;
                }
                ranked.add(new ScoredItem(hit.getId(), hit.getScore(), ItemPayload.of(hit.getPayload()), vectorType, ranked.size() + 1));
            }
        }
        long tookMs = (System.nanoTime() - started) / 1_000_000L;
        return RetrievalStageResult.success(vectorType, ranked, tookMs);
    }
}
