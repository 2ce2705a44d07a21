package com.toolfinder.search.vector;

import java.util.List;
import java.util.Map;

/**
 * Per-type nearest-neighbour search against the vector store. Hits come back best first;
 * that order defines each hit's rank. Failures surface as {@link VectorStoreException}.
 */
public interface VectorSearchGateway {
    List<VectorHit> searchVectorType(List<Double> embedding, String vectorType, int limit, Map<String, Object> filter);
}
