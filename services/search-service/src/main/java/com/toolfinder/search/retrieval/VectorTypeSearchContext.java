package com.toolfinder.search.retrieval;

import java.util.List;
import java.util.Map;

public class VectorTypeSearchContext {
    private final String vectorType;
    private final List<Double> embedding;
    private final int topK;
    private final Map<String, Object> filter;

    public VectorTypeSearchContext(String vectorType, List<Double> embedding, int topK, Map<String, Object> filter) {
        this.vectorType = vectorType;
        this.embedding = embedding;
        this.topK = topK;
        this.filter = filter == null ? Map.of() : filter;
    }

    public String getVectorType() {
        return vectorType;
    }

    public List<Double> getEmbedding() {
        return embedding;
    }

    public int getTopK() {
        return topK;
    }

    public Map<String, Object> getFilter() {
        return filter;
    }
}
