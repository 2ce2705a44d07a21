package com.toolfinder.search.vector;

import java.util.Map;

public class VectorHit {
    private final String id;
    private final double score;
    private final Map<String, Object> payload;

    public VectorHit(String id, double score, Map<String, Object> payload) {
        this.id = id;
        this.score = score;
        this.payload = payload == null ? Map.of() : payload;
    }

    public String getId() {
        return id;
    }

    public double getScore() {
        return score;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }
}
