package com.toolfinder.search.model;

public class ScoredItem {
    private final String id;
    private final double score;
    private final ItemPayload payload;
    private final String vectorType;
    private final int rank;

    public ScoredItem(String id, double score, ItemPayload payload, String vectorType, int rank) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("item id is required");
        }
        this.id = id;
        this.score = score;
        this.payload = payload == null ? ItemPayload.empty() : payload;
        this.vectorType = vectorType;
        this.rank = rank;
    }

    public String getId() {
        return id;
    }

    public double getScore() {
        return score;
    }

    public ItemPayload getPayload() {
        return payload;
    }

    public String getVectorType() {
        return vectorType;
    }

    public int getRank() {
        return rank;
    }
}
