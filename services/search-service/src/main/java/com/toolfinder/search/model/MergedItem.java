package com.toolfinder.search.model;

import java.util.Collections;
import java.util.List;

public class MergedItem extends ScoredItem {
    private final double combinedScore;
    private final List<SourceAttribution> attributions;
    private final int mergedFromCount;

    public MergedItem(
        String id,
        double score,
        ItemPayload payload,
        String vectorType,
        int rank,
        double combinedScore,
        List<SourceAttribution> attributions,
        int mergedFromCount
    ) {
        super(id, score, payload, vectorType, rank);
        this.combinedScore = combinedScore;
        this.attributions = attributions == null ? List.of() : Collections.unmodifiableList(attributions);
        this.mergedFromCount = mergedFromCount;
    }

    public double getCombinedScore() {
        return combinedScore;
    }

    public List<SourceAttribution> getAttributions() {
        return attributions;
    }

    public int getMergedFromCount() {
        return mergedFromCount;
    }
}
