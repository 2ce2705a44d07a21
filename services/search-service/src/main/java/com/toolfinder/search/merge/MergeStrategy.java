package com.toolfinder.search.merge;

import java.util.Locale;

public enum MergeStrategy {
    RECIPROCAL_RANK_FUSION("reciprocal_rank_fusion"),
    WEIGHTED_AVERAGE("weighted_average"),
    HYBRID("hybrid"),
    CUSTOM("custom");

    private final String tag;

    MergeStrategy(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Unknown or blank values resolve to {@link #RECIPROCAL_RANK_FUSION}.
     */
    public static MergeStrategy fromString(String value) {
        if (value == null) {
            return RECIPROCAL_RANK_FUSION;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        if (normalized.isEmpty()) {
            return RECIPROCAL_RANK_FUSION;
        }
        for (MergeStrategy strategy : values()) {
            if (strategy.tag.equals(normalized) || strategy.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return strategy;
            }
        }
        if (normalized.equals("rrf")) {
            return RECIPROCAL_RANK_FUSION;
        }
        if (normalized.startsWith("weighted")) {
            return WEIGHTED_AVERAGE;
        }
        return RECIPROCAL_RANK_FUSION;
    }
}
