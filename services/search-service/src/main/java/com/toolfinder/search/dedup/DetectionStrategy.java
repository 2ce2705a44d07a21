package com.toolfinder.search.dedup;

public enum DetectionStrategy {
    EXACT_ID("exact_id"),
    EXACT_URL("exact_url"),
    CONTENT_SIMILARITY("content_similarity"),
    VERSION_AWARE("version_aware"),
    FUZZY_MATCH("fuzzy_match"),
    CUSTOM("custom");

    private final String label;

    DetectionStrategy(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
