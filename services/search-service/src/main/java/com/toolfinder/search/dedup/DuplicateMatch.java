package com.toolfinder.search.dedup;

public class DuplicateMatch {
    private static final DuplicateMatch NONE = new DuplicateMatch(false, 0.0, null, null, null);

    private final boolean duplicate;
    private final double similarityScore;
    private final String detectedBy;
    private final DuplicateType duplicateType;
    private final String reason;

    public DuplicateMatch(
        boolean duplicate,
        double similarityScore,
        String detectedBy,
        DuplicateType duplicateType,
        String reason
    ) {
        this.duplicate = duplicate;
        this.similarityScore = similarityScore;
        this.detectedBy = detectedBy;
        this.duplicateType = duplicateType;
        this.reason = reason;
    }

    public static DuplicateMatch none() {
        return NONE;
    }

    public static DuplicateMatch notDuplicate(double similarityScore, String detectedBy) {
        return new DuplicateMatch(false, similarityScore, detectedBy, null, null);
    }

    public static DuplicateMatch of(double similarityScore, DetectionStrategy strategy, DuplicateType type, String reason) {
        return new DuplicateMatch(true, similarityScore, strategy.label(), type, reason);
    }

    public boolean isDuplicate() {
        return duplicate;
    }

    public double getSimilarityScore() {
        return similarityScore;
    }

    /**
     * Label of the strategy or custom rule that decided the pair, e.g. {@code exact_url}.
     */
    public String getDetectedBy() {
        return detectedBy;
    }

    public DuplicateType getDuplicateType() {
        return duplicateType;
    }

    public String getReason() {
        return reason;
    }
}
