package com.toolfinder.search.dedup;

import com.toolfinder.search.model.MergedItem;
import java.util.Locale;

/**
 * 0.7 for an exact (case-insensitive) name match plus 0.3 times the description word overlap.
 */
class ContentSimilarityDetector implements DuplicateDetector {
    static final double NAME_WEIGHT = 0.7;
    static final double DESCRIPTION_WEIGHT = 0.3;
    private static final double EXACT_CUTOFF = 0.95;

    private final double threshold;

    ContentSimilarityDetector(double threshold) {
        this.threshold = threshold;
    }

    @Override
    public String id() {
        return DetectionStrategy.CONTENT_SIMILARITY.label();
    }

    @Override
    public DetectionStrategy strategy() {
        return DetectionStrategy.CONTENT_SIMILARITY;
    }

    @Override
    public int priority() {
        return 300;
    }

    @Override
    public DuplicateMatch match(MergedItem a, MergedItem b) {
        String nameA = a.getPayload().name().map(value -> value.toLowerCase(Locale.ROOT)).orElse(null);
        String nameB = b.getPayload().name().map(value -> value.toLowerCase(Locale.ROOT)).orElse(null);
        double nameScore = nameA != null && nameA.equals(nameB) ? 1.0 : 0.0;
        double descriptionScore = TextSimilarity.jaccard(
            a.getPayload().description().orElse(null),
            b.getPayload().description().orElse(null)
        );
        double similarity = NAME_WEIGHT * nameScore + DESCRIPTION_WEIGHT * descriptionScore;
        if (similarity >= threshold) {
            DuplicateType type = similarity >= EXACT_CUTOFF ? DuplicateType.EXACT : DuplicateType.NEAR;
            return DuplicateMatch.of(
                similarity,
                DetectionStrategy.CONTENT_SIMILARITY,
                type,
                String.format(Locale.ROOT, "content similarity %.3f", similarity)
            );
        }
        return DuplicateMatch.notDuplicate(similarity, id());
    }
}
