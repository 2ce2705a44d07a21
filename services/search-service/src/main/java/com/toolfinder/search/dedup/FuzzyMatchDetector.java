package com.toolfinder.search.dedup;

import com.toolfinder.search.model.MergedItem;
import java.util.Locale;
import java.util.Optional;

/**
 * Last-resort approximate comparison over name, description, url and category.
 * Text fields are boosted by 20% (capped at 1); category must match exactly.
 * A field missing on both sides does not take part in the weighting.
 */
class FuzzyMatchDetector implements DuplicateDetector {
    private static final double FUZZY_BOOST = 1.2;
    private static final double NEAR_CUTOFF = 0.8;

    private final double threshold;
    private final DeduplicationProperties.FieldWeights weights;

    FuzzyMatchDetector(double threshold, DeduplicationProperties.FieldWeights weights) {
        this.threshold = threshold;
        this.weights = weights == null ? new DeduplicationProperties.FieldWeights() : weights;
    }

    @Override
    public String id() {
        return DetectionStrategy.FUZZY_MATCH.label();
    }

    @Override
    public DetectionStrategy strategy() {
        return DetectionStrategy.FUZZY_MATCH;
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public DuplicateMatch match(MergedItem a, MergedItem b) {
        WeightedSum sum = new WeightedSum();
        sum.add(nameSimilarity(a, b), weights.getName());
        sum.add(fieldSimilarity(a.getPayload().description(), b.getPayload().description()), weights.getDescription());
        sum.add(fieldSimilarity(a.getPayload().url(), b.getPayload().url()), weights.getUrl());
        sum.add(categorySimilarity(a.getPayload().category(), b.getPayload().category()), weights.getCategory());
        double similarity = sum.value();
        if (similarity >= threshold) {
            DuplicateType type = similarity >= NEAR_CUTOFF ? DuplicateType.NEAR : DuplicateType.PARTIAL;
            return DuplicateMatch.of(
                similarity,
                DetectionStrategy.FUZZY_MATCH,
                type,
                String.format(Locale.ROOT, "fuzzy match %.3f", similarity)
            );
        }
        return DuplicateMatch.notDuplicate(similarity, id());
    }

    private static Double nameSimilarity(MergedItem a, MergedItem b) {
        String nameA = a.getPayload().name().orElse(a.getId());
        String nameB = b.getPayload().name().orElse(b.getId());
        return boost(TextSimilarity.stringSimilarity(nameA, nameB));
    }

    private static Double fieldSimilarity(Optional<String> a, Optional<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return null;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        return boost(TextSimilarity.stringSimilarity(a.get(), b.get()));
    }

    private static Double categorySimilarity(Optional<String> a, Optional<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return null;
        }
        return a.isPresent() && b.isPresent() && a.get().equalsIgnoreCase(b.get()) ? 1.0 : 0.0;
    }

    private static double boost(double similarity) {
        return Math.min(similarity * FUZZY_BOOST, 1.0);
    }

    private static final class WeightedSum {
        private double weighted;
        private double total;

        void add(Double similarity, double weight) {
            if (similarity == null || weight <= 0) {
                return;
            }
            weighted += similarity * weight;
            total += weight;
        }

        double value() {
            return total <= 0 ? 0.0 : weighted / total;
        }
    }
}
