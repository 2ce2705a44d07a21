package com.toolfinder.search.embed;

import java.util.List;

public final class VectorMath {
    private static final int SEMANTIC_BUCKETS = 16;

    private VectorMath() {
    }

    public static double cosineSimilarity(List<Double> a, List<Double> b) {
        if (a == null || b == null || a.isEmpty() || a.size() != b.size()) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.size(); i++) {
            double x = a.get(i);
            double y = b.get(i);
            dot += x * y;
            normA += x * x;
            normB += y * y;
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /**
     * Coarse fingerprint: one sign bit per contiguous slice of the unit vector.
     */
    public static String semanticHash(List<Double> embedding) {
        if (embedding == null || embedding.isEmpty()) {
            return "";
        }
        double norm = 0.0;
        for (Double value : embedding) {
            norm += value * value;
        }
        norm = Math.sqrt(norm);
        double divisor = norm == 0.0 ? 1.0 : norm;
        double bucketSize = (double) embedding.size() / SEMANTIC_BUCKETS;
        StringBuilder hash = new StringBuilder(SEMANTIC_BUCKETS);
        for (int bucket = 0; bucket < SEMANTIC_BUCKETS; bucket++) {
            int start = (int) Math.floor(bucket * bucketSize);
            int end = (int) Math.floor((bucket + 1) * bucketSize);
            double sum = 0.0;
            for (int i = start; i < end; i++) {
                sum += embedding.get(i) / divisor;
            }
            hash.append(sum > 0 ? '1' : '0');
        }
        return hash.toString();
    }
}
