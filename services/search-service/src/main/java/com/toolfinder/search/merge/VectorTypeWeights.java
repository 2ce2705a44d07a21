package com.toolfinder.search.merge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class VectorTypeWeights {
    public static final double UNKNOWN_TYPE_WEIGHT = 0.5;

    private static final Map<String, Double> DEFAULTS = defaultWeights();

    private final Map<String, Double> weights;
    private final double fallbackWeight;

    public VectorTypeWeights(Map<String, Double> overrides) {
        this(overrides, UNKNOWN_TYPE_WEIGHT);
    }

    public VectorTypeWeights(Map<String, Double> overrides, double fallbackWeight) {
        Map<String, Double> merged = new LinkedHashMap<>(DEFAULTS);
        if (overrides != null) {
            overrides.forEach((type, weight) -> {
                if (type != null && weight != null && weight >= 0) {
                    merged.put(type, weight);
                }
            });
        }
        this.weights = Collections.unmodifiableMap(merged);
        this.fallbackWeight = fallbackWeight;
    }

    public static VectorTypeWeights defaults() {
        return new VectorTypeWeights(Map.of());
    }

    public double weightFor(String vectorType) {
        if (vectorType == null) {
            return fallbackWeight;
        }
        return weights.getOrDefault(vectorType, fallbackWeight);
    }

    public Map<String, Double> asMap() {
        return weights;
    }

    private static Map<String, Double> defaultWeights() {
        Map<String, Double> defaults = new LinkedHashMap<>();
        defaults.put("semantic", 1.0);
        defaults.put("categories", 0.8);
        defaults.put("functionality", 0.7);
        defaults.put("aliases", 0.6);
        defaults.put("composites", 0.5);
        return Collections.unmodifiableMap(defaults);
    }
}
