package com.toolfinder.search.merge;

public class MergeContext {
    public static final int DEFAULT_RRF_K = 60;

    private final int rrfK;
    private final VectorTypeWeights weights;

    public MergeContext(int rrfK, VectorTypeWeights weights) {
        this.rrfK = Math.max(0, rrfK);
        this.weights = weights == null ? VectorTypeWeights.defaults() : weights;
    }

    public static MergeContext defaults() {
        return new MergeContext(DEFAULT_RRF_K, VectorTypeWeights.defaults());
    }

    public int getRrfK() {
        return rrfK;
    }

    public VectorTypeWeights getWeights() {
        return weights;
    }
}
