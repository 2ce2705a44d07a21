package com.toolfinder.search.service;

import com.toolfinder.search.merge.MergeStrategy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search.multi-vector")
public class MultiVectorSearchProperties {
    private List<String> vectorTypes = new ArrayList<>(List.of("semantic", "categories", "functionality", "aliases", "composites"));
    private MergeStrategy mergeStrategy = MergeStrategy.RECIPROCAL_RANK_FUSION;
    private int rrfK = 60;
    private int maxResultsPerVector = 20;
    private long searchTimeoutMs = 5000;
    private boolean parallelSearchEnabled = true;
    private Map<String, Double> weights = new LinkedHashMap<>();
    private boolean diversityEnabled = true;
    private double diversityThreshold = 0.7;
    private boolean cacheDegradedResults = false;
    private double performanceSmoothing = 0.3;

    public List<String> getVectorTypes() {
        return vectorTypes;
    }

    public void setVectorTypes(List<String> vectorTypes) {
        this.vectorTypes = vectorTypes;
    }

    public MergeStrategy getMergeStrategy() {
        return mergeStrategy;
    }

    public void setMergeStrategy(MergeStrategy mergeStrategy) {
        this.mergeStrategy = mergeStrategy;
    }

    public int getRrfK() {
        return rrfK;
    }

    public void setRrfK(int rrfK) {
        this.rrfK = rrfK;
    }

    public int getMaxResultsPerVector() {
        return maxResultsPerVector;
    }

    public void setMaxResultsPerVector(int maxResultsPerVector) {
        this.maxResultsPerVector = maxResultsPerVector;
    }

    public long getSearchTimeoutMs() {
        return searchTimeoutMs;
    }

    public void setSearchTimeoutMs(long searchTimeoutMs) {
        this.searchTimeoutMs = searchTimeoutMs;
    }

    public boolean isParallelSearchEnabled() {
        return parallelSearchEnabled;
    }

    public void setParallelSearchEnabled(boolean parallelSearchEnabled) {
        this.parallelSearchEnabled = parallelSearchEnabled;
    }

    public Map<String, Double> getWeights() {
        return weights;
    }

    public void setWeights(Map<String, Double> weights) {
        this.weights = weights;
    }

    public boolean isDiversityEnabled() {
        return diversityEnabled;
    }

    public void setDiversityEnabled(boolean diversityEnabled) {
        this.diversityEnabled = diversityEnabled;
    }

    public double getDiversityThreshold() {
        return diversityThreshold;
    }

    public void setDiversityThreshold(double diversityThreshold) {
        this.diversityThreshold = diversityThreshold;
    }

    public boolean isCacheDegradedResults() {
        return cacheDegradedResults;
    }

    public void setCacheDegradedResults(boolean cacheDegradedResults) {
        this.cacheDegradedResults = cacheDegradedResults;
    }

    public double getPerformanceSmoothing() {
        return performanceSmoothing;
    }

    public void setPerformanceSmoothing(double performanceSmoothing) {
        this.performanceSmoothing = performanceSmoothing;
    }
}
