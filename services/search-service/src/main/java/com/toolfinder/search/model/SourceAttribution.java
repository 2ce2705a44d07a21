package com.toolfinder.search.model;

import java.util.Objects;

public class SourceAttribution {
    private final String vectorType;
    private final double score;
    private final int rank;
    private final double weight;

    public SourceAttribution(String vectorType, double score, int rank, double weight) {
        this.vectorType = vectorType;
        this.score = score;
        this.rank = rank;
        this.weight = weight;
    }

    public String getVectorType() {
        return vectorType;
    }

    public double getScore() {
        return score;
    }

    public int getRank() {
        return rank;
    }

    public double getWeight() {
        return weight;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SourceAttribution)) {
            return false;
        }
        SourceAttribution other = (SourceAttribution) o;
        return Double.compare(score, other.score) == 0
            && rank == other.rank
            && Double.compare(weight, other.weight) == 0
            && Objects.equals(vectorType, other.vectorType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vectorType, score, rank, weight);
    }

    @Override
    public String toString() {
        return vectorType + "#" + rank + "(" + score + ")";
    }
}
