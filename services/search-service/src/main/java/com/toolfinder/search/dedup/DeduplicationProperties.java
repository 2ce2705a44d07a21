package com.toolfinder.search.dedup;

import java.util.EnumSet;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search.dedup")
public class DeduplicationProperties {
    private boolean enabled = true;
    private double contentSimilarityThreshold = 0.85;
    private double fuzzyMatchThreshold = 0.7;
    private ScoreMergeMode scoreMergeMode = ScoreMergeMode.MAX;
    private Set<DetectionStrategy> strategies = EnumSet.of(
        DetectionStrategy.EXACT_ID,
        DetectionStrategy.EXACT_URL,
        DetectionStrategy.CONTENT_SIMILARITY,
        DetectionStrategy.VERSION_AWARE,
        DetectionStrategy.FUZZY_MATCH
    );
    private FieldWeights fieldWeights = new FieldWeights();
    private int statsWindow = 100;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public double getContentSimilarityThreshold() {
        return contentSimilarityThreshold;
    }

    public void setContentSimilarityThreshold(double contentSimilarityThreshold) {
        this.contentSimilarityThreshold = contentSimilarityThreshold;
    }

    public double getFuzzyMatchThreshold() {
        return fuzzyMatchThreshold;
    }

    public void setFuzzyMatchThreshold(double fuzzyMatchThreshold) {
        this.fuzzyMatchThreshold = fuzzyMatchThreshold;
    }

    public ScoreMergeMode getScoreMergeMode() {
        return scoreMergeMode;
    }

    public void setScoreMergeMode(ScoreMergeMode scoreMergeMode) {
        this.scoreMergeMode = scoreMergeMode;
    }

    public Set<DetectionStrategy> getStrategies() {
        return strategies;
    }

    public void setStrategies(Set<DetectionStrategy> strategies) {
        this.strategies = strategies;
    }

    public FieldWeights getFieldWeights() {
        return fieldWeights;
    }

    public void setFieldWeights(FieldWeights fieldWeights) {
        this.fieldWeights = fieldWeights;
    }

    public int getStatsWindow() {
        return statsWindow;
    }

    public void setStatsWindow(int statsWindow) {
        this.statsWindow = statsWindow;
    }

    public static class FieldWeights {
        private double name = 0.5;
        private double description = 0.3;
        private double url = 0.15;
        private double category = 0.05;

        public double getName() {
            return name;
        }

        public void setName(double name) {
            this.name = name;
        }

        public double getDescription() {
            return description;
        }

        public void setDescription(double description) {
            this.description = description;
        }

        public double getUrl() {
            return url;
        }

        public void setUrl(double url) {
            this.url = url;
        }

        public double getCategory() {
            return category;
        }

        public void setCategory(double category) {
            this.category = category;
        }
    }
}
