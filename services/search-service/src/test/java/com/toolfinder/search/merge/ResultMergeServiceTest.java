package com.toolfinder.search.merge;

import static com.toolfinder.search.merge.RrfMergerTest.hit;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.toolfinder.search.model.MergedItem;
import com.toolfinder.search.model.ScoredItem;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ResultMergeServiceTest {
    private RrfMerger rrfMerger;
    private CustomMerger customMerger;
    private ResultMergeService service;

    @BeforeEach
    void setUp() {
        rrfMerger = new RrfMerger();
        customMerger = new CustomMerger(rrfMerger);
        service = new ResultMergeService(List.of(rrfMerger, new WeightedAverageMerger(), new HybridMerger(), customMerger));
    }

    @Test
    void weightedAverageUsesVectorTypeWeights() {
        Map<String, List<ScoredItem>> byType = new LinkedHashMap<>();
        byType.put("semantic", List.of(hit("figma", 0.9, "semantic", 1)));
        byType.put("aliases", List.of(hit("figma", 0.5, "aliases", 3)));

        MergedItem merged = service.merge(MergeStrategy.WEIGHTED_AVERAGE, byType, MergeContext.defaults()).get(0);

        assertEquals((0.9 * 1.0 + 0.5 * 0.6) / 1.6, merged.getCombinedScore(), 1e-12);
        assertThat(merged.getAttributions()).extracting(a -> a.getWeight()).containsExactly(1.0, 0.6);
    }

    @Test
    void unknownVectorTypeGetsFallbackWeight() {
        Map<String, List<ScoredItem>> byType = new LinkedHashMap<>();
        byType.put("semantic", List.of(hit("figma", 1.0, "semantic", 1)));
        byType.put("screenshots", List.of(hit("figma", 0.0, "screenshots", 1)));

        MergedItem merged = service.merge(MergeStrategy.WEIGHTED_AVERAGE, byType, MergeContext.defaults()).get(0);

        assertEquals(1.0 / 1.5, merged.getCombinedScore(), 1e-12);
    }

    @Test
    void hybridBlendsRankAndScore() {
        Map<String, List<ScoredItem>> byType = Map.of("semantic", List.of(hit("figma", 0.8, "semantic", 1)));

        MergedItem merged = service.merge(MergeStrategy.HYBRID, byType, MergeContext.defaults()).get(0);

        assertEquals(0.6 * (1.0 / 61) + 0.4 * 0.8, merged.getCombinedScore(), 1e-12);
    }

    @Test
    void customFallsBackToRrfUntilDelegateRegistered() {
        Map<String, List<ScoredItem>> byType = Map.of("semantic", List.of(hit("a", 0.8, "semantic", 1), hit("b", 0.7, "semantic", 2)));

        assertFalse(customMerger.hasDelegate());
        assertThat(service.merge(MergeStrategy.CUSTOM, byType, MergeContext.defaults()))
            .extracting(MergedItem::getId)
            .containsExactly("a", "b");

        customMerger.setDelegate(new ResultMerger() {
            @Override
            public MergeStrategy strategy() {
                return MergeStrategy.CUSTOM;
            }

            @Override
            public List<MergedItem> merge(Map<String, List<ScoredItem>> resultsByType, MergeContext context) {
                return List.of();
            }
        });

        assertTrue(customMerger.hasDelegate());
        assertThat(service.merge(MergeStrategy.CUSTOM, byType, MergeContext.defaults())).isEmpty();
    }

    @Test
    void missingStrategyDefaultsToRrf() {
        assertThat(service.resolve(null)).isSameAs(rrfMerger);
        assertEquals(MergeStrategy.RECIPROCAL_RANK_FUSION, MergeStrategy.fromString("unknown"));
        assertEquals(MergeStrategy.RECIPROCAL_RANK_FUSION, MergeStrategy.fromString("rrf"));
        assertEquals(MergeStrategy.WEIGHTED_AVERAGE, MergeStrategy.fromString("weighted_average"));
        assertEquals(MergeStrategy.HYBRID, MergeStrategy.fromString("HYBRID"));
    }
}
