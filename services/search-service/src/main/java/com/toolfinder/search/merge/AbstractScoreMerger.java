package com.toolfinder.search.merge;

import com.toolfinder.search.model.MergedItem;
import com.toolfinder.search.model.ScoredItem;
import com.toolfinder.search.model.SourceAttribution;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

abstract class AbstractScoreMerger implements ResultMerger {

    @Override
    public List<MergedItem> merge(Map<String, List<ScoredItem>> resultsByType, MergeContext context) {
        MergeContext resolved = context == null ? MergeContext.defaults() : context;
        Map<String, CandidateGroup> groups = CandidateGroup.collect(resultsByType);
        List<MergedItem> merged = new ArrayList<>(groups.size());
        for (CandidateGroup group : groups.values()) {
            merged.add(toMergedItem(group, score(group, resolved), resolved));
        }
        // List.sort is stable, so equal scores keep first-seen order.
        merged.sort(Comparator.comparingDouble(MergedItem::getCombinedScore).reversed());
        return merged;
    }

    abstract double score(CandidateGroup group, MergeContext context);

    static double rrfScore(CandidateGroup group, MergeContext context) {
        double score = 0.0;
        for (ScoredItem hit : group.getHits()) {
            score += 1.0 / (context.getRrfK() + hit.getRank());
        }
        return score;
    }

    static double weightedScore(CandidateGroup group, MergeContext context) {
        double weightedSum = 0.0;
        double weightTotal = 0.0;
        for (ScoredItem hit : group.getHits()) {
            double weight = context.getWeights().weightFor(hit.getVectorType());
            weightedSum += hit.getScore() * weight;
            weightTotal += weight;
        }
        return weightTotal <= 0.0 ? 0.0 : weightedSum / weightTotal;
    }

    private static MergedItem toMergedItem(CandidateGroup group, double combinedScore, MergeContext context) {
        List<SourceAttribution> attributions = new ArrayList<>(group.getHits().size());
        for (ScoredItem hit : group.getHits()) {
            attributions.add(
                new SourceAttribution(
                    hit.getVectorType(),
                    hit.getScore(),
                    hit.getRank(),
                    context.getWeights().weightFor(hit.getVectorType())
                )
            );
        }
        ScoredItem representative = group.getRepresentative();
        return new MergedItem(
            group.getId(),
            representative.getScore(),
            representative.getPayload(),
            representative.getVectorType(),
            representative.getRank(),
            combinedScore,
            attributions,
            attributions.size()
        );
    }
}
