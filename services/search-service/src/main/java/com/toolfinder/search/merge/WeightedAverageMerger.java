package com.toolfinder.search.merge;

import org.springframework.stereotype.Component;

@Component
public class WeightedAverageMerger extends AbstractScoreMerger {

    @Override
    public MergeStrategy strategy() {
        return MergeStrategy.WEIGHTED_AVERAGE;
    }

    @Override
    double score(CandidateGroup group, MergeContext context) {
        return weightedScore(group, context);
    }
}
