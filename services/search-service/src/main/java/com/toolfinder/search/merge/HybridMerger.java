package com.toolfinder.search.merge;

import org.springframework.stereotype.Component;

@Component
public class HybridMerger extends AbstractScoreMerger {
    static final double RRF_SHARE = 0.6;
    static final double WEIGHTED_SHARE = 0.4;

    @Override
    public MergeStrategy strategy() {
        return MergeStrategy.HYBRID;
    }

    @Override
    double score(CandidateGroup group, MergeContext context) {
        return RRF_SHARE * rrfScore(group, context) + WEIGHTED_SHARE * weightedScore(group, context);
    }
}
