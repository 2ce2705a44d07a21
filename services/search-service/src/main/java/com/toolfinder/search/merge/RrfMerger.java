package com.toolfinder.search.merge;

import org.springframework.stereotype.Component;

@Component
public class RrfMerger extends AbstractScoreMerger {

    @Override
    public MergeStrategy strategy() {
        return MergeStrategy.RECIPROCAL_RANK_FUSION;
    }

    @Override
    double score(CandidateGroup group, MergeContext context) {
        return rrfScore(group, context);
    }
}
