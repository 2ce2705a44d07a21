package com.toolfinder.search.dedup;

import com.toolfinder.search.merge.MergeStrategy;

/**
 * How a duplicate's combined score folds into the item it is merged into.
 */
public enum ScoreMergeMode {
    MAX,
    SUM,
    /** SUM for reciprocal rank fusion, MAX for every other strategy. */
    RRF_AWARE;

    public boolean sums(MergeStrategy strategy) {
        if (this == SUM) {
            return true;
        }
        return this == RRF_AWARE && strategy == MergeStrategy.RECIPROCAL_RANK_FUSION;
    }
}
