package com.toolfinder.search.merge;

import com.toolfinder.search.model.MergedItem;
import com.toolfinder.search.model.ScoredItem;
import java.util.List;
import java.util.Map;

public interface ResultMerger {
    MergeStrategy strategy();

    /**
     * Iteration order of {@code resultsByType} decides ties: equal scores keep first-seen order.
     */
    List<MergedItem> merge(Map<String, List<ScoredItem>> resultsByType, MergeContext context);
}
