package com.toolfinder.search.merge;

import com.toolfinder.search.model.MergedItem;
import com.toolfinder.search.model.ScoredItem;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

@Service
public class ResultMergeService {
    private final Map<MergeStrategy, ResultMerger> mergers = new EnumMap<>(MergeStrategy.class);

    public ResultMergeService(List<ResultMerger> mergers) {
        for (ResultMerger merger : mergers) {
            this.mergers.put(merger.strategy(), merger);
        }
        if (!this.mergers.containsKey(MergeStrategy.RECIPROCAL_RANK_FUSION)) {
            this.mergers.put(MergeStrategy.RECIPROCAL_RANK_FUSION, new RrfMerger());
        }
    }

    public List<MergedItem> merge(
        MergeStrategy strategy,
        Map<String, List<ScoredItem>> resultsByType,
        MergeContext context
    ) {
        return resolve(strategy).merge(resultsByType, context);
    }

    ResultMerger resolve(MergeStrategy strategy) {
        ResultMerger merger = strategy == null ? null : mergers.get(strategy);
        if (merger == null) {
            return mergers.get(MergeStrategy.RECIPROCAL_RANK_FUSION);
        }
        return merger;
    }
}
