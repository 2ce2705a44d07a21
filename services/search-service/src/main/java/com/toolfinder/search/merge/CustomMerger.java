package com.toolfinder.search.merge;

import com.toolfinder.search.model.MergedItem;
import com.toolfinder.search.model.ScoredItem;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Extension point. Runs the registered delegate, or reciprocal rank fusion when none is set.
 */
@Component
public class CustomMerger implements ResultMerger {
    private final RrfMerger fallback;
    private volatile ResultMerger delegate;

    public CustomMerger(RrfMerger fallback) {
        this.fallback = fallback;
    }

    @Override
    public MergeStrategy strategy() {
        return MergeStrategy.CUSTOM;
    }

    public void setDelegate(ResultMerger delegate) {
        if (delegate == this) {
            throw new IllegalArgumentException("custom merger cannot delegate to itself");
        }
        this.delegate = delegate;
    }

    public boolean hasDelegate() {
        return delegate != null;
    }

    @Override
    public List<MergedItem> merge(Map<String, List<ScoredItem>> resultsByType, MergeContext context) {
        ResultMerger current = delegate;
        if (current == null) {
            return fallback.merge(resultsByType, context);
        }
        return current.merge(resultsByType, context);
    }
}
