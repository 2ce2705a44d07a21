package com.toolfinder.search.dedup;

import com.toolfinder.search.model.MergedItem;

public interface DuplicateDetector {
    String id();

    DetectionStrategy strategy();

    /**
     * Higher values run first.
     */
    int priority();

    DuplicateMatch match(MergedItem a, MergedItem b);
}
