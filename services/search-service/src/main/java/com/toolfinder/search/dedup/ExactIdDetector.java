package com.toolfinder.search.dedup;

import com.toolfinder.search.model.MergedItem;

class ExactIdDetector implements DuplicateDetector {

    @Override
    public String id() {
        return DetectionStrategy.EXACT_ID.label();
    }

    @Override
    public DetectionStrategy strategy() {
        return DetectionStrategy.EXACT_ID;
    }

    @Override
    public int priority() {
        return 500;
    }

    @Override
    public DuplicateMatch match(MergedItem a, MergedItem b) {
        if (a.getId().equals(b.getId())) {
            return DuplicateMatch.of(1.0, DetectionStrategy.EXACT_ID, DuplicateType.EXACT, "same id " + a.getId());
        }
        return DuplicateMatch.none();
    }
}
