package com.toolfinder.search.dedup;

import com.toolfinder.search.model.MergedItem;
import java.util.Optional;

class ExactUrlDetector implements DuplicateDetector {

    @Override
    public String id() {
        return DetectionStrategy.EXACT_URL.label();
    }

    @Override
    public DetectionStrategy strategy() {
        return DetectionStrategy.EXACT_URL;
    }

    @Override
    public int priority() {
        return 400;
    }

    @Override
    public DuplicateMatch match(MergedItem a, MergedItem b) {
        Optional<String> urlA = a.getPayload().url();
        Optional<String> urlB = b.getPayload().url();
        if (urlA.isPresent() && urlB.isPresent() && urlA.get().equals(urlB.get())) {
            return DuplicateMatch.of(1.0, DetectionStrategy.EXACT_URL, DuplicateType.EXACT, "same url " + urlA.get());
        }
        return DuplicateMatch.none();
    }
}
