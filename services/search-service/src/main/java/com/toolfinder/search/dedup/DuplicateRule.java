package com.toolfinder.search.dedup;

import com.toolfinder.search.model.MergedItem;
import java.util.function.BiPredicate;

/**
 * Caller-supplied duplicate test, ordered among the built-in detectors by priority
 * (built-ins use 500 for exact id down to 100 for fuzzy matching).
 */
public class DuplicateRule implements DuplicateDetector {
    private final String id;
    private final String name;
    private final String strategyLabel;
    private final int priority;
    private final BiPredicate<MergedItem, MergedItem> predicate;
    private final boolean enabled;

    public DuplicateRule(
        String id,
        String name,
        String strategyLabel,
        int priority,
        BiPredicate<MergedItem, MergedItem> predicate,
        boolean enabled
    ) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("rule id is required");
        }
        if (predicate == null) {
            throw new IllegalArgumentException("rule predicate is required");
        }
        this.id = id;
        this.name = name == null ? id : name;
        this.strategyLabel = strategyLabel == null || strategyLabel.isBlank() ? DetectionStrategy.CUSTOM.label() : strategyLabel;
        this.priority = priority;
        this.predicate = predicate;
        this.enabled = enabled;
    }

    public DuplicateRule(String id, int priority, BiPredicate<MergedItem, MergedItem> predicate) {
        this(id, id, null, priority, predicate, true);
    }

    @Override
    public String id() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getStrategyLabel() {
        return strategyLabel;
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public DetectionStrategy strategy() {
        return DetectionStrategy.CUSTOM;
    }

    @Override
    public int priority() {
        return priority;
    }

    @Override
    public DuplicateMatch match(MergedItem a, MergedItem b) {
        if (!enabled) {
            return DuplicateMatch.none();
        }
        if (predicate.test(a, b) || predicate.test(b, a)) {
            return new DuplicateMatch(true, 1.0, strategyLabel, DuplicateType.NEAR, "custom rule " + name);
        }
        return DuplicateMatch.none();
    }
}
