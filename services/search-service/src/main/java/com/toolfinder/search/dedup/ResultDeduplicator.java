package com.toolfinder.search.dedup;

import com.toolfinder.search.merge.MergeStrategy;
import com.toolfinder.search.model.MergedItem;
import com.toolfinder.search.model.SourceAttribution;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ResultDeduplicator {
    private static final Logger log = LoggerFactory.getLogger(ResultDeduplicator.class);
    private static final Comparator<DuplicateDetector> BY_PRIORITY =
        Comparator.comparingInt(DuplicateDetector::priority).reversed();

    private final DeduplicationProperties properties;
    private final List<DuplicateDetector> builtIns;
    private final CopyOnWriteArrayList<DuplicateRule> customRules = new CopyOnWriteArrayList<>();
    private final Deque<DeduplicationResult> recentRuns = new ArrayDeque<>();
    private final Map<String, Long> detectionTotals = new LinkedHashMap<>();
    private long runs;
    private long totalProcessed;
    private long totalRemoved;
    private DeduplicationResult lastRun;

    public ResultDeduplicator(DeduplicationProperties properties) {
        this.properties = properties;
        this.builtIns = List.of(
            new ExactIdDetector(),
            new ExactUrlDetector(),
            new ContentSimilarityDetector(properties.getContentSimilarityThreshold()),
            new VersionAwareDetector(),
            new FuzzyMatchDetector(properties.getFuzzyMatchThreshold(), properties.getFieldWeights())
        );
    }

    public DeduplicationResult detectDuplicates(List<MergedItem> items) {
        return detectDuplicates(items, null);
    }

    /**
     * Single greedy pass over the items in descending combined-score order. Each item is compared only
     * with the items already kept; a duplicate is folded into the first kept item it matches.
     */
    public DeduplicationResult detectDuplicates(List<MergedItem> items, MergeStrategy strategy) {
        long started = System.nanoTime();
        List<MergedItem> input = items == null ? List.of() : items;
        if (!properties.isEnabled() || input.size() < 2) {
            DeduplicationResult passthrough = new DeduplicationResult(
                new ArrayList<>(input),
                0,
                input.size(),
                averageScore(input),
                elapsedMs(started),
                Map.of()
            );
            record(passthrough);
            return passthrough;
        }

        List<MergedItem> sorted = new ArrayList<>(input);
        sorted.sort(Comparator.comparingDouble(MergedItem::getCombinedScore).reversed());
        boolean sumScores = resolveMode().sums(strategy);
        List<DuplicateDetector> detectors = activeDetectors();

        List<Group> kept = new ArrayList<>();
        Map<String, Integer> detections = new LinkedHashMap<>();
        for (MergedItem item : sorted) {
            Group target = null;
            DuplicateMatch match = null;
            for (Group group : kept) {
                DuplicateMatch candidate = firstMatch(detectors, group.lead, item);
                if (candidate.isDuplicate()) {
                    target = group;
                    match = candidate;
                    break;
                }
            }
            if (target == null) {
                kept.add(new Group(item));
                continue;
            }
            target.absorb(item, sumScores);
            detections.merge(match.getDetectedBy(), 1, Integer::sum);
            log.debug(
                "duplicate merged kept={} dropped={} detected_by={} similarity={}",
                target.lead.getId(),
                item.getId(),
                match.getDetectedBy(),
                match.getSimilarityScore()
            );
        }

        List<MergedItem> unique = new ArrayList<>(kept.size());
        for (Group group : kept) {
            unique.add(group.toMergedItem());
        }
        unique.sort(Comparator.comparingDouble(MergedItem::getCombinedScore).reversed());

        DeduplicationResult result = new DeduplicationResult(
            unique,
            sorted.size() - unique.size(),
            sorted.size(),
            averageScore(unique),
            elapsedMs(started),
            detections
        );
        record(result);
        return result;
    }

    public DuplicateMatch areDuplicates(MergedItem a, MergedItem b) {
        if (a == null || b == null) {
            return DuplicateMatch.none();
        }
        return firstMatch(activeDetectors(), a, b);
    }

    public void addRule(DuplicateRule rule) {
        if (rule == null) {
            throw new IllegalArgumentException("rule is required");
        }
        customRules.removeIf(existing -> existing.id().equals(rule.id()));
        customRules.add(rule);
        log.info("duplicate rule registered id={} priority={}", rule.id(), rule.priority());
    }

    public boolean removeRule(String ruleId) {
        return customRules.removeIf(existing -> existing.id().equals(ruleId));
    }

    public List<DuplicateRule> getRules() {
        return List.copyOf(customRules);
    }

    public synchronized DeduplicationStats getStats() {
        double avgTime = 0.0;
        double avgRate = 0.0;
        for (DeduplicationResult run : recentRuns) {
            avgTime += run.getProcessingTimeMs();
            avgRate += run.getDuplicateRate();
        }
        if (!recentRuns.isEmpty()) {
            avgTime /= recentRuns.size();
            avgRate /= recentRuns.size();
        }
        return new DeduplicationStats(runs, totalProcessed, totalRemoved, avgTime, avgRate, detectionTotals, lastRun);
    }

    public synchronized void resetStats() {
        recentRuns.clear();
        detectionTotals.clear();
        runs = 0;
        totalProcessed = 0;
        totalRemoved = 0;
        lastRun = null;
    }

    public ScoreMergeMode resolveMode() {
        return properties.getScoreMergeMode() == null ? ScoreMergeMode.MAX : properties.getScoreMergeMode();
    }

    private List<DuplicateDetector> activeDetectors() {
        List<DuplicateDetector> detectors = new ArrayList<>();
        for (DuplicateDetector detector : builtIns) {
            if (properties.getStrategies() == null || properties.getStrategies().contains(detector.strategy())) {
                detectors.add(detector);
            }
        }
        for (DuplicateRule rule : customRules) {
            if (rule.isEnabled()) {
                detectors.add(rule);
            }
        }
        detectors.sort(BY_PRIORITY);
        return detectors;
    }

    private static DuplicateMatch firstMatch(List<DuplicateDetector> detectors, MergedItem a, MergedItem b) {
        DuplicateMatch closest = DuplicateMatch.none();
        for (DuplicateDetector detector : detectors) {
            DuplicateMatch match = detector.match(a, b);
            if (match.isDuplicate()) {
                return match;
            }
            if (match.getSimilarityScore() > closest.getSimilarityScore()) {
                closest = match;
            }
        }
        return closest;
    }

    private synchronized void record(DeduplicationResult result) {
        runs++;
        totalProcessed += result.getTotalProcessed();
        totalRemoved += result.getDuplicatesRemoved();
        result.getDetectionsByStrategy().forEach((strategy, count) -> detectionTotals.merge(strategy, (long) count, Long::sum));
        recentRuns.addLast(result);
        while (recentRuns.size() > Math.max(1, properties.getStatsWindow())) {
            recentRuns.removeFirst();
        }
        lastRun = result;
    }

    private static double averageScore(List<MergedItem> items) {
        if (items.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (MergedItem item : items) {
            total += item.getCombinedScore();
        }
        return total / items.size();
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }

    private static final class Group {
        private final MergedItem lead;
        private final Set<SourceAttribution> attributions;
        private double combinedScore;
        private int mergedFromCount;

        private Group(MergedItem lead) {
            this.lead = lead;
            this.attributions = new LinkedHashSet<>(lead.getAttributions());
            this.combinedScore = lead.getCombinedScore();
            this.mergedFromCount = lead.getMergedFromCount();
        }

        // the lead is never lower-scored than anything absorbed, so its payload is kept
        private void absorb(MergedItem duplicate, boolean sumScores) {
            attributions.addAll(duplicate.getAttributions());
            mergedFromCount += duplicate.getMergedFromCount();
            combinedScore = sumScores
                ? combinedScore + duplicate.getCombinedScore()
                : Math.max(combinedScore, duplicate.getCombinedScore());
        }

        private MergedItem toMergedItem() {
            return new MergedItem(
                lead.getId(),
                lead.getScore(),
                lead.getPayload(),
                lead.getVectorType(),
                lead.getRank(),
                combinedScore,
                new ArrayList<>(attributions),
                mergedFromCount
            );
        }
    }
}
