package com.toolfinder.search.dedup;

import com.toolfinder.search.model.MergedItem;
import java.util.Locale;

class VersionAwareDetector implements DuplicateDetector {

    @Override
    public String id() {
        return DetectionStrategy.VERSION_AWARE.label();
    }

    @Override
    public DetectionStrategy strategy() {
        return DetectionStrategy.VERSION_AWARE;
    }

    @Override
    public int priority() {
        return 200;
    }

    @Override
    public DuplicateMatch match(MergedItem a, MergedItem b) {
        String nameA = a.getPayload().name().orElse(null);
        String nameB = b.getPayload().name().orElse(null);
        if (nameA == null || nameB == null) {
            return DuplicateMatch.none();
        }
        String baseA = TextSimilarity.normalizeName(nameA);
        String baseB = TextSimilarity.normalizeName(nameB);
        if (baseA.isEmpty() || !baseA.equals(baseB)) {
            return DuplicateMatch.none();
        }
        String versionA = version(a, nameA);
        String versionB = version(b, nameB);
        if (!versionA.equals(versionB)) {
            return DuplicateMatch.of(
                1.0,
                DetectionStrategy.VERSION_AWARE,
                DuplicateType.VERSION_VARIANT,
                "same tool, different versions (" + display(versionA) + " vs " + display(versionB) + ")"
            );
        }
        double similarity = TextSimilarity.stringSimilarity(nameA, nameB);
        return DuplicateMatch.of(
            similarity,
            DetectionStrategy.VERSION_AWARE,
            DuplicateType.VERSION_VARIANT,
            String.format(Locale.ROOT, "same tool name after version strip %.3f", similarity)
        );
    }

    private static String version(MergedItem item, String name) {
        return item.getPayload().version().orElseGet(() -> TextSimilarity.trailingVersion(name)).toLowerCase(Locale.ROOT);
    }

    private static String display(String version) {
        return version.isEmpty() ? "none" : version;
    }
}
