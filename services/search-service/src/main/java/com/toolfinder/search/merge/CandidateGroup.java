package com.toolfinder.search.merge;

import com.toolfinder.search.model.ScoredItem;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Hits for one item id gathered across vector types, in first-seen order.
 */
final class CandidateGroup {
    private final String id;
    private final List<ScoredItem> hits = new ArrayList<>();
    private final Set<String> vectorTypes = new HashSet<>();
    private ScoredItem representative;

    private CandidateGroup(String id) {
        this.id = id;
    }

    static Map<String, CandidateGroup> collect(Map<String, List<ScoredItem>> resultsByType) {
        Map<String, CandidateGroup> groups = new LinkedHashMap<>();
        if (resultsByType == null) {
            return groups;
        }
        for (Map.Entry<String, List<ScoredItem>> entry : resultsByType.entrySet()) {
            List<ScoredItem> items = entry.getValue();
            if (items == null) {
                continue;
            }
            for (int i = 0; i < items.size(); i++) {
                ScoredItem item = items.get(i);
                if (item == null) {
                    continue;
                }
                int rank = item.getRank() > 0 ? item.getRank() : i + 1;
                String vectorType = item.getVectorType() != null ? item.getVectorType() : entry.getKey();
                ScoredItem ranked = new ScoredItem(item.getId(), item.getScore(), item.getPayload(), vectorType, rank);
                groups.computeIfAbsent(item.getId(), CandidateGroup::new).add(ranked);
            }
        }
        return groups;
    }

    private void add(ScoredItem item) {
        // one hit per vector type; a repeated id later in the same list is ignored
        if (!vectorTypes.add(item.getVectorType())) {
            return;
        }
        hits.add(item);
        if (representative == null || item.getScore() > representative.getScore()) {
            representative = item;
        }
    }

    String getId() {
        return id;
    }

    List<ScoredItem> getHits() {
        return Collections.unmodifiableList(hits);
    }

    ScoredItem getRepresentative() {
        return representative;
    }
}
