package com.toolfinder.search.service;

import com.toolfinder.search.model.MergedItem;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Walks a score-sorted list and drops repeats: any item whose name was already selected, and any item
 * whose category already makes up more than {@code threshold} of the selection.
 */
@Component
public class DiversityFilter {

    public List<MergedItem> apply(List<MergedItem> items, double threshold) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        List<MergedItem> selected = new ArrayList<>(items.size());
        Set<String> names = new HashSet<>();
        Map<String, Integer> categoryCounts = new HashMap<>();
        for (MergedItem item : items) {
            Optional<String> name = item.getPayload().name();
            if (name.isPresent() && names.contains(name.get())) {
                continue;
            }
            Optional<String> category = item.getPayload().category();
            if (threshold > 0 && category.isPresent() && !selected.isEmpty()) {
                int sameCategory = categoryCounts.getOrDefault(category.get(), 0);
                double share = (double) sameCategory / selected.size();
                if (share > threshold) {
                    continue;
                }
            }
            selected.add(item);
            name.ifPresent(names::add);
            category.ifPresent(value -> categoryCounts.merge(value, 1, Integer::sum));
        }
        return selected;
    }
}
