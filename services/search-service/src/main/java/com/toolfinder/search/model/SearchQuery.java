package com.toolfinder.search.model;

import com.toolfinder.search.merge.MergeStrategy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class SearchQuery {
    private final String text;
    private final List<String> vectorTypes;
    private final int limit;
    private final Map<String, Object> filter;
    private final MergeStrategy mergeStrategy;
    private final Integer rrfK;

    public SearchQuery(
        String text,
        List<String> vectorTypes,
        int limit,
        Map<String, Object> filter,
        MergeStrategy mergeStrategy,
        Integer rrfK
    ) {
        if (text == null || text.isBlank()) {
            throw new InvalidSearchQueryException("query text must not be empty");
        }
        if (vectorTypes == null || vectorTypes.isEmpty()) {
            throw new InvalidSearchQueryException("at least one vector type is required");
        }
        if (limit <= 0) {
            throw new InvalidSearchQueryException("limit must be positive: " + limit);
        }
        if (rrfK != null && rrfK < 0) {
            throw new InvalidSearchQueryException("rrf k must not be negative: " + rrfK);
        }
        List<String> types = new ArrayList<>();
        for (String vectorType : vectorTypes) {
            if (vectorType == null || vectorType.isBlank()) {
                throw new InvalidSearchQueryException("vector type must not be blank");
            }
            String trimmed = vectorType.trim();
            if (!types.contains(trimmed)) {
                types.add(trimmed);
            }
        }
        this.text = text;
        this.vectorTypes = Collections.unmodifiableList(types);
        this.limit = limit;
        this.filter = filter == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(filter));
        this.mergeStrategy = mergeStrategy;
        this.rrfK = rrfK;
    }

    public static SearchQuery of(String text, List<String> vectorTypes, int limit) {
        return new SearchQuery(text, vectorTypes, limit, null, null, null);
    }

    public String getText() {
        return text;
    }

    public List<String> getVectorTypes() {
        return vectorTypes;
    }

    public int getLimit() {
        return limit;
    }

    public Map<String, Object> getFilter() {
        return filter;
    }

    public MergeStrategy getMergeStrategy() {
        return mergeStrategy;
    }

    public Integer getRrfK() {
        return rrfK;
    }
}
