package com.toolfinder.search.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view over the opaque payload returned by the vector store.
 * Typed accessors never assume a field is present.
 */
public final class ItemPayload {
    private static final ItemPayload EMPTY = new ItemPayload(Map.of());

    private final Map<String, Object> fields;

    private ItemPayload(Map<String, Object> fields) {
        this.fields = fields;
    }

    public static ItemPayload of(Map<String, Object> fields) {
        if (fields == null || fields.isEmpty()) {
            return EMPTY;
        }
        return new ItemPayload(Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
    }

    public static ItemPayload empty() {
        return EMPTY;
    }

    public Optional<String> name() {
        return string("name");
    }

    public Optional<String> description() {
        return string("description");
    }

    public Optional<String> category() {
        return string("category");
    }

    public Optional<String> url() {
        Optional<String> url = string("url");
        return url.isPresent() ? url : string("website");
    }

    public Optional<String> version() {
        return string("version");
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(fields.get(key));
    }

    public Optional<String> string(String key) {
        Object value = fields.get(key);
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    public Map<String, Object> asMap() {
        return fields;
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ItemPayload)) {
            return false;
        }
        return fields.equals(((ItemPayload) o).fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }
}
