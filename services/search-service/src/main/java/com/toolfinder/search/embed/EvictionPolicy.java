package com.toolfinder.search.embed;

import java.util.Locale;

public enum EvictionPolicy {
    LRU,
    LFU,
    PRIORITY,
    ADAPTIVE;

    public static EvictionPolicy fromString(String value) {
        if (value == null || value.isBlank()) {
            return ADAPTIVE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return LRU;
        }
    }
}
