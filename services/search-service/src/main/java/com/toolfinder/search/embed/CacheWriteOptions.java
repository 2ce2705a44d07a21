package com.toolfinder.search.embed;

public class CacheWriteOptions {
    private static final CacheWriteOptions DEFAULTS = new CacheWriteOptions(1.0, null, null);

    private final double priority;
    private final String source;
    private final Long customTtlSeconds;

    public CacheWriteOptions(double priority, String source, Long customTtlSeconds) {
        this.priority = priority > 0 ? priority : 1.0;
        this.source = source;
        this.customTtlSeconds = customTtlSeconds != null && customTtlSeconds > 0 ? customTtlSeconds : null;
    }

    public static CacheWriteOptions defaults() {
        return DEFAULTS;
    }

    public static CacheWriteOptions fromSource(String source) {
        return new CacheWriteOptions(1.0, source, null);
    }

    public double getPriority() {
        return priority;
    }

    public String getSource() {
        return source;
    }

    public Long getCustomTtlSeconds() {
        return customTtlSeconds;
    }
}
