package com.toolfinder.search.embed;

/**
 * Stretches an entry's lease with its access rate: {@code base * min(ln(accessesPerSecond + 1) + 1, 3)},
 * clamped to {@code [minTtl, maxTtl]}.
 */
public class AdaptiveTtlPolicy {
    private static final double MAX_MULTIPLIER = 3.0;

    private final long minTtlSeconds;
    private final long maxTtlSeconds;
    private final boolean enabled;

    public AdaptiveTtlPolicy(long minTtlSeconds, long maxTtlSeconds, boolean enabled) {
        this.minTtlSeconds = Math.max(0L, minTtlSeconds);
        this.maxTtlSeconds = Math.max(this.minTtlSeconds, maxTtlSeconds);
        this.enabled = enabled;
    }

    public long compute(long baseTtlSeconds, long accessCount, double ageSeconds) {
        if (!enabled) {
            return baseTtlSeconds;
        }
        double accessesPerSecond = accessCount / Math.max(ageSeconds, 1.0);
        double multiplier = Math.min(Math.log(accessesPerSecond + 1.0) + 1.0, MAX_MULTIPLIER);
        long ttl = Math.round(baseTtlSeconds * multiplier);
        return Math.max(minTtlSeconds, Math.min(ttl, maxTtlSeconds));
    }

    public long getMinTtlSeconds() {
        return minTtlSeconds;
    }

    public long getMaxTtlSeconds() {
        return maxTtlSeconds;
    }

    public boolean isEnabled() {
        return enabled;
    }
}
