package com.toolfinder.search.embed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class AdaptiveTtlPolicyTest {
    private final AdaptiveTtlPolicy policy = new AdaptiveTtlPolicy(300, 7200, true);

    @Test
    void ttlGrowsWithAccessRate() {
        long previous = 0;
        for (long accesses = 0; accesses <= 200; accesses += 10) {
            long ttl = policy.compute(3600, accesses, 100.0);
            assertThat(ttl).isGreaterThanOrEqualTo(previous);
            previous = ttl;
        }
    }

    @Test
    void ttlStaysWithinBounds() {
        assertEquals(300, policy.compute(60, 0, 1000.0));
        assertEquals(7200, policy.compute(3600, 10_000, 1.0));
        assertEquals(3600, policy.compute(3600, 0, 1000.0));
    }

    @Test
    void disabledPolicyKeepsBaseTtl() {
        AdaptiveTtlPolicy disabled = new AdaptiveTtlPolicy(300, 7200, false);

        assertEquals(3600, disabled.compute(3600, 10_000, 1.0));
    }
}
