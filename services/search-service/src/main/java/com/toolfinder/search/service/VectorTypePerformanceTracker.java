package com.toolfinder.search.service;

import com.toolfinder.search.model.VectorTypeMetrics;
import com.toolfinder.search.model.VectorTypeStatus;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Exponentially smoothed latency, result count and score per vector type.
 */
@Component
public class VectorTypePerformanceTracker {
    private final double alpha;
    private final ConcurrentHashMap<String, VectorTypePerformance> byType = new ConcurrentHashMap<>();

    public VectorTypePerformanceTracker(MultiVectorSearchProperties properties) {
        double configured = properties.getPerformanceSmoothing();
        this.alpha = configured > 0 && configured <= 1 ? configured : 0.3;
    }

    public void record(VectorTypeMetrics metrics) {
        if (metrics == null || metrics.getVectorType() == null) {
            return;
        }
        byType.compute(metrics.getVectorType(), (type, previous) -> next(type, previous, metrics));
    }

    public Map<String, VectorTypePerformance> snapshot() {
        return new LinkedHashMap<>(new TreeMap<>(byType));
    }

    public void reset() {
        byType.clear();
    }

    private VectorTypePerformance next(String type, VectorTypePerformance previous, VectorTypeMetrics metrics) {
        long errors = metrics.getStatus() == VectorTypeStatus.ERROR || metrics.getStatus() == VectorTypeStatus.CIRCUIT_OPEN ? 1 : 0;
        long timeouts = metrics.getStatus() == VectorTypeStatus.TIMEOUT ? 1 : 0;
        if (previous == null) {
            return new VectorTypePerformance(
                type,
                1,
                errors,
                timeouts,
                metrics.getLatencyMs(),
                metrics.getResultCount(),
                metrics.getAverageScore()
            );
        }
        return new VectorTypePerformance(
            type,
            previous.getSearches() + 1,
            previous.getErrors() + errors,
            previous.getTimeouts() + timeouts,
            smooth(previous.getAverageLatencyMs(), metrics.getLatencyMs()),
            smooth(previous.getAverageResultCount(), metrics.getResultCount()),
            smooth(previous.getAverageScore(), metrics.getAverageScore())
        );
    }

    private double smooth(double previous, double current) {
        return alpha * current + (1 - alpha) * previous;
    }
}
