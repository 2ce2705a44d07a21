package com.toolfinder.search.retrieval;

import com.toolfinder.search.model.ScoredItem;
import com.toolfinder.search.model.VectorTypeStatus;
import java.util.Collections;
import java.util.List;

public class RetrievalStageResult {
    private final String vectorType;
    private final List<ScoredItem> items;
    private final VectorTypeStatus status;
    private final long tookMs;
    private final String errorMessage;

    private RetrievalStageResult(
        String vectorType,
        List<ScoredItem> items,
        VectorTypeStatus status,
        long tookMs,
        String errorMessage
    ) {
        this.vectorType = vectorType;
        this.items = items == null ? List.of() : Collections.unmodifiableList(items);
        this.status = status;
        this.tookMs = tookMs;
        this.errorMessage = errorMessage;
    }

    public static RetrievalStageResult success(String vectorType, List<ScoredItem> items, long tookMs) {
        return new RetrievalStageResult(vectorType, items, VectorTypeStatus.OK, tookMs, null);
    }

    public static RetrievalStageResult error(String vectorType, String message, long tookMs) {
        return new RetrievalStageResult(vectorType, List.of(), VectorTypeStatus.ERROR, tookMs, message);
    }

    public static RetrievalStageResult timedOut(String vectorType, long tookMs) {
        return new RetrievalStageResult(vectorType, List.of(), VectorTypeStatus.TIMEOUT, tookMs, "timeout");
    }

    public static RetrievalStageResult circuitOpen(String vectorType) {
        return new RetrievalStageResult(vectorType, List.of(), VectorTypeStatus.CIRCUIT_OPEN, 0L, "vector_circuit_open");
    }

    public String getVectorType() {
        return vectorType;
    }

    public List<ScoredItem> getItems() {
        return items;
    }

    public VectorTypeStatus getStatus() {
        return status;
    }

    public boolean isError() {
        return status != VectorTypeStatus.OK;
    }

    public boolean isTimedOut() {
        return status == VectorTypeStatus.TIMEOUT;
    }

    public boolean isSkipped() {
        return status == VectorTypeStatus.CIRCUIT_OPEN;
    }

    public long getTookMs() {
        return tookMs;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public double averageScore() {
        if (items.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (ScoredItem item : items) {
            total += item.getScore();
        }
        return total / items.size();
    }
}
