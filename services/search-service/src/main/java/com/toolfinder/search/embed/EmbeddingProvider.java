package com.toolfinder.search.embed;

import java.util.List;

/**
 * External model call turning text into a vector. Failures surface as {@link EmbeddingUnavailableException}.
 */
public interface EmbeddingProvider {
    List<Double> embed(String text, Integer timeBudgetMs);
}
