package io.engram.core.embedding;

import java.util.List;

/**
 * Maps text to a vector of {@link #dimension()} components. Identical input yields an identical
 * vector within one process.
 *
 * @throws io.engram.core.error.EmbeddingException from {@link #embed} when no vector can be produced
 */
public interface EmbeddingService {
    List<Double> embed(String text);

    int dimension();
}
