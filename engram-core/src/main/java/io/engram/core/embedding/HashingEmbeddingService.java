package io.engram.core.embedding;

import io.engram.core.index.Tokenizer;
import java.util.ArrayList;
import java.util.List;

/**
 * Offline feature-hashing embedding: each token increments one bucket, the vector is L2-normalized.
 */
public final class HashingEmbeddingService implements EmbeddingService {
    public static final int DEFAULT_DIMENSION = 256;

    private final int dimension;

    public HashingEmbeddingService() {
        this(DEFAULT_DIMENSION);
    }

    public HashingEmbeddingService(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
    }

    @Override
    public List<Double> embed(String text) {
        double[] vector = new double[dimension];
        for (String token : Tokenizer.tokenize(text)) {
            vector[Math.floorMod(token.hashCode(), dimension)] += 1.0;
        }

        double norm = 0.0;
        for (double value : vector) {
            norm += value * value;
        }
        norm = Math.sqrt(norm);

        List<Double> embedding = new ArrayList<>(dimension);
        for (double value : vector) {
            embedding.add(norm == 0.0 ? 0.0 : value / norm);
        }
        return embedding;
    }

    @Override
    public int dimension() {
        return dimension;
    }
}
