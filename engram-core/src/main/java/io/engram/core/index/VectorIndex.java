package io.engram.core.index;

import java.util.List;
import java.util.Map;

/**
 * Nearest-neighbour search by cosine similarity. Implementations may be eventually consistent:
 * a just-upserted item is not guaranteed to appear in the next search.
 *
 * @throws io.engram.core.error.IndexUnavailableException from {@link #search} when the backing
 *     store cannot be reached
 */
public interface VectorIndex {
    void upsert(String id, List<Double> vector, Map<String, String> payload);

    List<ScoredId> search(List<Double> vector, int topK);

    int size();
}
