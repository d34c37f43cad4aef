package io.engram.core.index;

import java.util.List;

/**
 * Term-frequency ranking over short texts. Only documents sharing at least one query term are returned.
 */
public interface LexicalIndex {
    void index(String id, String text);

    List<ScoredId> search(String text, int topK);

    int size();
}
