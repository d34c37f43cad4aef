package io.engram.core.index;

/**
 * Creates the per-user index pair a memory space searches.
 */
public interface IndexFactory {
    VectorIndex vectorIndex(String userId);

    LexicalIndex lexicalIndex(String userId);

    static IndexFactory inMemory() {
        return new IndexFactory() {
            @Override
            public VectorIndex vectorIndex(String userId) {
                return new InMemoryVectorIndex();
            }

            @Override
            public LexicalIndex lexicalIndex(String userId) {
                return new Bm25LexicalIndex();
            }
        };
    }
}
