package io.engram.core.retrieval;

import io.engram.core.embedding.EmbeddingService;
import io.engram.core.error.IndexUnavailableException;
import io.engram.core.error.MemoryException;
import io.engram.core.index.LexicalIndex;
import io.engram.core.index.ScoredId;
import io.engram.core.index.VectorIndex;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the dense and sparse searches for one query concurrently and fuses the two rankings.
 * A failure of either side fails the whole search; there is no single-modality fallback.
 */
public final class HybridSearch {
    private static final Logger LOG = LoggerFactory.getLogger(HybridSearch.class);

    private final EmbeddingService embeddings;
    private final RankFusion fusion;
    private final Executor executor;
    private final int topK;

    public HybridSearch(EmbeddingService embeddings, RankFusion fusion, Executor executor, int topK) {
        this.embeddings = Objects.requireNonNull(embeddings, "embeddings must not be null");
        this.fusion = Objects.requireNonNull(fusion, "fusion must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.topK = Math.max(1, topK);
    }

    public List<FusedCandidate> search(String query, VectorIndex vectorIndex, LexicalIndex lexicalIndex) {
        CompletableFuture<List<String>> dense = CompletableFuture.supplyAsync(
            () -> ids(vectorIndex.search(embeddings.embed(query), topK)), executor);
        CompletableFuture<List<String>> sparse = CompletableFuture.supplyAsync(
            () -> ids(lexicalIndex.search(query, topK)), executor);

        try {
            CompletableFuture.allOf(dense, sparse).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof MemoryException memoryException) {
                throw memoryException;
            }
            throw new IndexUnavailableException("Search failed for query '" + query + "': " + cause.getMessage(), cause);
        }

        List<String> denseIds = dense.join();
        List<String> sparseIds = sparse.join();
        List<FusedCandidate> fused = fusion.fuse(denseIds, sparseIds);
        LOG.debug("Query '{}': {} dense, {} sparse, {} fused", query, denseIds.size(), sparseIds.size(), fused.size());
        return fused;
    }

    private List<String> ids(List<ScoredId> scored) {
        return scored.stream().map(ScoredId::id).toList();
    }
}
