package io.engram.core.engine;

import io.engram.core.error.MemoryException;
import io.engram.core.index.IndexFactory;
import io.engram.core.store.MemorySpaceStore;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out one {@link MemorySpace} per user id, loading persisted state on first use.
 */
final class MemorySpaceRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(MemorySpaceRegistry.class);

    private final Map<String, MemorySpace> spaces = new ConcurrentHashMap<>();
    private final MemorySpaceStore store;
    private final IndexFactory indexes;

    MemorySpaceRegistry(MemorySpaceStore store, IndexFactory indexes) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.indexes = Objects.requireNonNull(indexes, "indexes must not be null");
    }

    MemorySpace space(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        return spaces.computeIfAbsent(userId, this::open);
    }

    List<String> userIds() {
        TreeSet<String> ids = new TreeSet<>(spaces.keySet());
        try {
            ids.addAll(store.userIds());
        } catch (IOException e) {
            LOG.warn("Could not list stored memory spaces: {}", e.getMessage());
        }
        return List.copyOf(ids);
    }

    private MemorySpace open(String userId) {
        try {
            return store.load(userId)
                .map(snapshot -> {
                    LOG.info("Loaded memory space {} ({} units, {} clusters)", userId, snapshot.units().size(), snapshot.clusters().size());
                    return MemorySpace.restore(snapshot, indexes);
                })
                .orElseGet(() -> MemorySpace.empty(userId, indexes));
        } catch (IOException e) {
            throw new MemoryException("Failed to load memory space for " + userId, e);
        }
    }
}
