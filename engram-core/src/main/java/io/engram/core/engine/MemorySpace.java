package io.engram.core.engine;

import io.engram.core.cluster.ThematicCluster;
import io.engram.core.index.IndexFactory;
import io.engram.core.index.LexicalIndex;
import io.engram.core.index.VectorIndex;
import io.engram.core.memory.MemoryUnit;
import io.engram.core.profile.UserProfile;
import io.engram.core.store.MemorySpaceSnapshot;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * A single user's memory: profile, clusters, units and the index pair over those units.
 * All mutation and every consistent read happens while holding {@link #lock}, so ingestion for
 * one user is serialized while different users proceed independently.
 */
final class MemorySpace {
    private final String userId;
    private final ReentrantLock lock = new ReentrantLock();
    private final UserProfile profile;
    private final List<ThematicCluster> clusters;
    private final Map<String, MemoryUnit> units;
    private final VectorIndex vectorIndex;
    private final LexicalIndex lexicalIndex;

    private MemorySpace(
        String userId,
        UserProfile profile,
        List<ThematicCluster> clusters,
        List<MemoryUnit> units,
        VectorIndex vectorIndex,
        LexicalIndex lexicalIndex
    ) {
        this.userId = Objects.requireNonNull(userId, "userId must not be null");
        this.profile = profile;
        this.clusters = new ArrayList<>(clusters);
        this.units = new LinkedHashMap<>();
        this.vectorIndex = vectorIndex;
        this.lexicalIndex = lexicalIndex;
        for (MemoryUnit unit : units) {
            add(unit);
        }
    }

    static MemorySpace empty(String userId, IndexFactory indexes) {
        return new MemorySpace(
            userId,
            UserProfile.create(userId),
            List.of(),
            List.of(),
            indexes.vectorIndex(userId),
            indexes.lexicalIndex(userId)
        );
    }

    static MemorySpace restore(MemorySpaceSnapshot snapshot, IndexFactory indexes) {
        return new MemorySpace(
            snapshot.userId(),
            snapshot.profile(),
            snapshot.clusters(),
            snapshot.units(),
            indexes.vectorIndex(snapshot.userId()),
            indexes.lexicalIndex(snapshot.userId())
        );
    }

    <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    String userId() {
        return userId;
    }

    UserProfile profile() {
        return profile;
    }

    List<ThematicCluster> clusters() {
        return clusters;
    }

    VectorIndex vectorIndex() {
        return vectorIndex;
    }

    LexicalIndex lexicalIndex() {
        return lexicalIndex;
    }

    void add(MemoryUnit unit) {
        units.put(unit.id(), unit);
        vectorIndex.upsert(unit.id(), unit.embedding(), payload(unit));
        lexicalIndex.index(unit.id(), unit.lexicalText());
    }

    int unitCount() {
        return units.size();
    }

    /**
     * Copies taken under the lock; safe to search after the lock is released.
     */
    View view() {
        Map<String, ThematicCluster> clusterCopies = new LinkedHashMap<>();
        for (ThematicCluster cluster : clusters) {
            clusterCopies.put(cluster.id(), cluster.copy());
        }
        return new View(Map.copyOf(units), profile.copy(), clusterCopies);
    }

    MemorySpaceSnapshot snapshot(Instant savedAt) {
        List<ThematicCluster> clusterCopies = clusters.stream().map(ThematicCluster::copy).toList();
        return new MemorySpaceSnapshot(userId, profile.copy(), clusterCopies, new ArrayList<>(units.values()), savedAt);
    }

    private Map<String, String> payload(MemoryUnit unit) {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("conversationId", unit.conversationId());
        payload.put("createdAt", unit.createdAt().toString());
        if (unit.clusterId() != null) {
            payload.put("clusterId", unit.clusterId());
        }
        return payload;
    }

    record View(Map<String, MemoryUnit> units, UserProfile profile, Map<String, ThematicCluster> clusters) {
    }
}
