package io.engram.core.store;

import java.util.List;
import java.util.Optional;

/**
 * Store that keeps nothing; memory lives only as long as the process.
 */
public final class EphemeralMemorySpaceStore implements MemorySpaceStore {

    @Override
    public Optional<MemorySpaceSnapshot> load(String userId) {
        return Optional.empty();
    }

    @Override
    public void save(MemorySpaceSnapshot snapshot) {
        // nothing to keep
    }

    @Override
    public List<String> userIds() {
        return List.of();
    }
}
