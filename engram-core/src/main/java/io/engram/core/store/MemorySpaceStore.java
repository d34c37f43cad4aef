package io.engram.core.store;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface MemorySpaceStore {
    Optional<MemorySpaceSnapshot> load(String userId) throws IOException;

    void save(MemorySpaceSnapshot snapshot) throws IOException;

    List<String> userIds() throws IOException;
}
