package io.engram.core.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.engram.core.cluster.ThematicCluster;
import io.engram.core.memory.MemoryUnit;
import io.engram.core.profile.UserProfile;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Everything persisted for one user. Indexes are not stored; they are rebuilt from the units.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MemorySpaceSnapshot(
    String userId,
    UserProfile profile,
    List<ThematicCluster> clusters,
    List<MemoryUnit> units,
    Instant savedAt
) {

    public MemorySpaceSnapshot {
        Objects.requireNonNull(userId, "userId must not be null");
        profile = profile == null ? UserProfile.create(userId) : profile;
        clusters = clusters == null ? List.of() : List.copyOf(clusters);
        units = units == null ? List.of() : List.copyOf(units);
    }
}
