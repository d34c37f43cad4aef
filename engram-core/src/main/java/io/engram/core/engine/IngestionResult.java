package io.engram.core.engine;

import io.engram.core.profile.ConflictRecord;
import java.util.List;

/**
 * Outcome of ingesting one conversation. A failed result means nothing was written for it.
 *
 * @param persisted false when the in-memory update succeeded but writing it to the store did not
 */
public record IngestionResult(
    String userId,
    String conversationId,
    boolean succeeded,
    String failureReason,
    List<String> unitIds,
    List<String> clusterIds,
    int clustersCreated,
    List<ConflictRecord> conflicts,
    boolean persisted
) {

    public IngestionResult {
        failureReason = failureReason == null ? "" : failureReason;
        unitIds = unitIds == null ? List.of() : List.copyOf(unitIds);
        clusterIds = clusterIds == null ? List.of() : List.copyOf(clusterIds);
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }

    public static IngestionResult failed(String userId, String conversationId, String reason) {
        return new IngestionResult(userId, conversationId, false, reason, List.of(), List.of(), 0, List.of(), false);
    }

    public String describe() {
        if (!succeeded) {
            return "no memory units created: " + failureReason;
        }
        if (unitIds.isEmpty()) {
            return "no memory units created: nothing to remember";
        }
        return unitIds.size() + " memory unit(s), " + clustersCreated + " new cluster(s), " + conflicts.size() + " conflict(s)";
    }
}
