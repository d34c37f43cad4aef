package io.engram.core.profile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

/**
 * Audit entry for a contradiction between a stored attribute value and an incoming one.
 * {@code applied} tells whether the incoming value replaced the stored one.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConflictRecord(
    String id,
    String attributeName,
    String oldValue,
    String newValue,
    Instant oldTimestamp,
    Instant newTimestamp,
    String oldSourceUnitId,
    String newSourceUnitId,
    ResolutionStrategy resolutionStrategy,
    boolean applied,
    Instant detectedAt
) {

    public String liveValue() {
        return applied ? newValue : oldValue;
    }
}
