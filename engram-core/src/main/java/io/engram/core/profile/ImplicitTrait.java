package io.engram.core.profile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ImplicitTrait(String traitType, String description, double strength, List<String> evidence, Instant lastUpdated) {

    public ImplicitTrait {
        traitType = traitType == null || traitType.isBlank() ? "preference" : traitType.trim();
        description = description == null ? "" : description.trim();
        strength = Math.max(0.0, Math.min(1.0, strength));
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
