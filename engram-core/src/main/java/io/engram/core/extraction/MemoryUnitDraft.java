package io.engram.core.extraction;

import io.engram.core.memory.AttributeClaim;
import java.time.Instant;
import java.util.List;

/**
 * Extraction output for one conversation segment, before it is embedded and clustered.
 *
 * @param observedAt when the segment was said, if the turns carried timestamps
 */
public record MemoryUnitDraft(
    String narrative,
    List<String> atomicFacts,
    List<ForesightCandidate> foresightCandidates,
    List<AttributeClaim> attributes,
    List<TraitClaim> traits,
    List<String> tags,
    Instant observedAt
) {

    public MemoryUnitDraft {
        narrative = narrative == null ? "" : narrative.trim();
        atomicFacts = atomicFacts == null ? List.of() : List.copyOf(atomicFacts);
        foresightCandidates = foresightCandidates == null ? List.of() : List.copyOf(foresightCandidates);
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
        traits = traits == null ? List.of() : List.copyOf(traits);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public boolean isEmpty() {
        return narrative.isBlank() && atomicFacts.isEmpty() && foresightCandidates.isEmpty();
    }
}
