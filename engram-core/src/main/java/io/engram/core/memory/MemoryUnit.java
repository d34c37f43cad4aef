package io.engram.core.memory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Structured record derived from one topical conversation segment.
 * Immutable apart from the cluster reference, which the clustering engine assigns exactly once.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MemoryUnit(
    String id,
    String conversationId,
    String narrative,
    List<String> atomicFacts,
    List<Foresight> foresights,
    List<AttributeClaim> attributes,
    List<String> tags,
    Instant createdAt,
    String clusterId,
    List<Double> embedding
) {

    public MemoryUnit {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        conversationId = conversationId == null ? "" : conversationId;
        narrative = narrative == null ? "" : narrative;
        atomicFacts = atomicFacts == null ? List.of() : List.copyOf(atomicFacts);
        foresights = foresights == null ? List.of() : List.copyOf(foresights);
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
        tags = tags == null ? List.of() : List.copyOf(tags);
        embedding = embedding == null ? List.of() : List.copyOf(embedding);
    }

    public MemoryUnit withClusterId(String assignedClusterId) {
        Objects.requireNonNull(assignedClusterId, "assignedClusterId must not be null");
        if (clusterId != null) {
            throw new IllegalStateException("memory unit " + id + " already belongs to cluster " + clusterId);
        }
        return new MemoryUnit(id, conversationId, narrative, atomicFacts, foresights, attributes, tags, createdAt, assignedClusterId, embedding);
    }

    public MemoryUnit withAtomicFacts(List<String> facts) {
        return new MemoryUnit(id, conversationId, narrative, facts, foresights, attributes, tags, createdAt, clusterId, embedding);
    }

    public MemoryUnit withNarrative(String text) {
        return new MemoryUnit(id, conversationId, text, atomicFacts, foresights, attributes, tags, createdAt, clusterId, embedding);
    }

    public MemoryUnit withForesights(List<Foresight> retained) {
        return new MemoryUnit(id, conversationId, narrative, atomicFacts, retained, attributes, tags, createdAt, clusterId, embedding);
    }

    /**
     * Text fed to the embedding service: narrative, facts and foresight contents.
     */
    public String searchableText() {
        List<String> parts = new ArrayList<>();
        parts.add(narrative);
        parts.addAll(atomicFacts);
        for (Foresight foresight : foresights) {
            parts.add(foresight.content());
        }
        return String.join(" ", parts).trim();
    }

    /**
     * Text handed to the lexical index. Falls back to the narrative when no facts were extracted.
     */
    public String lexicalText() {
        if (atomicFacts.isEmpty()) {
            return narrative;
        }
        return String.join(" ", atomicFacts);
    }
}
