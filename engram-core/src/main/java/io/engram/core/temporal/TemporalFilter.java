package io.engram.core.temporal;

import io.engram.core.memory.Foresight;
import io.engram.core.memory.MemoryUnit;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Drops expired foresights from ranked candidates. Atomic facts never expire, so a unit survives
 * as long as it keeps at least one fact or one valid foresight. Input order is preserved.
 */
public final class TemporalFilter {

    public List<MemoryUnit> apply(List<MemoryUnit> candidates, Instant reference) {
        Objects.requireNonNull(reference, "reference must not be null");
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        List<MemoryUnit> retained = new ArrayList<>(candidates.size());
        for (MemoryUnit unit : candidates) {
            List<Foresight> valid = unit.foresights().stream()
                .filter(foresight -> TemporalValidity.isValid(foresight, reference))
                .toList();
            if (unit.atomicFacts().isEmpty() && valid.isEmpty()) {
                continue;
            }
            retained.add(valid.size() == unit.foresights().size() ? unit : unit.withForesights(valid));
        }
        return retained;
    }
}
