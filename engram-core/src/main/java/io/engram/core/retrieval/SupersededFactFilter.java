package io.engram.core.retrieval;

import io.engram.core.memory.AttributeClaim;
import io.engram.core.memory.MemoryUnit;
import io.engram.core.profile.ProfileAttribute;
import io.engram.core.profile.UserProfile;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Hides claims whose value no longer matches the live profile, so a query about the present only
 * sees the value that won conflict resolution.
 *
 * <p>The atomic facts stating a replaced value are removed. The unit's narrative retells the
 * conversation as it was, replaced value included, so it is dropped as well and the unit is
 * rendered from its remaining facts and foresights.
 */
public final class SupersededFactFilter {

    public List<MemoryUnit> apply(List<MemoryUnit> candidates, UserProfile profile) {
        List<MemoryUnit> result = new ArrayList<>(candidates.size());
        for (MemoryUnit unit : candidates) {
            boolean superseded = false;
            Set<String> stale = new HashSet<>();
            for (AttributeClaim claim : unit.attributes()) {
                Optional<ProfileAttribute> live = profile.attribute(claim.name());
                if (live.isPresent() && !live.get().value().equals(claim.value())) {
                    superseded = true;
                    if (claim.statement() != null) {
                        stale.add(claim.statement());
                    }
                }
            }
            if (!superseded) {
                result.add(unit);
                continue;
            }
            List<String> kept = unit.atomicFacts().stream().filter(fact -> !stale.contains(fact)).toList();
            result.add(unit.withAtomicFacts(kept).withNarrative(""));
        }
        return result;
    }
}
