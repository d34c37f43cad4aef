package io.engram.core.profile;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Folds inferred traits into a profile. A trait of the same type whose description shares more
 * than half of the smaller word set is treated as the same trait: strengths are averaged and the
 * evidence accumulates.
 */
public final class TraitMerger {
    private static final double OVERLAP_THRESHOLD = 0.5;

    private final Clock clock;

    public TraitMerger(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public void merge(ImplicitTrait incoming, UserProfile profile) {
        if (incoming == null || incoming.description().isBlank()) {
            return;
        }
        List<ImplicitTrait> traits = profile.implicitTraits();
        for (int i = 0; i < traits.size(); i++) {
            ImplicitTrait existing = traits.get(i);
            if (similar(existing, incoming)) {
                List<String> evidence = new ArrayList<>(existing.evidence());
                for (String id : incoming.evidence()) {
                    if (!evidence.contains(id)) {
                        evidence.add(id);
                    }
                }
                profile.replaceTrait(i, new ImplicitTrait(
                    existing.traitType(),
                    existing.description(),
                    (existing.strength() + incoming.strength()) / 2,
                    evidence,
                    clock.instant()
                ), clock.instant());
                return;
            }
        }
        profile.addTrait(incoming, clock.instant());
    }

    boolean similar(ImplicitTrait a, ImplicitTrait b) {
        if (!a.traitType().equalsIgnoreCase(b.traitType())) {
            return false;
        }
        Set<String> wordsA = words(a.description());
        Set<String> wordsB = words(b.description());
        if (wordsA.isEmpty() || wordsB.isEmpty()) {
            return false;
        }
        Set<String> shared = new HashSet<>(wordsA);
        shared.retainAll(wordsB);
        return (double) shared.size() / Math.min(wordsA.size(), wordsB.size()) > OVERLAP_THRESHOLD;
    }

    private Set<String> words(String text) {
        Set<String> words = new HashSet<>();
        for (String token : text.toLowerCase(Locale.ROOT).split("\\s+")) {
            if (!token.isBlank()) {
                words.add(token);
            }
        }
        return words;
    }
}
