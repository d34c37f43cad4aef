package io.engram.core.profile;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reconciles newly extracted attribute values with a profile using recency-wins.
 *
 * <p>An absent attribute is inserted. An identical value is a no-op that leaves the stored
 * timestamp alone. A different value is always logged as a conflict; it replaces the stored
 * value unless the stored value is strictly newer. Equal timestamps favour the incoming value.
 */
public final class ConflictResolver {
    private static final Logger LOG = LoggerFactory.getLogger(ConflictResolver.class);

    private final Clock clock;

    public ConflictResolver() {
        this(Clock.systemUTC());
    }

    public ConflictResolver(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public List<ConflictRecord> resolve(List<AttributeObservation> observations, UserProfile profile) {
        Objects.requireNonNull(profile, "profile must not be null");
        if (observations == null || observations.isEmpty()) {
            return List.of();
        }

        List<ConflictRecord> conflicts = new ArrayList<>();
        for (AttributeObservation observation : observations) {
            if (observation.name().isBlank()) {
                continue;
            }
            ProfileAttribute current = profile.attribute(observation.name()).orElse(null);
            if (current == null) {
                profile.putAttribute(observation.toAttribute(), clock.instant());
                continue;
            }
            if (current.value().equals(observation.value())) {
                continue;
            }

            boolean applied = !observation.timestamp().isBefore(current.timestamp());
            ConflictRecord record = new ConflictRecord(
                UUID.randomUUID().toString(),
                observation.name(),
                current.value(),
                observation.value(),
                current.timestamp(),
                observation.timestamp(),
                current.sourceUnitId(),
                observation.sourceUnitId(),
                ResolutionStrategy.RECENCY,
                applied,
                clock.instant()
            );
            profile.appendConflict(record);
            if (applied) {
                profile.putAttribute(observation.toAttribute(), clock.instant());
            }
            conflicts.add(record);
            LOG.info(
                "Profile {} attribute '{}' conflict: '{}' -> '{}' ({})",
                profile.userId(),
                observation.name(),
                current.value(),
                observation.value(),
                applied ? "applied" : "retained older-dated value"
            );
        }
        return conflicts;
    }
}
