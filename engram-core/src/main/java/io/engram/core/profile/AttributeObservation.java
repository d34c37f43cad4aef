package io.engram.core.profile;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * A newly extracted attribute value waiting to be reconciled with the profile.
 */
public record AttributeObservation(String name, String value, Instant timestamp, String sourceUnitId, double confidence) {

    public AttributeObservation {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        name = name.trim().toLowerCase(Locale.ROOT);
        value = value == null ? "" : value.trim();
        sourceUnitId = sourceUnitId == null ? "" : sourceUnitId;
    }

    public AttributeObservation(String name, String value, Instant timestamp, String sourceUnitId) {
        this(name, value, timestamp, sourceUnitId, 1.0);
    }

    ProfileAttribute toAttribute() {
        return new ProfileAttribute(name, value, timestamp, sourceUnitId, confidence);
    }
}
