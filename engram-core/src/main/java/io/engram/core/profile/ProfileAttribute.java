package io.engram.core.profile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProfileAttribute(String name, String value, Instant timestamp, String sourceUnitId, double confidence) {

    public ProfileAttribute {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        value = value == null ? "" : value;
        sourceUnitId = sourceUnitId == null ? "" : sourceUnitId;
    }
}
