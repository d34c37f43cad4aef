package io.engram.core.memory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Locale;
import java.util.Objects;

/**
 * An explicit profile attribute asserted by a conversation, e.g. {@code diet = pescatarian}.
 * {@code statement} is the atomic fact the claim was read from, when there is one.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AttributeClaim(String name, String value, String statement, double confidence) {

    public AttributeClaim {
        Objects.requireNonNull(name, "name must not be null");
        name = name.trim().toLowerCase(Locale.ROOT);
        value = value == null ? "" : value.trim();
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }
}
