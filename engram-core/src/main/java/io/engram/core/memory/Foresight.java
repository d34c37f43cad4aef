package io.engram.core.memory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A forward-looking statement that only holds inside a validity window.
 * A {@code null} end means the foresight is valid indefinitely once started.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Foresight(String id, String content, Instant start, Instant end, double confidence) {

    public Foresight {
        Objects.requireNonNull(start, "start must not be null");
        if (end != null && end.isBefore(start)) {
            throw new IllegalArgumentException("foresight end " + end + " precedes start " + start);
        }
        id = id == null || id.isBlank() ? UUID.randomUUID().toString() : id;
        content = content == null ? "" : content.trim();
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public static Foresight of(String content, Instant start, Instant end, double confidence) {
        return new Foresight(null, content, start, end, confidence);
    }
}
