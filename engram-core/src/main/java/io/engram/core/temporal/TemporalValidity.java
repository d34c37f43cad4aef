package io.engram.core.temporal;

import io.engram.core.memory.Foresight;
import java.time.Instant;
import java.util.Objects;

public final class TemporalValidity {

    private TemporalValidity() {
    }

    /**
     * Both window bounds are inclusive: a foresight is valid at its start instant and at its last valid instant.
     */
    public static boolean isValid(Foresight foresight, Instant reference) {
        Objects.requireNonNull(foresight, "foresight must not be null");
        Objects.requireNonNull(reference, "reference must not be null");
        if (reference.isBefore(foresight.start())) {
            return false;
        }
        return foresight.end() == null || !reference.isAfter(foresight.end());
    }
}
