package io.engram.core.extraction;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * One utterance of a conversation. {@code timestamp} is null when the transcript carries none.
 */
public record DialogueTurn(String speaker, String text, Instant timestamp) {

    public DialogueTurn {
        Objects.requireNonNull(speaker, "speaker must not be null");
        speaker = speaker.trim();
        text = text == null ? "" : text.trim();
    }

    public static DialogueTurn of(String speaker, String text) {
        return new DialogueTurn(speaker, text, null);
    }

    public boolean fromUser() {
        String normalized = speaker.toLowerCase(Locale.ROOT);
        return normalized.equals("user") || normalized.equals("human") || normalized.equals("me");
    }
}
