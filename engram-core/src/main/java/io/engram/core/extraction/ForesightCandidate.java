package io.engram.core.extraction;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.LocalDate;

/**
 * A foresight as extracted, before its validity window is pinned to absolute instants.
 *
 * @param durationHint free text such as {@code "10 days"}, {@code "next month"}, {@code "ongoing"}
 * @param startOffsetDays days between the conversation and the start of the window
 * @param expiryDate explicit last valid day when the conversation names one
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ForesightCandidate(
    String content,
    String durationHint,
    int startOffsetDays,
    LocalDate expiryDate,
    double confidence
) {

    public ForesightCandidate {
        content = content == null ? "" : content.trim();
        durationHint = durationHint == null ? "" : durationHint.trim();
        startOffsetDays = Math.max(0, startOffsetDays);
        confidence = confidence <= 0 ? 0.8 : Math.min(1.0, confidence);
    }

    public static ForesightCandidate of(String content, String durationHint) {
        return new ForesightCandidate(content, durationHint, 0, null, 0.8);
    }
}
