package io.engram.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GenerationConfig(
    String provider,
    String model,
    String extraction,
    @JsonAlias({"max_attempts"}) int maxAttempts
) {

    public static GenerationConfig defaults() {
        return new GenerationConfig("offline", "openai/gpt-4o-mini", "heuristic", 3);
    }
}
