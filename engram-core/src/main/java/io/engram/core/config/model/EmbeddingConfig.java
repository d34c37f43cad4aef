package io.engram.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EmbeddingConfig(
    String provider,
    String model,
    int dimension,
    @JsonAlias({"max_attempts"}) int maxAttempts
) {

    public static EmbeddingConfig defaults() {
        return new EmbeddingConfig("hashing", "text-embedding-3-small", 256, 3);
    }
}
