package io.engram.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EngramConfig(
    String workspace,
    MemoryConfig memory,
    EmbeddingConfig embedding,
    GenerationConfig generation,
    ProvidersConfig providers
) {

    public static EngramConfig defaults() {
        return new EngramConfig(
            "~/.engram/workspace",
            MemoryConfig.defaults(),
            EmbeddingConfig.defaults(),
            GenerationConfig.defaults(),
            ProvidersConfig.defaults()
        );
    }
}
