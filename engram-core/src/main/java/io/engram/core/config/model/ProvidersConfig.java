package io.engram.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProvidersConfig(
    ProviderConfig openrouter,
    ProviderConfig openai
) {

    public static ProvidersConfig defaults() {
        return new ProvidersConfig(ProviderConfig.defaults(), ProviderConfig.defaults());
    }
}
