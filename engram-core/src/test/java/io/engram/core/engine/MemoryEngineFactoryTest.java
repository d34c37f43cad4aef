package io.engram.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.engram.core.config.model.EmbeddingConfig;
import io.engram.core.config.model.EngramConfig;
import io.engram.core.config.model.GenerationConfig;
import io.engram.core.config.model.ProviderConfig;
import io.engram.core.config.model.ProvidersConfig;
import io.engram.core.embedding.HashingEmbeddingService;
import io.engram.core.embedding.OpenAiEmbeddingService;
import io.engram.core.extraction.HeuristicExtractionService;
import io.engram.core.extraction.LlmExtractionService;
import io.engram.core.generation.LlmGenerationService;
import io.engram.core.generation.OfflineGenerationService;
import io.engram.core.model.ChatMessage;
import io.engram.core.provider.LlmResponse;
import io.engram.core.provider.ProviderRegistry;
import io.engram.core.store.EphemeralMemorySpaceStore;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MemoryEngineFactoryTest {

    @Test
    void defaultsShouldRunWithoutAnyProvider() {
        EngramConfig config = EngramConfig.defaults();
        ProviderRegistry providers = MemoryEngineFactory.providers(config);

        assertThat(MemoryEngineFactory.embeddings(config.embedding(), config.providers().openai()))
            .isInstanceOf(HashingEmbeddingService.class);
        assertThat(MemoryEngineFactory.extraction(config.generation(), providers)).isInstanceOf(HeuristicExtractionService.class);
        assertThat(MemoryEngineFactory.generation(config.generation(), providers)).isInstanceOf(OfflineGenerationService.class);

        try (MemoryEngine engine = MemoryEngineFactory.create(config, new EphemeralMemorySpaceStore(), Clock.systemUTC())) {
            assertThat(engine.ingestTranscript("zoe", "c1", "user: I am vegan", null).succeeded()).isTrue();
        }
    }

    @Test
    void unconfiguredProvidersShouldAnswerWithErrors() {
        ProviderRegistry providers = MemoryEngineFactory.providers(EngramConfig.defaults());

        LlmResponse response = providers.find("openrouter").orElseThrow().chat("m", List.of(ChatMessage.user("hi")));

        assertThat(response.failed()).isTrue();
        assertThat(response.content()).contains("missing API key");
    }

    @Test
    void llmModesShouldUseRegisteredProviders() {
        EngramConfig config = configWith(new GenerationConfig("openai", "gpt-4o-mini", "llm", 2));
        ProviderRegistry providers = MemoryEngineFactory.providers(config);

        assertThat(MemoryEngineFactory.extraction(config.generation(), providers)).isInstanceOf(LlmExtractionService.class);
        assertThat(MemoryEngineFactory.generation(config.generation(), providers)).isInstanceOf(LlmGenerationService.class);
        assertThat(MemoryEngineFactory.embeddings(new EmbeddingConfig("openai", "text-embedding-3-small", 256, 3), config.providers().openai()))
            .isInstanceOf(OpenAiEmbeddingService.class);
    }

    @Test
    void unknownOrInconsistentChoicesShouldBeRejected() {
        EngramConfig defaults = EngramConfig.defaults();
        ProviderRegistry providers = MemoryEngineFactory.providers(defaults);

        assertThatThrownBy(() -> MemoryEngineFactory.generation(new GenerationConfig("anthropic", "m", "heuristic", 1), providers))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("anthropic");
        assertThatThrownBy(() -> MemoryEngineFactory.extraction(new GenerationConfig("offline", "m", "llm", 1), providers))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MemoryEngineFactory.embeddings(new EmbeddingConfig("word2vec", "m", 10, 1), null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static EngramConfig configWith(GenerationConfig generation) {
        EngramConfig defaults = EngramConfig.defaults();
        return new EngramConfig(
            defaults.workspace(),
            defaults.memory(),
            defaults.embedding(),
            generation,
            new ProvidersConfig(ProviderConfig.defaults(), new ProviderConfig("sk-test", null, Map.of()))
        );
    }
}
