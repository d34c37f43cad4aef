package io.engram.core.engine;

import io.engram.core.config.ConfigPaths;
import io.engram.core.config.model.EmbeddingConfig;
import io.engram.core.config.model.EngramConfig;
import io.engram.core.config.model.GenerationConfig;
import io.engram.core.config.model.ProviderConfig;
import io.engram.core.embedding.EmbeddingService;
import io.engram.core.embedding.HashingEmbeddingService;
import io.engram.core.embedding.OpenAiEmbeddingService;
import io.engram.core.extraction.ExtractionService;
import io.engram.core.extraction.HeuristicExtractionService;
import io.engram.core.extraction.LlmExtractionService;
import io.engram.core.generation.GenerationService;
import io.engram.core.generation.LlmGenerationService;
import io.engram.core.generation.OfflineGenerationService;
import io.engram.core.index.IndexFactory;
import io.engram.core.provider.DisabledProvider;
import io.engram.core.provider.FallbackLlmProvider;
import io.engram.core.provider.LlmProvider;
import io.engram.core.provider.OpenAiCompatProvider;
import io.engram.core.provider.ProviderRegistry;
import io.engram.core.store.FileMemorySpaceStore;
import io.engram.core.store.MemorySpaceStore;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Locale;

/**
 * Builds a {@link MemoryEngine} from configuration: picks the embedding, extraction and generation
 * services and wires the provider fallback chains.
 */
public final class MemoryEngineFactory {
    static final String OPENROUTER_BASE = "https://openrouter.ai/api/v1";
    static final String OPENAI_BASE = "https://api.openai.com/v1";
    static final String OFFLINE = "offline";

    private MemoryEngineFactory() {
    }

    public static MemoryEngine create(EngramConfig config) {
        Path workspace = ConfigPaths.resolveWorkspace(config.workspace());
        return create(config, new FileMemorySpaceStore(ConfigPaths.spacesDirectory(workspace)), Clock.systemUTC());
    }

    public static MemoryEngine create(EngramConfig config, MemorySpaceStore store, Clock clock) {
        ProviderRegistry providers = providers(config);
        return new MemoryEngine(
            EngineSettings.from(config.memory()),
            extraction(config.generation(), providers),
            embeddings(config.embedding(), config.providers().openai()),
            generation(config.generation(), providers),
            store,
            IndexFactory.inMemory(),
            clock
        );
    }

    static ProviderRegistry providers(EngramConfig config) {
        int attempts = config.generation().maxAttempts();
        LlmProvider openrouter = chatProvider("openrouter", config.providers().openrouter(), OPENROUTER_BASE, attempts);
        LlmProvider openai = chatProvider("openai", config.providers().openai(), OPENAI_BASE, attempts);

        ProviderRegistry registry = new ProviderRegistry();
        registry.register(new FallbackLlmProvider("openrouter", List.of(openrouter, openai)));
        registry.register(new FallbackLlmProvider("openai", List.of(openai, openrouter)));
        return registry;
    }

    static EmbeddingService embeddings(EmbeddingConfig config, ProviderConfig openai) {
        return switch (normalize(config.provider())) {
            case "hashing" -> new HashingEmbeddingService(
                config.dimension() > 0 ? config.dimension() : HashingEmbeddingService.DEFAULT_DIMENSION);
            case "openai" -> new OpenAiEmbeddingService(
                openai == null ? "" : openai.apiKey(),
                baseOrDefault(openai, OPENAI_BASE),
                config.model(),
                config.dimension(),
                config.maxAttempts()
            );
            default -> throw new IllegalArgumentException("Unknown embedding provider: " + config.provider());
        };
    }

    static ExtractionService extraction(GenerationConfig config, ProviderRegistry providers) {
        return switch (normalize(config.extraction())) {
            case "heuristic" -> new HeuristicExtractionService();
            case "llm" -> {
                if (OFFLINE.equals(normalize(config.provider()))) {
                    throw new IllegalArgumentException("llm extraction needs generation.provider set to openrouter or openai");
                }
                yield new LlmExtractionService(registered(config, providers), config.model());
            }
            default -> throw new IllegalArgumentException("Unknown extraction mode: " + config.extraction());
        };
    }

    static GenerationService generation(GenerationConfig config, ProviderRegistry providers) {
        if (OFFLINE.equals(normalize(config.provider()))) {
            return new OfflineGenerationService();
        }
        return new LlmGenerationService(registered(config, providers), config.model());
    }

    private static LlmProvider registered(GenerationConfig config, ProviderRegistry providers) {
        return providers.find(config.provider())
            .orElseThrow(() -> new IllegalArgumentException("Unknown generation provider: " + config.provider()));
    }

    private static LlmProvider chatProvider(String name, ProviderConfig config, String defaultBase, int maxAttempts) {
        if (config != null && config.configured()) {
            return new OpenAiCompatProvider(name, config.apiKey(), baseOrDefault(config, defaultBase), config.extraHeaders(), maxAttempts);
        }
        return new DisabledProvider(name, "missing API key");
    }

    private static String baseOrDefault(ProviderConfig config, String defaultBase) {
        if (config == null || config.apiBase() == null || config.apiBase().isBlank()) {
            return defaultBase;
        }
        return config.apiBase();
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
