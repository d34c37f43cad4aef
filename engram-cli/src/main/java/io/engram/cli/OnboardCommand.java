package io.engram.cli;

import io.engram.core.config.OnboardResult;
import io.engram.core.config.model.EmbeddingConfig;
import io.engram.core.config.model.EngramConfig;
import io.engram.core.config.model.GenerationConfig;
import io.engram.core.config.model.MemoryConfig;
import io.engram.core.config.model.ProviderConfig;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Writes or refreshes the config file, creates the memory space directory and reports the
 * settings the engine will start with.
 */
@Command(name = "onboard", description = "Initialize or refresh the engram config and memory workspace")
public final class OnboardCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Replace the existing config with defaults")
    boolean overwrite;

    public OnboardCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        OnboardResult result;
        try {
            result = context.configService().onboard(context.configPath(), overwrite);
        } catch (IllegalArgumentException e) {
            System.err.println("Onboard failed: " + e.getMessage());
            System.err.println("Fix the config file or rerun with --overwrite to reset it.");
            return 1;
        } catch (Exception e) {
            System.err.println("Onboard failed: " + e.getMessage());
            return 1;
        }

        if (result.createdConfig()) {
            System.out.println("Created config: " + result.configPath());
        } else if (result.overwrittenConfig()) {
            System.out.println("Overwrote config with defaults: " + result.configPath());
        } else {
            System.out.println("Refreshed config with new defaults: " + result.configPath());
        }
        System.out.println("Workspace ready: " + result.workspacePath());
        System.out.println("Memory spaces: " + result.spacesPath());

        EngramConfig config = result.config();
        MemoryConfig memory = config.memory();
        System.out.println(String.format(Locale.ROOT,
            "Memory: cluster threshold %.2f, rrf k %d, top %d per index, %d context unit(s), %d retr%s",
            memory.clusterThreshold(), memory.rrfK(), memory.topK(), memory.maxContextUnits(),
            memory.maxRetries(), memory.maxRetries() == 1 ? "y" : "ies"));
        System.out.println("Embeddings: " + describe(config.embedding()));
        System.out.println("Generation: " + describe(config.generation()));

        String missingKey = missingKey(config);
        if (missingKey != null) {
            System.out.println("Missing API key: set providers." + missingKey + ".apiKey in " + result.configPath());
        }
        return 0;
    }

    private static String describe(EmbeddingConfig embedding) {
        if ("openai".equalsIgnoreCase(embedding.provider())) {
            return "openai " + embedding.model();
        }
        return embedding.provider() + " (" + embedding.dimension() + " dimensions)";
    }

    private static String describe(GenerationConfig generation) {
        if ("offline".equalsIgnoreCase(generation.provider())) {
            return "offline, " + generation.extraction() + " extraction";
        }
        return generation.provider() + " " + generation.model() + ", " + generation.extraction() + " extraction";
    }

    private static String missingKey(EngramConfig config) {
        String provider = config.generation().provider() == null ? "" : config.generation().provider().toLowerCase(Locale.ROOT);
        if ("openai".equalsIgnoreCase(config.embedding().provider()) && !configured(config.providers().openai())) {
            return "openai";
        }
        if ("openrouter".equals(provider) && !configured(config.providers().openrouter())) {
            return "openrouter";
        }
        if ("openai".equals(provider) && !configured(config.providers().openai())) {
            return "openai";
        }
        return null;
    }

    private static boolean configured(ProviderConfig provider) {
        return provider != null && provider.configured();
    }
}
