package io.engram.cli;

import io.engram.core.config.ConfigPaths;
import io.engram.core.config.model.EngramConfig;
import io.engram.core.engine.MemorySpaceStats;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and stored memory status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            EngramConfig config = context.configService().load(context.configPath());
            Path workspace = ConfigPaths.resolveWorkspace(config.workspace());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Workspace: " + workspace);
            System.out.println("Memory spaces: " + ConfigPaths.spacesDirectory(workspace));
            System.out.println("Embedding provider: " + config.embedding().provider());
            System.out.println("Generation provider: " + config.generation().provider());
            System.out.println("Generation model: " + config.generation().model());
            System.out.println("Extraction: " + config.generation().extraction());
            System.out.println("OpenRouter configured: " + config.providers().openrouter().configured());
            System.out.println("OpenAI configured: " + config.providers().openai().configured());

            List<String> users = context.engine().userIds();
            System.out.println("Users: " + users.size());
            for (String user : users) {
                MemorySpaceStats stats = context.engine().stats(user);
                System.out.println("  " + user + ": " + stats.units() + " unit(s), " + stats.clusters() + " cluster(s), "
                    + stats.attributes() + " attribute(s), " + stats.traits() + " trait(s), " + stats.conflicts() + " conflict(s)");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
