package io.engram.cli;

import io.engram.core.cluster.ThematicCluster;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "profile", description = "Show what is known about a user")
public final class ProfileCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-u", "--user"}, required = true, description = "User to describe")
    String userId;

    @Option(names = "--clusters", description = "Also list the user's thematic clusters")
    boolean clusters;

    public ProfileCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            System.out.print(context.engine().profileSummary(userId));
            if (clusters) {
                System.out.println();
                System.out.println("Thematic clusters:");
                for (ThematicCluster cluster : context.engine().clusters(userId)) {
                    System.out.println("  - " + cluster.themeLabel() + " (" + cluster.size() + " unit(s))");
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Profile command failed: " + e.getMessage());
            return 1;
        }
    }
}
