package io.engram.cli;

import io.engram.core.engine.Recollection;
import io.engram.core.retrieval.ClusterHit;
import io.engram.core.retrieval.LoopIteration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "ask", description = "Answer a question from a user's memory")
public final class AskCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Question to answer")
    String question;

    @Option(names = {"-u", "--user"}, required = true, description = "User whose memory is searched")
    String userId;

    @Option(names = "--at", description = "Answer as of this time instead of now")
    String at;

    @Option(names = "--context-only", description = "Print the retrieved memory context without generating an answer")
    boolean contextOnly;

    @Option(names = "--trace", description = "Show each retrieval cycle and the clusters involved")
    boolean trace;

    public AskCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Instant reference = ReferenceTimes.parse(at);
            Recollection recollection = context.engine().recall(userId, question, reference);
            if (trace) {
                printTrace(recollection);
            }
            if (contextOnly) {
                System.out.println(recollection.context().isBlank() ? "No relevant memories." : recollection.context());
            } else {
                System.out.println(context.engine().answer(recollection));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Ask failed: " + e.getMessage());
            return 1;
        }
    }

    private void printTrace(Recollection recollection) {
        System.out.println("Search cycles: " + recollection.searchCycles() + (recollection.sufficient() ? " (sufficient)" : " (insufficient)"));
        for (LoopIteration iteration : recollection.iterations()) {
            System.out.println("  [" + iteration.cycle() + "] \"" + iteration.query() + "\" -> "
                + iteration.unitIds().size() + " unit(s)" + (iteration.rationale().isBlank() ? "" : ": " + iteration.rationale()));
        }
        for (ClusterHit cluster : recollection.clusters()) {
            System.out.println(String.format(Locale.ROOT, "  cluster %s (%.4f)", cluster.themeLabel(), cluster.score()));
        }
    }
}
