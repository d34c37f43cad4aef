package io.engram.cli;

import io.engram.core.engine.IngestionResult;
import io.engram.core.profile.ConflictRecord;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "ingest", description = "Turn a conversation transcript into memory for a user")
public final class IngestCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Transcript file, or '-' for standard input")
    String transcript;

    @Option(names = {"-u", "--user"}, required = true, description = "User whose memory receives the conversation")
    String userId;

    @Option(names = {"-c", "--conversation"}, description = "Conversation id (generated when omitted)")
    String conversationId;

    @Option(names = "--at", description = "Time the conversation took place, for turns without timestamps")
    String at;

    public IngestCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            IngestionResult result = context.engine().ingestTranscript(userId, conversationId, read(), ReferenceTimes.parse(at));
            System.out.println(result.describe());
            if (!result.succeeded()) {
                return 1;
            }
            for (ConflictRecord conflict : result.conflicts()) {
                System.out.println("Conflict on " + conflict.attributeName() + ": " + conflict.oldValue() + " -> " + conflict.newValue()
                    + (conflict.applied() ? " (updated)" : " (kept " + conflict.oldValue() + ", newer)"));
            }
            if (!result.persisted()) {
                System.err.println("Warning: memory for " + userId + " could not be saved and lives only in this process");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Ingest failed: " + e.getMessage());
            return 1;
        }
    }

    private String read() throws IOException {
        if ("-".equals(transcript)) {
            return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(Path.of(transcript), StandardCharsets.UTF_8);
    }
}
