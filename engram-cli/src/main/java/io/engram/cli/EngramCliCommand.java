package io.engram.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(name = "engram", mixinStandardHelpOptions = true, description = "Engram long-term conversational memory")
public final class EngramCliCommand implements Runnable {

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    public static CommandLine create(CliContext context) {
        CommandLine commandLine = new CommandLine(new EngramCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("ingest", new IngestCommand(context));
        commandLine.addSubcommand("ask", new AskCommand(context));
        commandLine.addSubcommand("profile", new ProfileCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        return commandLine;
    }
}
