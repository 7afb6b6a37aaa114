package io.engram.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(name = "engram", mixinStandardHelpOptions = true, description = "Temporal memory lifecycle engine")
public final class EngramCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }

    public static CommandLine commandLine(CliContext context) {
        CommandLine commandLine = new CommandLine(new EngramCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("remember", new RememberCommand(context));
        commandLine.addSubcommand("recall", new RecallCommand(context));
        commandLine.addSubcommand("capture", new CaptureCommand(context));
        commandLine.addSubcommand("review", new CommandLine(new ReviewCommand())
            .addSubcommand("pending", new ReviewPendingCommand(context))
            .addSubcommand("decide", new ReviewDecideCommand(context))
            .addSubcommand("history", new ReviewHistoryCommand(context)));
        commandLine.addSubcommand("sleep", new SleepCommand(context));
        commandLine.addSubcommand("buffer", new CommandLine(new BufferCommand())
            .addSubcommand("status", new BufferStatusCommand(context))
            .addSubcommand("sync", new BufferSyncCommand(context))
            .addSubcommand("clear", new BufferClearCommand(context))
            .addSubcommand("purge-tag", new BufferPurgeTagCommand(context)));
        commandLine.addSubcommand("stats", new StatsCommand(context));
        commandLine.addSubcommand("worker", new WorkerCommand(context));
        return commandLine;
    }
}
