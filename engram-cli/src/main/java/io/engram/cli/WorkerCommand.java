package io.engram.cli;

import java.time.Duration;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "worker", description = "Run the background consolidation worker until interrupted")
public final class WorkerCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--interval-minutes", description = "Minutes between backlog checks (defaults to config)")
    Integer intervalMinutes;

    public WorkerCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            int minutes = intervalMinutes == null
                ? context.configService().load(context.configPath()).consolidation().intervalMinutes()
                : intervalMinutes;
            if (minutes < 1) {
                throw new IllegalArgumentException("interval must be >= 1 minute");
            }
            return context.workerRunner().run(Duration.ofMinutes(minutes));
        } catch (Exception e) {
            System.err.println("Worker failed: " + e.getMessage());
            return 1;
        }
    }
}
