package io.engram.cli;

import io.engram.core.config.model.ConsolidationConfig;
import io.engram.core.consolidation.ConsolidationReport;
import io.engram.core.consolidation.PlannedDecision;
import io.engram.core.consolidation.SleepCycleOptions;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "sleep", description = "Run one consolidation pass over the review backlog")
public final class SleepCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--dry-run", description = "Show the planned decisions without applying them")
    boolean dryRun;

    @Option(names = "--batch-size", description = "Memories per advisor request (defaults to config)")
    Integer batchSize;

    @Option(names = {"-n", "--limit"}, description = "Maximum memories per pass (defaults to config)")
    Integer limit;

    @Option(names = {"-a", "--agent"}, description = "Only this agent's memories")
    String agent;

    public SleepCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ConsolidationConfig config = context.configService().load(context.configPath()).consolidation();
            SleepCycleOptions options = new SleepCycleOptions(
                agent,
                limit == null ? config.limit() : limit,
                batchSize == null ? config.batchSize() : batchSize,
                dryRun
            );
            ConsolidationReport report = context.services().open().sleepCycle().run(options);
            if (report.total() == 0) {
                System.out.println("Nothing to consolidate.");
                return 0;
            }
            if (report.dryRun()) {
                for (PlannedDecision planned : report.planned()) {
                    System.out.println("#" + planned.memoryId() + " " + planned.category().wireName()
                        + " -> " + planned.decision().wireName() + ": " + planned.summary());
                }
            }
            System.out.println((report.dryRun() ? "Planned" : "Consolidated") + " " + report.total() + " memories:"
                + " promoted=" + report.promoted()
                + " extended=" + report.extended()
                + " archived=" + report.archived()
                + " forgotten=" + report.forgotten());
            if (report.skippedBatches() > 0) {
                System.out.println("Skipped batches: " + report.skippedBatches());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Sleep cycle failed: " + e.getMessage());
            return 1;
        }
    }
}
