package io.engram.cli;

import io.engram.core.memory.MemoryStats;
import io.engram.core.memory.TemporalLayer;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "stats", description = "Show memory counts for an agent")
public final class StatsCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-a", "--agent"}, description = "Agent name (defaults to the configured agent)")
    String agent;

    public StatsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MemoryStats stats = context.services().open().engine().stats(agent);
            System.out.println("Total memories: " + stats.totalMemories());
            System.out.printf(Locale.ROOT, "Average importance: %.2f%n", stats.averageImportance());
            System.out.println("Total accesses: " + stats.totalAccesses());
            for (TemporalLayer layer : TemporalLayer.values()) {
                System.out.println("  " + layer.wireName() + ": " + stats.byLayer().getOrDefault(layer, 0));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Stats command failed: " + e.getMessage());
            return 1;
        }
    }
}
