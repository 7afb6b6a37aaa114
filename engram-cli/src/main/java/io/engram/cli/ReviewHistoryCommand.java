package io.engram.cli;

import io.engram.core.memory.ReviewLogEntry;
import io.engram.core.memory.TemporalLayer;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "history", description = "Show the review log of a memory")
public final class ReviewHistoryCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", paramLabel = "MEMORY_ID", description = "Memory id")
    long memoryId;

    public ReviewHistoryCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            List<ReviewLogEntry> entries = context.services().open().lifecycle().history(memoryId);
            if (entries.isEmpty()) {
                System.out.println("No review history for memory " + memoryId);
                return 0;
            }
            for (ReviewLogEntry entry : entries) {
                System.out.println(entry.reviewedAt() + " " + entry.decision() + " "
                    + layerName(entry.oldLayer()) + " -> " + layerName(entry.newLayer())
                    + " by " + entry.reviewedBy()
                    + (entry.reason() == null ? "" : ": " + entry.reason()));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Review history failed: " + e.getMessage());
            return 1;
        }
    }

    private static String layerName(TemporalLayer layer) {
        return layer == null ? "-" : layer.wireName();
    }
}
