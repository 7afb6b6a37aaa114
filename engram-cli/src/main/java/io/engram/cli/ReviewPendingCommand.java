package io.engram.cli;

import io.engram.core.lifecycle.PendingMemory;
import io.engram.core.lifecycle.PendingReview;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "pending", description = "List memories awaiting review, oldest first")
public final class ReviewPendingCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-a", "--agent"}, description = "Only this agent's memories")
    String agent;

    @Option(names = {"-n", "--limit"}, description = "Maximum memories to list (default: ${DEFAULT-VALUE})")
    int limit = 20;

    public ReviewPendingCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            PendingReview review = context.services().open().lifecycle().pending(agent, limit);
            System.out.println("Pending review: " + review.pendingCount());
            for (PendingMemory memory : review.memories()) {
                System.out.printf(Locale.ROOT, "#%d [%s/%s] %s age=%.1fh importance=%.2f %s%n",
                    memory.id(),
                    memory.temporalLayer().wireName(),
                    memory.status().wireName(),
                    memory.domain().wireName(),
                    memory.ageHours(),
                    memory.importanceScore(),
                    memory.summary());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Review pending failed: " + e.getMessage());
            return 1;
        }
    }
}
