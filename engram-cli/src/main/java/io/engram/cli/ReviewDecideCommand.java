package io.engram.cli;

import io.engram.core.lifecycle.ReviewDecisionRequest;
import io.engram.core.lifecycle.TransitionSummary;
import io.engram.core.memory.TemporalLayer;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "decide", description = "Apply a lifecycle decision: promote, extend, archive or delete")
public final class ReviewDecideCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", paramLabel = "MEMORY_ID", description = "Memory id")
    long memoryId;

    @Parameters(index = "1", paramLabel = "DECISION", description = "promote, extend, archive or delete")
    String decision;

    @Option(names = {"-l", "--layer"}, description = "Target temporal layer")
    String layer;

    @Option(names = "--ttl-hours", description = "Extension in hours")
    Double ttlHours;

    @Option(names = {"-r", "--reason"}, description = "Reason recorded in the review log")
    String reason;

    @Option(names = "--reviewer", description = "Reviewer recorded in the review log (default: agent)")
    String reviewer;

    public ReviewDecideCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ReviewDecisionRequest request = ReviewDecisionRequest.parse(memoryId, decision)
                .withReason(reason)
                .withTtlHours(ttlHours)
                .withReviewedBy(reviewer);
            if (layer != null) {
                request = request.withNewLayer(TemporalLayer.fromWire(layer));
            }
            TransitionSummary summary = context.services().open().lifecycle().decide(request);
            System.out.println("Memory " + summary.memoryId() + " " + summary.decision().wireName() + ": "
                + summary.oldLayer().wireName() + " -> " + summary.newLayer().wireName()
                + " (" + summary.status().wireName() + ")");
            if (summary.expiresAt() != null) {
                System.out.println("Expires at: " + summary.expiresAt());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Review decide failed: " + e.getMessage());
            return 1;
        }
    }
}
