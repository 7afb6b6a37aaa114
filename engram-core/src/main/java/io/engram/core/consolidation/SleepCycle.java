package io.engram.core.consolidation;

import io.engram.core.lifecycle.LifecycleService;
import io.engram.core.lifecycle.PendingMemory;
import io.engram.core.lifecycle.PendingReview;
import io.engram.core.memory.MemoryNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Batch consolidation of the review backlog: pending memories go to the advisor in fixed-size batches and
 * each verdict is applied as a lifecycle decision. A batch the advisor cannot answer is skipped whole.
 */
public final class SleepCycle {
    private static final Logger LOG = LoggerFactory.getLogger(SleepCycle.class);
    static final String REVIEWER = "sleep-cycle";

    private final LifecycleService lifecycle;
    private final ConsolidationAdvisor advisor;

    public SleepCycle(LifecycleService lifecycle, ConsolidationAdvisor advisor) {
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle must not be null");
        this.advisor = Objects.requireNonNull(advisor, "advisor must not be null");
    }

    public ConsolidationReport run(SleepCycleOptions options) throws IOException {
        Objects.requireNonNull(options, "options must not be null");
        PendingReview pending = lifecycle.pending(options.agentName(), options.limit());
        List<PendingMemory> memories = pending.memories();
        if (memories.isEmpty()) {
            LOG.info("Sleep cycle found no memories to review");
            return ConsolidationReport.empty(options.dryRun());
        }

        int batches = (memories.size() + options.batchSize() - 1) / options.batchSize();
        LOG.info("Sleep cycle reviewing {} of {} pending memories in {} batches with {}{}",
            memories.size(), pending.pendingCount(), batches, advisor.name(), options.dryRun() ? " (dry run)" : "");

        Tally tally = new Tally();
        List<PlannedDecision> planned = new ArrayList<>();
        int skipped = 0;
        for (int start = 0, batchNumber = 1; start < memories.size(); start += options.batchSize(), batchNumber++) {
            List<PendingMemory> batch = memories.subList(start, Math.min(start + options.batchSize(), memories.size()));
            List<BatchDecision> decisions;
            try {
                decisions = advisor.review(batch);
            } catch (AdvisorException e) {
                skipped++;
                LOG.warn("Skipping batch {}/{} ({} memories): {}", batchNumber, batches, batch.size(), e.getMessage());
                continue;
            }
            if (!coversBatch(decisions, batch.size())) {
                skipped++;
                LOG.warn("Skipping batch {}/{}: advisor did not return one decision per memory", batchNumber, batches);
                continue;
            }

            for (BatchDecision decision : decisions) {
                PendingMemory memory = batch.get(decision.ordinal() - 1);
                PlannedDecision plan = new PlannedDecision(
                    memory.id(),
                    decision.category(),
                    decision.category().decision(),
                    decision.reason(),
                    memory.summary()
                );
                planned.add(plan);
                if (options.dryRun()) {
                    tally.count(decision.category());
                    continue;
                }
                if (apply(plan)) {
                    tally.count(decision.category());
                }
            }
            LOG.info("Batch {}/{} done ({} memories)", batchNumber, batches, batch.size());
        }

        ConsolidationReport report = new ConsolidationReport(
            tally.promoted,
            tally.extended,
            tally.archived,
            tally.forgotten,
            memories.size(),
            skipped,
            options.dryRun(),
            planned
        );
        LOG.info("Sleep cycle complete: total={} promoted={} extended={} archived={} forgotten={} skippedBatches={}",
            report.total(), report.promoted(), report.extended(), report.archived(), report.forgotten(), skipped);
        return report;
    }

    private boolean apply(PlannedDecision plan) {
        try {
            lifecycle.decide(plan.category().toRequest(plan.memoryId(), plan.reason(), REVIEWER));
            return true;
        } catch (IOException | MemoryNotFoundException | IllegalStateException e) {
            LOG.warn("Failed to apply {} to memory {}: {}", plan.decision().wireName(), plan.memoryId(), e.getMessage());
            return false;
        }
    }

    private static boolean coversBatch(List<BatchDecision> decisions, int size) {
        if (decisions == null || decisions.size() != size) {
            return false;
        }
        boolean[] seen = new boolean[size];
        for (BatchDecision decision : decisions) {
            int index = decision.ordinal() - 1;
            if (index < 0 || index >= size || seen[index]) {
                return false;
            }
            seen[index] = true;
        }
        return true;
    }

    private static final class Tally {
        private int promoted;
        private int extended;
        private int archived;
        private int forgotten;

        private void count(ReviewCategory category) {
            switch (category) {
                case IMPORTANT -> promoted++;
                case CONTEXT -> extended++;
                case ARCHIVE -> archived++;
                case FORGET -> forgotten++;
            }
        }
    }
}
