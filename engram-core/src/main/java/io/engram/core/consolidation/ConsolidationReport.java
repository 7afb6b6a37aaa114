package io.engram.core.consolidation;

import java.util.List;

public record ConsolidationReport(
    int promoted,
    int extended,
    int archived,
    int forgotten,
    int total,
    int skippedBatches,
    boolean dryRun,
    List<PlannedDecision> planned
) {
    public ConsolidationReport {
        planned = planned == null ? List.of() : List.copyOf(planned);
    }

    public static ConsolidationReport empty(boolean dryRun) {
        return new ConsolidationReport(0, 0, 0, 0, 0, 0, dryRun, List.of());
    }

    public int applied() {
        return promoted + extended + archived + forgotten;
    }
}
