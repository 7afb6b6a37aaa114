package io.engram.core.consolidation;

import io.engram.core.lifecycle.LifecycleDecision;

public record PlannedDecision(long memoryId, ReviewCategory category, LifecycleDecision decision, String reason, String summary) {
    public PlannedDecision {
        reason = reason == null ? "" : reason;
        summary = summary == null ? "" : summary;
    }
}
