package io.engram.core.lifecycle;

import io.engram.core.memory.TemporalLayer;
import java.util.Objects;

public record ReviewDecisionRequest(
    long memoryId,
    LifecycleDecision decision,
    TemporalLayer newLayer,
    String reason,
    Double ttlHours,
    String reviewedBy
) {
    public ReviewDecisionRequest {
        Objects.requireNonNull(decision, "decision must not be null");
    }

    public static ReviewDecisionRequest of(long memoryId, LifecycleDecision decision) {
        return new ReviewDecisionRequest(memoryId, decision, null, null, null, null);
    }

    public static ReviewDecisionRequest parse(long memoryId, String decision) {
        return of(memoryId, LifecycleDecision.parse(decision));
    }

    public ReviewDecisionRequest withNewLayer(TemporalLayer layer) {
        return new ReviewDecisionRequest(memoryId, decision, layer, reason, ttlHours, reviewedBy);
    }

    public ReviewDecisionRequest withReason(String newReason) {
        return new ReviewDecisionRequest(memoryId, decision, newLayer, newReason, ttlHours, reviewedBy);
    }

    public ReviewDecisionRequest withTtlHours(Double hours) {
        return new ReviewDecisionRequest(memoryId, decision, newLayer, reason, hours, reviewedBy);
    }

    public ReviewDecisionRequest withReviewedBy(String reviewer) {
        return new ReviewDecisionRequest(memoryId, decision, newLayer, reason, ttlHours, reviewer);
    }
}
