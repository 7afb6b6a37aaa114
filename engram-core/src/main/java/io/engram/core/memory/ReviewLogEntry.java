package io.engram.core.memory;

import java.time.Instant;

public record ReviewLogEntry(
    long memoryId,
    String decision,
    TemporalLayer oldLayer,
    TemporalLayer newLayer,
    String reason,
    String reviewedBy,
    Instant reviewedAt
) {
    public ReviewLogEntry {
        decision = decision == null ? "" : decision;
        reason = reason == null ? "" : reason;
        reviewedBy = reviewedBy == null || reviewedBy.isBlank() ? "agent" : reviewedBy.trim();
    }
}
