package io.engram.core.lifecycle;

import io.engram.core.memory.MemoryStatus;
import io.engram.core.memory.TemporalLayer;
import java.time.Instant;

public record TransitionSummary(
    long memoryId,
    LifecycleDecision decision,
    TemporalLayer oldLayer,
    TemporalLayer newLayer,
    MemoryStatus status,
    Instant expiresAt,
    double importanceScore
) {
}
