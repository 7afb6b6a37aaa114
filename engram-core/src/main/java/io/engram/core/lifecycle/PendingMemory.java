package io.engram.core.lifecycle;

import io.engram.core.memory.MemoryDomain;
import io.engram.core.memory.MemoryStatus;
import io.engram.core.memory.MemoryType;
import io.engram.core.memory.TemporalLayer;
import java.time.Instant;
import java.util.List;

/**
 * A memory awaiting a lifecycle decision. {@code hoursSinceAccess} is null when it was never recalled.
 */
public record PendingMemory(
    long id,
    String agentName,
    String summary,
    String details,
    List<String> tags,
    double importanceScore,
    MemoryType memoryType,
    TemporalLayer temporalLayer,
    MemoryStatus status,
    MemoryDomain domain,
    Instant expiresAt,
    int accessCount,
    double ageHours,
    Double hoursSinceAccess
) {
    public PendingMemory {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
