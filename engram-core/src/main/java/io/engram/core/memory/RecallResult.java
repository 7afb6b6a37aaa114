package io.engram.core.memory;

import java.time.Instant;
import java.util.List;

public record RecallResult(
    long id,
    String content,
    List<String> tags,
    double importanceScore,
    int accessCount,
    double similarity,
    Instant createdAt,
    MemoryType memoryType,
    TemporalLayer temporalLayer,
    Instant expiresAt,
    MemoryDomain domain
) {
    public RecallResult {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
