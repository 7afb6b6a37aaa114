package io.engram.core.memory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record Memory(
    long id,
    String agentName,
    LayeredContent content,
    List<Double> layer1Embedding,
    List<Double> layer2Embedding,
    List<String> tags,
    double importanceScore,
    MemoryType memoryType,
    TemporalLayer temporalLayer,
    MemoryStatus status,
    Instant expiresAt,
    MemoryDomain domain,
    String sourceType,
    Instant createdAt,
    Instant updatedAt,
    Instant lastAccessed,
    int accessCount
) {
    public Memory {
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(memoryType, "memoryType must not be null");
        Objects.requireNonNull(temporalLayer, "temporalLayer must not be null");
        Objects.requireNonNull(status, "status must not be null");
        layer1Embedding = layer1Embedding == null ? List.of() : List.copyOf(layer1Embedding);
        layer2Embedding = layer2Embedding == null ? List.of() : List.copyOf(layer2Embedding);
        tags = tags == null ? List.of() : List.copyOf(tags);
        domain = domain == null ? MemoryDomain.GENERAL : domain;
    }

    public Memory withLifecycle(
        TemporalLayer newLayer,
        MemoryStatus newStatus,
        Instant newExpiresAt,
        double newImportance,
        Instant changedAt
    ) {
        return new Memory(
            id,
            agentName,
            content,
            layer1Embedding,
            layer2Embedding,
            tags,
            newImportance,
            memoryType,
            newLayer,
            newStatus,
            newExpiresAt,
            domain,
            sourceType,
            createdAt,
            changedAt,
            lastAccessed,
            accessCount
        );
    }
}
