package io.engram.core.memory;

import java.util.Objects;

/**
 * The row a lifecycle decision produces together with its audit entry; both are written in one
 * store transaction.
 */
public record MemoryTransition(Memory before, Memory after, ReviewLogEntry log) {
    public MemoryTransition {
        Objects.requireNonNull(before, "before must not be null");
        Objects.requireNonNull(after, "after must not be null");
        Objects.requireNonNull(log, "log must not be null");
        if (before.id() != after.id() || after.id() != log.memoryId()) {
            throw new IllegalArgumentException("transition must target a single memory");
        }
    }
}
