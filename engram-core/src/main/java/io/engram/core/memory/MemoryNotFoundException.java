package io.engram.core.memory;

public final class MemoryNotFoundException extends RuntimeException {
    private final long memoryId;

    public MemoryNotFoundException(long memoryId) {
        super("Memory not found: " + memoryId);
        this.memoryId = memoryId;
    }

    public long memoryId() {
        return memoryId;
    }
}
