package io.engram.core.buffer;

/**
 * Result of a resilient write: either the stored memory id or a buffered copy awaiting sync.
 */
public record WriteOutcome(Long memoryId, BufferedMemory buffered) {
    public static WriteOutcome stored(long memoryId) {
        return new WriteOutcome(memoryId, null);
    }

    public static WriteOutcome buffered(BufferedMemory memory) {
        return new WriteOutcome(null, memory);
    }

    public boolean isBuffered() {
        return buffered != null;
    }
}
