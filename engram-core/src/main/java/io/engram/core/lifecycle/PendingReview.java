package io.engram.core.lifecycle;

import java.util.List;

public record PendingReview(int pendingCount, List<PendingMemory> memories) {
    public PendingReview {
        memories = memories == null ? List.of() : List.copyOf(memories);
    }
}
