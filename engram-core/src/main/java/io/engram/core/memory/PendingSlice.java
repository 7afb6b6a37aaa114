package io.engram.core.memory;

import java.util.List;

public record PendingSlice(int total, List<Memory> memories) {
    public PendingSlice {
        memories = memories == null ? List.of() : List.copyOf(memories);
    }
}
