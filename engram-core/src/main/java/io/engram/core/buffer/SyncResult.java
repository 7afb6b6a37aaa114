package io.engram.core.buffer;

import java.util.List;

public record SyncResult(int synced, List<BufferedMemory> failed) {
    public SyncResult {
        failed = failed == null ? List.of() : List.copyOf(failed);
    }

    public static SyncResult empty() {
        return new SyncResult(0, List.of());
    }
}
