package io.engram.core.memory;

import java.util.Map;

public record MemoryStats(
    int totalMemories,
    double averageImportance,
    long totalAccesses,
    Map<TemporalLayer, Integer> byLayer
) {
    public MemoryStats {
        byLayer = byLayer == null ? Map.of() : Map.copyOf(byLayer);
    }

    public static MemoryStats empty() {
        return new MemoryStats(0, 0.0, 0, Map.of());
    }
}
