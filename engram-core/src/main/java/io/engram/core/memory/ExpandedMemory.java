package io.engram.core.memory;

public record ExpandedMemory(long id, int layer, String content, TemporalLayer temporalLayer, MemoryStatus status) {
}
