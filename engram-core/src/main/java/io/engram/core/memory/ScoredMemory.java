package io.engram.core.memory;

public record ScoredMemory(Memory memory, double similarity) {
}
