package io.engram.core.memory;

public record BacklogStats(int activeWorking, int lapsedWorking, int awaitingReview) {
}
