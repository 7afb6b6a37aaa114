package io.engram.core.memory;

import io.engram.core.memory.query.RecallPredicates;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Durable owner of agents, memories and their append-only logs. Every mutation is atomic per call;
 * callers hold no mutable copies between calls.
 */
public interface MemoryStore {
    long upsertAgent(String agentName) throws IOException;

    Optional<Long> findAgentId(String agentName) throws IOException;

    Memory insert(NewMemory memory) throws IOException;

    Optional<Memory> find(long memoryId) throws IOException;

    /**
     * Candidates matching the predicates, scored by cosine similarity against their layer 1 embedding,
     * most similar first.
     */
    List<ScoredMemory> nearest(List<Double> queryEmbedding, RecallPredicates predicates) throws IOException;

    void recordAccess(AccessLogEntry entry) throws IOException;

    List<AccessLogEntry> accessLog(long memoryId) throws IOException;

    /**
     * Flips lapsed {@code active} rows to {@code expired}, then returns the review backlog. A null agent
     * name covers every agent.
     */
    PendingSlice pendingReview(String agentName, Instant now, int limit) throws IOException;

    /**
     * Loads the row, lets the planner compute the new state, then writes the row update and the review
     * log entry in one transaction. Planner exceptions roll back and propagate.
     */
    MemoryTransition transition(long memoryId, Function<Memory, MemoryTransition> planner) throws IOException;

    List<ReviewLogEntry> reviewLog(long memoryId) throws IOException;

    MemoryStats stats(String agentName) throws IOException;

    BacklogStats backlog(String agentName, Instant now) throws IOException;
}
