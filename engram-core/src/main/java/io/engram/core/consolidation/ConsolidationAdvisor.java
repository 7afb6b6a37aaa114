package io.engram.core.consolidation;

import io.engram.core.lifecycle.PendingMemory;
import java.util.List;

/**
 * External reviewer for a batch of pending memories. Must return exactly one decision per memory, or fail.
 */
public interface ConsolidationAdvisor {
    String name();

    List<BatchDecision> review(List<PendingMemory> batch) throws AdvisorException;
}
