package io.engram.core.consolidation;

import java.util.Objects;

/**
 * One advisor verdict; {@code ordinal} is the 1-based position of the memory in its batch.
 */
public record BatchDecision(int ordinal, ReviewCategory category, String reason) {
    public BatchDecision {
        Objects.requireNonNull(category, "category must not be null");
        reason = reason == null ? "" : reason;
    }
}
