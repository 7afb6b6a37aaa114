package io.engram.core.consolidation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.engram.core.lifecycle.LifecycleDecision;
import io.engram.core.lifecycle.ReviewDecisionRequest;
import io.engram.core.memory.TemporalLayer;
import java.util.Locale;

/**
 * The advisor's verdict on a pending memory, and the lifecycle decision each verdict maps to.
 */
public enum ReviewCategory {
    IMPORTANT("important", LifecycleDecision.PROMOTE),
    CONTEXT("context", LifecycleDecision.EXTEND),
    ARCHIVE("archive", LifecycleDecision.ARCHIVE),
    FORGET("forget", LifecycleDecision.DELETE);

    static final double CONTEXT_TTL_HOURS = 168.0;

    private final String wireName;
    private final LifecycleDecision decision;

    ReviewCategory(String wireName, LifecycleDecision decision) {
        this.wireName = wireName;
        this.decision = decision;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public LifecycleDecision decision() {
        return decision;
    }

    public ReviewDecisionRequest toRequest(long memoryId, String reason, String reviewedBy) {
        ReviewDecisionRequest request = ReviewDecisionRequest.of(memoryId, decision)
            .withReason(reason)
            .withReviewedBy(reviewedBy);
        return switch (this) {
            case IMPORTANT -> request.withNewLayer(TemporalLayer.LONG);
            case CONTEXT -> request.withNewLayer(TemporalLayer.SHORT).withTtlHours(CONTEXT_TTL_HOURS);
            case ARCHIVE, FORGET -> request;
        };
    }

    @JsonCreator
    public static ReviewCategory parse(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (ReviewCategory category : values()) {
            if (category.wireName.equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown review category: " + value);
    }
}
