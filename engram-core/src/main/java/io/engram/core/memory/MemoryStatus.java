package io.engram.core.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum MemoryStatus {
    ACTIVE("active"),
    EXPIRED("expired"),
    PENDING_REVIEW("pending_review"),
    ARCHIVED("archived"),
    DELETED("deleted");

    private final String wireName;

    MemoryStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean awaitingReview() {
        return this == EXPIRED || this == PENDING_REVIEW;
    }

    public boolean terminal() {
        return this == DELETED;
    }

    @JsonCreator
    public static MemoryStatus fromWire(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (MemoryStatus status : values()) {
            if (status.wireName.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown memory status: " + value);
    }
}
