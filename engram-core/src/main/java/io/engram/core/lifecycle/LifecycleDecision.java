package io.engram.core.lifecycle;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum LifecycleDecision {
    PROMOTE("promote"),
    EXTEND("extend"),
    ARCHIVE("archive"),
    DELETE("delete");

    private final String wireName;

    LifecycleDecision(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static LifecycleDecision parse(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (LifecycleDecision decision : values()) {
            if (decision.wireName.equals(normalized)) {
                return decision;
            }
        }
        throw new IllegalArgumentException("Unknown lifecycle decision: " + value);
    }
}
