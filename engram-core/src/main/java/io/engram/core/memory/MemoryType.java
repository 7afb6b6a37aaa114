package io.engram.core.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum MemoryType {
    FACTS("facts"),
    EXPERIENCES("experiences"),
    SKILLS("skills"),
    PREFERENCES("preferences"),
    DECISIONS("decisions"),
    CONTEXT("context");

    private final String wireName;

    MemoryType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static MemoryType fromWire(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (MemoryType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown memory type: " + value);
    }
}
