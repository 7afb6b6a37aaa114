package io.engram.core.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum MemoryDomain {
    SELF("self"),
    USER("user"),
    PROJECTS("projects"),
    WORLD("world"),
    SYSTEM("system"),
    GENERAL("general");

    private final String wireName;

    MemoryDomain(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static MemoryDomain fromWire(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (MemoryDomain domain : values()) {
            if (domain.wireName.equals(normalized)) {
                return domain;
            }
        }
        throw new IllegalArgumentException("Unknown memory domain: " + value);
    }
}
