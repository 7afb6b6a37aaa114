package io.engram.core.buffer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.engram.core.memory.MemoryDomain;
import java.util.Locale;

public enum CaptureType {
    LEARNING("learning", 4, MemoryDomain.SELF),
    DECISION("decision", 3, MemoryDomain.PROJECTS),
    ERROR("error", 2, MemoryDomain.SYSTEM),
    USER_FEEDBACK("user_feedback", 4, MemoryDomain.USER),
    ANALYSIS("analysis", 2, MemoryDomain.GENERAL),
    TOOL_USE("tool_use", 1, MemoryDomain.SYSTEM),
    FILE_READ("file_read", 1, MemoryDomain.SYSTEM),
    FILE_WRITE("file_write", 2, MemoryDomain.PROJECTS),
    TASK_COMPLETE("task_complete", 3, MemoryDomain.PROJECTS),
    QUESTION("question", 2, MemoryDomain.GENERAL),
    MILESTONE("milestone", 168, MemoryDomain.PROJECTS);

    private final String wireName;
    private final double ttlHours;
    private final MemoryDomain domain;

    CaptureType(String wireName, double ttlHours, MemoryDomain domain) {
        this.wireName = wireName;
        this.ttlHours = ttlHours;
        this.domain = domain;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public double ttlHours() {
        return ttlHours;
    }

    public MemoryDomain domain() {
        return domain;
    }

    @JsonCreator
    public static CaptureType fromWire(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (CaptureType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown capture type: " + value);
    }
}
