package io.engram.core.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum TemporalLayer {
    WORKING("working", 1.5),
    SHORT("short", 1.2),
    LONG("long", 1.0),
    ARCHIVE("archive", 0.5);

    private final String wireName;
    private final double searchWeight;

    TemporalLayer(String wireName, double searchWeight) {
        this.wireName = wireName;
        this.searchWeight = searchWeight;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public double searchWeight() {
        return searchWeight;
    }

    @JsonCreator
    public static TemporalLayer fromWire(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (TemporalLayer layer : values()) {
            if (layer.wireName.equals(normalized)) {
                return layer;
            }
        }
        throw new IllegalArgumentException("Unknown temporal layer: " + value);
    }
}
