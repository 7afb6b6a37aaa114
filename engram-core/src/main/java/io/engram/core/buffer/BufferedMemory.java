package io.engram.core.buffer;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.engram.core.memory.MemoryDomain;
import io.engram.core.memory.TemporalLayer;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One line of the offline buffer: a write that could not reach the store yet.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BufferedMemory(
    String content,
    MemoryDomain domain,
    @JsonAlias({"temporal_layer"}) TemporalLayer temporalLayer,
    @JsonAlias({"ttl_hours"}) Double ttlHours,
    List<String> tags,
    Map<String, Object> metadata,
    Instant timestamp,
    boolean queued
) {
    public BufferedMemory {
        content = content == null ? "" : content;
        domain = domain == null ? MemoryDomain.GENERAL : domain;
        temporalLayer = temporalLayer == null ? TemporalLayer.WORKING : temporalLayer;
        tags = tags == null ? List.of() : List.copyOf(tags);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static BufferedMemory of(
        String content,
        MemoryDomain domain,
        TemporalLayer temporalLayer,
        Double ttlHours,
        List<String> tags,
        Map<String, Object> metadata,
        Instant timestamp
    ) {
        return new BufferedMemory(content, domain, temporalLayer, ttlHours, tags, metadata, timestamp, true);
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }
}
