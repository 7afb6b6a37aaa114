package io.engram.core.memory;

import java.time.Instant;

public record AccessLogEntry(
    long memoryId,
    long agentId,
    int layerRequested,
    String queryText,
    double relevanceScore,
    Instant accessedAt
) {
    public AccessLogEntry {
        queryText = queryText == null ? "" : queryText;
    }
}
