package io.engram.core.memory;

import java.util.List;
import java.util.Set;

public record RecallRequest(
    String query,
    String agentName,
    List<String> tags,
    MemoryType memoryType,
    MemoryDomain domain,
    Set<TemporalLayer> temporalLayers,
    int maxLayer,
    int limit,
    double minScore,
    boolean includeArchive
) {
    public static final int DEFAULT_MAX_LAYER = 2;
    public static final int DEFAULT_LIMIT = 10;
    public static final double DEFAULT_MIN_SCORE = 0.5;

    public RecallRequest {
        query = query == null ? "" : query;
        tags = tags == null ? List.of() : List.copyOf(tags);
        temporalLayers = temporalLayers == null || temporalLayers.isEmpty() ? null : Set.copyOf(temporalLayers);
    }

    public static RecallRequest of(String query, String agentName) {
        return new RecallRequest(query, agentName, List.of(), null, null, null,
            DEFAULT_MAX_LAYER, DEFAULT_LIMIT, DEFAULT_MIN_SCORE, false);
    }

    public RecallRequest withTags(List<String> newTags) {
        return new RecallRequest(query, agentName, newTags, memoryType, domain, temporalLayers,
            maxLayer, limit, minScore, includeArchive);
    }

    public RecallRequest withMemoryType(MemoryType newType) {
        return new RecallRequest(query, agentName, tags, newType, domain, temporalLayers,
            maxLayer, limit, minScore, includeArchive);
    }

    public RecallRequest withDomain(MemoryDomain newDomain) {
        return new RecallRequest(query, agentName, tags, memoryType, newDomain, temporalLayers,
            maxLayer, limit, minScore, includeArchive);
    }

    public RecallRequest withTemporalLayers(Set<TemporalLayer> layers) {
        return new RecallRequest(query, agentName, tags, memoryType, domain, layers,
            maxLayer, limit, minScore, includeArchive);
    }

    public RecallRequest withMaxLayer(int newMaxLayer) {
        return new RecallRequest(query, agentName, tags, memoryType, domain, temporalLayers,
            newMaxLayer, limit, minScore, includeArchive);
    }

    public RecallRequest withLimit(int newLimit) {
        return new RecallRequest(query, agentName, tags, memoryType, domain, temporalLayers,
            maxLayer, newLimit, minScore, includeArchive);
    }

    public RecallRequest withMinScore(double newMinScore) {
        return new RecallRequest(query, agentName, tags, memoryType, domain, temporalLayers,
            maxLayer, limit, newMinScore, includeArchive);
    }

    public RecallRequest withIncludeArchive(boolean include) {
        return new RecallRequest(query, agentName, tags, memoryType, domain, temporalLayers,
            maxLayer, limit, minScore, include);
    }
}
