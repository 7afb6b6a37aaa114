package io.engram.core.memory;

import java.util.List;

/**
 * Write-path input. Null optional fields fall back to the engine defaults: agent {@code default},
 * importance 0.5, layer {@code working}, domain {@code general}, type from the classifier.
 */
public record RememberRequest(
    String content,
    String agentName,
    List<String> tags,
    String sourceType,
    Double importanceScore,
    MemoryType memoryType,
    TemporalLayer temporalLayer,
    Double ttlHours,
    MemoryDomain domain
) {
    public RememberRequest {
        tags = tags == null ? List.of() : tags.stream()
            .filter(tag -> tag != null && !tag.isBlank())
            .map(String::trim)
            .toList();
    }

    public static RememberRequest of(String content, String agentName) {
        return new RememberRequest(content, agentName, List.of(), null, null, null, null, null, null);
    }

    public RememberRequest withTags(List<String> newTags) {
        return new RememberRequest(content, agentName, newTags, sourceType, importanceScore, memoryType,
            temporalLayer, ttlHours, domain);
    }

    public RememberRequest withSourceType(String newSourceType) {
        return new RememberRequest(content, agentName, tags, newSourceType, importanceScore, memoryType,
            temporalLayer, ttlHours, domain);
    }

    public RememberRequest withImportance(double newImportance) {
        return new RememberRequest(content, agentName, tags, sourceType, newImportance, memoryType,
            temporalLayer, ttlHours, domain);
    }

    public RememberRequest withMemoryType(MemoryType newType) {
        return new RememberRequest(content, agentName, tags, sourceType, importanceScore, newType,
            temporalLayer, ttlHours, domain);
    }

    public RememberRequest withTemporalLayer(TemporalLayer newLayer) {
        return new RememberRequest(content, agentName, tags, sourceType, importanceScore, memoryType,
            newLayer, ttlHours, domain);
    }

    public RememberRequest withTtlHours(Double newTtlHours) {
        return new RememberRequest(content, agentName, tags, sourceType, importanceScore, memoryType,
            temporalLayer, newTtlHours, domain);
    }

    public RememberRequest withDomain(MemoryDomain newDomain) {
        return new RememberRequest(content, agentName, tags, sourceType, importanceScore, memoryType,
            temporalLayer, ttlHours, newDomain);
    }
}
