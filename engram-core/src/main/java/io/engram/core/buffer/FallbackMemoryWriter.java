package io.engram.core.buffer;

import io.engram.core.memory.MemoryEngine;
import io.engram.core.memory.RememberRequest;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Write path that parks the record in the offline buffer when the store cannot be reached. Validation
 * errors are not buffered; they propagate to the caller.
 */
public final class FallbackMemoryWriter {
    private static final Logger LOG = LoggerFactory.getLogger(FallbackMemoryWriter.class);

    static final String AGENT_KEY = "agent_name";
    static final String SOURCE_TYPE_KEY = "source_type";
    static final String IMPORTANCE_KEY = "importance_score";
    static final String MEMORY_TYPE_KEY = "memory_type";

    private final MemoryEngine engine;
    private final OfflineBuffer buffer;

    public FallbackMemoryWriter(MemoryEngine engine, OfflineBuffer buffer) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.buffer = Objects.requireNonNull(buffer, "buffer must not be null");
    }

    public WriteOutcome write(RememberRequest request) throws IOException {
        try {
            return WriteOutcome.stored(engine.remember(request));
        } catch (IOException storeFailure) {
            LOG.warn("Store unavailable, buffering memory: {}", storeFailure.getMessage());
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(AGENT_KEY, request.agentName() == null ? engine.defaultAgent() : request.agentName());
            if (request.sourceType() != null) {
                metadata.put(SOURCE_TYPE_KEY, request.sourceType());
            }
            if (request.importanceScore() != null) {
                metadata.put(IMPORTANCE_KEY, request.importanceScore());
            }
            if (request.memoryType() != null) {
                metadata.put(MEMORY_TYPE_KEY, request.memoryType().wireName());
            }
            try {
                return WriteOutcome.buffered(buffer.enqueue(
                    request.content(),
                    request.domain(),
                    request.temporalLayer(),
                    request.ttlHours(),
                    request.tags(),
                    metadata
                ));
            } catch (IOException bufferFailure) {
                bufferFailure.addSuppressed(storeFailure);
                throw bufferFailure;
            }
        }
    }
}
