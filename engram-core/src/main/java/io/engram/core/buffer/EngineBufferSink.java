package io.engram.core.buffer;

import io.engram.core.memory.MemoryEngine;
import io.engram.core.memory.MemoryType;
import io.engram.core.memory.RememberRequest;
import java.io.IOException;
import java.util.Objects;

/**
 * Replays buffered writes straight into a local engine.
 */
public final class EngineBufferSink implements BufferSink {
    static final String SOURCE_TYPE = "offline-buffer";

    private final MemoryEngine engine;

    public EngineBufferSink(MemoryEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    @Override
    public String name() {
        return "local-engine";
    }

    @Override
    public void deliver(BufferedMemory memory) throws IOException {
        Object agent = memory.metadata().get(FallbackMemoryWriter.AGENT_KEY);
        Object sourceType = memory.metadata().get(FallbackMemoryWriter.SOURCE_TYPE_KEY);
        Object importance = memory.metadata().get(FallbackMemoryWriter.IMPORTANCE_KEY);
        Object memoryType = memory.metadata().get(FallbackMemoryWriter.MEMORY_TYPE_KEY);

        RememberRequest request = RememberRequest.of(memory.content(), agent instanceof String name ? name : null)
            .withTags(memory.tags())
            .withDomain(memory.domain())
            .withTemporalLayer(memory.temporalLayer())
            .withTtlHours(memory.ttlHours())
            .withSourceType(sourceType instanceof String type ? type : SOURCE_TYPE);
        if (importance instanceof Number score) {
            request = request.withImportance(score.doubleValue());
        }
        if (memoryType instanceof String type) {
            request = request.withMemoryType(MemoryType.fromWire(type));
        }
        engine.remember(request);
    }
}
