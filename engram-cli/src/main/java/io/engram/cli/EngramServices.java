package io.engram.cli;

import io.engram.core.buffer.AutoCapture;
import io.engram.core.buffer.BufferSink;
import io.engram.core.buffer.FallbackMemoryWriter;
import io.engram.core.buffer.OfflineBuffer;
import io.engram.core.consolidation.SleepCycle;
import io.engram.core.lifecycle.LifecycleService;
import io.engram.core.memory.MemoryEngine;

/**
 * The engine-side collaborators the commands drive, opened from the loaded configuration.
 */
public record EngramServices(
    MemoryEngine engine,
    LifecycleService lifecycle,
    SleepCycle sleepCycle,
    FallbackMemoryWriter writer,
    OfflineBuffer buffer,
    AutoCapture capture,
    BufferSink remoteSink,
    BufferSink localSink
) {
}
