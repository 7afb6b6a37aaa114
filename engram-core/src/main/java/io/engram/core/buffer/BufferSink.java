package io.engram.core.buffer;

import java.io.IOException;

/**
 * Destination for buffered writes during a sync. Throwing marks the record as not delivered.
 */
public interface BufferSink {
    String name();

    void deliver(BufferedMemory memory) throws IOException;
}
