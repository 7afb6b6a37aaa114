package io.engram.core.buffer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.engram.core.memory.MemoryDomain;
import io.engram.core.memory.TemporalLayer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON-lines buffer of writes that could not reach the store. Delivery is at-least-once: a record that
 * fails during sync stays in the file and is retried by the next sync. Assumes a single writer process.
 */
public final class OfflineBuffer {
    private static final Logger LOG = LoggerFactory.getLogger(OfflineBuffer.class);

    private final Path file;
    private final Clock clock;
    private final ObjectMapper mapper;

    public OfflineBuffer(Path file) {
        this(file, Clock.systemUTC());
    }

    public OfflineBuffer(Path file, Clock clock) {
        if (file == null) {
            throw new IllegalArgumentException("file must not be null");
        }
        this.file = file;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public Path path() {
        return file;
    }

    public BufferedMemory enqueue(
        String content,
        MemoryDomain domain,
        TemporalLayer temporalLayer,
        Double ttlHours,
        List<String> tags,
        Map<String, Object> metadata
    ) throws IOException {
        return enqueue(BufferedMemory.of(content, domain, temporalLayer, ttlHours, tags, metadata, clock.instant()));
    }

    public synchronized BufferedMemory enqueue(BufferedMemory memory) throws IOException {
        if (memory.content().isBlank()) {
            throw new IllegalArgumentException("content must not be blank");
        }
        BufferedMemory stamped = memory.timestamp() == null
            ? new BufferedMemory(memory.content(), memory.domain(), memory.temporalLayer(), memory.ttlHours(),
                memory.tags(), memory.metadata(), clock.instant(), true)
            : memory;
        ensureParent();
        Files.writeString(
            file,
            mapper.writeValueAsString(stamped) + "\n",
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND
        );
        LOG.debug("Buffered memory: {}", preview(stamped.content()));
        return stamped;
    }

    public synchronized int count() throws IOException {
        if (!Files.exists(file)) {
            return 0;
        }
        int count = 0;
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (!line.isBlank()) {
                count++;
            }
        }
        return count;
    }

    public synchronized List<BufferedMemory> readAll() throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        List<BufferedMemory> memories = new ArrayList<>();
        int lineNumber = 0;
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                memories.add(mapper.readValue(line, BufferedMemory.class));
            } catch (IOException e) {
                throw new IOException("Malformed buffer record at " + file + ":" + lineNumber, e);
            }
        }
        return memories;
    }

    public synchronized SyncResult sync(BufferSink sink) throws IOException {
        List<BufferedMemory> memories = readAll();
        if (memories.isEmpty()) {
            return SyncResult.empty();
        }

        int synced = 0;
        List<BufferedMemory> failed = new ArrayList<>();
        for (BufferedMemory memory : memories) {
            try {
                sink.deliver(memory);
                synced++;
            } catch (IOException | RuntimeException e) {
                failed.add(memory);
                LOG.warn("Failed to deliver buffered memory to {}: {}", sink.name(), e.getMessage());
            }
        }

        if (failed.isEmpty()) {
            Files.deleteIfExists(file);
        } else {
            rewrite(failed);
        }
        LOG.info("Buffer sync to {}: {} synced, {} remaining", sink.name(), synced, failed.size());
        return new SyncResult(synced, failed);
    }

    public synchronized int removeByTag(String tag) throws IOException {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("tag must not be blank");
        }
        List<BufferedMemory> memories = readAll();
        List<BufferedMemory> kept = new ArrayList<>();
        for (BufferedMemory memory : memories) {
            if (!memory.hasTag(tag)) {
                kept.add(memory);
            }
        }
        int removed = memories.size() - kept.size();
        if (removed == 0) {
            return 0;
        }
        if (kept.isEmpty()) {
            Files.deleteIfExists(file);
        } else {
            rewrite(kept);
        }
        return removed;
    }

    public synchronized void clear() throws IOException {
        Files.deleteIfExists(file);
    }

    private void rewrite(List<BufferedMemory> memories) throws IOException {
        StringBuilder out = new StringBuilder();
        for (BufferedMemory memory : memories) {
            out.append(mapper.writeValueAsString(memory)).append('\n');
        }
        ensureParent();
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.writeString(temp, out.toString(), StandardCharsets.UTF_8);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private void ensureParent() throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private static String preview(String content) {
        return content.length() <= 60 ? content : content.substring(0, 60) + "...";
    }
}
