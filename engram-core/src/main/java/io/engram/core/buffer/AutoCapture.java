package io.engram.core.buffer;

import io.engram.core.memory.MemoryDomain;
import io.engram.core.memory.TemporalLayer;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Records notable agent events as short-lived working memories in the offline buffer, to be synced and
 * consolidated later.
 */
public final class AutoCapture {
    public static final String AUTO_CAPTURED_TAG = "auto-captured";

    private final OfflineBuffer buffer;
    private final Clock clock;

    public AutoCapture(OfflineBuffer buffer, Clock clock) {
        this.buffer = Objects.requireNonNull(buffer, "buffer must not be null");
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public BufferedMemory capture(CaptureType type, String content) throws IOException {
        return capture(type, content, Map.of(), null, null, List.of());
    }

    public BufferedMemory capture(
        CaptureType type,
        String content,
        Map<String, Object> context,
        Double ttlHours,
        MemoryDomain domain,
        List<String> tags
    ) throws IOException {
        Objects.requireNonNull(type, "type must not be null");
        List<String> eventTags = new ArrayList<>();
        eventTags.add(type.wireName());
        eventTags.add(AUTO_CAPTURED_TAG);
        if (tags != null) {
            eventTags.addAll(tags);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("timestamp", clock.instant().toString());
        metadata.put("capture_type", type.wireName());
        if (context != null) {
            metadata.putAll(context);
        }

        return buffer.enqueue(
            content,
            domain == null ? type.domain() : domain,
            TemporalLayer.WORKING,
            ttlHours == null ? type.ttlHours() : ttlHours,
            eventTags,
            metadata
        );
    }

    public BufferedMemory toolUse(String tool, String details) throws IOException {
        return capture(CaptureType.TOOL_USE, "Used " + tool + ": " + details);
    }

    public BufferedMemory fileOperation(String operation, String path) throws IOException {
        String normalized = operation == null ? "" : operation.trim().toLowerCase(Locale.ROOT);
        CaptureType type = "write".equals(normalized) || "edit".equals(normalized)
            ? CaptureType.FILE_WRITE
            : CaptureType.FILE_READ;
        String label = normalized.isEmpty() ? "Access" : Character.toUpperCase(normalized.charAt(0)) + normalized.substring(1);
        return capture(type, label + " file: " + path, Map.of("path", path), null, null, List.of());
    }

    public Map<CaptureType, Integer> countsByType() throws IOException {
        Map<CaptureType, Integer> counts = new EnumMap<>(CaptureType.class);
        for (BufferedMemory memory : buffer.readAll()) {
            for (CaptureType type : CaptureType.values()) {
                if (memory.hasTag(type.wireName())) {
                    counts.merge(type, 1, Integer::sum);
                }
            }
        }
        return counts;
    }
}
