package io.engram.core.provider;

import java.util.LinkedHashMap;
import java.util.Map;

public record LlmResponse(String content, Map<String, Object> usage) {
    public static final String ERROR_PREFIX = "Error calling LLM:";

    public LlmResponse {
        content = content == null ? "" : content;
        if (usage == null) {
            usage = Map.of();
        } else {
            Map<String, Object> present = new LinkedHashMap<>();
            usage.forEach((key, value) -> {
                if (key != null && value != null) {
                    present.put(key, value);
                }
            });
            usage = Map.copyOf(present);
        }
    }

    public static LlmResponse error(String message) {
        return new LlmResponse(ERROR_PREFIX + " " + message, Map.of());
    }

    public boolean isError() {
        return content.startsWith(ERROR_PREFIX);
    }
}
