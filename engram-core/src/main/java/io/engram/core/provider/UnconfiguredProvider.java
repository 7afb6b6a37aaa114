package io.engram.core.provider;

import io.engram.core.model.ChatMessage;
import java.util.List;

/**
 * Placeholder for a provider whose API key is missing from the config. It always answers with an error so a
 * fallback chain moves on, and so a sleep cycle without any configured provider skips its batches instead of
 * failing at startup.
 */
public final class UnconfiguredProvider implements LlmProvider {
    private final String name;

    public UnconfiguredProvider(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages) {
        return LlmResponse.error("no API key configured for " + name + " (set providers." + name + ".apiKey)");
    }
}
