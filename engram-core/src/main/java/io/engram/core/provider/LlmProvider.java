package io.engram.core.provider;

import io.engram.core.model.ChatMessage;
import java.util.List;

/**
 * Chat transport to a language model. Failures are reported as an error {@link LlmResponse}, never thrown.
 */
public interface LlmProvider {
    String name();

    LlmResponse chat(String model, List<ChatMessage> messages);
}
