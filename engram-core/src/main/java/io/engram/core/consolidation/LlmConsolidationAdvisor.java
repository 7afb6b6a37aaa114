package io.engram.core.consolidation;

import io.engram.core.lifecycle.PendingMemory;
import io.engram.core.model.ChatMessage;
import io.engram.core.provider.LlmProvider;
import io.engram.core.provider.LlmResponse;
import java.util.List;
import java.util.Objects;

public final class LlmConsolidationAdvisor implements ConsolidationAdvisor {
    public static final String DEFAULT_MODEL = "claude-3-5-haiku-20241022";

    private final LlmProvider provider;
    private final String model;
    private final ConsolidationPromptBuilder promptBuilder;
    private final ConsolidationResponseParser parser;

    public LlmConsolidationAdvisor(LlmProvider provider, String model) {
        this(provider, model, new ConsolidationPromptBuilder(), new ConsolidationResponseParser());
    }

    public LlmConsolidationAdvisor(
        LlmProvider provider,
        String model,
        ConsolidationPromptBuilder promptBuilder,
        ConsolidationResponseParser parser
    ) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.model = model == null || model.isBlank() ? DEFAULT_MODEL : model;
        this.promptBuilder = Objects.requireNonNull(promptBuilder, "promptBuilder must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    @Override
    public String name() {
        return provider.name() + "/" + model;
    }

    @Override
    public List<BatchDecision> review(List<PendingMemory> batch) throws AdvisorException {
        if (batch.isEmpty()) {
            return List.of();
        }
        LlmResponse response = provider.chat(model, List.of(ChatMessage.user(promptBuilder.build(batch))));
        if (response.isError()) {
            throw new AdvisorException(response.content());
        }
        return parser.parse(response.content(), batch.size());
    }
}
