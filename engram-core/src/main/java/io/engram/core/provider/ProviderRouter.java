package io.engram.core.provider;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Chooses the transport for a consolidation model. An explicit provider name wins; otherwise the model
 * family decides, and anything unrecognised goes through OpenRouter. The chosen provider is the only one
 * asked; its error ends the call.
 */
public final class ProviderRouter {
    public static final String OPENROUTER = "openrouter";
    public static final String OPENAI = "openai";
    public static final String ANTHROPIC = "anthropic";

    private final Map<String, LlmProvider> providers = new LinkedHashMap<>();

    public ProviderRouter register(LlmProvider provider) {
        providers.put(key(provider.name()), provider);
        return this;
    }

    public Set<String> names() {
        return Set.copyOf(providers.keySet());
    }

    public LlmProvider resolve(String preferredProvider, String model) {
        boolean explicit = preferredProvider != null && !preferredProvider.isBlank();
        String name = explicit ? key(preferredProvider) : familyOf(model);
        LlmProvider provider = providers.get(name);
        if (provider == null) {
            throw new IllegalArgumentException(explicit
                ? "Unknown provider: " + preferredProvider
                : "Provider " + name + " is not registered for model " + model);
        }
        return provider;
    }

    static String familyOf(String model) {
        String normalized = model == null ? "" : model.trim().toLowerCase(Locale.ROOT);
        if (normalized.contains("/")) {
            return normalized.startsWith("openai/") ? OPENAI : OPENROUTER;
        }
        if (normalized.startsWith("claude")) {
            return ANTHROPIC;
        }
        if (normalized.startsWith("gpt") || normalized.matches("o\\d.*")) {
            return OPENAI;
        }
        return OPENROUTER;
    }

    private static String key(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
