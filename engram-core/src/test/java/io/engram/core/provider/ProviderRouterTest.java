package io.engram.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.engram.core.model.ChatMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProviderRouterTest {

    @Test
    void shouldRouteByModelFamily() {
        ProviderRouter router = new ProviderRouter()
            .register(new StubProvider("anthropic", "ok"))
            .register(new StubProvider("openai", "ok"))
            .register(new StubProvider("openrouter", "ok"));

        assertThat(router.resolve(null, "claude-3-5-haiku-20241022").name()).isEqualTo("anthropic");
        assertThat(router.resolve("", "gpt-4o-mini").name()).isEqualTo("openai");
        assertThat(router.resolve(null, "o3-mini").name()).isEqualTo("openai");
        assertThat(router.resolve(null, "openai/o4-mini").name()).isEqualTo("openai");
        assertThat(router.resolve(null, "anthropic/claude-3-haiku").name()).isEqualTo("openrouter");
        assertThat(router.resolve(null, "meta-llama/llama-3.1-8b").name()).isEqualTo("openrouter");
        assertThat(router.resolve(null, null).name()).isEqualTo("openrouter");
    }

    @Test
    void shouldPreferExplicitProvider() {
        ProviderRouter router = new ProviderRouter()
            .register(new StubProvider("anthropic", "ok"))
            .register(new StubProvider("openrouter", "ok"));

        assertThat(router.resolve(" OpenRouter ", "claude-3-5-haiku-20241022").name()).isEqualTo("openrouter");
        assertThat(router.names()).containsExactlyInAnyOrder("anthropic", "openrouter");
    }

    @Test
    void shouldFailForMissingProviders() {
        ProviderRouter router = new ProviderRouter().register(new StubProvider("openrouter", "ok"));

        assertThatThrownBy(() -> router.resolve("missing", "gpt-5"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown provider: missing");
        assertThatThrownBy(() -> router.resolve(null, "claude-3-opus"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("anthropic is not registered");
    }

    @Test
    void shouldReturnErrorOfResolvedProviderWithoutTryingOthers() {
        StubProvider openai = new StubProvider("openai", null);
        StubProvider anthropic = new StubProvider("anthropic", "from anthropic");
        ProviderRouter router = new ProviderRouter().register(openai).register(anthropic);

        LlmResponse response = router.resolve("openai", "gpt-4o-mini")
            .chat("gpt-4o-mini", List.of(ChatMessage.user("hi")));

        assertThat(response.isError()).isTrue();
        assertThat(response.content()).contains("openai is down");
        assertThat(anthropic.calls()).isEmpty();
    }

    private record StubProvider(String name, String answer, List<String> calls) implements LlmProvider {
        StubProvider(String name, String answer) {
            this(name, answer, new ArrayList<>());
        }

        @Override
        public LlmResponse chat(String model, List<ChatMessage> messages) {
            calls.add(model);
            return answer == null ? LlmResponse.error(name + " is down") : new LlmResponse(answer, Map.of());
        }
    }
}
