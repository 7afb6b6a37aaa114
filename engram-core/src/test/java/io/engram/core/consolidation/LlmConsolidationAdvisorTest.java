package io.engram.core.consolidation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.engram.core.memory.MemoryDomain;
import io.engram.core.provider.AnthropicProvider;
import java.io.IOException;
import java.util.List;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LlmConsolidationAdvisorTest {

    private MockWebServer server;
    private LlmConsolidationAdvisor advisor;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        advisor = new LlmConsolidationAdvisor(
            new AnthropicProvider("anthropic", "sk-ant", server.url("/v1").toString()),
            null
        );
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldSendPromptAndParseVerdicts() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {"content": [{"type": "text", "text": "[{\\"id\\": 1, \\"decision\\": \\"archive\\", \\"reason\\": \\"done\\"}]"}]}
                """));

        List<BatchDecision> decisions = advisor.review(List.of(
            ConsolidationPromptBuilderTest.pending(5L, MemoryDomain.PROJECTS, "Closed the Q3 migration epic")));

        assertThat(decisions).containsExactly(new BatchDecision(1, ReviewCategory.ARCHIVE, "done"));
        assertThat(advisor.name()).isEqualTo("anthropic/" + LlmConsolidationAdvisor.DEFAULT_MODEL);
        RecordedRequest request = server.takeRequest();
        String body = request.getBody().readUtf8();
        assertThat(body).contains("\"model\":\"" + LlmConsolidationAdvisor.DEFAULT_MODEL + "\"");
        assertThat(body).contains("1. [projects] Closed the Q3 migration epic");
    }

    @Test
    void shouldTurnProviderErrorIntoAdvisorException() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("overloaded"));

        assertThatThrownBy(() -> advisor.review(List.of(
            ConsolidationPromptBuilderTest.pending(5L, MemoryDomain.GENERAL, "anything"))))
            .isInstanceOf(AdvisorException.class)
            .hasMessageContaining("HTTP 500");
    }

    @Test
    void shouldNotCallProviderForEmptyBatch() throws Exception {
        assertThat(advisor.review(List.of())).isEmpty();
        assertThat(server.getRequestCount()).isZero();
    }
}
