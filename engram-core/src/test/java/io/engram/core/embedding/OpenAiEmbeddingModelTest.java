package io.engram.core.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.util.List;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenAiEmbeddingModelTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldRequestAndParseEmbedding() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"data\":[{\"embedding\":[0.1,0.2,0.3]}]}"));

        OpenAiEmbeddingModel model = new OpenAiEmbeddingModel("sk-test", server.url("/v1").toString(),
            "text-embedding-3-small", 3);

        List<Double> vector = model.embed("hello");

        assertThat(vector).containsExactly(0.1, 0.2, 0.3);
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/embeddings");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        assertThat(request.getBody().readUtf8())
            .contains("\"model\":\"text-embedding-3-small\"")
            .contains("\"dimensions\":3");
    }

    @Test
    void shouldFailOnDimensionMismatch() {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"data\":[{\"embedding\":[0.1,0.2]}]}"));

        OpenAiEmbeddingModel model = new OpenAiEmbeddingModel("sk-test", server.url("/v1").toString(),
            "text-embedding-3-small", 3);

        assertThatThrownBy(() -> model.embed("hello"))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("expected 3");
    }

    @Test
    void shouldFailOnHttpError() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("down"));

        OpenAiEmbeddingModel model = new OpenAiEmbeddingModel("sk-test", server.url("/v1").toString(),
            "text-embedding-3-small", 3);

        assertThatThrownBy(() -> model.embed("hello"))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("HTTP 500");
    }
}
