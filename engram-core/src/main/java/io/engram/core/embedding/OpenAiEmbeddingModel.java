package io.engram.core.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

public final class OpenAiEmbeddingModel implements EmbeddingModel {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_INPUT_CHARS = 8000;

    private final String apiKey;
    private final HttpUrl apiBase;
    private final String model;
    private final int dimensions;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public OpenAiEmbeddingModel(String apiKey, String apiBase, String model, int dimensions) {
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.model = Objects.requireNonNull(model, "model must not be null");
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be > 0");
        }
        this.dimensions = dimensions;
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .readTimeout(Duration.ofSeconds(30))
            .writeTimeout(Duration.ofSeconds(10))
            .retryOnConnectionFailure(false)
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return model;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public List<Double> embed(String text) throws IOException {
        if (apiKey.isBlank()) {
            throw new IOException("Embedding provider is missing an API key");
        }
        String input = text == null ? "" : text;
        if (input.length() > MAX_INPUT_CHARS) {
            input = input.substring(0, MAX_INPUT_CHARS);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("input", input);
        payload.put("dimensions", dimensions);

        Request request = new Request.Builder()
            .url(apiBase.newBuilder().addPathSegment("embeddings").build())
            .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json")
            .build();

        try (Response response = client.newCall(request).execute()) {
            String body = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                throw new IOException("Embedding API returned HTTP " + response.code() + ": " + body);
            }
            return parse(body);
        }
    }

    private List<Double> parse(String body) throws IOException {
        JsonNode vector = mapper.readTree(body).path("data").path(0).path("embedding");
        if (!vector.isArray() || vector.isEmpty()) {
            throw new IOException("Embedding response has no vector");
        }
        if (vector.size() != dimensions) {
            throw new IOException("Embedding has " + vector.size() + " dimensions, expected " + dimensions);
        }
        List<Double> out = new ArrayList<>(vector.size());
        for (JsonNode value : vector) {
            out.add(value.asDouble());
        }
        return out;
    }
}
