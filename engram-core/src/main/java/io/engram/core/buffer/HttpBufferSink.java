package io.engram.core.buffer;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Replays buffered writes against a remote memory service's {@code POST /api/v1/remember}.
 */
public final class HttpBufferSink implements BufferSink {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final HttpUrl endpoint;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public HttpBufferSink(String baseUrl) {
        this.endpoint = HttpUrl.get(Objects.requireNonNull(baseUrl, "baseUrl must not be null")).newBuilder()
            .addPathSegment("api")
            .addPathSegment("v1")
            .addPathSegment("remember")
            .build();
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(5))
            .readTimeout(Duration.ofSeconds(5))
            .writeTimeout(Duration.ofSeconds(5))
            .retryOnConnectionFailure(false)
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return endpoint.toString();
    }

    @Override
    public void deliver(BufferedMemory memory) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("content", memory.content());
        payload.put("domain", memory.domain().wireName());
        payload.put("temporal_layer", memory.temporalLayer().wireName());
        if (memory.ttlHours() != null) {
            payload.put("ttl_hours", memory.ttlHours());
        }
        payload.put("tags", memory.tags());
        payload.put("metadata", memory.metadata());
        if (memory.timestamp() != null) {
            payload.put("timestamp", memory.timestamp().toString());
        }

        Request request = new Request.Builder()
            .url(endpoint)
            .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
            .header("Content-Type", "application/json")
            .build();
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("Remember endpoint returned HTTP " + response.code());
            }
        }
    }
}
