package io.engram.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BufferConfig(
    String path,
    @JsonAlias({"sync_endpoint"}) String syncEndpoint
) {

    public static BufferConfig defaults() {
        return new BufferConfig("~/.engram/queue.jsonl", "http://localhost:8080");
    }
}
