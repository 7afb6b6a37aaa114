package io.engram.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * {@code provider} is {@code hashing} (local, default) or {@code openai}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EmbeddingConfig(String provider, String model, int dimensions) {

    public static EmbeddingConfig defaults() {
        return new EmbeddingConfig("hashing", "text-embedding-3-small", 256);
    }
}
