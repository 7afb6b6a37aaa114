package io.engram.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EngramConfig(
    StoreConfig store,
    EmbeddingConfig embedding,
    ConsolidationConfig consolidation,
    BufferConfig buffer,
    ProvidersConfig providers
) {

    public static EngramConfig defaults() {
        return new EngramConfig(
            StoreConfig.defaults(),
            EmbeddingConfig.defaults(),
            ConsolidationConfig.defaults(),
            BufferConfig.defaults(),
            ProvidersConfig.defaults()
        );
    }
}
