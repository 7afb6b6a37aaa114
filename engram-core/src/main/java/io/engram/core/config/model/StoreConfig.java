package io.engram.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StoreConfig(
    String path,
    @JsonAlias({"default_agent"}) String defaultAgent,
    @JsonAlias({"working_ttl_hours"}) double workingTtlHours
) {

    public static StoreConfig defaults() {
        return new StoreConfig("~/.engram/data/engram.db", "default", 2.0);
    }
}
