package io.engram.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ConsolidationConfig(
    String provider,
    String model,
    @JsonAlias({"batch_size"}) int batchSize,
    int limit,
    @JsonAlias({"interval_minutes"}) int intervalMinutes,
    @JsonAlias({"working_threshold"}) int workingThreshold,
    @JsonAlias({"expired_threshold"}) int expiredThreshold,
    @JsonAlias({"thresholds_enabled"}) boolean thresholdsEnabled
) {

    public static ConsolidationConfig defaults() {
        return new ConsolidationConfig("", "claude-3-5-haiku-20241022", 20, 200, 30, 300, 50, true);
    }
}
