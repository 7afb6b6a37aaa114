package io.engram.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.engram.core.config.model.ConsolidationConfig;
import io.engram.core.config.model.EngramConfig;
import io.engram.core.config.model.ProviderConfig;
import io.engram.core.config.model.ProvidersConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads {@code ~/.engram/config.json} over the built-in defaults. Environment variables override the store
 * and buffer paths and fill provider API keys the file leaves empty.
 */
public final class ConfigService {
    static final String OPENROUTER_KEY_ENV = "OPENROUTER_API_KEY";
    static final String OPENAI_KEY_ENV = "OPENAI_API_KEY";
    static final String ANTHROPIC_KEY_ENV = "ANTHROPIC_API_KEY";

    private final ObjectMapper mapper;
    private final Map<String, String> env;

    public ConfigService() {
        this(System.getenv());
    }

    public ConfigService(Map<String, String> env) {
        this.env = env == null ? Map.of() : Map.copyOf(env);
        this.mapper = new ObjectMapper();
    }

    public EngramConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        EngramConfig config = EngramConfig.defaults();
        if (Files.exists(configPath)) {
            JsonNode merged = deepMerge(mapper.valueToTree(config), mapper.readTree(Files.readString(configPath)));
            config = mapper.treeToValue(merged, EngramConfig.class);
        }
        List<String> problems = validate(config);
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("Invalid config " + configPath + ": " + String.join(", ", problems));
        }
        return withEnvironmentKeys(config);
    }

    public void save(Path configPath, EngramConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        Files.writeString(configPath, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config)
            + System.lineSeparator());
    }

    /**
     * Writes the config file and creates the directories the store and the offline buffer live in. An
     * existing file is re-saved with any newly added defaults unless {@code overwrite} resets it.
     */
    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        OnboardResult.Action action;
        EngramConfig config;
        if (!Files.exists(configPath)) {
            action = OnboardResult.Action.CREATED;
            config = EngramConfig.defaults();
        } else if (overwrite) {
            action = OnboardResult.Action.OVERWRITTEN;
            config = EngramConfig.defaults();
        } else {
            action = OnboardResult.Action.REFRESHED;
            JsonNode merged = deepMerge(mapper.valueToTree(EngramConfig.defaults()),
                mapper.readTree(Files.readString(configPath)));
            config = mapper.treeToValue(merged, EngramConfig.class);
        }
        save(configPath, config);

        Path storePath = storePath(config);
        Path bufferPath = bufferPath(config);
        Files.createDirectories(storePath.toAbsolutePath().getParent());
        Files.createDirectories(bufferPath.toAbsolutePath().getParent());
        return new OnboardResult(configPath, storePath, bufferPath, action);
    }

    public Path storePath(EngramConfig config) {
        return ConfigPaths.resolveStorePath(config.store().path(), env);
    }

    public Path bufferPath(EngramConfig config) {
        return ConfigPaths.resolveBufferPath(config.buffer().path(), env);
    }

    static List<String> validate(EngramConfig config) {
        List<String> problems = new ArrayList<>();
        if (!(config.store().workingTtlHours() > 0.0)) {
            problems.add("store.workingTtlHours must be > 0");
        }
        if (config.embedding().dimensions() < 1) {
            problems.add("embedding.dimensions must be >= 1");
        }
        ConsolidationConfig consolidation = config.consolidation();
        if (consolidation.batchSize() < 1) {
            problems.add("consolidation.batchSize must be >= 1");
        }
        if (consolidation.limit() < 1) {
            problems.add("consolidation.limit must be >= 1");
        }
        if (consolidation.intervalMinutes() < 1) {
            problems.add("consolidation.intervalMinutes must be >= 1");
        }
        return problems;
    }

    private EngramConfig withEnvironmentKeys(EngramConfig config) {
        ProvidersConfig providers = config.providers();
        ProvidersConfig resolved = new ProvidersConfig(
            keyFromEnv(providers.openrouter(), OPENROUTER_KEY_ENV),
            keyFromEnv(providers.openai(), OPENAI_KEY_ENV),
            keyFromEnv(providers.anthropic(), ANTHROPIC_KEY_ENV)
        );
        return new EngramConfig(config.store(), config.embedding(), config.consolidation(), config.buffer(), resolved);
    }

    private ProviderConfig keyFromEnv(ProviderConfig provider, String variable) {
        String key = env.get(variable);
        if (provider.configured() || key == null || key.isBlank()) {
            return provider;
        }
        return new ProviderConfig(key.trim(), provider.apiBase(), provider.extraHeaders());
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null || override.isNull()) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry ->
            merged.set(entry.getKey(), deepMerge(merged.get(entry.getKey()), entry.getValue())));
        return merged;
    }
}
