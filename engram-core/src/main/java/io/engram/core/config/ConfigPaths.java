package io.engram.core.config;

import java.nio.file.Path;
import java.util.Map;

public final class ConfigPaths {
    public static final String DB_PATH_ENV = "ENGRAM_DB_PATH";
    public static final String BUFFER_PATH_ENV = "ENGRAM_BUFFER_PATH";

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return engramHome().resolve("config.json");
    }

    public static Path resolveStorePath(String configuredPath, Map<String, String> env) {
        return resolve(env.get(DB_PATH_ENV), configuredPath, engramHome().resolve("data").resolve("engram.db"));
    }

    public static Path resolveBufferPath(String configuredPath, Map<String, String> env) {
        return resolve(env.get(BUFFER_PATH_ENV), configuredPath, engramHome().resolve("queue.jsonl"));
    }

    private static Path resolve(String override, String configuredPath, Path fallback) {
        if (override != null && !override.isBlank()) {
            return expand(override.trim());
        }
        if (configuredPath == null || configuredPath.isBlank()) {
            return fallback;
        }
        return expand(configuredPath.trim());
    }

    private static Path engramHome() {
        return Path.of(System.getProperty("user.home"), ".engram");
    }

    static Path expand(String rawPath) {
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
