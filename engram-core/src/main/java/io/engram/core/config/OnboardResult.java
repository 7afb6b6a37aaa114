package io.engram.core.config;

import java.nio.file.Path;

public record OnboardResult(Path configPath, Path storePath, Path bufferPath, Action action) {

    public enum Action {
        CREATED,
        OVERWRITTEN,
        REFRESHED
    }
}
