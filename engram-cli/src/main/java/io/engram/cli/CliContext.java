package io.engram.cli;

import io.engram.core.config.ConfigService;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    ServicesProvider services,
    WorkerRunner workerRunner
) {
    public CliContext(ConfigService configService, Path configPath, ServicesProvider services) {
        this(configService, configPath, services, interval -> {
            throw new UnsupportedOperationException("worker runner is not configured");
        });
    }
}
