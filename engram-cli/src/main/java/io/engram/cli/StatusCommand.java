package io.engram.cli;

import io.engram.core.config.model.ConsolidationConfig;
import io.engram.core.config.model.EngramConfig;
import io.engram.core.config.model.ProvidersConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show where memories are stored and how consolidation is configured")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Path configPath = context.configPath();
            EngramConfig config = context.configService().load(configPath);
            Path storePath = context.configService().storePath(config);
            Path bufferPath = context.configService().bufferPath(config);
            ConsolidationConfig consolidation = config.consolidation();

            System.out.println("Config: " + configPath + (Files.exists(configPath) ? "" : " (defaults, run onboard)"));
            System.out.println("Memory store: " + storePath + (Files.exists(storePath) ? "" : " (not created yet)"));
            System.out.println("Offline buffer: " + bufferPath + (Files.exists(bufferPath) ? "" : " (empty)"));
            System.out.printf(Locale.ROOT, "Default agent: %s, working TTL %.1fh%n",
                config.store().defaultAgent(), config.store().workingTtlHours());
            System.out.println("Embeddings: " + config.embedding().provider() + " (" + config.embedding().dimensions() + " dims)");
            System.out.println("Sleep cycle: " + consolidation.model()
                + ", batch " + consolidation.batchSize() + ", limit " + consolidation.limit()
                + ", every " + consolidation.intervalMinutes() + " min");
            System.out.println("Providers with keys: " + configuredProviders(config.providers()));
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }

    private static String configuredProviders(ProvidersConfig providers) {
        List<String> names = new ArrayList<>();
        if (providers.openrouter().configured()) {
            names.add("openrouter");
        }
        if (providers.openai().configured()) {
            names.add("openai");
        }
        if (providers.anthropic().configured()) {
            names.add("anthropic");
        }
        return names.isEmpty() ? "none" : String.join(", ", names);
    }
}
