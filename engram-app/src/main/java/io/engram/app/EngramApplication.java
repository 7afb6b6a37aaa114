package io.engram.app;

import io.engram.cli.CliContext;
import io.engram.cli.EngramCliCommand;
import io.engram.cli.EngramServices;
import io.engram.core.buffer.AutoCapture;
import io.engram.core.buffer.EngineBufferSink;
import io.engram.core.buffer.FallbackMemoryWriter;
import io.engram.core.buffer.HttpBufferSink;
import io.engram.core.buffer.OfflineBuffer;
import io.engram.core.config.ConfigPaths;
import io.engram.core.config.ConfigService;
import io.engram.core.config.model.ConsolidationConfig;
import io.engram.core.config.model.EmbeddingConfig;
import io.engram.core.config.model.EngramConfig;
import io.engram.core.config.model.ProviderConfig;
import io.engram.core.consolidation.ConsolidationWorker;
import io.engram.core.consolidation.LlmConsolidationAdvisor;
import io.engram.core.consolidation.SleepCycle;
import io.engram.core.consolidation.SleepCycleOptions;
import io.engram.core.embedding.EmbeddingModel;
import io.engram.core.embedding.HashingEmbeddingModel;
import io.engram.core.embedding.OpenAiEmbeddingModel;
import io.engram.core.lifecycle.LifecycleService;
import io.engram.core.memory.MemoryEngine;
import io.engram.core.memory.MemoryTypeClassifier;
import io.engram.core.memory.SqliteMemoryStore;
import io.engram.core.provider.AnthropicProvider;
import io.engram.core.provider.LlmProvider;
import io.engram.core.provider.OpenAiCompatProvider;
import io.engram.core.provider.ProviderRouter;
import io.engram.core.provider.UnconfiguredProvider;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class EngramApplication {
    private static final Logger LOG = LoggerFactory.getLogger(EngramApplication.class);

    private EngramApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        Clock clock = Clock.systemUTC();

        CliContext context = new CliContext(
            configService,
            configPath,
            () -> openServices(loadConfig(configService, configPath), configService, clock),
            interval -> runWorker(loadConfig(configService, configPath), configService, clock, interval)
        );

        int exitCode = EngramCliCommand.commandLine(context).execute(args);
        System.exit(exitCode);
    }

    private static EngramConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Falling back to default config: {}", e.getMessage());
            return EngramConfig.defaults();
        }
    }

    private static EngramServices openServices(EngramConfig config, ConfigService configService, Clock clock)
        throws IOException {
        SqliteMemoryStore store = new SqliteMemoryStore(configService.storePath(config));
        return buildServices(config, configService, store, clock);
    }

    private static EngramServices buildServices(
        EngramConfig config,
        ConfigService configService,
        SqliteMemoryStore store,
        Clock clock
    ) {
        MemoryEngine engine = new MemoryEngine(
            store,
            buildEmbeddingModel(config),
            new MemoryTypeClassifier(),
            clock,
            config.store().defaultAgent(),
            Duration.ofMillis(Math.round(config.store().workingTtlHours() * 3_600_000d))
        );
        LifecycleService lifecycle = new LifecycleService(store, clock);
        SleepCycle sleepCycle = new SleepCycle(lifecycle, buildAdvisor(config));
        OfflineBuffer buffer = new OfflineBuffer(configService.bufferPath(config), clock);
        return new EngramServices(
            engine,
            lifecycle,
            sleepCycle,
            new FallbackMemoryWriter(engine, buffer),
            buffer,
            new AutoCapture(buffer, clock),
            new HttpBufferSink(config.buffer().syncEndpoint()),
            new EngineBufferSink(engine)
        );
    }

    private static int runWorker(EngramConfig config, ConfigService configService, Clock clock, Duration interval)
        throws Exception {
        SqliteMemoryStore store = new SqliteMemoryStore(configService.storePath(config));
        EngramServices services = buildServices(config, configService, store, clock);
        ConsolidationConfig consolidation = config.consolidation();
        ConsolidationWorker.Thresholds thresholds = new ConsolidationWorker.Thresholds(
            consolidation.workingThreshold(),
            consolidation.expiredThreshold(),
            consolidation.thresholdsEnabled()
        );
        SleepCycleOptions options = new SleepCycleOptions(
            null,
            consolidation.limit(),
            consolidation.batchSize(),
            false
        );

        CountDownLatch shutdown = new CountDownLatch(1);
        try (ConsolidationWorker worker = new ConsolidationWorker(
            services.sleepCycle(),
            store,
            options,
            thresholds,
            clock
        )) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            worker.start(interval);
            System.out.println("Consolidation worker running every " + interval.toMinutes() + " minutes");
            shutdown.await();
        }
        return 0;
    }

    private static EmbeddingModel buildEmbeddingModel(EngramConfig config) {
        EmbeddingConfig embedding = config.embedding();
        String provider = embedding.provider() == null ? "" : embedding.provider().trim().toLowerCase(Locale.ROOT);
        if ("openai".equals(provider)) {
            ProviderConfig openai = config.providers().openai();
            if (openai.configured()) {
                return new OpenAiEmbeddingModel(
                    openai.apiKey(),
                    openai.apiBaseOr("https://api.openai.com/v1"),
                    embedding.model(),
                    embedding.dimensions()
                );
            }
            LOG.warn("OpenAI embeddings requested without an API key, using hashing embeddings");
        }
        return new HashingEmbeddingModel(embedding.dimensions());
    }

    private static LlmConsolidationAdvisor buildAdvisor(EngramConfig config) {
        ProviderRouter router = new ProviderRouter()
            .register(buildOpenAiCompatProvider(ProviderRouter.OPENROUTER, config.providers().openrouter(), "https://openrouter.ai/api/v1"))
            .register(buildOpenAiCompatProvider(ProviderRouter.OPENAI, config.providers().openai(), "https://api.openai.com/v1"))
            .register(buildAnthropicProvider(config.providers().anthropic(), "https://api.anthropic.com/v1"));
        ConsolidationConfig consolidation = config.consolidation();
        LlmProvider provider = router.resolve(consolidation.provider(), consolidation.model());
        return new LlmConsolidationAdvisor(provider, consolidation.model());
    }

    private static LlmProvider buildOpenAiCompatProvider(String name, ProviderConfig providerConfig, String defaultBase) {
        if (providerConfig != null && providerConfig.configured()) {
            return new OpenAiCompatProvider(
                name,
                providerConfig.apiKey(),
                providerConfig.apiBaseOr(defaultBase),
                providerConfig.extraHeaders()
            );
        }
        return new UnconfiguredProvider(name);
    }

    private static LlmProvider buildAnthropicProvider(ProviderConfig providerConfig, String defaultBase) {
        if (providerConfig != null && providerConfig.configured()) {
            return new AnthropicProvider(ProviderRouter.ANTHROPIC, providerConfig.apiKey(), providerConfig.apiBaseOr(defaultBase));
        }
        return new UnconfiguredProvider(ProviderRouter.ANTHROPIC);
    }
}
