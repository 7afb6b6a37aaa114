package io.engram.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.engram.core.buffer.AutoCapture;
import io.engram.core.buffer.EngineBufferSink;
import io.engram.core.buffer.FallbackMemoryWriter;
import io.engram.core.buffer.HttpBufferSink;
import io.engram.core.buffer.OfflineBuffer;
import io.engram.core.config.ConfigPaths;
import io.engram.core.config.ConfigService;
import io.engram.core.consolidation.BatchDecision;
import io.engram.core.consolidation.ConsolidationAdvisor;
import io.engram.core.consolidation.ReviewCategory;
import io.engram.core.consolidation.SleepCycle;
import io.engram.core.embedding.HashingEmbeddingModel;
import io.engram.core.lifecycle.LifecycleService;
import io.engram.core.lifecycle.PendingMemory;
import io.engram.core.memory.MemoryEngine;
import io.engram.core.memory.SqliteMemoryStore;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EngramCliIntegrationTest {

    private static final Instant START = Instant.parse("2026-03-01T09:00:00Z");

    @TempDir
    Path tempDir;

    private MockWebServer server;
    private SteppingClock clock;
    private CliContext context;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        clock = new SteppingClock(START);
        context = new CliContext(new ConfigService(Map.of()), tempDir.resolve("config.json"), this::openServices);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldRememberAndRecallThroughCommands() {
        Run remember = run("remember", "Standup moved to ten", "--tags", "team,schedule");
        assertThat(remember.code()).isZero();
        assertThat(remember.out()).contains("Stored memory 1");

        Run recall = run("recall", "Standup moved to ten");
        assertThat(recall.code()).isZero();
        assertThat(recall.out()).contains("#1 [working/").contains("1.500 Standup moved to ten");

        Run json = run("recall", "Standup moved to ten", "--json");
        assertThat(json.out()).contains("\"temporalLayer\" : \"working\"");

        Run stats = run("stats");
        assertThat(stats.out())
            .contains("Total memories: 1")
            .contains("Total accesses: 2")
            .contains("  working: 1");
    }

    @Test
    void shouldApplyAndListReviewDecisions() {
        run("remember", "Quarterly roadmap lives in the planning doc", "--layer", "short");

        Run decide = run("review", "decide", "1", "archive", "--reason", "superseded", "--reviewer", "alice");
        assertThat(decide.code()).isZero();
        assertThat(decide.out()).contains("Memory 1 archive: short -> archive (archived)");

        Run history = run("review", "history", "1");
        assertThat(history.out()).contains("archive short -> archive by alice: superseded");

        Run empty = run("review", "history", "42");
        assertThat(empty.out()).contains("No review history for memory 42");
    }

    @Test
    void shouldReportFailuresOnStderrWithExitCodeOne() {
        Run missing = run("review", "decide", "99", "promote");
        assertThat(missing.code()).isEqualTo(1);
        assertThat(missing.err()).contains("Review decide failed:");

        Run invalid = run("remember", "Too sure", "--importance", "3");
        assertThat(invalid.code()).isEqualTo(1);
        assertThat(invalid.err()).contains("Remember failed: importanceScore must be within [0, 1]");
    }

    @Test
    void shouldConsolidateLapsedWorkingMemories() {
        run("remember", "Prefer tabs in the build scripts", "--ttl-hours", "1");
        clock.advance(Duration.ofHours(2));

        Run pending = run("review", "pending");
        assertThat(pending.out()).contains("Pending review: 1").contains("#1 [working/expired]");

        Run dryRun = run("sleep", "--dry-run");
        assertThat(dryRun.code()).isZero();
        assertThat(dryRun.out())
            .contains("#1 important -> promote")
            .contains("Planned 1 memories: promoted=1 extended=0 archived=0 forgotten=0");

        Run sleep = run("sleep");
        assertThat(sleep.out()).contains("Consolidated 1 memories: promoted=1");

        assertThat(run("review", "history", "1").out()).contains("promote working -> long by sleep-cycle");
        assertThat(run("sleep").out()).contains("Nothing to consolidate.");
    }

    @Test
    void shouldCaptureEventsAndSyncBufferToRemoteService() throws Exception {
        Run capture = run("capture", "decision", "Chose SQLite for the local store", "--tags", "storage");
        assertThat(capture.code()).isZero();
        assertThat(capture.out()).contains("Captured decision,auto-captured,storage for 3.0h in projects");

        assertThat(run("buffer", "status").out()).contains("Buffered memories: 1");

        server.enqueue(new MockResponse().setResponseCode(201));
        Run sync = run("buffer", "sync");
        assertThat(sync.code()).isZero();
        assertThat(sync.out()).contains("Synced 1 via").contains("0 still buffered");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/api/v1/remember");
        assertThat(request.getBody().readUtf8()).contains("\"temporal_layer\":\"working\"");

        assertThat(run("buffer", "status").out()).contains("Buffered memories: 0");
    }

    @Test
    void shouldKeepFailedRecordsAndPurgeByTag() {
        run("capture", "tool_use", "Ran the formatter");
        run("capture", "error", "Formatter crashed");

        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setResponseCode(500));
        Run sync = run("buffer", "sync");
        assertThat(sync.code()).isEqualTo(1);
        assertThat(sync.out()).contains("Synced 0 via").contains("2 still buffered");

        Run purge = run("buffer", "purge-tag", "tool_use");
        assertThat(purge.out()).contains("Removed 1 buffered memories tagged 'tool_use'");

        Run local = run("buffer", "sync", "--local");
        assertThat(local.code()).isZero();
        assertThat(local.out()).contains("Synced 1 via local-engine, 0 still buffered");
        assertThat(run("stats").out()).contains("Total memories: 1");
    }

    @Test
    void shouldOnboardConfigAndReportStatus() throws Exception {
        Path dbPath = tempDir.resolve("data").resolve("engram.db");
        Path configPath = tempDir.resolve("home").resolve("config.json");
        CliContext onboardContext = new CliContext(
            new ConfigService(Map.of(
                ConfigPaths.DB_PATH_ENV, dbPath.toString(),
                ConfigPaths.BUFFER_PATH_ENV, tempDir.resolve("queue").resolve("queue.jsonl").toString()
            )),
            configPath,
            this::openServices
        );

        Run onboard = run(onboardContext, "onboard");
        assertThat(onboard.code()).isZero();
        assertThat(onboard.out())
            .contains("Created config: " + configPath)
            .contains("Memory store: " + dbPath);
        assertThat(Files.exists(configPath)).isTrue();

        Run again = run(onboardContext, "onboard", "--overwrite");
        assertThat(again.out()).contains("Reset config to defaults: " + configPath);

        Run status = run(onboardContext, "status");
        assertThat(status.code()).isZero();
        assertThat(status.out())
            .contains("Config: " + configPath)
            .contains("Memory store: " + dbPath + " (not created yet)")
            .contains("Providers with keys: none");
    }

    private EngramServices openServices() throws IOException {
        SqliteMemoryStore store = new SqliteMemoryStore(tempDir.resolve("engram.db"));
        MemoryEngine engine = new MemoryEngine(store, new HashingEmbeddingModel(), clock);
        LifecycleService lifecycle = new LifecycleService(store, clock);
        OfflineBuffer buffer = new OfflineBuffer(tempDir.resolve("buffer.jsonl"), clock);
        return new EngramServices(
            engine,
            lifecycle,
            new SleepCycle(lifecycle, new KeepEverythingAdvisor()),
            new FallbackMemoryWriter(engine, buffer),
            buffer,
            new AutoCapture(buffer, clock),
            new HttpBufferSink(server.url("/").toString()),
            new EngineBufferSink(engine)
        );
    }

    private Run run(String... args) {
        return run(context, args);
    }

    private static Run run(CliContext cliContext, String... args) {
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            int code = EngramCliCommand.commandLine(cliContext).execute(args);
            return new Run(code, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private record Run(int code, String out, String err) {
    }

    private static final class KeepEverythingAdvisor implements ConsolidationAdvisor {
        @Override
        public String name() {
            return "keep-everything";
        }

        @Override
        public List<BatchDecision> review(List<PendingMemory> batch) {
            List<BatchDecision> decisions = new ArrayList<>();
            for (int i = 0; i < batch.size(); i++) {
                decisions.add(new BatchDecision(i + 1, ReviewCategory.IMPORTANT, "keep"));
            }
            return decisions;
        }
    }

    private static final class SteppingClock extends Clock {
        private Instant now;

        private SteppingClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
