package io.engram.core.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.engram.core.memory.query.RecallPredicates;
import io.engram.core.testing.ConceptEmbeddingModel;
import io.engram.core.testing.MutableClock;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MemoryEngineTest {

    private static final Instant START = Instant.parse("2026-03-01T09:00:00Z");

    @TempDir
    Path tempDir;

    private SqliteMemoryStore store;
    private ConceptEmbeddingModel embeddings;
    private MutableClock clock;
    private MemoryEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        store = new SqliteMemoryStore(tempDir.resolve("engram.db"));
        embeddings = new ConceptEmbeddingModel();
        clock = new MutableClock(START);
        engine = new MemoryEngine(store, embeddings, clock);
    }

    @Test
    void shouldRecallRelatedDecisionByMeaning() throws Exception {
        long decision = engine.remember(RememberRequest.of(
                "We decided to use PostgreSQL as the primary database for the billing service", "assistant")
            .withTags(List.of("database"))
            .withTemporalLayer(TemporalLayer.LONG));
        engine.remember(RememberRequest.of("Lunch is served at noon", "assistant").withTemporalLayer(TemporalLayer.LONG));

        List<RecallResult> results = engine.recall(RecallRequest.of("which database did we pick?", "assistant")
            .withMinScore(0.3));

        assertThat(results).hasSize(1);
        RecallResult result = results.get(0);
        assertThat(result.id()).isEqualTo(decision);
        assertThat(result.memoryType()).isEqualTo(MemoryType.DECISIONS);
        assertThat(result.similarity()).isGreaterThan(0.9);
        assertThat(result.content()).startsWith("We decided to use PostgreSQL");
        assertThat(store.find(decision).orElseThrow().accessCount()).isEqualTo(1);
    }

    @Test
    void shouldDefaultNewMemoriesToWorkingLayerWithTtl() throws Exception {
        long id = engine.remember(RememberRequest.of("Deploy freeze starts on Friday", null));

        Memory saved = store.find(id).orElseThrow();
        assertThat(saved.agentName()).isEqualTo(MemoryEngine.DEFAULT_AGENT);
        assertThat(saved.temporalLayer()).isEqualTo(TemporalLayer.WORKING);
        assertThat(saved.expiresAt()).isEqualTo(START.plus(Duration.ofHours(2)));
        assertThat(saved.importanceScore()).isEqualTo(MemoryEngine.DEFAULT_IMPORTANCE);

        long custom = engine.remember(RememberRequest.of("Release notes due", null).withTtlHours(0.5));
        assertThat(store.find(custom).orElseThrow().expiresAt()).isEqualTo(START.plus(Duration.ofMinutes(30)));

        long durable = engine.remember(RememberRequest.of("Release cadence is weekly", null)
            .withTemporalLayer(TemporalLayer.SHORT)
            .withTtlHours(5.0));
        assertThat(store.find(durable).orElseThrow().expiresAt()).isNull();
    }

    @Test
    void shouldWeightSimilarityByTemporalLayer() throws Exception {
        embeddings.pin("working note", List.of(0.8, 0.6, 0.0, 0.0, 0.0));
        embeddings.pin("archived note", List.of(0.8, 0.6, 0.0, 0.0, 0.0));
        embeddings.pin("probe", List.of(1.0, 0.0, 0.0, 0.0, 0.0));
        engine.remember(RememberRequest.of("working note", "assistant"));
        engine.remember(RememberRequest.of("archived note", "assistant").withTemporalLayer(TemporalLayer.ARCHIVE));

        List<RecallResult> results = engine.recall(RecallRequest.of("probe", "assistant")
            .withIncludeArchive(true)
            .withMinScore(0.0));

        assertThat(results).hasSize(2);
        assertThat(results.get(0).temporalLayer()).isEqualTo(TemporalLayer.WORKING);
        assertThat(results.get(0).similarity()).isCloseTo(1.2, within(1e-9));
        assertThat(results.get(1).temporalLayer()).isEqualTo(TemporalLayer.ARCHIVE);
        assertThat(results.get(1).similarity()).isCloseTo(0.4, within(1e-9));
    }

    @Test
    void shouldExcludeArchiveUnlessRequested() throws Exception {
        engine.remember(RememberRequest.of("Old billing invoice process", "assistant")
            .withTemporalLayer(TemporalLayer.ARCHIVE));

        assertThat(engine.recall(RecallRequest.of("billing", "assistant").withMinScore(0.1))).isEmpty();
        assertThat(engine.recall(RecallRequest.of("billing", "assistant").withMinScore(0.1).withIncludeArchive(true)))
            .hasSize(1);
        assertThat(engine.recall(RecallRequest.of("billing", "assistant").withMinScore(0.1)
            .withTemporalLayers(Set.of(TemporalLayer.ARCHIVE)))).hasSize(1);
    }

    @Test
    void shouldHideLapsedWorkingMemoryWhileKeepingItActiveUntilReviewed() throws Exception {
        long id = engine.remember(RememberRequest.of("Friday deploy checklist", "assistant"));

        clock.advance(Duration.ofHours(3));

        assertThat(engine.recall(RecallRequest.of("deploy", "assistant").withMinScore(0.1))).isEmpty();
        assertThat(store.find(id).orElseThrow().status()).isEqualTo(MemoryStatus.ACTIVE);

        store.pendingReview(null, clock.instant(), 10);

        assertThat(store.find(id).orElseThrow().status()).isEqualTo(MemoryStatus.EXPIRED);
    }

    @Test
    void shouldBreakTiesByImportanceThenId() throws Exception {
        long low = engine.remember(RememberRequest.of("deploy on friday", "assistant")
            .withTemporalLayer(TemporalLayer.LONG).withImportance(0.2));
        long high = engine.remember(RememberRequest.of("release on friday", "assistant")
            .withTemporalLayer(TemporalLayer.LONG).withImportance(0.9));
        long second = engine.remember(RememberRequest.of("deploy friday", "assistant")
            .withTemporalLayer(TemporalLayer.LONG).withImportance(0.2));

        List<RecallResult> results = engine.recall(RecallRequest.of("release", "assistant").withMinScore(0.1));

        assertThat(results).extracting(RecallResult::id).containsExactly(high, low, second);
    }

    @Test
    void shouldLimitResultsAndLayerDepth() throws Exception {
        String longText = "We decided the billing database " + "detail ".repeat(80);
        engine.remember(RememberRequest.of(longText, "assistant").withTemporalLayer(TemporalLayer.LONG));
        engine.remember(RememberRequest.of("billing database again", "assistant").withTemporalLayer(TemporalLayer.LONG));

        List<RecallResult> shallow = engine.recall(RecallRequest.of("billing database", "assistant")
            .withMinScore(0.1).withMaxLayer(1).withLimit(1));

        assertThat(shallow).hasSize(1);
        assertThat(shallow.get(0).content().split(" ")).hasSizeLessThanOrEqualTo(LayeredContent.LAYER1_WORDS);
    }

    @Test
    void shouldReturnRankedResultsWhenAccessLogCannotBeWritten() throws Exception {
        embeddings.pin("working note", List.of(0.8, 0.6, 0.0, 0.0, 0.0));
        embeddings.pin("long note", List.of(0.6, 0.8, 0.0, 0.0, 0.0));
        embeddings.pin("probe", List.of(1.0, 0.0, 0.0, 0.0, 0.0));
        long working = engine.remember(RememberRequest.of("working note", "assistant"));
        long durable = engine.remember(RememberRequest.of("long note", "assistant").withTemporalLayer(TemporalLayer.LONG));
        MemoryEngine degraded = new MemoryEngine(new AccessLogDownStore(store), embeddings, clock);

        List<RecallResult> results = degraded.recall(RecallRequest.of("probe", "assistant").withMinScore(0.0));

        assertThat(results).extracting(RecallResult::id).containsExactly(working, durable);
        assertThat(results.get(0).similarity()).isCloseTo(1.2, within(1e-9));
        assertThat(results.get(1).similarity()).isCloseTo(0.6, within(1e-9));
        assertThat(store.accessLog(working)).isEmpty();
        assertThat(store.find(working).orElseThrow().accessCount()).isZero();
    }

    @Test
    void shouldReturnNothingForUnknownAgent() throws Exception {
        assertThat(engine.recall(RecallRequest.of("anything", "stranger"))).isEmpty();
        assertThat(store.findAgentId("stranger")).isEmpty();
    }

    @Test
    void shouldExpandRequestedLayer() throws Exception {
        long id = engine.remember(RememberRequest.of("one two three four five six seven eight nine ten eleven", "assistant"));

        assertThat(engine.expand(id, 1).content()).isEqualTo("one two three four five six seven eight nine ten...");
        assertThat(engine.expand(id, 3).content()).isEqualTo("one two three four five six seven eight nine ten eleven");
        assertThatThrownBy(() -> engine.expand(id, 4)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.expand(424242L, 1)).isInstanceOf(MemoryNotFoundException.class);
    }

    @Test
    void shouldRejectInvalidInput() {
        assertThatThrownBy(() -> engine.remember(RememberRequest.of("  ", "assistant")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.remember(RememberRequest.of("x", "assistant").withImportance(1.5)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.remember(RememberRequest.of("x", "assistant").withTtlHours(0.0)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.recall(RecallRequest.of("x", "assistant").withMaxLayer(0)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.recall(RecallRequest.of("x", "assistant").withLimit(0)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static final class AccessLogDownStore implements MemoryStore {
        private final MemoryStore delegate;

        private AccessLogDownStore(MemoryStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public long upsertAgent(String agentName) throws IOException {
            return delegate.upsertAgent(agentName);
        }

        @Override
        public Optional<Long> findAgentId(String agentName) throws IOException {
            return delegate.findAgentId(agentName);
        }

        @Override
        public Memory insert(NewMemory memory) throws IOException {
            return delegate.insert(memory);
        }

        @Override
        public Optional<Memory> find(long memoryId) throws IOException {
            return delegate.find(memoryId);
        }

        @Override
        public List<ScoredMemory> nearest(List<Double> queryEmbedding, RecallPredicates predicates) throws IOException {
            return delegate.nearest(queryEmbedding, predicates);
        }

        @Override
        public void recordAccess(AccessLogEntry entry) throws IOException {
            throw new IOException("database is locked");
        }

        @Override
        public List<AccessLogEntry> accessLog(long memoryId) throws IOException {
            return delegate.accessLog(memoryId);
        }

        @Override
        public PendingSlice pendingReview(String agentName, Instant now, int limit) throws IOException {
            return delegate.pendingReview(agentName, now, limit);
        }

        @Override
        public MemoryTransition transition(long memoryId, Function<Memory, MemoryTransition> planner) throws IOException {
            return delegate.transition(memoryId, planner);
        }

        @Override
        public List<ReviewLogEntry> reviewLog(long memoryId) throws IOException {
            return delegate.reviewLog(memoryId);
        }

        @Override
        public MemoryStats stats(String agentName) throws IOException {
            return delegate.stats(agentName);
        }

        @Override
        public BacklogStats backlog(String agentName, Instant now) throws IOException {
            return delegate.backlog(agentName, now);
        }
    }
}
