package io.engram.core.memory;

import io.engram.core.embedding.EmbeddingModel;
import io.engram.core.memory.query.RecallPredicates;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Write and read paths over a {@link MemoryStore}: layering, classification and embedding on the way in,
 * temporal-weighted similarity ranking with access accounting on the way out.
 */
public final class MemoryEngine {
    private static final Logger LOG = LoggerFactory.getLogger(MemoryEngine.class);

    public static final String DEFAULT_AGENT = "default";
    public static final double DEFAULT_IMPORTANCE = 0.5;
    public static final Duration DEFAULT_WORKING_TTL = Duration.ofHours(2);

    private static final Comparator<ScoredMemory> RANKING = Comparator
        .<ScoredMemory>comparingDouble(MemoryEngine::weighted).reversed()
        .thenComparing(Comparator.comparingDouble((ScoredMemory scored) -> scored.memory().importanceScore()).reversed())
        .thenComparingLong(scored -> scored.memory().id());

    private final MemoryStore store;
    private final EmbeddingModel embeddingModel;
    private final MemoryTypeClassifier classifier;
    private final Clock clock;
    private final String defaultAgent;
    private final Duration workingTtl;

    public MemoryEngine(MemoryStore store, EmbeddingModel embeddingModel, Clock clock) {
        this(store, embeddingModel, new MemoryTypeClassifier(), clock, DEFAULT_AGENT, DEFAULT_WORKING_TTL);
    }

    public MemoryEngine(
        MemoryStore store,
        EmbeddingModel embeddingModel,
        MemoryTypeClassifier classifier,
        Clock clock,
        String defaultAgent,
        Duration workingTtl
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.embeddingModel = Objects.requireNonNull(embeddingModel, "embeddingModel must not be null");
        this.classifier = classifier == null ? new MemoryTypeClassifier() : classifier;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.defaultAgent = defaultAgent == null || defaultAgent.isBlank() ? DEFAULT_AGENT : defaultAgent.trim();
        this.workingTtl = workingTtl == null || workingTtl.isZero() || workingTtl.isNegative()
            ? DEFAULT_WORKING_TTL
            : workingTtl;
    }

    public long remember(RememberRequest request) throws IOException {
        Objects.requireNonNull(request, "request must not be null");
        if (request.content() == null || request.content().isBlank()) {
            throw new IllegalArgumentException("content must not be blank");
        }
        double importance = request.importanceScore() == null ? DEFAULT_IMPORTANCE : request.importanceScore();
        if (Double.isNaN(importance) || importance < 0.0 || importance > 1.0) {
            throw new IllegalArgumentException("importanceScore must be within [0, 1]");
        }

        Instant now = clock.instant();
        TemporalLayer layer = request.temporalLayer() == null ? TemporalLayer.WORKING : request.temporalLayer();
        Instant expiresAt = null;
        if (layer == TemporalLayer.WORKING) {
            expiresAt = now.plus(request.ttlHours() == null ? workingTtl : hours(request.ttlHours()));
        }

        String agentName = agentOrDefault(request.agentName());
        LayeredContent content = LayeredContent.of(request.content());
        MemoryType memoryType = request.memoryType() == null
            ? classifier.classify(request.content(), request.tags())
            : request.memoryType();

        store.upsertAgent(agentName);
        Memory saved = store.insert(new NewMemory(
            agentName,
            content,
            embeddingModel.embed(content.layer1()),
            embeddingModel.embed(content.layer2()),
            List.copyOf(new LinkedHashSet<>(request.tags())),
            importance,
            memoryType,
            layer,
            expiresAt,
            request.domain(),
            request.sourceType(),
            now
        ));
        LOG.debug("Stored memory {} for agent {} in {} as {}", saved.id(), agentName, layer.wireName(),
            memoryType.wireName());
        return saved.id();
    }

    public List<RecallResult> recall(RecallRequest request) throws IOException {
        Objects.requireNonNull(request, "request must not be null");
        if (request.maxLayer() < 1 || request.maxLayer() > 3) {
            throw new IllegalArgumentException("maxLayer must be 1, 2 or 3");
        }
        if (request.limit() < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }

        String agentName = agentOrDefault(request.agentName());
        Optional<Long> agentId = store.findAgentId(agentName);
        if (agentId.isEmpty()) {
            return List.of();
        }

        Instant now = clock.instant();
        List<Double> queryEmbedding = embeddingModel.embed(request.query());
        RecallPredicates predicates = RecallPredicates.forRecall(
            agentId.get(),
            now,
            effectiveLayers(request),
            request.tags().isEmpty() ? null : new LinkedHashSet<>(request.tags()),
            request.memoryType(),
            request.domain()
        );

        List<ScoredMemory> ranked = new ArrayList<>();
        for (ScoredMemory candidate : store.nearest(queryEmbedding, predicates)) {
            if (weighted(candidate) >= request.minScore()) {
                ranked.add(candidate);
            }
        }
        ranked.sort(RANKING);
        if (ranked.size() > request.limit()) {
            ranked = ranked.subList(0, request.limit());
        }

        List<RecallResult> results = new ArrayList<>(ranked.size());
        for (ScoredMemory scored : ranked) {
            Memory memory = scored.memory();
            double similarity = weighted(scored);
            results.add(new RecallResult(
                memory.id(),
                memory.content().atMost(request.maxLayer()),
                memory.tags(),
                memory.importanceScore(),
                memory.accessCount(),
                similarity,
                memory.createdAt(),
                memory.memoryType(),
                memory.temporalLayer(),
                memory.expiresAt(),
                memory.domain()
            ));
            recordAccess(new AccessLogEntry(memory.id(), agentId.get(), request.maxLayer(), request.query(),
                similarity, now));
        }
        return results;
    }

    public ExpandedMemory expand(long memoryId, int layer) throws IOException {
        if (layer < 1 || layer > 3) {
            throw new IllegalArgumentException("layer must be 1, 2 or 3");
        }
        Memory memory = store.find(memoryId).orElseThrow(() -> new MemoryNotFoundException(memoryId));
        String content = switch (layer) {
            case 1 -> memory.content().layer1();
            case 2 -> memory.content().layer2();
            default -> memory.content().layer3();
        };
        return new ExpandedMemory(memory.id(), layer, content, memory.temporalLayer(), memory.status());
    }

    public MemoryStats stats(String agentName) throws IOException {
        return store.stats(agentOrDefault(agentName));
    }

    public String defaultAgent() {
        return defaultAgent;
    }

    private void recordAccess(AccessLogEntry entry) {
        try {
            store.recordAccess(entry);
        } catch (IOException e) {
            LOG.warn("Failed to record access for memory {}: {}", entry.memoryId(), e.getMessage());
        }
    }

    private Set<TemporalLayer> effectiveLayers(RecallRequest request) {
        if (request.temporalLayers() != null) {
            return request.temporalLayers();
        }
        Set<TemporalLayer> layers = EnumSet.of(TemporalLayer.WORKING, TemporalLayer.SHORT, TemporalLayer.LONG);
        if (request.includeArchive()) {
            layers.add(TemporalLayer.ARCHIVE);
        }
        return layers;
    }

    private String agentOrDefault(String agentName) {
        return agentName == null || agentName.isBlank() ? defaultAgent : agentName.trim();
    }

    private static double weighted(ScoredMemory scored) {
        return scored.similarity() * scored.memory().temporalLayer().searchWeight();
    }

    static Duration hours(double hours) {
        if (Double.isNaN(hours) || hours <= 0.0) {
            throw new IllegalArgumentException("ttlHours must be > 0");
        }
        return Duration.ofMillis(Math.round(hours * 3_600_000d));
    }
}
