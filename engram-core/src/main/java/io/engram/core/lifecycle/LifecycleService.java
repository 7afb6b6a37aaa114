package io.engram.core.lifecycle;

import io.engram.core.memory.Memory;
import io.engram.core.memory.MemoryStatus;
import io.engram.core.memory.MemoryStore;
import io.engram.core.memory.MemoryTransition;
import io.engram.core.memory.PendingSlice;
import io.engram.core.memory.ReviewLogEntry;
import io.engram.core.memory.TemporalLayer;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tier and status transitions for stored memories. Expiry is lazy: lapsed {@code active} rows only become
 * {@code expired} when the pending-review backlog is read.
 */
public final class LifecycleService {
    private static final Logger LOG = LoggerFactory.getLogger(LifecycleService.class);

    static final double PROMOTION_IMPORTANCE_FLOOR = 0.7;
    static final Duration SHORT_TERM_TTL = Duration.ofHours(168);
    static final Duration DEFAULT_EXTENSION_TTL = Duration.ofHours(24);

    private final MemoryStore store;
    private final Clock clock;

    public LifecycleService(MemoryStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public PendingReview pending(String agentName, int limit) throws IOException {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }
        Instant now = clock.instant();
        PendingSlice slice = store.pendingReview(agentName, now, limit);
        List<PendingMemory> memories = new ArrayList<>(slice.memories().size());
        for (Memory memory : slice.memories()) {
            memories.add(new PendingMemory(
                memory.id(),
                memory.agentName(),
                memory.content().layer1(),
                memory.content().layer3(),
                memory.tags(),
                memory.importanceScore(),
                memory.memoryType(),
                memory.temporalLayer(),
                memory.status(),
                memory.domain(),
                memory.expiresAt(),
                memory.accessCount(),
                hoursBetween(memory.createdAt(), now),
                memory.lastAccessed() == null ? null : hoursBetween(memory.lastAccessed(), now)
            ));
        }
        return new PendingReview(slice.total(), memories);
    }

    public TransitionSummary decide(ReviewDecisionRequest request) throws IOException {
        Objects.requireNonNull(request, "request must not be null");
        if (request.ttlHours() != null) {
            validateTtl(request.ttlHours());
        }
        if (request.decision() == LifecycleDecision.PROMOTE && request.newLayer() != null
            && request.newLayer() != TemporalLayer.SHORT && request.newLayer() != TemporalLayer.LONG) {
            throw new IllegalArgumentException("promote target must be short or long, got "
                + request.newLayer().wireName());
        }
        Instant now = clock.instant();

        MemoryTransition transition = store.transition(request.memoryId(), current -> plan(current, request, now));
        Memory after = transition.after();
        LOG.debug("Memory {} {}: {} -> {} ({})", after.id(), request.decision().wireName(),
            transition.before().temporalLayer().wireName(), after.temporalLayer().wireName(), after.status().wireName());
        return new TransitionSummary(
            after.id(),
            request.decision(),
            transition.before().temporalLayer(),
            after.temporalLayer(),
            after.status(),
            after.expiresAt(),
            after.importanceScore()
        );
    }

    public List<ReviewLogEntry> history(long memoryId) throws IOException {
        return store.reviewLog(memoryId);
    }

    private MemoryTransition plan(Memory current, ReviewDecisionRequest request, Instant now) {
        if (current.status().terminal() && request.decision() != LifecycleDecision.DELETE) {
            throw new IllegalStateException("Memory " + current.id() + " is deleted; '"
                + request.decision().wireName() + "' is not allowed");
        }
        TemporalLayer target = request.newLayer() == null ? current.temporalLayer() : request.newLayer();
        Memory after = switch (request.decision()) {
            case PROMOTE -> current.withLifecycle(
                request.newLayer() == null ? TemporalLayer.LONG : request.newLayer(),
                MemoryStatus.ACTIVE,
                null,
                Math.max(current.importanceScore(), PROMOTION_IMPORTANCE_FLOOR),
                now
            );
            case EXTEND -> current.withLifecycle(
                target,
                MemoryStatus.ACTIVE,
                now.plus(extensionTtl(request.ttlHours(), target)),
                current.importanceScore(),
                now
            );
            case ARCHIVE -> current.withLifecycle(
                TemporalLayer.ARCHIVE,
                MemoryStatus.ARCHIVED,
                null,
                current.importanceScore(),
                now
            );
            case DELETE -> current.withLifecycle(
                current.temporalLayer(),
                MemoryStatus.DELETED,
                current.expiresAt(),
                current.importanceScore(),
                now
            );
        };
        ReviewLogEntry log = new ReviewLogEntry(
            current.id(),
            request.decision().wireName(),
            current.temporalLayer(),
            after.temporalLayer(),
            request.reason(),
            request.reviewedBy(),
            now
        );
        return new MemoryTransition(current, after, log);
    }

    private static Duration extensionTtl(Double ttlHours, TemporalLayer target) {
        if (ttlHours != null) {
            return Duration.ofMillis(Math.round(ttlHours * 3_600_000d));
        }
        return target == TemporalLayer.SHORT ? SHORT_TERM_TTL : DEFAULT_EXTENSION_TTL;
    }

    private static void validateTtl(double hours) {
        if (Double.isNaN(hours) || hours <= 0.0) {
            throw new IllegalArgumentException("ttlHours must be > 0");
        }
    }

    private static double hoursBetween(Instant from, Instant to) {
        if (from == null) {
            return 0.0;
        }
        return Duration.between(from, to).toMillis() / 3_600_000d;
    }
}
