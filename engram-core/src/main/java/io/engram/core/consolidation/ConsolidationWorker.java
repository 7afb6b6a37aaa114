package io.engram.core.consolidation;

import io.engram.core.memory.BacklogStats;
import io.engram.core.memory.MemoryStore;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodic sleep-cycle runner. A tick consolidates only when the backlog crosses a threshold, and a tick
 * that starts while another is still running in this process is skipped.
 */
public final class ConsolidationWorker implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ConsolidationWorker.class);

    private final SleepCycle sleepCycle;
    private final MemoryStore store;
    private final SleepCycleOptions options;
    private final Thresholds thresholds;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledExecutorService scheduler;

    public ConsolidationWorker(
        SleepCycle sleepCycle,
        MemoryStore store,
        SleepCycleOptions options,
        Thresholds thresholds,
        Clock clock
    ) {
        this.sleepCycle = Objects.requireNonNull(sleepCycle, "sleepCycle must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.options = options == null ? SleepCycleOptions.defaults() : options;
        this.thresholds = thresholds == null ? Thresholds.defaults() : thresholds;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public Optional<ConsolidationReport> tick() {
        if (!running.compareAndSet(false, true)) {
            LOG.debug("Previous consolidation still running, skipping tick");
            return Optional.empty();
        }
        try {
            BacklogStats backlog = store.backlog(options.agentName(), clock.instant());
            if (!thresholds.shouldRun(backlog)) {
                LOG.debug("Backlog below thresholds (working={}, lapsed={})",
                    backlog.activeWorking(), backlog.lapsedWorking());
                return Optional.empty();
            }
            LOG.info("Running consolidation (working={}, lapsed={}, awaiting review={})",
                backlog.activeWorking(), backlog.lapsedWorking(), backlog.awaitingReview());
            return Optional.of(sleepCycle.run(options));
        } catch (IOException | RuntimeException e) {
            LOG.warn("Consolidation tick failed: {}", e.getMessage(), e);
            return Optional.empty();
        } finally {
            running.set(false);
        }
    }

    public synchronized void start(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        if (scheduler != null) {
            throw new IllegalStateException("worker already started");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "engram-consolidation");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::tick, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        LOG.info("Consolidation worker started, interval {}", interval);
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    /**
     * Backlog levels that trigger a run. Lapsed working memories count whether or not a previous cycle already
     * swept them into review. Disabled thresholds make every tick consolidate.
     */
    public record Thresholds(int workingThreshold, int expiredThreshold, boolean enabled) {
        public static final int DEFAULT_WORKING_THRESHOLD = 300;
        public static final int DEFAULT_EXPIRED_THRESHOLD = 50;

        public static Thresholds defaults() {
            return new Thresholds(DEFAULT_WORKING_THRESHOLD, DEFAULT_EXPIRED_THRESHOLD, true);
        }

        public static Thresholds disabled() {
            return new Thresholds(DEFAULT_WORKING_THRESHOLD, DEFAULT_EXPIRED_THRESHOLD, false);
        }

        public boolean shouldRun(BacklogStats backlog) {
            if (!enabled) {
                return true;
            }
            return backlog.activeWorking() > workingThreshold
                || backlog.lapsedWorking() + backlog.awaitingReview() > expiredThreshold;
        }
    }
}
