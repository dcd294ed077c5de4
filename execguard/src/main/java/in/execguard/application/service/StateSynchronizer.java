package in.execguard.application.service;

import in.execguard.application.port.output.BridgeExecutor;
import in.execguard.config.SyncConfig;
import in.execguard.domain.consistency.ConsistencyDiscrepancy;
import in.execguard.domain.event.ResilienceEvent;
import in.execguard.domain.strategy.ShadowRecord;
import in.execguard.domain.strategy.StrategyExecutionRecord;
import in.execguard.infrastructure.bridge.metrics.ResilienceMetrics;
import in.execguard.infrastructure.event.EventListeners;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Periodically pulls strategy state from the bridge and diffs it against the
 * local execution ledger.
 *
 * Every strategy tracked by the ledger is pulled once per pass. Fields that
 * differ beyond their tolerance become discrepancy candidates in the
 * reconciliation buffer, together with the bridge record, for the consistency
 * checker to act on. A strategy the bridge does not know counts as a failed
 * sync.
 *
 * Passes never overlap: a timer tick while a pass is running is skipped and
 * counted, and {@link #syncNow()} during a pass returns the running pass.
 */
public class StateSynchronizer {
    private static final Logger log = LoggerFactory.getLogger(StateSynchronizer.class);

    private final BridgeExecutor bridge;
    private final ExecutionLedger ledger;
    private final ReconciliationBuffer buffer;
    private final ToleranceComparator comparator;
    private final Duration syncInterval;
    private final Duration stateTimeout;

    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "StateSyncTimer");
        t.setDaemon(true);
        return t;
    });
    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "StateSyncWorker");
        t.setDaemon(true);
        return t;
    });

    private final AtomicReference<CompletableFuture<SyncResult>> inFlight = new AtomicReference<>();
    private final EventListeners<ResilienceEvent> listeners = new EventListeners<>("StateSync");
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private ScheduledFuture<?> syncTask;

    // Metrics
    private final AtomicLong totalSyncs = new AtomicLong();
    private final AtomicLong successfulSyncs = new AtomicLong();
    private final AtomicLong failedSyncs = new AtomicLong();
    private final AtomicLong skippedSyncs = new AtomicLong();
    private final AtomicLong discrepanciesFound = new AtomicLong();
    private volatile double averageSyncTimeMs = 0.0;
    private volatile Instant lastSyncTime;

    private volatile ResilienceMetrics metrics;  // Optional metrics collector

    public StateSynchronizer(SyncConfig config, BridgeExecutor bridge, ExecutionLedger ledger,
                             ReconciliationBuffer buffer) {
        this.bridge = bridge;
        this.ledger = ledger;
        this.buffer = buffer;
        this.comparator = new ToleranceComparator(config);
        this.syncInterval = Duration.ofMillis(config.syncIntervalMs());
        this.stateTimeout = Duration.ofMillis(config.stateTimeoutMs());
    }

    public void setMetrics(ResilienceMetrics metrics) {
        this.metrics = metrics;
    }

    public void onEvent(Consumer<ResilienceEvent> listener) {
        listeners.add(listener);
    }

    public synchronized void start() {
        if (syncTask != null || closed.get()) {
            return;
        }
        syncTask = timer.scheduleAtFixedRate(this::onTimer,
            syncInterval.toMillis(), syncInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("[StateSync] Started: interval={}ms, stateTimeout={}ms",
            syncInterval.toMillis(), stateTimeout.toMillis());
    }

    /**
     * Run a full pass now, or join the pass already running.
     */
    public CompletableFuture<SyncResult> syncNow() {
        while (true) {
            CompletableFuture<SyncResult> running = inFlight.get();
            if (running != null) {
                return running;
            }
            CompletableFuture<SyncResult> pass = new CompletableFuture<>();
            if (inFlight.compareAndSet(null, pass)) {
                submitPass(pass);
                return pass;
            }
        }
    }

    /**
     * Synchronize one strategy now, on the sync worker.
     */
    public CompletableFuture<StrategySyncResult> forceSynchronization(String strategyId) {
        if (strategyId == null || strategyId.isBlank()) {
            throw new IllegalArgumentException("Strategy id cannot be null or empty");
        }
        try {
            return CompletableFuture.supplyAsync(() -> syncStrategy(strategyId), worker);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(
                StrategySyncResult.failed(strategyId, "Synchronizer has been cleaned up"));
        }
    }

    public boolean isSyncInProgress() {
        return inFlight.get() != null;
    }

    public SyncMetrics getMetrics() {
        return new SyncMetrics(
            totalSyncs.get(),
            successfulSyncs.get(),
            failedSyncs.get(),
            skippedSyncs.get(),
            discrepanciesFound.get(),
            Duration.ofMillis(Math.round(averageSyncTimeMs)),
            lastSyncTime
        );
    }

    /**
     * Stop the timer and the worker. Safe to call more than once.
     */
    public void cleanup() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("[StateSync] Stopping");
        synchronized (this) {
            if (syncTask != null) {
                syncTask.cancel(false);
            }
        }
        shutdown(timer);
        shutdown(worker);
    }

    private void onTimer() {
        if (inFlight.get() != null) {
            skippedSyncs.incrementAndGet();
            ResilienceMetrics m = metrics;
            if (m != null) {
                m.recordSyncSkipped();
            }
            log.debug("[StateSync] Previous pass still running, skipping tick");
            return;
        }
        syncNow();
    }

    private void submitPass(CompletableFuture<SyncResult> pass) {
        try {
            worker.execute(() -> {
                SyncResult result;
                try {
                    result = runPass();
                } catch (Exception e) {
                    log.error("[StateSync] Sync pass failed", e);
                    result = new SyncResult(List.of(), Duration.ZERO, Instant.now());
                }
                inFlight.compareAndSet(pass, null);
                pass.complete(result);
            });
        } catch (RejectedExecutionException e) {
            inFlight.compareAndSet(pass, null);
            pass.complete(new SyncResult(List.of(), Duration.ZERO, Instant.now()));
        }
    }

    private SyncResult runPass() {
        Instant start = Instant.now();
        List<StrategySyncResult> results = new ArrayList<>();
        for (String strategyId : ledger.trackedStrategyIds()) {
            if (closed.get()) {
                break;
            }
            results.add(syncStrategy(strategyId));
        }
        Duration elapsed = Duration.between(start, Instant.now());
        SyncResult result = new SyncResult(results, elapsed, Instant.now());
        if (!results.isEmpty()) {
            log.info("[StateSync] Pass complete: strategies={}, failed={}, discrepancies={}, elapsed={}ms",
                results.size(), result.failedCount(), result.discrepancyCount(), elapsed.toMillis());
        }
        return result;
    }

    private StrategySyncResult syncStrategy(String strategyId) {
        long startNanos = System.nanoTime();
        totalSyncs.incrementAndGet();

        StrategySyncResult result;
        try {
            Optional<StrategyExecutionRecord> remote = bridge.getStrategyState(strategyId)
                .get(stateTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (remote == null || remote.isEmpty()) {
                result = StrategySyncResult.failed(strategyId, "Strategy unknown to bridge");
            } else {
                result = reconcile(strategyId, remote.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = StrategySyncResult.failed(strategyId, "Interrupted");
        } catch (TimeoutException e) {
            result = StrategySyncResult.failed(strategyId,
                "State pull timed out after " + stateTimeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            result = StrategySyncResult.failed(strategyId,
                cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
        } catch (Exception e) {
            log.error("[StateSync] Unexpected error syncing {}", strategyId, e);
            result = StrategySyncResult.failed(strategyId, String.valueOf(e.getMessage()));
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        lastSyncTime = Instant.now();
        ResilienceMetrics m = metrics;
        if (m != null) {
            m.recordSync(result.success(), elapsed);
        }

        if (result.success()) {
            long successes = successfulSyncs.incrementAndGet();
            averageSyncTimeMs += (elapsed.toMillis() - averageSyncTimeMs) / successes;
            discrepanciesFound.addAndGet(result.discrepancies().size());
            listeners.publish(new ResilienceEvent.SynchronizationCompleted(strategyId,
                result.discrepancies().size(), elapsed, Instant.now()));
        } else {
            failedSyncs.incrementAndGet();
            log.warn("[StateSync] Sync of {} failed: {}", strategyId, result.error());
            listeners.publish(new ResilienceEvent.SynchronizationFailed(strategyId, result.error(), Instant.now()));
        }
        return result;
    }

    private StrategySyncResult reconcile(String strategyId, StrategyExecutionRecord remote) {
        buffer.storeSnapshot(remote, Instant.now());
        if (ledger.adoptIfUninitialized(remote)) {
            log.info("[StateSync] Initialized local state of {} from bridge", strategyId);
        }

        Optional<ShadowRecord> local = ledger.shadowRecord(strategyId);
        if (local.isEmpty()) {
            return StrategySyncResult.failed(strategyId, "Strategy no longer tracked locally");
        }

        List<ConsistencyDiscrepancy> discrepancies = comparator.compare(remote, local.get());
        if (discrepancies.isEmpty()) {
            buffer.clearCandidates(strategyId);
            log.debug("[StateSync] {} in sync", strategyId);
        } else {
            buffer.offer(discrepancies);
            log.info("[StateSync] {} has {} discrepancies: {}", strategyId, discrepancies.size(),
                discrepancies.stream().map(ConsistencyDiscrepancy::subject).toList());
        }
        return new StrategySyncResult(strategyId, true, discrepancies, null);
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Outcome of synchronizing one strategy.
     */
    public record StrategySyncResult(
        String strategyId,
        boolean success,
        List<ConsistencyDiscrepancy> discrepancies,
        String error
    ) {
        public StrategySyncResult {
            discrepancies = discrepancies == null ? List.of() : List.copyOf(discrepancies);
        }

        static StrategySyncResult failed(String strategyId, String error) {
            return new StrategySyncResult(strategyId, false, List.of(), error);
        }
    }

    /**
     * Outcome of one full pass.
     */
    public record SyncResult(
        List<StrategySyncResult> strategies,
        Duration elapsed,
        Instant completedAt
    ) {
        public SyncResult {
            strategies = List.copyOf(strategies);
        }

        public long failedCount() {
            return strategies.stream().filter(s -> !s.success()).count();
        }

        public int discrepancyCount() {
            return strategies.stream().mapToInt(s -> s.discrepancies().size()).sum();
        }
    }

    /**
     * Synchronization metrics snapshot.
     */
    public record SyncMetrics(
        long totalSyncs,
        long successfulSyncs,
        long failedSyncs,
        long skippedSyncs,
        long discrepanciesFound,
        Duration averageSyncTime,
        Instant lastSyncTime
    ) {
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("totalSyncs", totalSyncs);
            map.put("successfulSyncs", successfulSyncs);
            map.put("failedSyncs", failedSyncs);
            map.put("skippedSyncs", skippedSyncs);
            map.put("discrepanciesFound", discrepanciesFound);
            map.put("averageSyncTimeMs", averageSyncTime.toMillis());
            map.put("lastSyncTime", lastSyncTime != null ? lastSyncTime.toString() : null);
            return map;
        }
    }
}
