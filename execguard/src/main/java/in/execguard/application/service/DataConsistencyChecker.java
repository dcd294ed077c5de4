package in.execguard.application.service;

import in.execguard.config.ConsistencyConfig;
import in.execguard.domain.consistency.ConsistencyDiscrepancy;
import in.execguard.domain.consistency.DiscrepancyType;
import in.execguard.domain.consistency.Resolution;
import in.execguard.domain.event.ResilienceEvent;
import in.execguard.domain.execution.ExecutionMethod;
import in.execguard.domain.execution.LedgerTrade;
import in.execguard.domain.strategy.BridgeOrder;
import in.execguard.domain.strategy.ShadowRecord;
import in.execguard.domain.strategy.StrategyExecutionRecord;
import in.execguard.domain.strategy.StrategyPerformance;
import in.execguard.infrastructure.bridge.metrics.ResilienceMetrics;
import in.execguard.infrastructure.event.EventListeners;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Slow sweep for structural divergence between the bridge and the local ledger.
 *
 * Each sweep drains the candidates left by the state synchronizer and scans
 * the latest bridge records for:
 * - trade ids recorded twice in the ledger (both paths recorded the fill)
 * - positions whose sign differs between bridge and ledger
 * - orders known to one side only
 * - impossible bridge records (fill rate outside [0,1], fewer total than
 *   successful trades, end before start)
 *
 * With autoCorrect the ledger is corrected by each discrepancy type's
 * resolution: bridge values win for totals, positions, parameters and start
 * time; the ledger wins for order existence; duplicates keep their earliest
 * entry; invalid bridge records are only reported.
 */
public class DataConsistencyChecker {
    private static final Logger log = LoggerFactory.getLogger(DataConsistencyChecker.class);

    static final String SWEEP_SUBJECT = "all";

    private final ExecutionLedger ledger;
    private final ReconciliationBuffer buffer;
    private final Duration checkInterval;
    private final boolean autoCorrect;

    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "ConsistencyTimer");
        t.setDaemon(true);
        return t;
    });
    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "ConsistencyWorker");
        t.setDaemon(true);
        return t;
    });

    private final AtomicReference<CompletableFuture<CheckResult>> inFlight = new AtomicReference<>();
    private final EventListeners<ResilienceEvent> listeners = new EventListeners<>("ConsistencyCheck");
    private final Map<String, Set<String>> acknowledgedOrphans = new ConcurrentHashMap<>();  // strategy -> order ids
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private ScheduledFuture<?> checkTask;

    // Metrics
    private final AtomicLong totalChecks = new AtomicLong();
    private final AtomicLong skippedChecks = new AtomicLong();
    private final AtomicLong discrepanciesDetected = new AtomicLong();
    private final AtomicLong correctionsApplied = new AtomicLong();
    private volatile double averageCheckTimeMs = 0.0;
    private volatile Instant lastCheckTime;

    private volatile ResilienceMetrics metrics;  // Optional metrics collector

    public DataConsistencyChecker(ConsistencyConfig config, ExecutionLedger ledger, ReconciliationBuffer buffer) {
        this.ledger = ledger;
        this.buffer = buffer;
        this.checkInterval = Duration.ofMillis(config.checkIntervalMs());
        this.autoCorrect = config.autoCorrect();
    }

    public void setMetrics(ResilienceMetrics metrics) {
        this.metrics = metrics;
    }

    public void onEvent(Consumer<ResilienceEvent> listener) {
        listeners.add(listener);
    }

    public synchronized void start() {
        if (checkTask != null || closed.get()) {
            return;
        }
        checkTask = timer.scheduleAtFixedRate(this::onTimer,
            checkInterval.toMillis(), checkInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("[ConsistencyCheck] Started: interval={}ms, autoCorrect={}", checkInterval.toMillis(), autoCorrect);
    }

    /**
     * Run a sweep now, or join the sweep already running.
     */
    public CompletableFuture<CheckResult> checkNow() {
        while (true) {
            CompletableFuture<CheckResult> running = inFlight.get();
            if (running != null) {
                return running;
            }
            CompletableFuture<CheckResult> sweep = new CompletableFuture<>();
            if (inFlight.compareAndSet(null, sweep)) {
                submitSweep(sweep);
                return sweep;
            }
        }
    }

    public ConsistencyMetrics getMetrics() {
        return new ConsistencyMetrics(
            totalChecks.get(),
            skippedChecks.get(),
            discrepanciesDetected.get(),
            correctionsApplied.get(),
            Duration.ofMillis(Math.round(averageCheckTimeMs)),
            lastCheckTime
        );
    }

    /**
     * Stop the timer and the worker. Safe to call more than once.
     */
    public void cleanup() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("[ConsistencyCheck] Stopping");
        synchronized (this) {
            if (checkTask != null) {
                checkTask.cancel(false);
            }
        }
        shutdown(timer);
        shutdown(worker);
    }

    private void onTimer() {
        if (inFlight.get() != null) {
            skippedChecks.incrementAndGet();
            ResilienceMetrics m = metrics;
            if (m != null) {
                m.recordConsistencyCheckSkipped();
            }
            log.debug("[ConsistencyCheck] Previous sweep still running, skipping tick");
            return;
        }
        checkNow();
    }

    private void submitSweep(CompletableFuture<CheckResult> sweep) {
        try {
            worker.execute(() -> {
                CheckResult result;
                try {
                    result = runSweep();
                } catch (Exception e) {
                    log.error("[ConsistencyCheck] Sweep failed", e);
                    result = new CheckResult(List.of(), Duration.ZERO, Instant.now());
                }
                inFlight.compareAndSet(sweep, null);
                sweep.complete(result);
            });
        } catch (RejectedExecutionException e) {
            inFlight.compareAndSet(sweep, null);
            sweep.complete(new CheckResult(List.of(), Duration.ZERO, Instant.now()));
        }
    }

    private CheckResult runSweep() {
        long startNanos = System.nanoTime();
        totalChecks.incrementAndGet();

        Map<String, ConsistencyDiscrepancy> found = new LinkedHashMap<>();
        for (ConsistencyDiscrepancy candidate : buffer.drainCandidates()) {
            found.put(candidate.key(), candidate);
        }
        for (ReconciliationBuffer.Snapshot snapshot : buffer.latestSnapshots().values()) {
            for (ConsistencyDiscrepancy d : inspect(snapshot)) {
                found.putIfAbsent(d.key(), d);
            }
        }
        for (String tradeId : ledger.duplicateTradeIds()) {
            String strategyId = ledger.trades().stream()
                .filter(t -> t.tradeId().equals(tradeId))
                .map(LedgerTrade::strategyId)
                .findFirst()
                .orElse(null);
            long copies = ledger.trades().stream().filter(t -> t.tradeId().equals(tradeId)).count();
            ConsistencyDiscrepancy d = ConsistencyDiscrepancy.of(DiscrepancyType.DUPLICATE_TRADE, strategyId,
                tradeId, copies - 1, 1, copies);
            found.putIfAbsent(d.key(), d);
        }

        List<ConsistencyDiscrepancy> results = new ArrayList<>();
        int corrected = 0;
        for (ConsistencyDiscrepancy discrepancy : found.values()) {
            discrepanciesDetected.incrementAndGet();
            recordDiscrepancy(discrepancy);
            listeners.publish(new ResilienceEvent.DiscrepancyDetected(discrepancy, Instant.now()));

            ConsistencyDiscrepancy outcome = discrepancy;
            if (autoCorrect && applyCorrection(discrepancy)) {
                outcome = discrepancy.corrected();
                corrected++;
                correctionsApplied.incrementAndGet();
                recordCorrection(outcome);
                listeners.publish(new ResilienceEvent.CorrectionApplied(outcome, Instant.now()));
            }
            results.add(outcome);
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        long checks = totalChecks.get();
        averageCheckTimeMs += (elapsed.toMillis() - averageCheckTimeMs) / checks;
        lastCheckTime = Instant.now();

        ResilienceMetrics m = metrics;
        if (m != null) {
            m.recordConsistencyCheck(elapsed);
        }
        if (!results.isEmpty()) {
            log.info("[ConsistencyCheck] Sweep complete: detected={}, corrected={}, elapsed={}ms",
                results.size(), corrected, elapsed.toMillis());
        }
        listeners.publish(new ResilienceEvent.ConsistencyCheckCompleted(SWEEP_SUBJECT,
            results.size(), corrected, elapsed, lastCheckTime));
        return new CheckResult(results, elapsed, lastCheckTime);
    }

    private List<ConsistencyDiscrepancy> inspect(ReconciliationBuffer.Snapshot snapshot) {
        StrategyExecutionRecord remote = snapshot.record();
        String strategyId = remote.strategyId();
        List<ConsistencyDiscrepancy> found = new ArrayList<>();

        StrategyPerformance perf = remote.performance();
        if (perf.fillRate() < 0.0 || perf.fillRate() > 1.0) {
            found.add(ConsistencyDiscrepancy.of(DiscrepancyType.INVALID_FILL_RATE, strategyId, "fillRate",
                perf.fillRate() < 0.0 ? -perf.fillRate() : perf.fillRate() - 1.0, perf.fillRate(), null));
        }
        if (perf.totalTrades() < perf.successfulTrades()) {
            found.add(ConsistencyDiscrepancy.of(DiscrepancyType.TRADE_COUNT_LOGIC_ERROR, strategyId,
                "successfulTrades", perf.successfulTrades() - perf.totalTrades(),
                perf.successfulTrades(), perf.totalTrades()));
        }
        if (remote.startTime() != null && remote.endTime() != null && remote.endTime().isBefore(remote.startTime())) {
            found.add(ConsistencyDiscrepancy.of(DiscrepancyType.END_BEFORE_START, strategyId, "endTime",
                Duration.between(remote.endTime(), remote.startTime()).toMillis(),
                remote.endTime(), remote.startTime()));
        }

        Optional<ShadowRecord> localRecord = ledger.shadowRecord(strategyId);
        if (localRecord.isEmpty()) {
            return found;
        }
        ShadowRecord.BridgeShare local = localRecord.get().bridgeShare();

        Set<String> symbols = new LinkedHashSet<>(remote.positions().keySet());
        symbols.addAll(local.positions().keySet());
        for (String symbol : symbols) {
            BigDecimal bridgePos = remote.positionFor(symbol);
            BigDecimal localPos = local.positionFor(symbol);
            if (bridgePos.signum() != localPos.signum()) {
                found.add(ConsistencyDiscrepancy.of(DiscrepancyType.POSITION_SIGN_MISMATCH, strategyId, symbol,
                    bridgePos.subtract(localPos).abs().doubleValue(), bridgePos, localPos));
            }
        }

        found.addAll(orphanedOrders(strategyId, remote, snapshot.capturedAt()));
        return found;
    }

    private List<ConsistencyDiscrepancy> orphanedOrders(String strategyId, StrategyExecutionRecord remote,
                                                        Instant capturedAt) {
        Set<String> bridgeIds = new LinkedHashSet<>();
        for (BridgeOrder order : remote.orders()) {
            bridgeIds.add(order.orderId());
        }
        // Fills recorded after the pull cannot be on the bridge record yet
        Set<String> localIds = new LinkedHashSet<>();
        for (LedgerTrade trade : ledger.trades(strategyId)) {
            if (trade.method() == ExecutionMethod.BRIDGE && !trade.recordedAt().isAfter(capturedAt)) {
                localIds.add(trade.tradeId());
            }
        }

        // An acknowledged id now on both sides, or on neither, is settled
        acknowledgedOrphans.computeIfPresent(strategyId, (id, ids) -> {
            ids.removeIf(orderId -> bridgeIds.contains(orderId) == localIds.contains(orderId));
            return ids.isEmpty() ? null : ids;
        });
        Set<String> acknowledged = acknowledgedOrphans.getOrDefault(strategyId, Set.of());

        List<ConsistencyDiscrepancy> found = new ArrayList<>();
        for (String orderId : bridgeIds) {
            if (!localIds.contains(orderId) && !acknowledged.contains(orderId)) {
                found.add(ConsistencyDiscrepancy.of(DiscrepancyType.ORPHANED_ORDER, strategyId, orderId,
                    1.0, "present", "missing"));
            }
        }
        for (String orderId : localIds) {
            if (!bridgeIds.contains(orderId) && !acknowledged.contains(orderId)) {
                found.add(ConsistencyDiscrepancy.of(DiscrepancyType.ORPHANED_ORDER, strategyId, orderId,
                    1.0, "missing", "present"));
            }
        }
        return found;
    }

    /**
     * @return true if the ledger now reflects the discrepancy's resolution
     */
    private boolean applyCorrection(ConsistencyDiscrepancy d) {
        if (d.resolution() == Resolution.REPORT_ONLY) {
            return false;
        }
        String strategyId = d.strategyId();
        try {
            switch (d.type()) {
                case PNL_MISMATCH -> ledger.overrideRealizedPnl(strategyId, toBigDecimal(d.bridgeValue()));
                case TRADE_COUNT_MISMATCH -> ledger.overrideTradeCount(strategyId, ((Number) d.bridgeValue()).intValue());
                case TIMESTAMP_SKEW -> ledger.overrideStartTime(strategyId, (Instant) d.bridgeValue());
                case PARAMETER_DRIFT -> ledger.overrideParameter(strategyId,
                    d.subject().substring("parameters.".length()), d.bridgeValue());
                case POSITION_SIGN_MISMATCH -> ledger.overridePosition(strategyId, d.subject(),
                    toBigDecimal(d.bridgeValue()));
                case ORPHANED_ORDER -> acknowledgedOrphans
                    .computeIfAbsent(strategyId, id -> ConcurrentHashMap.newKeySet())
                    .add(d.subject());
                case DUPLICATE_TRADE -> ledger.removeDuplicateTrades(d.subject());
                default -> {
                    return false;
                }
            }
            log.info("[ConsistencyCheck] Corrected {} for {} ({}, {})",
                d.type(), strategyId, d.subject(), d.resolution());
            return true;
        } catch (RuntimeException e) {
            log.warn("[ConsistencyCheck] Could not correct {} for {} ({}): {}",
                d.type(), strategyId, d.subject(), e.getMessage());
            return false;
        }
    }

    private static BigDecimal toBigDecimal(Object value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        return new BigDecimal(String.valueOf(value));
    }

    private void recordDiscrepancy(ConsistencyDiscrepancy d) {
        ResilienceMetrics m = metrics;
        if (m != null) {
            m.recordDiscrepancy(d.type());
        }
    }

    private void recordCorrection(ConsistencyDiscrepancy d) {
        ResilienceMetrics m = metrics;
        if (m != null) {
            m.recordCorrection(d.type());
        }
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
     * Outcome of one sweep. Corrected discrepancies have correctionApplied set.
     */
    public record CheckResult(
        List<ConsistencyDiscrepancy> discrepancies,
        Duration elapsed,
        Instant completedAt
    ) {
        public CheckResult {
            discrepancies = List.copyOf(discrepancies);
        }

        public long correctedCount() {
            return discrepancies.stream().filter(ConsistencyDiscrepancy::correctionApplied).count();
        }

        public List<ConsistencyDiscrepancy> ofType(DiscrepancyType type) {
            return discrepancies.stream().filter(d -> d.type() == type).toList();
        }
    }

    /**
     * Consistency metrics snapshot.
     */
    public record ConsistencyMetrics(
        long totalChecks,
        long skippedChecks,
        long discrepanciesDetected,
        long correctionsApplied,
        Duration averageCheckTime,
        Instant lastCheckTime
    ) {
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("totalChecks", totalChecks);
            map.put("skippedChecks", skippedChecks);
            map.put("discrepanciesDetected", discrepanciesDetected);
            map.put("correctionsApplied", correctionsApplied);
            map.put("averageCheckTimeMs", averageCheckTime.toMillis());
            map.put("lastCheckTime", lastCheckTime != null ? lastCheckTime.toString() : null);
            return map;
        }
    }
}
