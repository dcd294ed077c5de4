package in.execguard.application.service;

import in.execguard.application.port.output.BridgeExecutor;
import in.execguard.application.port.output.ConnectionFactory;
import in.execguard.application.port.output.DirectExecutor;
import in.execguard.config.FailoverConfig;
import in.execguard.domain.connection.ConnectionDescriptor;
import in.execguard.domain.event.ResilienceEvent;
import in.execguard.domain.event.ResilienceEventType;
import in.execguard.domain.execution.ExecutionMethod;
import in.execguard.domain.execution.ExecutionResult;
import in.execguard.domain.signal.TradingSignal;
import in.execguard.infrastructure.bridge.metrics.ResilienceMetrics;
import in.execguard.infrastructure.bridge.recovery.ConnectionRecoveryManager;
import in.execguard.infrastructure.event.EventListeners;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Entry point for signal execution with bridge-to-direct failover.
 *
 * Flow per signal:
 * 1. Execute through the bridge, bounded by the execution timeout
 * 2. On error, timeout or unsuccessful result: count a failover, switch to
 *    RECOVERING, emit {@code failover} and execute once through the direct path,
 *    bounded by the direct timeout
 * 3. While RECOVERING, make sure a recovery of the bridge instance is running
 * 4. When the recovery manager reports the bridge instance recovered, switch
 *    back to NORMAL and emit {@code recovery-completed}
 *
 * Signals always try the bridge first, also while RECOVERING. The returned
 * future never completes exceptionally: failures of both paths yield an
 * unsuccessful DIRECT result carrying the direct path's error.
 *
 * Usage:
 * <pre>
 * FailoverOrchestrator failover = new FailoverOrchestrator(config.failover(),
 *     bridge, direct, recoveryManager, bridge::connect, ledger);
 * failover.onEvent(event -> audit.record(event));
 * failover.start();
 *
 * ExecutionResult result = failover.executeWithFailover(signal).join();
 * </pre>
 */
public class FailoverOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(FailoverOrchestrator.class);

    public enum FailoverState {
        NORMAL,      // Bridge considered healthy
        RECOVERING   // Bridge failed at least once since the last recovery
    }

    private final String bridgeInstanceId;
    private final Duration executionTimeout;
    private final Duration directTimeout;
    private final Duration healthCheckInterval;
    private final BridgeExecutor bridge;
    private final DirectExecutor direct;
    private final ConnectionRecoveryManager recoveryManager;
    private final ConnectionFactory bridgeConnectionFactory;
    private final ExecutionLedger ledger;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "BridgeHealthMonitor");
        t.setDaemon(true);
        return t;
    });

    private final AtomicReference<FailoverState> state = new AtomicReference<>(FailoverState.NORMAL);
    private final EventListeners<ResilienceEvent> listeners = new EventListeners<>("Failover");
    private final Consumer<ResilienceEvent> recoveryListener = this::onRecoveryEvent;
    private final Map<String, ConnectionHealth> connectionHealth = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean running = false;
    private ScheduledFuture<?> healthCheckTask;

    // Metrics
    private final AtomicLong totalExecutions = new AtomicLong();
    private final AtomicLong bridgeExecutions = new AtomicLong();
    private final AtomicLong directExecutions = new AtomicLong();
    private final AtomicLong failedExecutions = new AtomicLong();
    private final AtomicLong failoverCount = new AtomicLong();
    private final AtomicLong recoveryCount = new AtomicLong();
    private volatile Instant lastFailoverTime;
    private volatile Instant lastRecoveryTime;

    private volatile ResilienceMetrics metrics;  // Optional metrics collector

    public FailoverOrchestrator(FailoverConfig config, BridgeExecutor bridge, DirectExecutor direct,
                                ConnectionRecoveryManager recoveryManager,
                                ConnectionFactory bridgeConnectionFactory, ExecutionLedger ledger) {
        if (bridge == null || direct == null || recoveryManager == null || bridgeConnectionFactory == null) {
            throw new IllegalArgumentException("Bridge, direct executor, recovery manager and connection factory are required");
        }
        this.bridgeInstanceId = config.bridgeInstanceId();
        this.executionTimeout = Duration.ofMillis(config.executionTimeoutMs());
        this.directTimeout = Duration.ofMillis(config.directTimeoutMs());
        this.healthCheckInterval = Duration.ofMillis(config.healthCheckIntervalMs());
        this.bridge = bridge;
        this.direct = direct;
        this.recoveryManager = recoveryManager;
        this.bridgeConnectionFactory = bridgeConnectionFactory;
        this.ledger = ledger != null ? ledger : new ExecutionLedger();

        recoveryManager.addListener(recoveryListener);
    }

    public void setMetrics(ResilienceMetrics metrics) {
        this.metrics = metrics;
    }

    public void onEvent(Consumer<ResilienceEvent> listener) {
        listeners.add(listener);
    }

    /**
     * Start bridge connection health monitoring. No-op when the interval is 0.
     */
    public synchronized void start() {
        if (running || closed.get()) {
            return;
        }
        if (healthCheckInterval.isZero()) {
            log.info("[Failover] Health monitoring disabled");
            return;
        }
        running = true;
        healthCheckTask = scheduler.scheduleWithFixedDelay(
            this::performHealthCheck,
            0,
            healthCheckInterval.toMillis(),
            TimeUnit.MILLISECONDS
        );
        log.info("[Failover] Started bridge health monitoring (interval: {}ms)", healthCheckInterval.toMillis());
    }

    /**
     * Execute a signal, bridge first with direct fallback.
     *
     * @return future of the final result; never completes exceptionally
     * @throws IllegalArgumentException if the signal is null
     */
    public CompletableFuture<ExecutionResult> executeWithFailover(TradingSignal signal) {
        if (signal == null) {
            throw new IllegalArgumentException("Signal cannot be null");
        }
        totalExecutions.incrementAndGet();
        long startNanos = System.nanoTime();

        CompletableFuture<ExecutionResult> bridgeCall;
        try {
            bridgeCall = bridge.execute(signal);
            if (bridgeCall == null) {
                bridgeCall = CompletableFuture.failedFuture(new IllegalStateException("Bridge returned no result"));
            }
        } catch (Exception e) {
            bridgeCall = CompletableFuture.failedFuture(e);
        }

        return bridgeCall.copy()
            .orTimeout(executionTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .handle((result, error) -> {
                if (error == null && result != null && result.success()) {
                    return CompletableFuture.completedFuture(onBridgeSuccess(signal, result, startNanos));
                }
                return handleFailover(signal, result, error, startNanos);
            })
            .thenCompose(f -> f)
            .whenComplete((result, error) -> ensureRecovery())
            .exceptionally(error -> {
                log.error("[Failover] Unexpected error executing signal {}: {}", signal.id(), error.getMessage(), error);
                failedExecutions.incrementAndGet();
                return ExecutionResult.failed(ExecutionMethod.DIRECT, "Unexpected failover error: " + rootMessage(error));
            });
    }

    /**
     * Enter the failover path without a signal (operator tool).
     */
    public void forceFailover(String reason) {
        String cause = reason != null ? reason : "Forced failover";
        log.warn("[Failover] Forced failover: {}", cause);
        enterFailover(cause, "FORCED", null);
        ensureRecovery();
    }

    public FailoverState getState() {
        return state.get();
    }

    public Map<String, ConnectionHealth> getConnectionHealth() {
        return Map.copyOf(connectionHealth);
    }

    public FailoverMetrics getMetrics() {
        return new FailoverMetrics(
            state.get(),
            totalExecutions.get(),
            bridgeExecutions.get(),
            directExecutions.get(),
            failedExecutions.get(),
            failoverCount.get(),
            recoveryCount.get(),
            lastFailoverTime,
            lastRecoveryTime
        );
    }

    /**
     * Stop health monitoring and detach from the recovery manager. Safe to call more than once.
     */
    public void cleanup() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("[Failover] Cleaning up");
        recoveryManager.removeListener(recoveryListener);
        synchronized (this) {
            running = false;
            if (healthCheckTask != null) {
                healthCheckTask.cancel(false);
            }
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private ExecutionResult onBridgeSuccess(TradingSignal signal, ExecutionResult result, long startNanos) {
        Duration latency = Duration.ofNanos(System.nanoTime() - startNanos);
        bridgeExecutions.incrementAndGet();
        ExecutionResult timed = result.withLatency(latency);
        ledger.record(signal, timed);
        recordExecution(ExecutionMethod.BRIDGE, true, latency);
        log.debug("[Failover] Signal {} executed via bridge in {}ms (order {})",
            signal.id(), latency.toMillis(), result.orderId());
        return timed;
    }

    private CompletableFuture<ExecutionResult> handleFailover(TradingSignal signal, ExecutionResult bridgeResult,
                                                              Throwable error, long startNanos) {
        String cause;
        String causeCode;
        if (error != null) {
            Throwable root = unwrap(error);
            if (root instanceof TimeoutException) {
                cause = "Bridge execution timed out after " + executionTimeout.toMillis() + "ms";
                causeCode = "TIMEOUT";
            } else {
                cause = "Bridge execution failed: " + rootMessage(root);
                causeCode = "ERROR";
            }
        } else {
            cause = "Bridge rejected signal: "
                + (bridgeResult != null && bridgeResult.error() != null ? bridgeResult.error() : "no result");
            causeCode = "REJECTED";
        }
        recordExecution(ExecutionMethod.BRIDGE, false, Duration.ofNanos(System.nanoTime() - startNanos));

        log.warn("[Failover] {} for signal {}, executing directly", cause, signal.id());
        enterFailover(cause, causeCode, signal.id());
        ensureRecovery();

        CompletableFuture<ExecutionResult> directCall;
        try {
            directCall = direct.execute(signal);
            if (directCall == null) {
                directCall = CompletableFuture.failedFuture(new IllegalStateException("Direct executor returned no result"));
            }
        } catch (Exception e) {
            directCall = CompletableFuture.failedFuture(e);
        }

        return directCall.copy()
            .orTimeout(directTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .handle((result, directError) -> {
                Duration latency = Duration.ofNanos(System.nanoTime() - startNanos);
                if (directError != null) {
                    Throwable root = unwrap(directError);
                    String message = root instanceof TimeoutException
                        ? "Direct execution timed out after " + directTimeout.toMillis() + "ms"
                        : rootMessage(root);
                    log.error("[Failover] Direct execution of signal {} failed: {}", signal.id(), message);
                    failedExecutions.incrementAndGet();
                    recordExecution(ExecutionMethod.DIRECT, false, latency);
                    return ExecutionResult.failed(ExecutionMethod.DIRECT, message).withLatency(latency);
                }
                if (result == null || !result.success()) {
                    String message = result != null ? result.error() : "Direct executor returned no result";
                    log.error("[Failover] Direct execution of signal {} unsuccessful: {}", signal.id(), message);
                    failedExecutions.incrementAndGet();
                    recordExecution(ExecutionMethod.DIRECT, false, latency);
                    return ExecutionResult.failed(ExecutionMethod.DIRECT, message).withLatency(latency);
                }

                directExecutions.incrementAndGet();
                ExecutionResult timed = result.withLatency(latency);
                ledger.record(signal, timed);
                recordExecution(ExecutionMethod.DIRECT, true, latency);
                log.info("[Failover] Signal {} executed directly in {}ms (order {})",
                    signal.id(), latency.toMillis(), result.orderId());
                return timed;
            });
    }

    private void enterFailover(String cause, String causeCode, String signalId) {
        int count = (int) failoverCount.incrementAndGet();
        lastFailoverTime = Instant.now();
        state.set(FailoverState.RECOVERING);

        ResilienceMetrics m = metrics;
        if (m != null) {
            m.recordFailover(bridgeInstanceId, causeCode);
            m.recordFailoverState(true);
        }
        listeners.publish(new ResilienceEvent.Failover(bridgeInstanceId, cause, signalId, count, lastFailoverTime));
    }

    private void ensureRecovery() {
        if (closed.get() || state.get() != FailoverState.RECOVERING) {
            return;
        }
        if (recoveryManager.isRecovering(bridgeInstanceId)) {
            return;
        }
        try {
            recoveryManager.startRecovery(bridgeInstanceId, bridgeConnectionFactory);
        } catch (IllegalStateException e) {
            log.warn("[Failover] Cannot start recovery for {}: {}", bridgeInstanceId, e.getMessage());
        }
    }

    private void onRecoveryEvent(ResilienceEvent event) {
        if (event.type() != ResilienceEventType.RECOVERY_SUCCESSFUL || !bridgeInstanceId.equals(event.subjectId())) {
            return;
        }
        if (!state.compareAndSet(FailoverState.RECOVERING, FailoverState.NORMAL)) {
            log.debug("[Failover] Bridge {} recovered while already NORMAL", bridgeInstanceId);
            return;
        }

        int count = (int) recoveryCount.incrementAndGet();
        lastRecoveryTime = Instant.now();
        log.info("[Failover] Bridge {} recovered, resuming normal operation (recovery #{})", bridgeInstanceId, count);

        ResilienceMetrics m = metrics;
        if (m != null) {
            m.recordFailoverState(false);
        }
        listeners.publish(new ResilienceEvent.RecoveryCompleted(bridgeInstanceId, count, lastRecoveryTime));
    }

    private void performHealthCheck() {
        try {
            List<ConnectionDescriptor> connections = bridge.getConnections()
                .get(executionTimeout.toMillis(), TimeUnit.MILLISECONDS);
            Instant now = Instant.now();
            for (ConnectionDescriptor connection : connections) {
                ConnectionHealth previous = connectionHealth.get(connection.instanceId());
                boolean healthy = connection.isConnected();
                int errorCount = healthy ? 0 : (previous != null ? previous.errorCount() : 0) + 1;
                Duration sincePing = connection.heartbeatAge(now);
                connectionHealth.put(connection.instanceId(), new ConnectionHealth(
                    connection.instanceId(),
                    healthy,
                    connection.lastHeartbeat(),
                    sincePing,
                    errorCount,
                    healthy ? null : "Status " + connection.status(),
                    now
                ));
                if (!healthy) {
                    log.warn("[Failover] Bridge instance {} unhealthy: {} ({} consecutive checks)",
                        connection.instanceId(), connection.status(), errorCount);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.error("[Failover] Health monitoring failed: {}", rootMessage(unwrap(e)));
        } catch (Exception e) {
            log.error("[Failover] Health monitoring failed", e);
        }
    }

    private void recordExecution(ExecutionMethod method, boolean success, Duration latency) {
        ResilienceMetrics m = metrics;
        if (m != null) {
            m.recordExecution(method, success, latency);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
            && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static String rootMessage(Throwable error) {
        Throwable root = unwrap(error);
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }

    /**
     * Health of one bridge instance from the last poll.
     */
    public record ConnectionHealth(
        String instanceId,
        boolean healthy,
        Instant lastPing,
        Duration sinceLastPing,
        int errorCount,
        String lastError,
        Instant checkedAt
    ) {}

    /**
     * Failover metrics snapshot.
     */
    public record FailoverMetrics(
        FailoverState currentState,
        long totalExecutions,
        long bridgeExecutions,
        long directExecutions,
        long failedExecutions,
        long failoverCount,
        long recoveryCount,
        Instant lastFailoverTime,
        Instant lastRecoveryTime
    ) {
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("currentState", currentState.name());
            map.put("totalExecutions", totalExecutions);
            map.put("bridgeExecutions", bridgeExecutions);
            map.put("directExecutions", directExecutions);
            map.put("failedExecutions", failedExecutions);
            map.put("failoverCount", failoverCount);
            map.put("recoveryCount", recoveryCount);
            map.put("lastFailoverTime", lastFailoverTime != null ? lastFailoverTime.toString() : null);
            map.put("lastRecoveryTime", lastRecoveryTime != null ? lastRecoveryTime.toString() : null);
            return map;
        }
    }
}
