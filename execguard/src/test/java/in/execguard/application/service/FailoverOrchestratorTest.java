package in.execguard.application.service;

import in.execguard.application.port.output.BridgeExecutor;
import in.execguard.application.port.output.ConnectionFactory;
import in.execguard.application.port.output.DirectExecutor;
import in.execguard.config.FailoverConfig;
import in.execguard.config.ValidationPolicy;
import in.execguard.domain.connection.ConnectionDescriptor;
import in.execguard.domain.connection.ConnectionStatus;
import in.execguard.domain.event.ResilienceEvent;
import in.execguard.domain.event.ResilienceEventType;
import in.execguard.domain.execution.ExecutionMethod;
import in.execguard.domain.execution.ExecutionResult;
import in.execguard.domain.signal.TradingSignal;
import in.execguard.infrastructure.bridge.common.ReconnectionPolicy;
import in.execguard.infrastructure.bridge.recovery.ConnectionRecoveryManager;
import in.execguard.infrastructure.bridge.recovery.PostRecoveryValidator;
import in.execguard.support.Fixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for FailoverOrchestrator against mocked executors and a real
 * recovery manager.
 */
class FailoverOrchestratorTest {

    private static final String INSTANCE = "bridge-primary";

    private BridgeExecutor bridge;
    private DirectExecutor direct;
    private ExecutionLedger ledger;
    private ConnectionRecoveryManager recoveryManager;
    private FailoverOrchestrator orchestrator;
    private final List<ResilienceEvent> events = new CopyOnWriteArrayList<>();
    private long directTimeoutMs = 1_000;

    @BeforeEach
    void setUp() {
        bridge = mock(BridgeExecutor.class);
        direct = mock(DirectExecutor.class);
        ledger = new ExecutionLedger();
    }

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.cleanup();
        }
        if (recoveryManager != null) {
            recoveryManager.cleanup();
        }
    }

    /**
     * Orchestrator whose recovery never completes: first attempt after 5s,
     * and the connection never opens.
     */
    private FailoverOrchestrator stalledRecovery(long executionTimeoutMs) {
        return orchestrator(Duration.ofSeconds(5), CompletableFuture::new, executionTimeoutMs, 0);
    }

    private FailoverOrchestrator orchestrator(Duration recoveryDelay, ConnectionFactory factory,
                                              long executionTimeoutMs, long healthCheckIntervalMs) {
        ReconnectionPolicy policy = ReconnectionPolicy.builder()
            .initialDelay(recoveryDelay)
            .maxDelay(recoveryDelay.multipliedBy(2))
            .maxAttempts(3)
            .build();
        recoveryManager = new ConnectionRecoveryManager(policy, Duration.ofMillis(500),
            new PostRecoveryValidator(Duration.ofSeconds(30), Set.of()), ValidationPolicy.ADVISORY, () -> 0.0);
        orchestrator = new FailoverOrchestrator(
            new FailoverConfig(INSTANCE, executionTimeoutMs, directTimeoutMs, healthCheckIntervalMs),
            bridge, direct, recoveryManager, factory, ledger);
        orchestrator.onEvent(events::add);
        return orchestrator;
    }

    private long count(ResilienceEventType type) {
        return events.stream().filter(e -> e.type() == type).count();
    }

    private static void await(BooleanSupplier condition, String message) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail(message);
            }
            Thread.sleep(10);
        }
    }

    @Test
    @DisplayName("Bridge success: result returned as-is, fill recorded, no failover")
    void bridgeSuccess() throws Exception {
        stalledRecovery(1_000);
        TradingSignal signal = Fixtures.signal();
        when(bridge.execute(signal)).thenReturn(
            CompletableFuture.completedFuture(Fixtures.bridgeFill("b-1", "strat-1", "1", "100")));

        ExecutionResult result = orchestrator.executeWithFailover(signal).get(2, TimeUnit.SECONDS);

        assertTrue(result.success());
        assertEquals(ExecutionMethod.BRIDGE, result.executionMethod());
        assertEquals("b-1", result.orderId());
        assertEquals(FailoverOrchestrator.FailoverState.NORMAL, orchestrator.getState());
        assertEquals(1, ledger.trades("strat-1").size());
        assertTrue(events.isEmpty());
        assertFalse(recoveryManager.isRecovering(INSTANCE));
        verify(direct, never()).execute(any());

        FailoverOrchestrator.FailoverMetrics metrics = orchestrator.getMetrics();
        assertEquals(1, metrics.totalExecutions());
        assertEquals(1, metrics.bridgeExecutions());
        assertEquals(0, metrics.failoverCount());
    }

    @Test
    @DisplayName("Bridge error: direct path executes, failover emitted, recovery started")
    void bridgeErrorFailsOverToDirect() throws Exception {
        stalledRecovery(1_000);
        TradingSignal signal = Fixtures.signal();
        when(bridge.execute(signal)).thenReturn(CompletableFuture.failedFuture(new IOException("bridge down")));
        when(direct.execute(signal)).thenReturn(
            CompletableFuture.completedFuture(Fixtures.directFill("d-1", "1", "100")));

        ExecutionResult result = orchestrator.executeWithFailover(signal).get(2, TimeUnit.SECONDS);

        assertTrue(result.success());
        assertEquals(ExecutionMethod.DIRECT, result.executionMethod());
        assertEquals("d-1", result.orderId());
        assertEquals(FailoverOrchestrator.FailoverState.RECOVERING, orchestrator.getState());
        assertTrue(recoveryManager.isRecovering(INSTANCE));

        assertEquals(1, events.size());
        ResilienceEvent.Failover failover = (ResilienceEvent.Failover) events.get(0);
        assertEquals(INSTANCE, failover.subjectId());
        assertEquals(signal.id(), failover.signalId());
        assertEquals(1, failover.failoverCount());
        assertTrue(failover.cause().contains("bridge down"), failover.cause());

        // Direct fills are booked under the signal's source tag
        assertEquals(ExecutionMethod.DIRECT, ledger.trades("strat-1").get(0).method());

        FailoverOrchestrator.FailoverMetrics metrics = orchestrator.getMetrics();
        assertEquals(1, metrics.directExecutions());
        assertEquals(1, metrics.failoverCount());
        assertNotNull(metrics.lastFailoverTime());
    }

    @Test
    void bridgeTimeoutFailsOver() throws Exception {
        stalledRecovery(50);
        TradingSignal signal = Fixtures.signal();
        when(bridge.execute(signal)).thenReturn(new CompletableFuture<>());
        when(direct.execute(signal)).thenReturn(
            CompletableFuture.completedFuture(Fixtures.directFill("d-1", "1", "100")));

        ExecutionResult result = orchestrator.executeWithFailover(signal).get(2, TimeUnit.SECONDS);

        assertEquals(ExecutionMethod.DIRECT, result.executionMethod());
        ResilienceEvent.Failover failover = (ResilienceEvent.Failover) events.get(0);
        assertTrue(failover.cause().contains("timed out after 50ms"), failover.cause());
    }

    @Test
    void bridgeRejectionFailsOver() throws Exception {
        stalledRecovery(1_000);
        TradingSignal signal = Fixtures.signal();
        when(bridge.execute(signal)).thenReturn(
            CompletableFuture.completedFuture(ExecutionResult.failed(ExecutionMethod.BRIDGE, "insufficient margin")));
        when(direct.execute(signal)).thenReturn(
            CompletableFuture.completedFuture(Fixtures.directFill("d-1", "1", "100")));

        ExecutionResult result = orchestrator.executeWithFailover(signal).get(2, TimeUnit.SECONDS);

        assertTrue(result.success());
        ResilienceEvent.Failover failover = (ResilienceEvent.Failover) events.get(0);
        assertEquals("Bridge rejected signal: insufficient margin", failover.cause());
    }

    @Test
    @DisplayName("Both paths fail: unsuccessful DIRECT result with the direct error")
    void bothPathsFail() throws Exception {
        stalledRecovery(1_000);
        TradingSignal signal = Fixtures.signal();
        when(bridge.execute(signal)).thenReturn(CompletableFuture.failedFuture(new IOException("bridge down")));
        when(direct.execute(signal)).thenReturn(
            CompletableFuture.failedFuture(new IOException("exchange unreachable")));

        ExecutionResult result = orchestrator.executeWithFailover(signal).get(2, TimeUnit.SECONDS);

        assertFalse(result.success());
        assertEquals(ExecutionMethod.DIRECT, result.executionMethod());
        assertEquals("exchange unreachable", result.error());
        assertTrue(ledger.trades().isEmpty());
        assertEquals(1, orchestrator.getMetrics().failedExecutions());
        assertEquals(FailoverOrchestrator.FailoverState.RECOVERING, orchestrator.getState());
    }

    @Test
    void directExecutorThrowingIsHandled() throws Exception {
        stalledRecovery(1_000);
        TradingSignal signal = Fixtures.signal();
        when(bridge.execute(signal)).thenThrow(new IllegalStateException("bridge client closed"));
        when(direct.execute(signal)).thenThrow(new IllegalStateException("no api key"));

        ExecutionResult result = orchestrator.executeWithFailover(signal).get(2, TimeUnit.SECONDS);

        assertFalse(result.success());
        assertEquals("no api key", result.error());
    }

    @Test
    @DisplayName("Hanging direct path: unsuccessful DIRECT result after the direct timeout")
    void directTimeoutBoundsExecution() throws Exception {
        directTimeoutMs = 200;
        stalledRecovery(200);
        TradingSignal signal = Fixtures.signal();
        when(bridge.execute(signal)).thenThrow(new IllegalStateException("bridge client closed"));
        when(direct.execute(signal)).thenReturn(new CompletableFuture<>());

        ExecutionResult result = orchestrator.executeWithFailover(signal).get(3, TimeUnit.SECONDS);

        assertFalse(result.success());
        assertEquals(ExecutionMethod.DIRECT, result.executionMethod());
        assertEquals("Direct execution timed out after 200ms", result.error());
        assertTrue(ledger.trades().isEmpty());
        assertEquals(1, orchestrator.getMetrics().failedExecutions());
        assertEquals(0, orchestrator.getMetrics().directExecutions());
    }

    @Test
    @DisplayName("Burst of failures starts one recovery episode")
    void burstOfFailuresStartsOneRecovery() throws Exception {
        stalledRecovery(1_000);
        when(bridge.execute(any())).thenReturn(CompletableFuture.failedFuture(new IOException("bridge down")));
        when(direct.execute(any())).thenReturn(
            CompletableFuture.completedFuture(Fixtures.directFill("d-1", "1", "100")));

        for (int i = 0; i < 5; i++) {
            orchestrator.executeWithFailover(Fixtures.signal()).get(2, TimeUnit.SECONDS);
        }

        assertEquals(5, orchestrator.getMetrics().failoverCount());
        assertEquals(5, count(ResilienceEventType.FAILOVER));
        assertEquals(1, recoveryManager.getMetrics().totalEpisodes());
    }

    @Test
    @DisplayName("Successful recovery returns the orchestrator to NORMAL")
    void recoveryReturnsToNormal() throws Exception {
        orchestrator(Duration.ofMillis(10),
            () -> CompletableFuture.completedFuture(Fixtures.connected(INSTANCE)), 1_000, 0);
        CountDownLatch completed = new CountDownLatch(1);
        orchestrator.onEvent(event -> {
            if (event.type() == ResilienceEventType.RECOVERY_COMPLETED) {
                completed.countDown();
            }
        });
        TradingSignal signal = Fixtures.signal();
        when(bridge.execute(signal)).thenReturn(CompletableFuture.failedFuture(new IOException("bridge down")));
        when(direct.execute(signal)).thenReturn(
            CompletableFuture.completedFuture(Fixtures.directFill("d-1", "1", "100")));

        orchestrator.executeWithFailover(signal).get(2, TimeUnit.SECONDS);

        assertTrue(completed.await(2, TimeUnit.SECONDS), "recovery-completed not emitted");
        assertEquals(FailoverOrchestrator.FailoverState.NORMAL, orchestrator.getState());
        assertEquals(1, orchestrator.getMetrics().recoveryCount());
        assertNotNull(orchestrator.getMetrics().lastRecoveryTime());
        assertEquals(1, count(ResilienceEventType.RECOVERY_COMPLETED));

        ResilienceEvent.RecoveryCompleted event = (ResilienceEvent.RecoveryCompleted) events.stream()
            .filter(e -> e.type() == ResilienceEventType.RECOVERY_COMPLETED)
            .findFirst()
            .orElseThrow();
        assertEquals(1, event.recoveryCount());
    }

    @Test
    @DisplayName("While RECOVERING the bridge is still tried first")
    void bridgeTriedFirstWhileRecovering() throws Exception {
        stalledRecovery(1_000);
        orchestrator.forceFailover("maintenance");
        assertEquals(FailoverOrchestrator.FailoverState.RECOVERING, orchestrator.getState());

        TradingSignal signal = Fixtures.signal();
        when(bridge.execute(signal)).thenReturn(
            CompletableFuture.completedFuture(Fixtures.bridgeFill("b-1", "strat-1", "1", "100")));

        ExecutionResult result = orchestrator.executeWithFailover(signal).get(2, TimeUnit.SECONDS);

        assertEquals(ExecutionMethod.BRIDGE, result.executionMethod());
        verify(direct, never()).execute(any());
        assertEquals(FailoverOrchestrator.FailoverState.RECOVERING, orchestrator.getState(),
            "Only a successful recovery returns to NORMAL");
    }

    @Test
    void forceFailoverEmitsEventWithoutSignal() {
        stalledRecovery(1_000);

        orchestrator.forceFailover("operator request");

        ResilienceEvent.Failover failover = (ResilienceEvent.Failover) events.get(0);
        assertEquals("operator request", failover.cause());
        assertNull(failover.signalId());
        assertTrue(recoveryManager.isRecovering(INSTANCE));
    }

    @Test
    void healthMonitorTracksConnections() throws Exception {
        orchestrator(Duration.ofSeconds(5), CompletableFuture::new, 1_000, 20);
        when(bridge.getConnections()).thenReturn(CompletableFuture.completedFuture(List.of(
            Fixtures.connected("bridge-a"),
            Fixtures.withStatus("bridge-b", ConnectionStatus.ERROR)
        )));

        orchestrator.start();
        await(() -> orchestrator.getConnectionHealth().size() == 2, "health not recorded");
        await(() -> orchestrator.getConnectionHealth().get("bridge-b").errorCount() >= 2, "errors not counted");

        Map<String, FailoverOrchestrator.ConnectionHealth> health = orchestrator.getConnectionHealth();
        assertTrue(health.get("bridge-a").healthy());
        assertEquals(0, health.get("bridge-a").errorCount());
        assertFalse(health.get("bridge-b").healthy());
        assertEquals("Status ERROR", health.get("bridge-b").lastError());
        // Monitoring only records health
        assertEquals(FailoverOrchestrator.FailoverState.NORMAL, orchestrator.getState());
    }

    @Test
    void healthMonitorSurvivesBridgeErrors() throws Exception {
        orchestrator(Duration.ofSeconds(5), CompletableFuture::new, 1_000, 20);
        CompletableFuture<List<ConnectionDescriptor>> failing =
            CompletableFuture.failedFuture(new IOException("bridge down"));
        when(bridge.getConnections())
            .thenReturn(failing)
            .thenReturn(CompletableFuture.completedFuture(List.of(Fixtures.connected("bridge-a"))));

        orchestrator.start();

        await(() -> orchestrator.getConnectionHealth().containsKey("bridge-a"), "monitor stopped after error");
    }

    @Test
    void cleanupIsIdempotent() {
        stalledRecovery(1_000);
        orchestrator.cleanup();
        orchestrator.cleanup();

        orchestrator.forceFailover("after cleanup");
        assertFalse(recoveryManager.isRecovering(INSTANCE), "No recovery once cleaned up");
    }

    @Test
    void rejectsNullSignal() {
        stalledRecovery(1_000);
        assertThrows(IllegalArgumentException.class, () -> orchestrator.executeWithFailover(null));
    }
}
