package in.execguard.bootstrap;

import in.execguard.application.port.output.AuditSink;
import in.execguard.application.port.output.BridgeExecutor;
import in.execguard.application.port.output.ConnectionFactory;
import in.execguard.application.port.output.DirectExecutor;
import in.execguard.application.service.DataConsistencyChecker;
import in.execguard.application.service.ExecutionLedger;
import in.execguard.application.service.FailoverOrchestrator;
import in.execguard.application.service.ReconciliationBuffer;
import in.execguard.application.service.StateSynchronizer;
import in.execguard.config.ResilienceConfig;
import in.execguard.config.StatusConfig;
import in.execguard.domain.event.ResilienceEvent;
import in.execguard.domain.execution.ExecutionResult;
import in.execguard.domain.signal.TradingSignal;
import in.execguard.infrastructure.audit.Slf4jAuditSink;
import in.execguard.infrastructure.bridge.metrics.PrometheusResilienceMetrics;
import in.execguard.infrastructure.bridge.recovery.ConnectionRecoveryManager;
import in.execguard.transport.http.StatusServer;
import io.prometheus.client.CollectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Wires the resilience components together.
 *
 * Startup sequence:
 * 1. Validate configuration
 * 2. Build ledger, reconciliation buffer, recovery manager, orchestrator,
 *    synchronizer and checker; attach metrics and route every event to the audit sink
 * 3. {@link #start()} starts health monitoring, the sync and consistency timers
 *    and (if enabled) the status server
 *
 * {@link #close()} stops everything in reverse order and may be called more than once.
 */
public final class ResilienceSubsystem implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResilienceSubsystem.class);

    private final ResilienceConfig config;
    private final ExecutionLedger ledger;
    private final ReconciliationBuffer buffer;
    private final ConnectionRecoveryManager recoveryManager;
    private final FailoverOrchestrator orchestrator;
    private final StateSynchronizer synchronizer;
    private final DataConsistencyChecker checker;
    private final PrometheusResilienceMetrics metrics;
    private final StatusServer statusServer;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private ResilienceSubsystem(ResilienceConfig config, BridgeExecutor bridge, DirectExecutor direct,
                                ConnectionFactory bridgeConnectionFactory, AuditSink auditSink,
                                CollectorRegistry registry) {
        this.config = config;
        this.ledger = new ExecutionLedger();
        this.buffer = new ReconciliationBuffer();
        this.metrics = new PrometheusResilienceMetrics(registry);

        this.recoveryManager = new ConnectionRecoveryManager(config.recovery());
        this.orchestrator = new FailoverOrchestrator(config.failover(), bridge, direct,
            recoveryManager, bridgeConnectionFactory, ledger);
        this.synchronizer = new StateSynchronizer(config.sync(), bridge, ledger, buffer);
        this.checker = new DataConsistencyChecker(config.consistency(), ledger, buffer);

        recoveryManager.setMetrics(metrics);
        orchestrator.setMetrics(metrics);
        synchronizer.setMetrics(metrics);
        checker.setMetrics(metrics);

        Consumer<ResilienceEvent> audit = auditSink::record;
        recoveryManager.addListener(audit);
        orchestrator.onEvent(audit);
        synchronizer.onEvent(audit);
        checker.onEvent(audit);

        this.statusServer = config.status().enabled()
            ? new StatusServer(metrics.getRegistry(), this::statusSnapshot)
            : null;
    }

    /**
     * Build a subsystem auditing through SLF4J with a private metrics registry.
     */
    public static ResilienceSubsystem create(ResilienceConfig config, BridgeExecutor bridge,
                                             DirectExecutor direct, ConnectionFactory bridgeConnectionFactory) {
        return create(config, bridge, direct, bridgeConnectionFactory, new Slf4jAuditSink(), new CollectorRegistry());
    }

    /**
     * @throws IllegalStateException if the configuration is invalid
     */
    public static ResilienceSubsystem create(ResilienceConfig config, BridgeExecutor bridge, DirectExecutor direct,
                                             ConnectionFactory bridgeConnectionFactory, AuditSink auditSink,
                                             CollectorRegistry registry) {
        if (config == null) {
            throw new IllegalArgumentException("Configuration cannot be null");
        }
        config.requireValid();
        return new ResilienceSubsystem(config, bridge, direct, bridgeConnectionFactory,
            auditSink != null ? auditSink : new Slf4jAuditSink(),
            registry != null ? registry : new CollectorRegistry());
    }

    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Resilience subsystem has been closed");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        orchestrator.start();
        synchronizer.start();
        checker.start();
        if (statusServer != null) {
            StatusConfig status = config.status();
            statusServer.start(status.host(), status.port());
        }
        log.info("[Resilience] Started (bridge instance: {})", config.failover().bridgeInstanceId());
    }

    public CompletableFuture<ExecutionResult> executeWithFailover(TradingSignal signal) {
        return orchestrator.executeWithFailover(signal);
    }

    /**
     * Metrics of every component, as served on /status.
     */
    public Map<String, Object> statusSnapshot() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("failover", orchestrator.getMetrics().toMap());
        status.put("recovery", recoveryManager.getMetrics().toMap());

        Map<String, Object> connections = new LinkedHashMap<>();
        recoveryManager.getConnectionStates().forEach((id, state) -> connections.put(id, state.name()));
        status.put("connectionStates", connections);

        status.put("synchronization", synchronizer.getMetrics().toMap());
        status.put("consistency", checker.getMetrics().toMap());
        status.put("pendingDiscrepancies", buffer.pendingCount());
        status.put("trackedStrategies", ledger.trackedStrategyIds().size());
        return status;
    }

    public ExecutionLedger ledger() {
        return ledger;
    }

    public ConnectionRecoveryManager recoveryManager() {
        return recoveryManager;
    }

    public FailoverOrchestrator failoverOrchestrator() {
        return orchestrator;
    }

    public StateSynchronizer stateSynchronizer() {
        return synchronizer;
    }

    public DataConsistencyChecker consistencyChecker() {
        return checker;
    }

    public PrometheusResilienceMetrics metrics() {
        return metrics;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("[Resilience] Shutting down");
        if (statusServer != null) {
            statusServer.stop();
        }
        checker.cleanup();
        synchronizer.cleanup();
        orchestrator.cleanup();
        recoveryManager.cleanup();
    }
}
