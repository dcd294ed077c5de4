package in.execguard.infrastructure.bridge.metrics;

import in.execguard.domain.connection.ConnectionState;
import in.execguard.domain.consistency.DiscrepancyType;
import in.execguard.domain.execution.ExecutionMethod;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of ResilienceMetrics.
 *
 * Key Metrics:
 * - execguard_recovery_attempts_total{instance, result} - connect() attempts
 * - execguard_recovery_episodes_total{instance, outcome} - finished episodes
 * - execguard_recovery_duration_seconds{instance} - episode duration
 * - execguard_recovery_backoff_seconds{instance} - backoff before the next attempt
 * - execguard_connection_state{instance} - ordinal of ConnectionState
 * - execguard_failovers_total{instance, cause} - bridge to direct switches
 * - execguard_executions_total{method, status} - executions per path
 * - execguard_execution_latency_seconds{method} - execution latency
 * - execguard_failover_recovering - 1 while the orchestrator is recovering
 * - execguard_syncs_total{status}, execguard_sync_duration_seconds
 * - execguard_discrepancies_total{type}, execguard_corrections_total{type}
 * - execguard_consistency_checks_total{status}, execguard_consistency_check_duration_seconds
 *
 * Usage:
 * <pre>
 * PrometheusResilienceMetrics metrics = new PrometheusResilienceMetrics(new CollectorRegistry());
 * recoveryManager.setMetrics(metrics);
 *
 * // Expose at /metrics endpoint
 * new StatusServer(metrics.getRegistry(), subsystem::statusSnapshot).start("0.0.0.0", 9095);
 * </pre>
 */
public class PrometheusResilienceMetrics implements ResilienceMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusResilienceMetrics.class);

    private final CollectorRegistry registry;

    // Recovery metrics
    private final Counter recoveryAttempts;
    private final Counter recoveryEpisodes;
    private final Histogram recoveryDuration;
    private final Gauge recoveryBackoff;
    private final Gauge connectionState;

    // Failover metrics
    private final Counter failovers;
    private final Counter executions;
    private final Histogram executionLatency;
    private final Gauge failoverRecovering;

    // Reconciliation metrics
    private final Counter syncs;
    private final Histogram syncDuration;
    private final Counter discrepancies;
    private final Counter corrections;
    private final Counter consistencyChecks;
    private final Histogram consistencyCheckDuration;

    public PrometheusResilienceMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusResilienceMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.recoveryAttempts = Counter.build()
            .name("execguard_recovery_attempts_total")
            .help("Bridge reconnection attempts")
            .labelNames("instance", "result")
            .register(registry);

        this.recoveryEpisodes = Counter.build()
            .name("execguard_recovery_episodes_total")
            .help("Finished recovery episodes by outcome")
            .labelNames("instance", "outcome")
            .register(registry);

        this.recoveryDuration = Histogram.build()
            .name("execguard_recovery_duration_seconds")
            .help("Recovery episode duration in seconds")
            .labelNames("instance")
            .buckets(0.5, 1.0, 2.0, 5.0, 10.0, 30.0, 60.0, 120.0, 300.0)
            .register(registry);

        this.recoveryBackoff = Gauge.build()
            .name("execguard_recovery_backoff_seconds")
            .help("Backoff scheduled before the next reconnection attempt")
            .labelNames("instance")
            .register(registry);

        this.connectionState = Gauge.build()
            .name("execguard_connection_state")
            .help("Connection state (0=UNKNOWN, 1=CONNECTED, 2=RECOVERING, 3=FAILED, 4=STOPPED)")
            .labelNames("instance")
            .register(registry);

        this.failovers = Counter.build()
            .name("execguard_failovers_total")
            .help("Switches from the bridge to the direct execution path")
            .labelNames("instance", "cause")
            .register(registry);

        this.executions = Counter.build()
            .name("execguard_executions_total")
            .help("Signal executions by path and status")
            .labelNames("method", "status")
            .register(registry);

        this.executionLatency = Histogram.build()
            .name("execguard_execution_latency_seconds")
            .help("Signal execution latency in seconds")
            .labelNames("method")
            .buckets(0.01, 0.05, 0.1, 0.2, 0.5, 1.0, 2.0, 5.0)
            .register(registry);

        this.failoverRecovering = Gauge.build()
            .name("execguard_failover_recovering")
            .help("1 while the orchestrator is in RECOVERING state")
            .register(registry);

        this.syncs = Counter.build()
            .name("execguard_syncs_total")
            .help("Strategy state synchronizations")
            .labelNames("status")
            .register(registry);

        this.syncDuration = Histogram.build()
            .name("execguard_sync_duration_seconds")
            .help("Synchronization pass duration in seconds")
            .buckets(0.01, 0.05, 0.1, 0.5, 1.0, 5.0, 10.0)
            .register(registry);

        this.discrepancies = Counter.build()
            .name("execguard_discrepancies_total")
            .help("Detected discrepancies by type")
            .labelNames("type")
            .register(registry);

        this.corrections = Counter.build()
            .name("execguard_corrections_total")
            .help("Applied corrections by discrepancy type")
            .labelNames("type")
            .register(registry);

        this.consistencyChecks = Counter.build()
            .name("execguard_consistency_checks_total")
            .help("Consistency sweeps by status")
            .labelNames("status")
            .register(registry);

        this.consistencyCheckDuration = Histogram.build()
            .name("execguard_consistency_check_duration_seconds")
            .help("Consistency sweep duration in seconds")
            .buckets(0.01, 0.05, 0.1, 0.5, 1.0, 5.0, 10.0)
            .register(registry);

        log.info("[PrometheusResilienceMetrics] Initialized resilience metrics");
    }

    @Override
    public void recordRecoveryAttempt(String instanceId, boolean success) {
        recoveryAttempts.labels(instanceId, success ? "success" : "failure").inc();
    }

    @Override
    public void recordRecoveryOutcome(String instanceId, String outcome, Duration elapsed) {
        recoveryEpisodes.labels(instanceId, outcome.toLowerCase()).inc();
        recoveryDuration.labels(instanceId).observe(seconds(elapsed));
    }

    @Override
    public void recordBackoff(String instanceId, Duration delay) {
        recoveryBackoff.labels(instanceId).set(seconds(delay));
    }

    @Override
    public void recordConnectionState(String instanceId, ConnectionState state) {
        connectionState.labels(instanceId).set(state.ordinal());
    }

    @Override
    public void recordFailover(String instanceId, String cause) {
        failovers.labels(instanceId, cause).inc();
        log.debug("[PrometheusResilienceMetrics] Failover: instance={}, cause={}", instanceId, cause);
    }

    @Override
    public void recordExecution(ExecutionMethod method, boolean success, Duration latency) {
        String path = method.name().toLowerCase();
        executions.labels(path, success ? "success" : "failure").inc();
        executionLatency.labels(path).observe(seconds(latency));
    }

    @Override
    public void recordFailoverState(boolean recovering) {
        failoverRecovering.set(recovering ? 1 : 0);
    }

    @Override
    public void recordSync(boolean success, Duration elapsed) {
        syncs.labels(success ? "success" : "failure").inc();
        syncDuration.observe(seconds(elapsed));
    }

    @Override
    public void recordSyncSkipped() {
        syncs.labels("skipped").inc();
    }

    @Override
    public void recordDiscrepancy(DiscrepancyType type) {
        discrepancies.labels(type.name()).inc();
    }

    @Override
    public void recordCorrection(DiscrepancyType type) {
        corrections.labels(type.name()).inc();
    }

    @Override
    public void recordConsistencyCheck(Duration elapsed) {
        consistencyChecks.labels("completed").inc();
        consistencyCheckDuration.observe(seconds(elapsed));
    }

    @Override
    public void recordConsistencyCheckSkipped() {
        consistencyChecks.labels("skipped").inc();
    }

    /**
     * Get Prometheus registry for HTTP exposition.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }

    private static double seconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }
}
