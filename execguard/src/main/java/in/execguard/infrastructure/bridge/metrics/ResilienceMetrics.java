package in.execguard.infrastructure.bridge.metrics;

import in.execguard.domain.connection.ConnectionState;
import in.execguard.domain.consistency.DiscrepancyType;
import in.execguard.domain.execution.ExecutionMethod;

import java.time.Duration;

/**
 * Metrics sink for the resilience components.
 *
 * Components hold an optional reference and call it after updating their own
 * counters, so a missing or failing sink never changes behaviour.
 */
public interface ResilienceMetrics {

    /**
     * Record one connect() attempt of a recovery episode.
     *
     * @param instanceId Bridge instance id
     * @param success Whether the attempt produced a usable connection
     */
    void recordRecoveryAttempt(String instanceId, boolean success);

    /**
     * Record the end of a recovery episode.
     *
     * @param instanceId Bridge instance id
     * @param outcome RECOVERED, EXHAUSTED or STOPPED
     * @param elapsed Episode duration
     */
    void recordRecoveryOutcome(String instanceId, String outcome, Duration elapsed);

    /**
     * Record the backoff scheduled before the next attempt.
     */
    void recordBackoff(String instanceId, Duration delay);

    void recordConnectionState(String instanceId, ConnectionState state);

    /**
     * Record a switch from the bridge to the direct path.
     *
     * @param instanceId Bridge instance id
     * @param cause Short cause (ERROR, TIMEOUT, REJECTED, FORCED)
     */
    void recordFailover(String instanceId, String cause);

    /**
     * Record one execution through either path.
     */
    void recordExecution(ExecutionMethod method, boolean success, Duration latency);

    /**
     * Record the orchestrator state (true while recovering).
     */
    void recordFailoverState(boolean recovering);

    void recordSync(boolean success, Duration elapsed);

    void recordSyncSkipped();

    void recordDiscrepancy(DiscrepancyType type);

    void recordCorrection(DiscrepancyType type);

    void recordConsistencyCheck(Duration elapsed);

    void recordConsistencyCheckSkipped();
}
