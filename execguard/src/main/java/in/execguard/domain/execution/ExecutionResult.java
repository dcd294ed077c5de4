package in.execguard.domain.execution;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one execution attempt, produced by either executor.
 *
 * A successful result always carries an order id.
 */
public record ExecutionResult(
    boolean success,
    ExecutionMethod executionMethod,
    String orderId,
    String strategyId,
    BigDecimal filledQuantity,
    BigDecimal averagePrice,
    Instant timestamp,
    Duration latency,
    String error
) {
    public ExecutionResult {
        if (executionMethod == null) {
            throw new IllegalArgumentException("Execution method cannot be null");
        }
        if (success && (orderId == null || orderId.isBlank())) {
            throw new IllegalArgumentException("Successful execution must carry an order id");
        }
        if (filledQuantity == null) {
            filledQuantity = BigDecimal.ZERO;
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        if (latency == null) {
            latency = Duration.ZERO;
        }
    }

    public static ExecutionResult filled(ExecutionMethod method, String orderId, String strategyId,
                                         BigDecimal filledQuantity, BigDecimal averagePrice) {
        return new ExecutionResult(true, method, orderId, strategyId, filledQuantity, averagePrice,
            Instant.now(), Duration.ZERO, null);
    }

    public static ExecutionResult failed(ExecutionMethod method, String error) {
        return new ExecutionResult(false, method, null, null, BigDecimal.ZERO, null,
            Instant.now(), Duration.ZERO, error != null ? error : "Unknown execution error");
    }

    public ExecutionResult withLatency(Duration latency) {
        return new ExecutionResult(success, executionMethod, orderId, strategyId, filledQuantity,
            averagePrice, timestamp, latency, error);
    }
}
