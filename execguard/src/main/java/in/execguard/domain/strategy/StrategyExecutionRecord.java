package in.execguard.domain.strategy;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bridge view of one strategy: status, parameters, performance, the orders
 * the bridge executed for it and net positions per symbol.
 *
 * Parameter values are numbers, strings or booleans. Collections are copied
 * on construction so a record can be shared between threads.
 */
public record StrategyExecutionRecord(
    String strategyId,
    String instanceId,
    StrategyStatus status,
    Instant startTime,
    Instant endTime,
    Map<String, Object> parameters,
    StrategyPerformance performance,
    List<BridgeOrder> orders,
    Map<String, BigDecimal> positions
) {
    public StrategyExecutionRecord {
        if (strategyId == null || strategyId.isBlank()) {
            throw new IllegalArgumentException("Strategy id cannot be null or empty");
        }
        if (status == null) {
            throw new IllegalArgumentException("Strategy status cannot be null");
        }
        parameters = parameters == null ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        performance = performance == null ? StrategyPerformance.empty() : performance;
        orders = orders == null ? List.of() : List.copyOf(orders);
        positions = positions == null ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(positions));
    }

    public BigDecimal positionFor(String symbol) {
        return positions.getOrDefault(symbol, BigDecimal.ZERO);
    }
}
