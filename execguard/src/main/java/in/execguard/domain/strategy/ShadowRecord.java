package in.execguard.domain.strategy;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Local view of one strategy, derived from the execution ledger.
 *
 * The top-level totals merge fills from both execution paths. The bridge
 * only knows its own fills, so {@link #bridgeShare()} is what gets compared
 * with the bridge's {@link StrategyExecutionRecord}.
 */
public record ShadowRecord(
    String strategyId,
    int tradeCount,
    BigDecimal realizedPnl,
    BigDecimal totalVolume,
    Map<String, BigDecimal> positions,
    Map<String, Object> parameters,
    Instant startTime,
    Set<String> bridgeOrderIds,
    BridgeShare bridgeShare
) {
    public ShadowRecord {
        if (bridgeShare == null) {
            throw new IllegalArgumentException("Bridge share cannot be null");
        }
        positions = positions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(positions));
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        bridgeOrderIds = bridgeOrderIds == null ? Set.of() : Set.copyOf(bridgeOrderIds);
    }

    public BigDecimal positionFor(String symbol) {
        return positions.getOrDefault(symbol, BigDecimal.ZERO);
    }

    /**
     * Totals of the bridge-path fills alone, corrections included.
     */
    public record BridgeShare(
        int tradeCount,
        BigDecimal realizedPnl,
        Map<String, BigDecimal> positions
    ) {
        public BridgeShare {
            positions = positions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(positions));
        }

        public BigDecimal positionFor(String symbol) {
            return positions.getOrDefault(symbol, BigDecimal.ZERO);
        }
    }
}
