package in.execguard.domain.strategy;

import java.math.BigDecimal;

/**
 * Performance counters the bridge keeps for one strategy.
 *
 * Values are taken as reported; the consistency checker flags impossible
 * combinations (fill rate outside [0,1], more successful than total trades).
 */
public record StrategyPerformance(
    int totalTrades,
    int successfulTrades,
    BigDecimal totalVolume,
    BigDecimal totalPnl,
    double fillRate,
    BigDecimal maxDrawdown,
    BigDecimal currentDrawdown
) {
    public StrategyPerformance {
        if (totalVolume == null) totalVolume = BigDecimal.ZERO;
        if (totalPnl == null) totalPnl = BigDecimal.ZERO;
        if (maxDrawdown == null) maxDrawdown = BigDecimal.ZERO;
        if (currentDrawdown == null) currentDrawdown = BigDecimal.ZERO;
    }

    public static StrategyPerformance empty() {
        return new StrategyPerformance(0, 0, BigDecimal.ZERO, BigDecimal.ZERO, 0.0,
            BigDecimal.ZERO, BigDecimal.ZERO);
    }
}
