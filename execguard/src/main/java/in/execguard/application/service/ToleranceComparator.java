package in.execguard.application.service;

import in.execguard.config.SyncConfig;
import in.execguard.domain.consistency.ConsistencyDiscrepancy;
import in.execguard.domain.consistency.DiscrepancyType;
import in.execguard.domain.strategy.ShadowRecord;
import in.execguard.domain.strategy.StrategyExecutionRecord;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Field-by-field comparison of a bridge record with the local shadow record.
 *
 * Totals are compared with the shadow record's bridge share: fills executed
 * through the direct path never reach the bridge.
 *
 * A field is flagged only when its difference exceeds the tolerance:
 * - P&L: absolute difference
 * - trade count: absolute integer difference
 * - start time: milliseconds, skipped when either side has none
 * - numeric parameters: relative difference against the larger magnitude
 * - other parameters: any inequality; a key present on one side only is drift
 */
public class ToleranceComparator {

    private final BigDecimal pnlTolerance;
    private final int tradeCountTolerance;
    private final long timestampToleranceMs;
    private final double parameterTolerance;

    public ToleranceComparator(SyncConfig config) {
        this(BigDecimal.valueOf(config.pnlTolerance()), config.tradeCountTolerance(),
            config.timestampToleranceMs(), config.parameterTolerance());
    }

    public ToleranceComparator(BigDecimal pnlTolerance, int tradeCountTolerance,
                               long timestampToleranceMs, double parameterTolerance) {
        this.pnlTolerance = pnlTolerance;
        this.tradeCountTolerance = tradeCountTolerance;
        this.timestampToleranceMs = timestampToleranceMs;
        this.parameterTolerance = parameterTolerance;
    }

    public List<ConsistencyDiscrepancy> compare(StrategyExecutionRecord bridge, ShadowRecord local) {
        String strategyId = bridge.strategyId();
        List<ConsistencyDiscrepancy> found = new ArrayList<>();

        ShadowRecord.BridgeShare share = local.bridgeShare();

        BigDecimal bridgePnl = bridge.performance().totalPnl();
        BigDecimal pnlDiff = bridgePnl.subtract(share.realizedPnl()).abs();
        if (pnlDiff.compareTo(pnlTolerance) > 0) {
            found.add(ConsistencyDiscrepancy.of(DiscrepancyType.PNL_MISMATCH, strategyId, "totalPnl",
                pnlDiff.doubleValue(), bridgePnl, share.realizedPnl()));
        }

        int countDiff = Math.abs(bridge.performance().totalTrades() - share.tradeCount());
        if (countDiff > tradeCountTolerance) {
            found.add(ConsistencyDiscrepancy.of(DiscrepancyType.TRADE_COUNT_MISMATCH, strategyId, "totalTrades",
                countDiff, bridge.performance().totalTrades(), share.tradeCount()));
        }

        if (bridge.startTime() != null && local.startTime() != null) {
            long skewMs = Math.abs(Duration.between(bridge.startTime(), local.startTime()).toMillis());
            if (skewMs > timestampToleranceMs) {
                found.add(ConsistencyDiscrepancy.of(DiscrepancyType.TIMESTAMP_SKEW, strategyId, "startTime",
                    skewMs, bridge.startTime(), local.startTime()));
            }
        }

        found.addAll(compareParameters(strategyId, bridge.parameters(), local.parameters()));
        return found;
    }

    private List<ConsistencyDiscrepancy> compareParameters(String strategyId,
                                                           Map<String, Object> bridgeParams,
                                                           Map<String, Object> localParams) {
        List<ConsistencyDiscrepancy> found = new ArrayList<>();
        Set<String> keys = new LinkedHashSet<>(bridgeParams.keySet());
        keys.addAll(localParams.keySet());

        for (String key : keys) {
            boolean onBridge = bridgeParams.containsKey(key);
            boolean onLocal = localParams.containsKey(key);
            Object bridgeValue = bridgeParams.get(key);
            Object localValue = localParams.get(key);

            if (!onBridge || !onLocal) {
                found.add(ConsistencyDiscrepancy.of(DiscrepancyType.PARAMETER_DRIFT, strategyId,
                    "parameters." + key, 1.0, bridgeValue, localValue));
                continue;
            }

            if (bridgeValue instanceof Number && localValue instanceof Number) {
                double b = ((Number) bridgeValue).doubleValue();
                double l = ((Number) localValue).doubleValue();
                double scale = Math.max(Math.abs(b), Math.abs(l));
                double relative = scale == 0.0 ? 0.0 : Math.abs(b - l) / scale;
                if (relative > parameterTolerance) {
                    found.add(ConsistencyDiscrepancy.of(DiscrepancyType.PARAMETER_DRIFT, strategyId,
                        "parameters." + key, Math.abs(b - l), bridgeValue, localValue));
                }
            } else if (!Objects.equals(bridgeValue, localValue)) {
                found.add(ConsistencyDiscrepancy.of(DiscrepancyType.PARAMETER_DRIFT, strategyId,
                    "parameters." + key, 1.0, bridgeValue, localValue));
            }
        }
        return found;
    }
}
