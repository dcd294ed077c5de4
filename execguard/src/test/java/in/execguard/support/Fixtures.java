package in.execguard.support;

import in.execguard.domain.connection.ConnectionDescriptor;
import in.execguard.domain.connection.ConnectionStatus;
import in.execguard.domain.execution.ExecutionMethod;
import in.execguard.domain.execution.ExecutionResult;
import in.execguard.domain.signal.Direction;
import in.execguard.domain.signal.TradingSignal;
import in.execguard.domain.strategy.BridgeOrder;
import in.execguard.domain.strategy.StrategyExecutionRecord;
import in.execguard.domain.strategy.StrategyPerformance;
import in.execguard.domain.strategy.StrategyStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared builders for test data.
 */
public final class Fixtures {

    private static final AtomicInteger SEQ = new AtomicInteger();

    public static TradingSignal signal(String strategyId, String symbol, Direction direction,
                                       String quantity, String price) {
        return new TradingSignal("sig-" + SEQ.incrementAndGet(), symbol, "binance", direction,
            new BigDecimal(price), new BigDecimal(quantity), Instant.now(), 0.8, strategyId);
    }

    public static TradingSignal signal() {
        return signal("strat-1", "BTC-USDT", Direction.BUY, "1", "100");
    }

    public static ExecutionResult bridgeFill(String orderId, String strategyId, String quantity, String price) {
        return ExecutionResult.filled(ExecutionMethod.BRIDGE, orderId, strategyId,
            new BigDecimal(quantity), new BigDecimal(price));
    }

    public static ExecutionResult directFill(String orderId, String quantity, String price) {
        return ExecutionResult.filled(ExecutionMethod.DIRECT, orderId, null,
            new BigDecimal(quantity), new BigDecimal(price));
    }

    public static ConnectionDescriptor connected(String instanceId) {
        return new ConnectionDescriptor(instanceId, ConnectionStatus.CONNECTED, Instant.now(), "v1", "ws://localhost:8000");
    }

    public static ConnectionDescriptor withStatus(String instanceId, ConnectionStatus status) {
        return new ConnectionDescriptor(instanceId, status, Instant.now(), "v1", "ws://localhost:8000");
    }

    public static StrategyExecutionRecord bridgeRecord(String strategyId, int totalTrades, String totalPnl,
                                                       Instant startTime, Map<String, Object> parameters,
                                                       List<BridgeOrder> orders, Map<String, BigDecimal> positions) {
        StrategyPerformance performance = new StrategyPerformance(totalTrades, totalTrades,
            BigDecimal.ZERO, new BigDecimal(totalPnl), 1.0, BigDecimal.ZERO, BigDecimal.ZERO);
        return new StrategyExecutionRecord(strategyId, "bridge-primary", StrategyStatus.ACTIVE, startTime, null,
            parameters, performance, orders, positions);
    }

    private Fixtures() {}
}
