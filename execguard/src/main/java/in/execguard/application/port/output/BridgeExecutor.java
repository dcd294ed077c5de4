package in.execguard.application.port.output;

import in.execguard.domain.connection.ConnectionDescriptor;
import in.execguard.domain.execution.ExecutionResult;
import in.execguard.domain.signal.TradingSignal;
import in.execguard.domain.strategy.StrategyExecutionRecord;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Client for the external execution engine ("bridge").
 *
 * All calls are asynchronous. A future completing exceptionally means the
 * bridge could not be reached; an unsuccessful {@link ExecutionResult} means
 * it was reached but refused or failed the order.
 */
public interface BridgeExecutor {

    CompletableFuture<ExecutionResult> execute(TradingSignal signal);

    CompletableFuture<List<ConnectionDescriptor>> getConnections();

    /**
     * @return the bridge record, or empty if the bridge does not know the strategy
     */
    CompletableFuture<Optional<StrategyExecutionRecord>> getStrategyState(String strategyId);
}
