package in.execguard.application.port.output;

import in.execguard.domain.execution.ExecutionResult;
import in.execguard.domain.signal.TradingSignal;

import java.util.concurrent.CompletableFuture;

/**
 * Executes a signal straight against the exchange API.
 */
public interface DirectExecutor {
    CompletableFuture<ExecutionResult> execute(TradingSignal signal);
}
