package in.execguard.domain.execution;

import in.execguard.domain.signal.Direction;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One fill recorded in the local execution ledger.
 *
 * Trade id is the order id reported by the executor. The same id appearing
 * twice means the fill was recorded by both execution paths.
 */
public record LedgerTrade(
    String tradeId,
    String strategyId,
    String signalId,
    String symbol,
    Direction direction,
    BigDecimal quantity,
    BigDecimal price,
    ExecutionMethod method,
    Instant recordedAt
) {
    public LedgerTrade {
        if (tradeId == null || tradeId.isBlank()) {
            throw new IllegalArgumentException("Trade id cannot be null or empty");
        }
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("Trade quantity must be positive");
        }
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Trade price must be positive");
        }
    }

    public BigDecimal notional() {
        return quantity.multiply(price);
    }
}
