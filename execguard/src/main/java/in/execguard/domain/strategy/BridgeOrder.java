package in.execguard.domain.strategy;

import in.execguard.domain.signal.Direction;

import java.math.BigDecimal;

/**
 * Order the bridge reports as belonging to a strategy.
 */
public record BridgeOrder(
    String orderId,
    String symbol,
    Direction direction,
    BigDecimal quantity,
    BigDecimal price
) {
    public BridgeOrder {
        if (orderId == null || orderId.isBlank()) {
            throw new IllegalArgumentException("Order id cannot be null or empty");
        }
    }
}
