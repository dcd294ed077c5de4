package in.execguard.domain.signal;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Trading signal handed to the failover orchestrator.
 *
 * Created by the signal generator and consumed once per execution attempt.
 * The source tag identifies the originating strategy; direct-path executions
 * are attributed to it in the execution ledger.
 */
public record TradingSignal(
    String id,
    String symbol,
    String venue,
    Direction direction,
    BigDecimal referencePrice,
    BigDecimal quantity,
    Instant timestamp,
    double confidence,
    String sourceTag
) {
    public TradingSignal {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Signal id cannot be null or empty");
        }
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be null or empty");
        }
        if (direction == null) {
            throw new IllegalArgumentException("Direction cannot be null");
        }
        if (referencePrice == null || referencePrice.signum() <= 0) {
            throw new IllegalArgumentException("Reference price must be positive");
        }
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0 and 1");
        }
        if (sourceTag == null || sourceTag.isBlank()) {
            throw new IllegalArgumentException("Source tag cannot be null or empty");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
