package in.execguard.domain.signal;

import java.math.BigDecimal;

/**
 * Trade direction.
 */
public enum Direction {
    BUY,
    SELL;

    /**
     * Signed quantity for this direction (BUY positive, SELL negative).
     */
    public BigDecimal signed(BigDecimal quantity) {
        return this == BUY ? quantity : quantity.negate();
    }
}
