package in.execguard.domain.signal;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class TradingSignalTest {

    private static TradingSignal signal(String quantity, double confidence, String sourceTag) {
        return new TradingSignal("sig-1", "BTC-USDT", "binance", Direction.BUY,
            new BigDecimal("100"), new BigDecimal(quantity), null, confidence, sourceTag);
    }

    @Test
    void timestampDefaultsToNow() {
        assertNotNull(signal("1", 0.5, "strat-1").timestamp());
    }

    @Test
    void rejectsInvalidSignals() {
        assertThrows(IllegalArgumentException.class, () -> signal("0", 0.5, "strat-1"));
        assertThrows(IllegalArgumentException.class, () -> signal("1", 1.5, "strat-1"));
        assertThrows(IllegalArgumentException.class, () -> signal("1", 0.5, " "));
    }

    @Test
    void signedQuantity() {
        assertEquals(new BigDecimal("2"), Direction.BUY.signed(new BigDecimal("2")));
        assertEquals(new BigDecimal("-2"), Direction.SELL.signed(new BigDecimal("2")));
    }
}
