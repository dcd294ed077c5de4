package in.execguard.domain.execution;

import in.execguard.domain.signal.Direction;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionResultTest {

    @Test
    void successRequiresOrderId() {
        assertThrows(IllegalArgumentException.class, () -> new ExecutionResult(true, ExecutionMethod.BRIDGE,
            null, "strat-1", BigDecimal.ONE, BigDecimal.TEN, Instant.now(), Duration.ZERO, null));
    }

    @Test
    void failedResultCarriesError() {
        ExecutionResult result = ExecutionResult.failed(ExecutionMethod.DIRECT, null);

        assertFalse(result.success());
        assertNull(result.orderId());
        assertEquals("Unknown execution error", result.error());
        assertEquals(BigDecimal.ZERO, result.filledQuantity());
    }

    @Test
    void withLatencyKeepsEverythingElse() {
        ExecutionResult filled = ExecutionResult.filled(ExecutionMethod.BRIDGE, "b-1", "strat-1",
            BigDecimal.ONE, BigDecimal.TEN);

        ExecutionResult timed = filled.withLatency(Duration.ofMillis(42));

        assertEquals(Duration.ofMillis(42), timed.latency());
        assertEquals(filled.orderId(), timed.orderId());
        assertEquals(filled.timestamp(), timed.timestamp());
        assertTrue(timed.success());
    }

    @Test
    void ledgerTradeNotional() {
        LedgerTrade trade = new LedgerTrade("b-1", "strat-1", "sig-1", "BTC-USDT",
            Direction.SELL, new BigDecimal("2"), new BigDecimal("50.5"),
            ExecutionMethod.BRIDGE, Instant.now());

        assertEquals(0, new BigDecimal("101.0").compareTo(trade.notional()));
    }
}
