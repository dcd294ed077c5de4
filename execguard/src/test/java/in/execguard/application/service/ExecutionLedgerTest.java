package in.execguard.application.service;

import in.execguard.domain.execution.ExecutionMethod;
import in.execguard.domain.execution.ExecutionResult;
import in.execguard.domain.execution.LedgerTrade;
import in.execguard.domain.signal.Direction;
import in.execguard.domain.signal.TradingSignal;
import in.execguard.domain.strategy.ShadowRecord;
import in.execguard.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionLedgerTest {

    private ExecutionLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new ExecutionLedger();
    }

    private void fill(String orderId, Direction direction, String qty, String price) {
        TradingSignal signal = Fixtures.signal("strat-1", "BTC-USDT", direction, qty, price);
        ledger.record(signal, Fixtures.bridgeFill(orderId, "strat-1", qty, price));
    }

    private ShadowRecord shadow() {
        return ledger.shadowRecord("strat-1").orElseThrow();
    }

    private static void assertDecimal(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "expected " + expected + " but was " + actual);
    }

    @Test
    void averageCostRealizedPnl() {
        fill("o-1", Direction.BUY, "1", "100");
        fill("o-2", Direction.BUY, "1", "110");
        fill("o-3", Direction.SELL, "1", "120");

        ShadowRecord record = shadow();
        assertEquals(3, record.tradeCount());
        assertDecimal("15", record.realizedPnl());
        assertDecimal("1", record.positionFor("BTC-USDT"));
        assertDecimal("330", record.totalVolume());
        assertEquals(Set.of("o-1", "o-2", "o-3"), record.bridgeOrderIds());
    }

    @Test
    void flippingPositionRealizesAndResetsCost() {
        fill("o-1", Direction.BUY, "1", "100");
        fill("o-2", Direction.SELL, "2", "90");   // closes long at -10, opens short at 90
        fill("o-3", Direction.BUY, "1", "80");    // covers short at +10

        ShadowRecord record = shadow();
        assertDecimal("0", record.realizedPnl());
        assertDecimal("0", record.positionFor("BTC-USDT"));
    }

    @Test
    void directFillUsesSourceTagAndSignalFallbacks() {
        TradingSignal signal = Fixtures.signal("strat-9", "ETH-USDT", Direction.SELL, "2", "3000");
        ExecutionResult result = new ExecutionResult(true, ExecutionMethod.DIRECT, "d-1", null,
            BigDecimal.ZERO, null, Instant.now(), null, null);

        Optional<LedgerTrade> trade = ledger.record(signal, result);

        assertTrue(trade.isPresent());
        assertEquals("strat-9", trade.get().strategyId());
        assertDecimal("2", trade.get().quantity());
        assertDecimal("3000", trade.get().price());
        assertTrue(ledger.shadowRecord("strat-9").orElseThrow().bridgeOrderIds().isEmpty(),
            "Direct fills are not bridge orders");
    }

    @Test
    void failedResultsAreNotRecorded() {
        Optional<LedgerTrade> trade = ledger.record(Fixtures.signal(),
            ExecutionResult.failed(ExecutionMethod.DIRECT, "rejected"));

        assertTrue(trade.isEmpty());
        assertTrue(ledger.trades().isEmpty());
        assertTrue(ledger.trackedStrategyIds().isEmpty());
    }

    @Test
    void overridesSurviveLaterFills() {
        fill("o-1", Direction.BUY, "1", "100");
        fill("o-2", Direction.SELL, "1", "110");   // realized 10

        ledger.overrideRealizedPnl("strat-1", new BigDecimal("25"));
        ledger.overrideTradeCount("strat-1", 5);
        ledger.overridePosition("strat-1", "BTC-USDT", new BigDecimal("3"));
        assertDecimal("25", shadow().realizedPnl());
        assertEquals(5, shadow().tradeCount());
        assertDecimal("3", shadow().positionFor("BTC-USDT"));

        fill("o-3", Direction.BUY, "1", "100");
        fill("o-4", Direction.SELL, "1", "104");   // realized +4

        assertDecimal("29", shadow().realizedPnl());
        assertEquals(7, shadow().tradeCount());
        assertDecimal("3", shadow().positionFor("BTC-USDT"));
    }

    @Test
    void bridgeShareExcludesDirectFills() {
        fill("o-1", Direction.BUY, "2", "100");
        ledger.record(Fixtures.signal("strat-1", "BTC-USDT", Direction.SELL, "1", "120"),
            Fixtures.directFill("d-1", "1", "120"));   // realized 20 on the direct path

        ShadowRecord record = shadow();
        assertEquals(2, record.tradeCount());
        assertDecimal("20", record.realizedPnl());
        assertDecimal("1", record.positionFor("BTC-USDT"));
        assertEquals(1, record.bridgeShare().tradeCount());
        assertDecimal("0", record.bridgeShare().realizedPnl());
        assertDecimal("2", record.bridgeShare().positionFor("BTC-USDT"));

        ledger.overrideTradeCount("strat-1", 1);
        ledger.overridePosition("strat-1", "BTC-USDT", new BigDecimal("2"));
        assertEquals(2, shadow().tradeCount(), "Matching bridge values change nothing");
        assertDecimal("1", shadow().positionFor("BTC-USDT"));
    }

    @Test
    void removingDuplicatesRebuildsTotals() {
        fill("o-1", Direction.BUY, "1", "100");
        fill("o-1", Direction.BUY, "1", "100");
        assertDecimal("2", shadow().positionFor("BTC-USDT"));

        assertEquals(1, ledger.removeDuplicateTrades("o-1"));

        assertEquals(1, shadow().tradeCount());
        assertDecimal("1", shadow().positionFor("BTC-USDT"));
        assertDecimal("100", shadow().totalVolume());
        assertEquals(Set.of("o-1"), shadow().bridgeOrderIds());
    }

    @Test
    void parameterOverridesAndRemoval() {
        ledger.registerStrategy("strat-1", Map.of("spread", 0.5, "mode", "passive"), null);

        ledger.overrideParameter("strat-1", "spread", 0.7);
        ledger.overrideParameter("strat-1", "mode", null);

        assertEquals(Map.of("spread", 0.7), shadow().parameters());
    }

    @Test
    void overridesRequireKnownStrategy() {
        assertThrows(IllegalArgumentException.class, () -> ledger.overrideTradeCount("missing", 1));
        assertThrows(IllegalArgumentException.class, () -> ledger.overrideStartTime("missing", Instant.now()));
    }

    @Test
    void duplicatesKeepEarliestEntry() {
        TradingSignal first = Fixtures.signal();
        TradingSignal second = Fixtures.signal();
        ledger.record(first, Fixtures.bridgeFill("b-1", "strat-1", "1", "100"));
        ledger.record(second, Fixtures.bridgeFill("b-1", "strat-1", "1", "100"));
        ledger.record(Fixtures.signal(), Fixtures.bridgeFill("b-2", "strat-1", "1", "100"));

        assertEquals(Set.of("b-1"), ledger.duplicateTradeIds());
        assertEquals(1, ledger.removeDuplicateTrades("b-1"));

        List<LedgerTrade> trades = ledger.trades("strat-1");
        assertEquals(2, trades.size());
        assertEquals(first.id(), trades.get(0).signalId());
        assertTrue(ledger.duplicateTradeIds().isEmpty());
        assertEquals(0, ledger.removeDuplicateTrades("b-1"));
    }

    @Test
    void adoptsBridgeStateOnlyForUninitializedStrategies() {
        Instant bridgeStart = Instant.parse("2024-03-01T09:15:00Z");
        fill("o-1", Direction.BUY, "1", "100");
        ledger.registerStrategy("strat-2", Map.of("spread", 0.5), Instant.now());

        assertTrue(ledger.adoptIfUninitialized(Fixtures.bridgeRecord("strat-1", 1, "0", bridgeStart,
            Map.of("spread", 0.4), List.of(), Map.of())));
        assertFalse(ledger.adoptIfUninitialized(Fixtures.bridgeRecord("strat-1", 1, "0", bridgeStart,
            Map.of("spread", 0.9), List.of(), Map.of())), "Adopted only once");
        assertFalse(ledger.adoptIfUninitialized(Fixtures.bridgeRecord("strat-2", 0, "0", bridgeStart,
            Map.of(), List.of(), Map.of())));
        assertFalse(ledger.adoptIfUninitialized(Fixtures.bridgeRecord("unknown", 0, "0", bridgeStart,
            Map.of(), List.of(), Map.of())));

        assertEquals(Map.of("spread", 0.4), shadow().parameters());
        assertEquals(bridgeStart, shadow().startTime());
    }
}
