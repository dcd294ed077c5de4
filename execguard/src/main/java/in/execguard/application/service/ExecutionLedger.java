package in.execguard.application.service;

import in.execguard.domain.execution.ExecutionMethod;
import in.execguard.domain.execution.ExecutionResult;
import in.execguard.domain.execution.LedgerTrade;
import in.execguard.domain.signal.TradingSignal;
import in.execguard.domain.strategy.ShadowRecord;
import in.execguard.domain.strategy.StrategyExecutionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Local ledger of fills from both execution paths.
 *
 * Every successful execution is recorded under its strategy id (reported by
 * the bridge, else the signal's source tag). Each strategy keeps two running
 * average-cost replays: one over all fills and one over bridge fills only.
 * Corrections made by the consistency checker are offsets against the
 * bridge-path replay; they are applied to both views, so corrected totals
 * survive later fills and direct fills are never corrected away.
 *
 * All methods are synchronized; returned collections are copies.
 */
public class ExecutionLedger {
    private static final Logger log = LoggerFactory.getLogger(ExecutionLedger.class);

    private static final MathContext MC = MathContext.DECIMAL64;

    private final Map<String, StrategyBook> books = new LinkedHashMap<>();

    /**
     * Record a successful execution. Failed results are ignored.
     *
     * @return the recorded trade, or empty if nothing was recorded
     */
    public synchronized Optional<LedgerTrade> record(TradingSignal signal, ExecutionResult result) {
        if (signal == null || result == null || !result.success()) {
            return Optional.empty();
        }

        String strategyId = result.strategyId() != null && !result.strategyId().isBlank()
            ? result.strategyId()
            : signal.sourceTag();
        BigDecimal quantity = result.filledQuantity().signum() > 0 ? result.filledQuantity() : signal.quantity();
        BigDecimal price = result.averagePrice() != null && result.averagePrice().signum() > 0
            ? result.averagePrice()
            : signal.referencePrice();

        LedgerTrade trade = new LedgerTrade(result.orderId(), strategyId, signal.id(), signal.symbol(),
            signal.direction(), quantity, price, result.executionMethod(), result.timestamp());

        StrategyBook book = books.computeIfAbsent(strategyId, StrategyBook::new);
        book.add(trade);
        if (book.startTime == null) {
            book.startTime = trade.recordedAt();
        }

        log.debug("[Ledger] Recorded {} {} {} @ {} for {} via {} (order {})",
            trade.direction(), quantity, trade.symbol(), price, strategyId, trade.method(), trade.tradeId());
        return Optional.of(trade);
    }

    /**
     * Register a strategy before any fill, with its configured parameters.
     */
    public synchronized void registerStrategy(String strategyId, Map<String, Object> parameters, Instant startTime) {
        StrategyBook book = books.computeIfAbsent(strategyId, StrategyBook::new);
        if (parameters != null) {
            book.parameters.putAll(parameters);
        }
        if (startTime != null) {
            book.startTime = startTime;
        }
        book.initialized = true;
    }

    /**
     * Take parameters and start time from the bridge for a strategy whose
     * local book was created by fills alone.
     *
     * @return true if the bridge values were adopted
     */
    public synchronized boolean adoptIfUninitialized(StrategyExecutionRecord bridgeRecord) {
        StrategyBook book = books.get(bridgeRecord.strategyId());
        if (book == null || book.initialized) {
            return false;
        }
        book.parameters.clear();
        book.parameters.putAll(bridgeRecord.parameters());
        if (bridgeRecord.startTime() != null) {
            book.startTime = bridgeRecord.startTime();
        }
        book.initialized = true;
        log.info("[Ledger] Adopted bridge parameters and start time for {}", bridgeRecord.strategyId());
        return true;
    }

    public synchronized Set<String> trackedStrategyIds() {
        return new LinkedHashSet<>(books.keySet());
    }

    public synchronized Optional<ShadowRecord> shadowRecord(String strategyId) {
        StrategyBook book = books.get(strategyId);
        return book == null ? Optional.empty() : Optional.of(book.toShadowRecord());
    }

    public synchronized List<LedgerTrade> trades() {
        List<LedgerTrade> all = new ArrayList<>();
        for (StrategyBook book : books.values()) {
            all.addAll(book.trades);
        }
        return all;
    }

    public synchronized List<LedgerTrade> trades(String strategyId) {
        StrategyBook book = books.get(strategyId);
        return book == null ? List.of() : new ArrayList<>(book.trades);
    }

    /**
     * Trade ids recorded more than once, across all strategies.
     */
    public synchronized Set<String> duplicateTradeIds() {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new TreeSet<>();
        for (StrategyBook book : books.values()) {
            for (LedgerTrade trade : book.trades) {
                if (!seen.add(trade.tradeId())) {
                    duplicates.add(trade.tradeId());
                }
            }
        }
        return duplicates;
    }

    /**
     * Keep the earliest entry for a trade id and drop the later copies.
     *
     * @return number of entries removed
     */
    public synchronized int removeDuplicateTrades(String tradeId) {
        LedgerTrade earliest = null;
        for (StrategyBook book : books.values()) {
            for (LedgerTrade trade : book.trades) {
                if (trade.tradeId().equals(tradeId)
                    && (earliest == null || trade.recordedAt().isBefore(earliest.recordedAt()))) {
                    earliest = trade;
                }
            }
        }
        if (earliest == null) {
            return 0;
        }

        int removed = 0;
        for (StrategyBook book : books.values()) {
            int before = book.trades.size();
            LedgerTrade keep = earliest;
            if (book.trades.removeIf(t -> t.tradeId().equals(tradeId) && t != keep)) {
                book.rebuild();
            }
            removed += before - book.trades.size();
        }
        if (removed > 0) {
            log.info("[Ledger] Removed {} duplicate entries of trade {}", removed, tradeId);
        }
        return removed;
    }

    /**
     * Set the bridge-path realized P&L. Direct fills keep their own share.
     */
    public synchronized void overrideRealizedPnl(String strategyId, BigDecimal target) {
        StrategyBook book = requireBook(strategyId);
        book.pnlAdjustment = target.subtract(book.bridgePath.realizedPnl);
    }

    /**
     * Set the bridge-path trade count. Direct fills keep their own share.
     */
    public synchronized void overrideTradeCount(String strategyId, int target) {
        StrategyBook book = requireBook(strategyId);
        book.tradeCountAdjustment = target - book.bridgeTradeCount;
    }

    /**
     * Set the bridge-path position in a symbol. Direct fills keep their own share.
     */
    public synchronized void overridePosition(String strategyId, String symbol, BigDecimal target) {
        StrategyBook book = requireBook(strategyId);
        BigDecimal replayed = book.bridgePath.positions.getOrDefault(symbol, BigDecimal.ZERO);
        book.positionAdjustments.put(symbol, target.subtract(replayed));
    }

    /**
     * Set a parameter, or remove it when the value is null.
     */
    public synchronized void overrideParameter(String strategyId, String key, Object value) {
        StrategyBook book = requireBook(strategyId);
        if (value == null) {
            book.parameters.remove(key);
        } else {
            book.parameters.put(key, value);
        }
    }

    public synchronized void overrideStartTime(String strategyId, Instant startTime) {
        requireBook(strategyId).startTime = startTime;
    }

    private StrategyBook requireBook(String strategyId) {
        StrategyBook book = books.get(strategyId);
        if (book == null) {
            throw new IllegalArgumentException("Unknown strategy: " + strategyId);
        }
        return book;
    }

    private static final class StrategyBook {
        private final String strategyId;
        private final List<LedgerTrade> trades = new ArrayList<>();
        private final Map<String, Object> parameters = new LinkedHashMap<>();
        private final Map<String, BigDecimal> positionAdjustments = new LinkedHashMap<>();
        private Instant startTime;
        private boolean initialized;
        private BigDecimal pnlAdjustment = BigDecimal.ZERO;
        private int tradeCountAdjustment;

        // Running replays, rebuilt only when trades are removed
        private Replay allPaths = new Replay();
        private Replay bridgePath = new Replay();
        private int bridgeTradeCount;
        private final Set<String> bridgeOrderIds = new LinkedHashSet<>();

        StrategyBook(String strategyId) {
            this.strategyId = strategyId;
        }

        void add(LedgerTrade trade) {
            trades.add(trade);
            apply(trade);
        }

        void rebuild() {
            allPaths = new Replay();
            bridgePath = new Replay();
            bridgeTradeCount = 0;
            bridgeOrderIds.clear();
            for (LedgerTrade trade : trades) {
                apply(trade);
            }
        }

        private void apply(LedgerTrade trade) {
            allPaths.apply(trade);
            if (trade.method() == ExecutionMethod.BRIDGE) {
                bridgePath.apply(trade);
                bridgeTradeCount++;
                bridgeOrderIds.add(trade.tradeId());
            }
        }

        ShadowRecord toShadowRecord() {
            ShadowRecord.BridgeShare share = new ShadowRecord.BridgeShare(
                bridgeTradeCount + tradeCountAdjustment,
                bridgePath.realizedPnl.add(pnlAdjustment),
                adjusted(bridgePath.positions)
            );
            return new ShadowRecord(
                strategyId,
                trades.size() + tradeCountAdjustment,
                allPaths.realizedPnl.add(pnlAdjustment),
                allPaths.volume,
                adjusted(allPaths.positions),
                parameters,
                startTime,
                bridgeOrderIds,
                share
            );
        }

        private Map<String, BigDecimal> adjusted(Map<String, BigDecimal> replayed) {
            Map<String, BigDecimal> positions = new LinkedHashMap<>(replayed);
            for (Map.Entry<String, BigDecimal> adj : positionAdjustments.entrySet()) {
                positions.merge(adj.getKey(), adj.getValue(), BigDecimal::add);
            }
            return positions;
        }
    }

    /**
     * Average-cost replay of fills: realized P&L, net positions and volume.
     */
    private static final class Replay {
        private final Map<String, BigDecimal> positions = new LinkedHashMap<>();
        private final Map<String, BigDecimal> avgCost = new LinkedHashMap<>();
        private BigDecimal realizedPnl = BigDecimal.ZERO;
        private BigDecimal volume = BigDecimal.ZERO;

        void apply(LedgerTrade trade) {
            String symbol = trade.symbol();
            BigDecimal position = positions.getOrDefault(symbol, BigDecimal.ZERO);
            BigDecimal cost = avgCost.getOrDefault(symbol, BigDecimal.ZERO);
            BigDecimal signedQty = trade.direction().signed(trade.quantity());
            volume = volume.add(trade.notional());

            if (position.signum() == 0 || position.signum() == signedQty.signum()) {
                // Opening or adding
                BigDecimal absPos = position.abs();
                BigDecimal newAbs = absPos.add(trade.quantity());
                cost = absPos.multiply(cost).add(trade.notional()).divide(newAbs, MC);
                position = position.add(signedQty);
            } else {
                // Reducing, closing or flipping
                BigDecimal closed = position.abs().min(trade.quantity());
                BigDecimal perUnit = trade.price().subtract(cost).multiply(BigDecimal.valueOf(position.signum()));
                realizedPnl = realizedPnl.add(closed.multiply(perUnit));
                position = position.add(signedQty);
                if (position.signum() == 0) {
                    cost = BigDecimal.ZERO;
                } else if (trade.quantity().compareTo(closed) > 0) {
                    cost = trade.price();
                }
            }

            positions.put(symbol, position);
            avgCost.put(symbol, cost);
        }
    }
}
