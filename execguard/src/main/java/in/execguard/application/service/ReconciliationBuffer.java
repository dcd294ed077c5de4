package in.execguard.application.service;

import in.execguard.domain.consistency.ConsistencyDiscrepancy;
import in.execguard.domain.strategy.StrategyExecutionRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hand-off between the state synchronizer and the consistency checker.
 *
 * Holds discrepancy candidates found by sync passes (the newest candidate per
 * type, strategy and subject) and the latest bridge record per strategy.
 */
public class ReconciliationBuffer {

    private final Map<String, ConsistencyDiscrepancy> candidates = new LinkedHashMap<>();
    private final Map<String, Snapshot> snapshots = new ConcurrentHashMap<>();

    public synchronized void offer(Collection<ConsistencyDiscrepancy> discrepancies) {
        for (ConsistencyDiscrepancy discrepancy : discrepancies) {
            candidates.put(discrepancy.key(), discrepancy);
        }
    }

    /**
     * Remove and return every pending candidate, oldest first.
     */
    public synchronized List<ConsistencyDiscrepancy> drainCandidates() {
        List<ConsistencyDiscrepancy> drained = new ArrayList<>(candidates.values());
        candidates.clear();
        return drained;
    }

    /**
     * Drop candidates for a strategy that no longer diverges.
     */
    public synchronized void clearCandidates(String strategyId) {
        candidates.values().removeIf(d -> strategyId.equals(d.strategyId()));
    }

    public synchronized int pendingCount() {
        return candidates.size();
    }

    public void storeSnapshot(StrategyExecutionRecord record, Instant capturedAt) {
        snapshots.put(record.strategyId(), new Snapshot(record, capturedAt));
    }

    public Optional<Snapshot> snapshot(String strategyId) {
        return Optional.ofNullable(snapshots.get(strategyId));
    }

    public Map<String, Snapshot> latestSnapshots() {
        return Map.copyOf(snapshots);
    }

    /**
     * Bridge record and the time it was pulled.
     */
    public record Snapshot(StrategyExecutionRecord record, Instant capturedAt) {}
}
