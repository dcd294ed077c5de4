package in.execguard.infrastructure.bridge.recovery;

import in.execguard.application.port.output.ConnectionFactory;
import in.execguard.config.RecoveryConfig;
import in.execguard.config.ValidationPolicy;
import in.execguard.domain.connection.ConnectionDescriptor;
import in.execguard.domain.connection.ConnectionState;
import in.execguard.domain.connection.RecoveryAttempt;
import in.execguard.domain.event.ResilienceEvent;
import in.execguard.infrastructure.bridge.common.ReconnectionPolicy;
import in.execguard.infrastructure.bridge.metrics.ResilienceMetrics;
import in.execguard.infrastructure.event.EventListeners;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.DoubleSupplier;

/**
 * Reconnects bridge instances using exponential backoff with jitter.
 *
 * Features:
 * - One recovery episode per instance id; starting a running episode returns it
 * - Every connect() call bounded by the connection timeout
 * - Post-recovery health check (ADVISORY: reported after success,
 *   STRICT: a failed check counts as a failed attempt)
 * - Gives up after exactly maxAttempts failed attempts (state FAILED)
 * - Events for every transition, metrics as immutable snapshots
 *
 * Usage:
 * <pre>
 * ConnectionRecoveryManager recovery = new ConnectionRecoveryManager(config.recovery());
 * recovery.addListener(event -> audit.record(event));
 *
 * recovery.startRecovery("bridge-primary", bridgeClient::connect)
 *     .thenAccept(outcome -> log.info("Recovery finished: {}", outcome.result()));
 * </pre>
 *
 * All timers run on one daemon scheduler thread. Results of attempts that
 * finish after their episode was stopped are discarded.
 */
public class ConnectionRecoveryManager {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRecoveryManager.class);

    private final ReconnectionPolicy policy;
    private final Duration connectionTimeout;
    private final PostRecoveryValidator validator;
    private final ValidationPolicy validationPolicy;
    private final DoubleSupplier random;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "BridgeRecovery");
        t.setDaemon(true);
        return t;
    });

    private final Object lock = new Object();
    private final Map<String, RecoveryEpisode> episodes = new ConcurrentHashMap<>();
    private final Map<String, ConnectionState> states = new ConcurrentHashMap<>();
    private final EventListeners<ResilienceEvent> listeners = new EventListeners<>("RecoveryManager");
    private final AtomicBoolean closed = new AtomicBoolean(false);

    // Metrics
    private final AtomicLong totalEpisodes = new AtomicLong();
    private final AtomicLong totalAttempts = new AtomicLong();
    private final AtomicLong successfulRecoveries = new AtomicLong();
    private final AtomicLong failedRecoveries = new AtomicLong();
    private final AtomicLong stoppedRecoveries = new AtomicLong();
    private volatile double averageRecoveryTimeMs = 0.0;
    private volatile long currentBackoffMs;
    private volatile Instant lastRecoveryTime;

    private volatile ResilienceMetrics metrics;  // Optional metrics collector

    public ConnectionRecoveryManager(RecoveryConfig config) {
        this(ReconnectionPolicy.from(config),
            Duration.ofMillis(config.connectionTimeoutMs()),
            new PostRecoveryValidator(Duration.ofMillis(config.maxPingAgeMs()),
                new HashSet<>(config.supportedApiVersions())),
            config.validationPolicy(),
            () -> ThreadLocalRandom.current().nextDouble());
    }

    public ConnectionRecoveryManager(ReconnectionPolicy policy, Duration connectionTimeout,
                                     PostRecoveryValidator validator, ValidationPolicy validationPolicy,
                                     DoubleSupplier random) {
        if (policy == null || validator == null || random == null) {
            throw new IllegalArgumentException("Policy, validator and random source are required");
        }
        if (connectionTimeout == null || connectionTimeout.isNegative() || connectionTimeout.isZero()) {
            throw new IllegalArgumentException("Connection timeout must be positive");
        }
        this.policy = policy;
        this.connectionTimeout = connectionTimeout;
        this.validator = validator;
        this.validationPolicy = validationPolicy == null ? ValidationPolicy.ADVISORY : validationPolicy;
        this.random = random;
        this.currentBackoffMs = policy.getInitialDelay().toMillis();
    }

    public void setMetrics(ResilienceMetrics metrics) {
        this.metrics = metrics;
    }

    public void addListener(Consumer<ResilienceEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<ResilienceEvent> listener) {
        listeners.remove(listener);
    }

    /**
     * Start recovering an instance, or join the episode already running for it.
     *
     * @param instanceId Bridge instance id
     * @param factory Opens one connection per attempt
     * @return future completed once the episode ends; never completes exceptionally
     * @throws IllegalStateException if the manager was cleaned up
     */
    public CompletableFuture<RecoveryOutcome> startRecovery(String instanceId, ConnectionFactory factory) {
        if (instanceId == null || instanceId.isBlank()) {
            throw new IllegalArgumentException("Instance id cannot be null or empty");
        }
        if (factory == null) {
            throw new IllegalArgumentException("Connection factory cannot be null");
        }
        if (closed.get()) {
            throw new IllegalStateException("Recovery manager has been cleaned up");
        }

        RecoveryEpisode episode;
        Duration firstDelay;
        synchronized (lock) {
            RecoveryEpisode running = episodes.get(instanceId);
            if (running != null) {
                log.debug("[RecoveryManager] Recovery already running for {} (attempt {})",
                    instanceId, running.attempts);
                return running.completion.copy();
            }

            episode = new RecoveryEpisode(instanceId, factory, Instant.now());
            firstDelay = policy.delayForAttempt(1, random);
            episode.currentBackoff = firstDelay;
            currentBackoffMs = firstDelay.toMillis();
            episodes.put(instanceId, episode);
            states.put(instanceId, ConnectionState.RECOVERING);
            totalEpisodes.incrementAndGet();
        }

        log.info("[RecoveryManager] Starting recovery for {} (max {} attempts, first attempt in {}ms)",
            instanceId, policy.getMaxAttempts(), firstDelay.toMillis());
        recordState(instanceId, ConnectionState.RECOVERING);
        recordBackoff(instanceId, firstDelay);
        listeners.publish(new ResilienceEvent.RecoveryStarted(instanceId, policy.getMaxAttempts(), episode.startTime));

        // First attempt is scheduled after recovery-started is out so events stay ordered
        boolean scheduled = true;
        synchronized (lock) {
            if (episodes.get(instanceId) == episode && !schedule(episode, firstDelay)) {
                episodes.remove(instanceId);
                states.put(instanceId, ConnectionState.STOPPED);
                scheduled = false;
            }
        }
        if (!scheduled) {
            episode.completion.complete(new RecoveryOutcome(instanceId, RecoveryOutcome.Result.STOPPED,
                0, Duration.ZERO, null, "Recovery manager has been cleaned up"));
        }
        return episode.completion.copy();
    }

    /**
     * Cancel the running episode for an instance.
     *
     * @return true if an episode was running
     */
    public boolean stopRecovery(String instanceId) {
        RecoveryEpisode episode;
        synchronized (lock) {
            episode = episodes.remove(instanceId);
            if (episode == null) {
                return false;
            }
            episode.cancelPending();
            states.put(instanceId, ConnectionState.STOPPED);
            stoppedRecoveries.incrementAndGet();
        }

        log.info("[RecoveryManager] Recovery stopped for {} after {} attempts", instanceId, episode.attempts);
        Duration elapsed = Duration.between(episode.startTime, Instant.now());
        recordState(instanceId, ConnectionState.STOPPED);
        recordOutcome(instanceId, RecoveryOutcome.Result.STOPPED, elapsed);
        listeners.publish(new ResilienceEvent.RecoveryStopped(instanceId, episode.attempts, Instant.now()));
        episode.completion.complete(new RecoveryOutcome(instanceId, RecoveryOutcome.Result.STOPPED,
            episode.attempts, elapsed, null, episode.lastError));
        return true;
    }

    public boolean isRecovering(String instanceId) {
        return episodes.containsKey(instanceId);
    }

    public RecoveryStatus getRecoveryStatus(String instanceId) {
        synchronized (lock) {
            RecoveryEpisode episode = episodes.get(instanceId);
            RecoveryAttempt attempt = episode == null ? null : episode.snapshot(policy.getMaxAttempts());
            return new RecoveryStatus(instanceId, states.getOrDefault(instanceId, ConnectionState.UNKNOWN), attempt);
        }
    }

    public Map<String, ConnectionState> getConnectionStates() {
        return Map.copyOf(states);
    }

    public RecoveryMetrics getMetrics() {
        return new RecoveryMetrics(
            totalEpisodes.get(),
            totalAttempts.get(),
            successfulRecoveries.get(),
            failedRecoveries.get(),
            stoppedRecoveries.get(),
            Duration.ofMillis(Math.round(averageRecoveryTimeMs)),
            Duration.ofMillis(currentBackoffMs),
            episodes.size(),
            lastRecoveryTime
        );
    }

    /**
     * Cancel every episode and stop the scheduler. Safe to call more than once.
     */
    public void cleanup() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        List<RecoveryEpisode> cancelled;
        synchronized (lock) {
            cancelled = new ArrayList<>(episodes.values());
            episodes.clear();
            for (RecoveryEpisode episode : cancelled) {
                episode.cancelPending();
                states.put(episode.instanceId, ConnectionState.STOPPED);
            }
        }

        log.info("[RecoveryManager] Cleaning up ({} active episodes cancelled)", cancelled.size());
        for (RecoveryEpisode episode : cancelled) {
            episode.completion.complete(new RecoveryOutcome(episode.instanceId, RecoveryOutcome.Result.STOPPED,
                episode.attempts, Duration.between(episode.startTime, Instant.now()), null, episode.lastError));
        }

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private boolean schedule(RecoveryEpisode episode, Duration delay) {
        try {
            episode.pending = scheduler.schedule(() -> runAttempt(episode), delay.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("[RecoveryManager] Scheduler rejected attempt for {}: {}", episode.instanceId, e.getMessage());
            return false;
        }
    }

    private void runAttempt(RecoveryEpisode episode) {
        int attemptNo;
        synchronized (lock) {
            if (episodes.get(episode.instanceId) != episode) {
                return;
            }
            attemptNo = ++episode.attempts;
            totalAttempts.incrementAndGet();
        }

        log.info("[RecoveryManager] Attempt {}/{} for {}", attemptNo, policy.getMaxAttempts(), episode.instanceId);

        CompletableFuture<ConnectionDescriptor> call;
        try {
            call = episode.factory.connect();
            if (call == null) {
                call = CompletableFuture.failedFuture(new IllegalStateException("Connection factory returned no future"));
            }
        } catch (Exception e) {
            call = CompletableFuture.failedFuture(e);
        }

        call.copy()
            .orTimeout(connectionTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .whenComplete((connection, error) -> onAttemptCompleted(episode, attemptNo, connection, error));
    }

    private void onAttemptCompleted(RecoveryEpisode episode, int attemptNo,
                                    ConnectionDescriptor connection, Throwable error) {
        String instanceId = episode.instanceId;
        Instant now = Instant.now();
        List<ResilienceEvent> events = new ArrayList<>();
        RecoveryOutcome outcome = null;
        Duration nextDelay = null;
        String failure;

        synchronized (lock) {
            if (episodes.get(instanceId) != episode) {
                log.debug("[RecoveryManager] Discarding late result of attempt {} for {}", attemptNo, instanceId);
                return;
            }

            failure = describeFailure(connection, error);
            List<String> issues = List.of();
            if (failure == null) {
                issues = validator.validate(connection, now);
                if (validationPolicy == ValidationPolicy.STRICT) {
                    events.add(new ResilienceEvent.PostRecoveryValidation(instanceId, issues.isEmpty(), issues, now));
                    if (!issues.isEmpty()) {
                        failure = "Post-recovery validation failed: " + String.join("; ", issues);
                    }
                }
            }

            if (failure == null) {
                Duration elapsed = Duration.between(episode.startTime, now);
                long successes = successfulRecoveries.incrementAndGet();
                averageRecoveryTimeMs += (elapsed.toMillis() - averageRecoveryTimeMs) / successes;
                currentBackoffMs = policy.getInitialDelay().toMillis();
                lastRecoveryTime = now;
                episodes.remove(instanceId);
                states.put(instanceId, ConnectionState.CONNECTED);

                events.add(new ResilienceEvent.RecoverySuccessful(instanceId, attemptNo, elapsed, connection, now));
                if (validationPolicy == ValidationPolicy.ADVISORY) {
                    events.add(new ResilienceEvent.PostRecoveryValidation(instanceId, issues.isEmpty(), issues, now));
                }
                outcome = new RecoveryOutcome(instanceId, RecoveryOutcome.Result.RECOVERED,
                    attemptNo, elapsed, connection, null);
            } else {
                episode.lastError = failure;
                if (policy.isExhausted(episode.attempts)) {
                    Duration elapsed = Duration.between(episode.startTime, now);
                    failedRecoveries.incrementAndGet();
                    episodes.remove(instanceId);
                    states.put(instanceId, ConnectionState.FAILED);
                    events.add(new ResilienceEvent.RecoveryFailed(instanceId, attemptNo, elapsed, failure, now));
                    outcome = new RecoveryOutcome(instanceId, RecoveryOutcome.Result.EXHAUSTED,
                        attemptNo, elapsed, null, failure);
                } else {
                    nextDelay = policy.delayForAttempt(episode.attempts + 1, random);
                    episode.currentBackoff = nextDelay;
                    currentBackoffMs = nextDelay.toMillis();
                    if (!schedule(episode, nextDelay)) {
                        episodes.remove(instanceId);
                        states.put(instanceId, ConnectionState.STOPPED);
                        outcome = new RecoveryOutcome(instanceId, RecoveryOutcome.Result.STOPPED,
                            attemptNo, Duration.between(episode.startTime, now), null, failure);
                    }
                }
            }
        }

        recordAttempt(instanceId, failure == null);
        if (outcome == null) {
            log.warn("[RecoveryManager] Attempt {}/{} for {} failed: {} (next in {}ms)",
                attemptNo, policy.getMaxAttempts(), instanceId, failure, nextDelay.toMillis());
            recordBackoff(instanceId, nextDelay);
        } else {
            switch (outcome.result()) {
                case RECOVERED -> log.info("[RecoveryManager] {} recovered after {} attempts in {}ms",
                    instanceId, attemptNo, outcome.elapsed().toMillis());
                case EXHAUSTED -> log.error("[RecoveryManager] Recovery of {} failed after {} attempts: {}",
                    instanceId, attemptNo, failure);
                case STOPPED -> log.warn("[RecoveryManager] Recovery of {} abandoned, scheduler stopped", instanceId);
            }
            recordState(instanceId, states.getOrDefault(instanceId, ConnectionState.UNKNOWN));
            recordOutcome(instanceId, outcome.result(), outcome.elapsed());
        }

        for (ResilienceEvent event : events) {
            listeners.publish(event);
        }
        if (outcome != null) {
            episode.completion.complete(outcome);
        }
    }

    private String describeFailure(ConnectionDescriptor connection, Throwable error) {
        if (error != null) {
            Throwable cause = error;
            while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause instanceof TimeoutException) {
                return "Connection timed out after " + connectionTimeout.toMillis() + "ms";
            }
            return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        }
        if (connection == null) {
            return "Connection factory returned no connection";
        }
        if (!connection.isConnected()) {
            return "Connection status is " + connection.status();
        }
        return null;
    }

    private void recordAttempt(String instanceId, boolean success) {
        ResilienceMetrics m = metrics;
        if (m != null) {
            m.recordRecoveryAttempt(instanceId, success);
        }
    }

    private void recordBackoff(String instanceId, Duration delay) {
        ResilienceMetrics m = metrics;
        if (m != null) {
            m.recordBackoff(instanceId, delay);
        }
    }

    private void recordState(String instanceId, ConnectionState state) {
        ResilienceMetrics m = metrics;
        if (m != null) {
            m.recordConnectionState(instanceId, state);
        }
    }

    private void recordOutcome(String instanceId, RecoveryOutcome.Result result, Duration elapsed) {
        ResilienceMetrics m = metrics;
        if (m != null) {
            m.recordRecoveryOutcome(instanceId, result.name(), elapsed);
        }
    }

    /**
     * One recovery episode. Mutable fields are guarded by the manager lock.
     */
    private static final class RecoveryEpisode {
        private final String instanceId;
        private final ConnectionFactory factory;
        private final Instant startTime;
        private final CompletableFuture<RecoveryOutcome> completion = new CompletableFuture<>();

        private int attempts;
        private Duration currentBackoff = Duration.ZERO;
        private String lastError;
        private ScheduledFuture<?> pending;

        RecoveryEpisode(String instanceId, ConnectionFactory factory, Instant startTime) {
            this.instanceId = instanceId;
            this.factory = factory;
            this.startTime = startTime;
        }

        void cancelPending() {
            if (pending != null) {
                pending.cancel(false);
            }
        }

        RecoveryAttempt snapshot(int maxAttempts) {
            return new RecoveryAttempt(instanceId, startTime, attempts, maxAttempts, currentBackoff, lastError);
        }
    }

    /**
     * Recovery metrics snapshot.
     */
    public record RecoveryMetrics(
        long totalEpisodes,
        long totalAttempts,
        long successfulRecoveries,
        long failedRecoveries,
        long stoppedRecoveries,
        Duration averageRecoveryTime,
        Duration currentBackoffDelay,
        int activeRecoveries,
        Instant lastRecoveryTime
    ) {
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("totalEpisodes", totalEpisodes);
            map.put("totalAttempts", totalAttempts);
            map.put("successfulRecoveries", successfulRecoveries);
            map.put("failedRecoveries", failedRecoveries);
            map.put("stoppedRecoveries", stoppedRecoveries);
            map.put("averageRecoveryTimeMs", averageRecoveryTime.toMillis());
            map.put("currentBackoffDelayMs", currentBackoffDelay.toMillis());
            map.put("activeRecoveries", activeRecoveries);
            map.put("lastRecoveryTime", lastRecoveryTime != null ? lastRecoveryTime.toString() : null);
            return map;
        }
    }
}
