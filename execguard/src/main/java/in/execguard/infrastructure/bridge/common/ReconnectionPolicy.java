package in.execguard.infrastructure.bridge.common;

import in.execguard.config.RecoveryConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter for bridge reconnection.
 *
 * Delay before attempt n (1-based):
 * <pre>
 * min(initialDelay * multiplier^(n-1), maxDelay) + uniform[0, jitter)
 * </pre>
 *
 * The policy is immutable; attempt counting belongs to the recovery episode
 * using it, so one policy can serve every bridge instance.
 *
 * Usage:
 * <pre>
 * ReconnectionPolicy policy = ReconnectionPolicy.builder()
 *     .initialDelay(Duration.ofSeconds(1))
 *     .maxDelay(Duration.ofSeconds(30))
 *     .multiplier(2.0)
 *     .jitter(Duration.ofMillis(500))
 *     .maxAttempts(5)
 *     .build();
 *
 * Duration wait = policy.delayForAttempt(attempt);
 * </pre>
 */
public final class ReconnectionPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;
    private final Duration jitter;

    private ReconnectionPolicy(Duration initialDelay, Duration maxDelay,
                               double multiplier, int maxAttempts, Duration jitter) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.jitter = jitter;
    }

    /**
     * Exponential part of the delay before an attempt, without jitter.
     *
     * @param attempt 1-based attempt number
     */
    public Duration baseDelayForAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1");
        }
        double raw = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        long capped = (long) Math.min(raw, (double) maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }

    /**
     * Delay before an attempt including random jitter.
     */
    public Duration delayForAttempt(int attempt) {
        return delayForAttempt(attempt, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Delay before an attempt, drawing jitter from the given source.
     *
     * @param random supplier of values in [0, 1)
     */
    public Duration delayForAttempt(int attempt, DoubleSupplier random) {
        Duration base = baseDelayForAttempt(attempt);
        long jitterMillis = jitter.toMillis();
        if (jitterMillis == 0) {
            return base;
        }
        return base.plusMillis((long) (random.getAsDouble() * jitterMillis));
    }

    /**
     * Check whether an episode with this many failed attempts should stop.
     */
    public boolean isExhausted(int failedAttempts) {
        return failedAttempts >= maxAttempts;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getJitter() {
        return jitter;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create a policy from recovery configuration.
     */
    public static ReconnectionPolicy from(RecoveryConfig config) {
        return builder()
            .initialDelay(Duration.ofMillis(config.initialBackoffMs()))
            .maxDelay(Duration.ofMillis(config.maxBackoffMs()))
            .multiplier(config.backoffMultiplier())
            .maxAttempts(config.maxRetryAttempts())
            .jitter(Duration.ofMillis(config.jitterMs()))
            .build();
    }

    /**
     * Default policy for bridge connections.
     */
    public static ReconnectionPolicy forBridge() {
        return builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofSeconds(30))
            .multiplier(2.0)
            .maxAttempts(5)
            .jitter(Duration.ofSeconds(1))
            .build();
    }

    @Override
    public String toString() {
        return "ReconnectionPolicy[initial=" + initialDelay.toMillis() + "ms, max=" + maxDelay.toMillis()
            + "ms, multiplier=" + multiplier + ", attempts=" + maxAttempts + ", jitter=" + jitter.toMillis() + "ms]";
    }

    /**
     * Builder for ReconnectionPolicy.
     */
    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double multiplier = 2.0;
        private int maxAttempts = 5;
        private Duration jitter = Duration.ZERO;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be at least 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder jitter(Duration jitter) {
            if (jitter.isNegative()) {
                throw new IllegalArgumentException("Jitter cannot be negative");
            }
            this.jitter = jitter;
            return this;
        }

        public ReconnectionPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new ReconnectionPolicy(initialDelay, maxDelay, multiplier, maxAttempts, jitter);
        }
    }
}
