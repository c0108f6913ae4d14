package in.tradecore.infrastructure.broker.common;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Retry policy with capped exponential backoff and jitter.
 *
 * Immutable and shared: callers keep their own attempt counters, so one instance can
 * back every call site of a given external system.
 *
 * Features:
 * - Exponential backoff with configurable multiplier
 * - Maximum backoff duration (cap)
 * - Symmetric jitter around the computed delay
 * - Maximum attempts (or unlimited) and optional maximum elapsed time
 *
 * Usage:
 * <pre>
 * RetryPolicy policy = RetryPolicy.builder()
 *     .initialDelay(Duration.ofMillis(500))
 *     .maxDelay(Duration.ofSeconds(8))
 *     .multiplier(2.0)
 *     .jitter(0.2)
 *     .maxAttempts(5)
 *     .build();
 *
 * int attempt = 0;
 * while (true) {
 *     attempt++;
 *     try {
 *         return call();
 *     } catch (RuntimeException e) {
 *         if (!policy.shouldRetry(attempt)) throw e;
 *         Thread.sleep(policy.delayForAttempt(attempt).toMillis());
 *     }
 * }
 * </pre>
 */
public final class RetryPolicy {

    public static final int UNLIMITED = -1;

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final double jitter;
    private final int maxAttempts;
    private final Duration maxElapsed;
    private final DoubleSupplier random;

    private RetryPolicy(Builder b) {
        this.initialDelay = b.initialDelay;
        this.maxDelay = b.maxDelay;
        this.multiplier = b.multiplier;
        this.jitter = b.jitter;
        this.maxAttempts = b.maxAttempts;
        this.maxElapsed = b.maxElapsed;
        this.random = b.random;
    }

    /**
     * Whether another attempt may follow the given number of failed attempts.
     *
     * @param failedAttempts attempts made so far (1 after the first failure)
     */
    public boolean shouldRetry(int failedAttempts) {
        return maxAttempts == UNLIMITED || failedAttempts < maxAttempts;
    }

    /**
     * Same as {@link #shouldRetry(int)} but also honors the elapsed-time ceiling.
     */
    public boolean shouldRetry(int failedAttempts, Duration elapsed) {
        if (maxElapsed != null && elapsed.compareTo(maxElapsed) >= 0) {
            return false;
        }
        return shouldRetry(failedAttempts);
    }

    /**
     * Delay before the next attempt after {@code failedAttempts} failures.
     * Attempt 1 waits ~initialDelay, each later attempt multiplies, capped at maxDelay.
     */
    public Duration delayForAttempt(int failedAttempts) {
        return applyJitter(baseDelayForAttempt(failedAttempts));
    }

    /**
     * Backoff delay without jitter.
     */
    public Duration baseDelayForAttempt(int failedAttempts) {
        int exponent = Math.max(0, failedAttempts - 1);
        double millis = initialDelay.toMillis() * Math.pow(multiplier, exponent);
        long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }

    private Duration applyJitter(Duration base) {
        if (jitter == 0.0) {
            return base;
        }
        // random in [0,1) -> factor in [1-jitter, 1+jitter)
        double factor = 1.0 + jitter * (2.0 * random.getAsDouble() - 1.0);
        long millis = Math.round(base.toMillis() * factor);
        return Duration.ofMillis(Math.max(0L, Math.min(millis, maxDelay.toMillis())));
    }

    public boolean isUnlimited() {
        return maxAttempts == UNLIMITED;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public double getJitter() {
        return jitter;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default policy for the market feed: never gives up while the engine runs.
     */
    public static RetryPolicy forMarketFeed() {
        return builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofMinutes(1))
            .multiplier(2.0)
            .jitter(0.2)
            .unlimitedAttempts()
            .build();
    }

    /**
     * Default policy for order gateway calls.
     */
    public static RetryPolicy forOrderGateway() {
        return builder()
            .initialDelay(Duration.ofMillis(500))
            .maxDelay(Duration.ofSeconds(8))
            .multiplier(2.0)
            .jitter(0.2)
            .maxAttempts(5)
            .build();
    }

    /**
     * Builder for RetryPolicy.
     */
    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(1);
        private double multiplier = 2.0;
        private double jitter = 0.0;
        private int maxAttempts = 5;
        private Duration maxElapsed;
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();

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
            if (multiplier <= 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder jitter(double jitter) {
            if (jitter < 0.0 || jitter >= 1.0) {
                throw new IllegalArgumentException("Jitter must be in [0, 1)");
            }
            this.jitter = jitter;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder unlimitedAttempts() {
            this.maxAttempts = UNLIMITED;
            return this;
        }

        public Builder maxElapsed(Duration maxElapsed) {
            if (maxElapsed.isNegative() || maxElapsed.isZero()) {
                throw new IllegalArgumentException("Max elapsed must be positive");
            }
            this.maxElapsed = maxElapsed;
            return this;
        }

        /**
         * Random source in [0, 1) for jitter. Tests pin it.
         */
        public Builder random(DoubleSupplier random) {
            this.random = random;
            return this;
        }

        public RetryPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new RetryPolicy(this);
        }
    }
}
