package org.tyl.errors.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * A configurable exponential backoff calculator.
 *
 * <p>The policy only computes numbers; waiting and re-invoking the operation is up to the caller.
 * It is independent of {@link org.tyl.errors.ErrorCategory#retryDelay(int)}, which embeds
 * its own fixed backoff per category.
 *
 * <h2>Presets</h2>
 * <ul>
 *   <li>{@link #fast()} - 3 attempts, 50ms base, 1s cap, x1.5</li>
 *   <li>{@link #standard()} - 3 attempts, 100ms base, 30s cap, x2.0</li>
 *   <li>{@link #slow()} - 5 attempts, 500ms base, 60s cap, x2.0</li>
 *   <li>{@link #network()} - 4 attempts, 250ms base, 30s cap, x2.0</li>
 *   <li>{@link #database()} - 3 attempts, 100ms base, 10s cap, x2.0</li>
 * </ul>
 * All presets apply jitter.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.builder()
 *     .maxAttempts(5)
 *     .baseDelay(Duration.ofMillis(200))
 *     .jitter(false)
 *     .build();
 *
 * for (int attempt = 0; policy.shouldRetry(attempt); attempt++) {
 *     ...
 *     Thread.sleep(policy.calculateDelay(attempt + 1).toMillis());
 * }
 * }</pre>
 *
 * @param maxAttempts maximum number of attempts
 * @param baseDelay delay before the first retry
 * @param maxDelay cap applied before jitter
 * @param backoffMultiplier growth factor between attempts
 * @param jitter whether delays are randomized by +/-25%
 */
public record RetryPolicy(
        int maxAttempts,
        Duration baseDelay,
        Duration maxDelay,
        double backoffMultiplier,
        boolean jitter
) {

    private static final double JITTER_MIN = 0.75;
    private static final double JITTER_MAX = 1.25;

    public RetryPolicy {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0");
        }
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
        if (maxDelay.isNegative()) {
            throw new IllegalArgumentException("maxDelay must not be negative");
        }
        if (!Double.isFinite(backoffMultiplier) || backoffMultiplier <= 0) {
            throw new IllegalArgumentException("backoffMultiplier must be a positive number");
        }
    }

    /**
     * Computes the delay before the given attempt.
     *
     * <p>Attempt 0 yields zero. Otherwise the delay is
     * {@code baseDelay * backoffMultiplier^(attempt - 1)}, truncated to whole milliseconds and
     * capped at {@code maxDelay}, then scaled by a random factor in [0.75, 1.25) when jitter is on.
     *
     * @param attempt the attempt number (1-based)
     * @throws IllegalArgumentException if attempt is negative
     */
    public Duration calculateDelay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }
        if (attempt == 0) {
            return Duration.ZERO;
        }

        double exponential = baseDelay.toMillis() * Math.pow(backoffMultiplier, attempt - 1);
        // the cast saturates at Long.MAX_VALUE
        Duration delay = Duration.ofMillis((long) exponential);
        if (delay.compareTo(maxDelay) > 0) {
            delay = maxDelay;
        }

        if (jitter) {
            delay = addJitter(delay);
        }
        return delay;
    }

    /**
     * Whether another attempt is allowed.
     *
     * @param attempt the number of attempts made so far (0-based)
     */
    public boolean shouldRetry(int attempt) {
        return attempt < maxAttempts;
    }

    private static Duration addJitter(Duration delay) {
        double factor = ThreadLocalRandom.current().nextDouble(JITTER_MIN, JITTER_MAX);
        return Duration.ofMillis((long) (delay.toMillis() * factor));
    }

    // === Copy methods ===

    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return toBuilder().maxAttempts(maxAttempts).build();
    }

    public RetryPolicy withBaseDelay(Duration baseDelay) {
        return toBuilder().baseDelay(baseDelay).build();
    }

    public RetryPolicy withMaxDelay(Duration maxDelay) {
        return toBuilder().maxDelay(maxDelay).build();
    }

    public RetryPolicy withBackoffMultiplier(double backoffMultiplier) {
        return toBuilder().backoffMultiplier(backoffMultiplier).build();
    }

    public RetryPolicy withJitter(boolean jitter) {
        return toBuilder().jitter(jitter).build();
    }

    // === Presets ===

    /**
     * For quick operations.
     */
    public static RetryPolicy fast() {
        return new RetryPolicy(3, Duration.ofMillis(50), Duration.ofSeconds(1), 1.5, true);
    }

    /**
     * For most operations. Same as {@code builder().build()}.
     */
    public static RetryPolicy standard() {
        return builder().build();
    }

    /**
     * For expensive operations.
     */
    public static RetryPolicy slow() {
        return new RetryPolicy(5, Duration.ofMillis(500), Duration.ofSeconds(60), 2.0, true);
    }

    public static RetryPolicy network() {
        return new RetryPolicy(4, Duration.ofMillis(250), Duration.ofSeconds(30), 2.0, true);
    }

    public static RetryPolicy database() {
        return new RetryPolicy(3, Duration.ofMillis(100), Duration.ofSeconds(10), 2.0, true);
    }

    /**
     * Creates a builder preset with the standard values.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder initialized from this policy.
     */
    public Builder toBuilder() {
        return new Builder()
                .maxAttempts(maxAttempts)
                .baseDelay(baseDelay)
                .maxDelay(maxDelay)
                .backoffMultiplier(backoffMultiplier)
                .jitter(jitter);
    }

    public static final class Builder {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofMillis(100);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double backoffMultiplier = 2.0;
        private boolean jitter = true;

        private Builder() {}

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder jitter(boolean jitter) {
            this.jitter = jitter;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a value is out of range
         */
        public RetryPolicy build() {
            return new RetryPolicy(maxAttempts, baseDelay, maxDelay, backoffMultiplier, jitter);
        }
    }
}
