package org.tyl.errors;

import java.time.Duration;

/**
 * The categories shipped with the library.
 */
public enum BuiltinCategory implements ErrorClassifier {
    /**
     * Temporary failure that should be retried (database timeouts, lock contention).
     */
    TRANSIENT("Transient", true, Duration.ofMillis(100)),

    /**
     * Permanent failure that will not resolve on retry.
     */
    PERMANENT("Permanent", false, Duration.ofMillis(100)),

    /**
     * Resource exhaustion. Retriable, but only after longer delays.
     */
    RESOURCE_EXHAUSTION("ResourceExhaustion", true, Duration.ofSeconds(5)),

    /**
     * Network failure, retried with exponential backoff.
     */
    NETWORK("Network", true, Duration.ofMillis(500)),

    /**
     * Authentication or authorization failure.
     */
    AUTHENTICATION("Authentication", false, Duration.ofMillis(100)),

    /**
     * Invalid input or unparseable data.
     */
    VALIDATION("Validation", false, Duration.ofMillis(100)),

    /**
     * Internal system error.
     */
    INTERNAL("Internal", false, Duration.ofMillis(100)),

    /**
     * Service temporarily unavailable (503-style).
     */
    SERVICE_UNAVAILABLE("ServiceUnavailable", true, Duration.ofSeconds(1)),

    /**
     * Fallback when nothing better is known.
     */
    UNKNOWN("Unknown", false, Duration.ofMillis(100));

    private static final int MAX_EXPONENT = 10;
    private static final long MAX_MULTIPLIER = 60;

    private final String categoryName;
    private final boolean retriable;
    private final Duration baseDelay;

    BuiltinCategory(String categoryName, boolean retriable, Duration baseDelay) {
        this.categoryName = categoryName;
        this.retriable = retriable;
        this.baseDelay = baseDelay;
    }

    @Override
    public boolean isRetriable() {
        return retriable;
    }

    /**
     * Returns {@code baseDelay * min(2^min(attempt, 10), 60)}.
     * The multiplier saturates at 60 from attempt 6 onwards.
     *
     * @throws IllegalArgumentException if attempt is negative
     */
    @Override
    public Duration retryDelay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }
        long multiplier = Math.min(1L << Math.min(attempt, MAX_EXPONENT), MAX_MULTIPLIER);
        return baseDelay.multipliedBy(multiplier);
    }

    @Override
    public String categoryName() {
        return categoryName;
    }

    /**
     * The delay the backoff starts from.
     */
    public Duration baseDelay() {
        return baseDelay;
    }
}
