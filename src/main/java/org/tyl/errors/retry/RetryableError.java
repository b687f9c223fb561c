package org.tyl.errors.retry;

import java.time.Duration;

/**
 * An error that knows whether, and after how long, the failed operation may be retried.
 */
public interface RetryableError {

    /**
     * Whether the operation should be retried after the given attempt.
     *
     * @param attempt the number of attempts made so far
     */
    boolean shouldRetry(int attempt);

    /**
     * Suggested delay before the given retry attempt (1-based).
     */
    Duration retryDelay(int attempt);

    /**
     * The maximum number of retries allowed for this error.
     */
    int maxRetries();
}
