package org.tyl.errors;

import java.time.Duration;

/**
 * Retry behavior of an error category.
 *
 * <p>Implement this interface to define domain-specific categories without touching the
 * built-in ones, then wrap the implementation with {@link ErrorCategory#custom(ErrorClassifier)}
 * or attach it to an error via {@link TylError#businessLogic(String, ErrorClassifier)}.
 *
 * <p>Implementations are shared between errors, categories and contexts, possibly across
 * threads, so they must be immutable.
 */
public interface ErrorClassifier {

    /**
     * Whether errors of this category should trigger retries.
     */
    boolean isRetriable();

    /**
     * Suggested delay before the given retry attempt.
     *
     * @param attempt the attempt number (1-based by convention)
     * @return the suggested delay, never null
     */
    Duration retryDelay(int attempt);

    /**
     * A stable, human-readable name used to group errors in logs and metrics.
     */
    String categoryName();
}
