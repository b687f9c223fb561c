package org.tyl.errors.retry;

import org.junit.jupiter.api.Test;
import org.tyl.errors.TylError;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class RetryResultTest {

    record CountedError(int limit) implements RetryableError {
        @Override
        public boolean shouldRetry(int attempt) {
            return attempt < limit;
        }

        @Override
        public Duration retryDelay(int attempt) {
            return Duration.ofMillis(10L * attempt);
        }

        @Override
        public int maxRetries() {
            return limit;
        }
    }

    @Test
    void success_isSuccess() {
        RetryResult<String, CountedError> result = RetryResult.success("done");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.shouldRetry()).isFalse();
        assertThat(result).isEqualTo(new RetryResult.Success<String, CountedError>("done"));
    }

    @Test
    void classify_belowLimit_isRetry() {
        RetryResult<String, CountedError> result = RetryResult.classify(new CountedError(2), 1);

        assertThat(result).isInstanceOf(RetryResult.Retry.class);
        assertThat(result.shouldRetry()).isTrue();
    }

    @Test
    void classify_atLimit_isFailed() {
        RetryResult<String, CountedError> result = RetryResult.classify(new CountedError(2), 2);

        assertThat(result).isEqualTo(new RetryResult.Failed<String, CountedError>(new CountedError(2)));
        assertThat(result.shouldRetry()).isFalse();
        assertThat(result.isSuccess()).isFalse();
    }

    @Test
    void classify_nonRetriableTylError_isFailed() {
        RetryResult<String, TylError> result = RetryResult.classify(TylError.validation("email", "x"), 0);

        assertThat(result).isInstanceOf(RetryResult.Failed.class);
    }

    @Test
    void classify_retriableTylErrorOnFirstAttempt_isRetry() {
        TylError error = TylError.database("deadlock");
        RetryResult<String, TylError> result = RetryResult.classify(error, 0);

        assertThat(result.shouldRetry()).isEqualTo(error.maxRetries() > 0);
    }

    @Test
    void retryableError_tylErrorExposesCategoryDelay() {
        RetryableError error = TylError.network("timeout");

        assertThat(error.retryDelay(1)).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void retry_rejectsNullError() {
        assertThatThrownBy(() -> new RetryResult.Retry<String, TylError>(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("error must not be null");
    }
}
