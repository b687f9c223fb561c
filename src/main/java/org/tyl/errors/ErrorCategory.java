package org.tyl.errors;

import java.time.Duration;
import java.util.Objects;

/**
 * The retry classification assigned to an error.
 * Either one of the {@link BuiltinCategory built-in categories} or a {@link Custom}
 * category backed by a user-supplied {@link ErrorClassifier}.
 *
 * <p>Both variants answer the same three questions, so callers never need to know which
 * one they hold:
 * <pre>{@code
 * ErrorCategory category = error.category();
 * if (category.isRetriable()) {
 *     Duration wait = category.retryDelay(attempt);
 *     ...
 * }
 * }</pre>
 */
public sealed interface ErrorCategory extends ErrorClassifier permits ErrorCategory.Builtin, ErrorCategory.Custom {

    /**
     * A built-in category.
     *
     * @param category the built-in category
     */
    record Builtin(BuiltinCategory category) implements ErrorCategory {

        public Builtin {
            Objects.requireNonNull(category, "category must not be null");
        }

        @Override
        public boolean isRetriable() {
            return category.isRetriable();
        }

        @Override
        public Duration retryDelay(int attempt) {
            return category.retryDelay(attempt);
        }

        @Override
        public String categoryName() {
            return category.categoryName();
        }

        @Override
        public String toString() {
            return category.categoryName();
        }
    }

    /**
     * A category defined outside the library.
     *
     * @param classifier the user-supplied classifier
     */
    record Custom(ErrorClassifier classifier) implements ErrorCategory {

        public Custom {
            Objects.requireNonNull(classifier, "classifier must not be null");
        }

        @Override
        public boolean isRetriable() {
            return classifier.isRetriable();
        }

        @Override
        public Duration retryDelay(int attempt) {
            return classifier.retryDelay(attempt);
        }

        @Override
        public String categoryName() {
            return classifier.categoryName();
        }

        @Override
        public String toString() {
            return classifier.categoryName();
        }
    }

    // === Built-in categories ===

    /**
     * Retriable with short delays. Named {@code transientError} because {@code transient}
     * is a reserved word.
     */
    static ErrorCategory transientError() {
        return of(BuiltinCategory.TRANSIENT);
    }

    static ErrorCategory permanent() {
        return of(BuiltinCategory.PERMANENT);
    }

    static ErrorCategory resourceExhaustion() {
        return of(BuiltinCategory.RESOURCE_EXHAUSTION);
    }

    static ErrorCategory network() {
        return of(BuiltinCategory.NETWORK);
    }

    static ErrorCategory authentication() {
        return of(BuiltinCategory.AUTHENTICATION);
    }

    static ErrorCategory validation() {
        return of(BuiltinCategory.VALIDATION);
    }

    static ErrorCategory internal() {
        return of(BuiltinCategory.INTERNAL);
    }

    static ErrorCategory serviceUnavailable() {
        return of(BuiltinCategory.SERVICE_UNAVAILABLE);
    }

    static ErrorCategory unknown() {
        return of(BuiltinCategory.UNKNOWN);
    }

    static ErrorCategory of(BuiltinCategory category) {
        return new Builtin(category);
    }

    /**
     * Wraps a user-supplied classifier.
     *
     * @param classifier the classifier to delegate to
     * @return a custom category
     */
    static ErrorCategory custom(ErrorClassifier classifier) {
        return new Custom(classifier);
    }

    /**
     * The classifier substituted when the original one cannot be restored,
     * e.g. after deserializing a custom error.
     */
    static ErrorClassifier defaultClassifier() {
        return BuiltinCategory.UNKNOWN;
    }
}
