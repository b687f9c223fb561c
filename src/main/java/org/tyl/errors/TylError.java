package org.tyl.errors;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.tyl.errors.ops.DiagnosticLog;
import org.tyl.errors.retry.RetryableError;
import org.tyl.errors.settings.ErrorSettings;
import org.tyl.errors.settings.LogLevel;

import java.time.Duration;
import java.util.Objects;

/**
 * The error type of the TYL framework.
 *
 * <p>Errors are plain immutable values. Each variant renders a fixed display text through
 * {@link #toString()} and maps to exactly one {@link ErrorCategory}, which drives retry decisions:
 * <pre>{@code
 * TylError error = TylError.network("upstream timed out");
 * if (error.shouldRetry(attempt)) {
 *     Duration wait = error.retryDelay(attempt);
 *     ...
 * }
 * }</pre>
 *
 * <p>In JSON each error is a single-key object tagged with the variant name, e.g.
 * {@code {"NotFound":{"resource":"user","id":"42"}}}. The classifier of a {@link Custom} error
 * is not written; reading one back yields the {@link BuiltinCategory#UNKNOWN} classifier.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(value = TylError.Database.class, name = "Database"),
        @JsonSubTypes.Type(value = TylError.Network.class, name = "Network"),
        @JsonSubTypes.Type(value = TylError.Validation.class, name = "Validation"),
        @JsonSubTypes.Type(value = TylError.NotFound.class, name = "NotFound"),
        @JsonSubTypes.Type(value = TylError.Conflict.class, name = "Conflict"),
        @JsonSubTypes.Type(value = TylError.Internal.class, name = "Internal"),
        @JsonSubTypes.Type(value = TylError.Configuration.class, name = "Configuration"),
        @JsonSubTypes.Type(value = TylError.NotImplemented.class, name = "NotImplemented"),
        @JsonSubTypes.Type(value = TylError.Custom.class, name = "Custom")
})
public sealed interface TylError extends RetryableError permits
        TylError.Database, TylError.Network, TylError.Validation, TylError.NotFound,
        TylError.Conflict, TylError.Internal, TylError.Configuration, TylError.NotImplemented,
        TylError.Custom {

    @JsonTypeName("Database")
    record Database(String message) implements TylError {
        public Database {
            Objects.requireNonNull(message, "message must not be null");
        }

        @Override
        public ErrorCategory category() {
            return ErrorCategory.transientError();
        }

        @Override
        public String toString() {
            return "Database error: " + message;
        }
    }

    @JsonTypeName("Network")
    record Network(String message) implements TylError {
        public Network {
            Objects.requireNonNull(message, "message must not be null");
        }

        @Override
        public ErrorCategory category() {
            return ErrorCategory.network();
        }

        @Override
        public String toString() {
            return "Network error: " + message;
        }
    }

    @JsonTypeName("Validation")
    record Validation(String field, String message) implements TylError {
        public Validation {
            Objects.requireNonNull(field, "field must not be null");
            Objects.requireNonNull(message, "message must not be null");
        }

        @Override
        public ErrorCategory category() {
            return ErrorCategory.validation();
        }

        @Override
        public String toString() {
            return "Validation error: " + field + ": " + message;
        }
    }

    @JsonTypeName("NotFound")
    record NotFound(String resource, String id) implements TylError {
        public NotFound {
            Objects.requireNonNull(resource, "resource must not be null");
            Objects.requireNonNull(id, "id must not be null");
        }

        @Override
        public ErrorCategory category() {
            return ErrorCategory.permanent();
        }

        @Override
        public String toString() {
            return "Not found: " + resource + " with id " + id;
        }
    }

    /**
     * Duplicate resources, constraint violations.
     */
    @JsonTypeName("Conflict")
    record Conflict(String message) implements TylError {
        public Conflict {
            Objects.requireNonNull(message, "message must not be null");
        }

        @Override
        public ErrorCategory category() {
            return ErrorCategory.permanent();
        }

        @Override
        public String toString() {
            return "Conflict: " + message;
        }
    }

    @JsonTypeName("Internal")
    record Internal(String message) implements TylError {
        public Internal {
            Objects.requireNonNull(message, "message must not be null");
        }

        @Override
        public ErrorCategory category() {
            return ErrorCategory.internal();
        }

        @Override
        public String toString() {
            return "Internal error: " + message;
        }
    }

    @JsonTypeName("Configuration")
    record Configuration(String message) implements TylError {
        public Configuration {
            Objects.requireNonNull(message, "message must not be null");
        }

        @Override
        public ErrorCategory category() {
            return ErrorCategory.permanent();
        }

        @Override
        public String toString() {
            return "Configuration error: " + message;
        }
    }

    @JsonTypeName("NotImplemented")
    record NotImplemented(String feature) implements TylError {
        public NotImplemented {
            Objects.requireNonNull(feature, "feature must not be null");
        }

        @Override
        public ErrorCategory category() {
            return ErrorCategory.permanent();
        }

        @Override
        public String toString() {
            return "Feature not implemented: " + feature;
        }
    }

    /**
     * A domain-specific error whose retry behavior comes from its own classifier.
     *
     * @param message human-readable description
     * @param classifier the classification to use; never serialized
     */
    @JsonTypeName("Custom")
    @JsonIgnoreProperties(value = "classifier")
    record Custom(String message, ErrorClassifier classifier) implements TylError {
        public Custom {
            Objects.requireNonNull(message, "message must not be null");
            Objects.requireNonNull(classifier, "classifier must not be null");
        }

        /**
         * Creates a custom error carrying the {@link ErrorCategory#defaultClassifier() default classifier}.
         * Used when reading custom errors back from JSON.
         */
        @JsonCreator
        public static Custom withDefaultClassifier(@JsonProperty("message") String message) {
            return new Custom(message, ErrorCategory.defaultClassifier());
        }

        @Override
        public ErrorCategory category() {
            return ErrorCategory.custom(classifier);
        }

        @Override
        public String toString() {
            return "Custom error: " + message;
        }
    }

    /**
     * The category this error belongs to.
     */
    ErrorCategory category();

    // === Factories ===

    static TylError database(String message) {
        return new Database(message);
    }

    static TylError network(String message) {
        return new Network(message);
    }

    static TylError validation(String field, String message) {
        return new Validation(field, message);
    }

    static TylError notFound(String resource, String id) {
        return new NotFound(resource, id);
    }

    static TylError conflict(String message) {
        return new Conflict(message);
    }

    static TylError internal(String message) {
        return new Internal(message);
    }

    static TylError configuration(String message) {
        return new Configuration(message);
    }

    static TylError notImplemented(String feature) {
        return new NotImplemented(feature);
    }

    /**
     * Creates a {@link Custom} error classified by the given classifier.
     *
     * @param message human-readable description
     * @param classifier the domain-specific classification
     */
    static TylError businessLogic(String message, ErrorClassifier classifier) {
        return new Custom(message, classifier);
    }

    // === Convenience factories ===

    /**
     * A validation error on the pseudo-field {@code parsing}.
     */
    static TylError parsing(String message) {
        return new Validation("parsing", message);
    }

    static TylError serialization(String message) {
        return new Internal("Serialization error: " + message);
    }

    static TylError connection(String message) {
        return new Network("Connection error: " + message);
    }

    static TylError initialization(String message) {
        return new Internal("Initialization error: " + message);
    }

    /**
     * Folds a Jackson failure into an {@link Internal} error.
     *
     * @param exception the codec failure
     */
    static TylError fromJsonFailure(JsonProcessingException exception) {
        Objects.requireNonNull(exception, "exception must not be null");
        return new Internal("JSON serialization error: " + exception.getOriginalMessage());
    }

    // === Observability ===

    /**
     * Creates a fresh {@link ErrorContext} for this error.
     *
     * @param operation the name of the operation that failed
     * @return a context with a new id, this error's category and display text, and attempt count 1
     */
    default ErrorContext toContext(String operation) {
        return new ErrorContext(operation, category(), toString());
    }

    /**
     * Writes this error to the diagnostic log if the global settings allow it.
     *
     * @param level the level of this message
     * @return true if the settings allowed the line; Log4j's own level threshold may still drop it
     */
    default boolean logIfEnabled(LogLevel level) {
        return DiagnosticLog.global().log(level, this);
    }

    // === Retry ===

    /**
     * Retriable category and fewer than {@link ErrorSettings#maxRetries()} attempts so far,
     * using the global settings.
     */
    @Override
    default boolean shouldRetry(int attempt) {
        return shouldRetry(attempt, ErrorSettings.global());
    }

    default boolean shouldRetry(int attempt, ErrorSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        return category().isRetriable() && attempt < settings.maxRetries();
    }

    @Override
    default Duration retryDelay(int attempt) {
        return category().retryDelay(attempt);
    }

    @Override
    default int maxRetries() {
        return ErrorSettings.global().maxRetries();
    }
}
