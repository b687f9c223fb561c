package org.tyl.errors;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import org.tyl.errors.codec.ErrorCodec;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A single error occurrence, tracked for debugging and monitoring.
 *
 * <p>Unlike {@link TylError}, a context is mutable: the owner increments the attempt count
 * on every retry and attaches metadata as it learns more about the failure.
 * <pre>{@code
 * ErrorContext context = new ErrorContext("api_call", ErrorCategory.network(), "Timeout")
 *     .withMetadata("endpoint", "/api/users")
 *     .withMetadata("timeout_ms", 5000);
 * }</pre>
 *
 * <p>Instances are meant to have a single owner and are not thread-safe.
 * The category is a snapshot taken at creation time and is not serialized; a context read
 * back from JSON carries the {@link BuiltinCategory#UNKNOWN} category.
 */
@JsonPropertyOrder({"error_id", "operation", "message", "occurred_at", "attempt_count", "metadata"})
public final class ErrorContext {

    @JsonProperty("error_id")
    private final UUID errorId;

    @JsonProperty("operation")
    private final String operation;

    private final ErrorCategory category;

    @JsonProperty("message")
    private final String message;

    @JsonProperty("occurred_at")
    private final Instant occurredAt;

    @JsonProperty("attempt_count")
    private int attemptCount;

    @JsonProperty("metadata")
    private final Map<String, JsonNode> metadata;

    /**
     * Creates a context with a fresh id, the current time, attempt count 1 and no metadata.
     *
     * @param operation the name of the operation that failed
     * @param category the error category
     * @param message human-readable error message
     */
    public ErrorContext(String operation, ErrorCategory category, String message) {
        this(UUID.randomUUID(), operation, category, message, Instant.now(), 1, new HashMap<>());
    }

    private ErrorContext(UUID errorId, String operation, ErrorCategory category, String message,
                         Instant occurredAt, int attemptCount, Map<String, JsonNode> metadata) {
        this.errorId = Objects.requireNonNull(errorId, "errorId must not be null");
        this.operation = Objects.requireNonNull(operation, "operation must not be null");
        this.category = Objects.requireNonNull(category, "category must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.occurredAt = Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        this.attemptCount = attemptCount;
        this.metadata = metadata;
    }

    @JsonCreator
    private static ErrorContext fromJson(
            @JsonProperty("error_id") UUID errorId,
            @JsonProperty("operation") String operation,
            @JsonProperty("message") String message,
            @JsonProperty("occurred_at") Instant occurredAt,
            @JsonProperty("attempt_count") int attemptCount,
            @JsonProperty("metadata") Map<String, JsonNode> metadata) {
        return new ErrorContext(errorId, operation, ErrorCategory.unknown(), message, occurredAt, attemptCount,
                metadata == null ? new HashMap<>() : new HashMap<>(metadata));
    }

    /**
     * Adds or replaces a metadata entry and returns this context for chaining.
     *
     * @param key metadata key
     * @param value any value Jackson can convert to a JSON tree
     */
    public ErrorContext withMetadata(String key, Object value) {
        addMetadata(key, value);
        return this;
    }

    /**
     * Adds or replaces a metadata entry. The last write for a key wins.
     *
     * @param key metadata key
     * @param value any value Jackson can convert to a JSON tree
     */
    public void addMetadata(String key, Object value) {
        Objects.requireNonNull(key, "key must not be null");
        metadata.put(key, ErrorCodec.toTree(value));
    }

    public Optional<JsonNode> getMetadata(String key) {
        return Optional.ofNullable(metadata.get(key));
    }

    public boolean hasMetadata(String key) {
        return metadata.containsKey(key);
    }

    /**
     * Removes a metadata entry.
     *
     * @return the removed value, or empty if the key was not present
     */
    public Optional<JsonNode> removeMetadata(String key) {
        return Optional.ofNullable(metadata.remove(key));
    }

    public void clearMetadata() {
        metadata.clear();
    }

    public int metadataCount() {
        return metadata.size();
    }

    /**
     * An unmodifiable view of the metadata.
     */
    public Map<String, JsonNode> metadata() {
        return Collections.unmodifiableMap(metadata);
    }

    /**
     * Records another attempt. No upper bound is enforced here.
     */
    public void incrementAttempt() {
        attemptCount++;
    }

    /**
     * Returns an independent copy. Metadata values are deep-copied.
     */
    public ErrorContext copy() {
        Map<String, JsonNode> copied = new HashMap<>();
        metadata.forEach((key, value) -> copied.put(key, value.deepCopy()));
        return new ErrorContext(errorId, operation, category, message, occurredAt, attemptCount, copied);
    }

    public UUID errorId() {
        return errorId;
    }

    public String operation() {
        return operation;
    }

    public ErrorCategory category() {
        return category;
    }

    public String message() {
        return message;
    }

    public Instant occurredAt() {
        return occurredAt;
    }

    public int attemptCount() {
        return attemptCount;
    }

    @Override
    public String toString() {
        return "ErrorContext[errorId=" + errorId +
                ", operation=" + operation +
                ", category=" + category.categoryName() +
                ", message=" + message +
                ", occurredAt=" + occurredAt +
                ", attemptCount=" + attemptCount +
                ", metadata=" + metadata + "]";
    }
}
