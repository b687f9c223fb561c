package org.tyl.errors.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.tyl.errors.ErrorContext;
import org.tyl.errors.TylError;
import org.tyl.errors.TylResult;

import java.util.Objects;

/**
 * JSON encoding of {@link TylError} and {@link ErrorContext}.
 *
 * <p>Every method reports failures as a {@link TylResult}; Jackson exceptions never escape.
 * Unknown fields are ignored on read, so payloads carrying extra keys (such as the events written
 * by {@code MetricsContextReporter}) still decode.
 * <pre>{@code
 * String json = ErrorCodec.encode(TylError.notFound("user", "42")).getOrThrow();
 * // {"NotFound":{"resource":"user","id":"42"}}
 * }</pre>
 */
public final class ErrorCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private ErrorCodec() {
        // Utility class
    }

    public static TylResult<String> encode(TylError error) {
        try {
            return TylResult.ok(MAPPER.writerFor(TylError.class).writeValueAsString(error));
        } catch (JsonProcessingException e) {
            return TylResult.err(TylError.fromJsonFailure(e));
        }
    }

    /**
     * Reads an error back. Custom errors come back with the default classifier.
     */
    public static TylResult<TylError> decodeError(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return TylResult.ok(MAPPER.readValue(json, TylError.class));
        } catch (JsonProcessingException e) {
            return TylResult.err(TylError.fromJsonFailure(e));
        }
    }

    public static TylResult<String> encode(ErrorContext context) {
        try {
            return TylResult.ok(MAPPER.writeValueAsString(context));
        } catch (JsonProcessingException e) {
            return TylResult.err(TylError.fromJsonFailure(e));
        }
    }

    /**
     * Reads a context back. The category is not part of the encoding and comes back as Unknown.
     */
    public static TylResult<ErrorContext> decodeContext(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return TylResult.ok(MAPPER.readValue(json, ErrorContext.class));
        } catch (JsonProcessingException e) {
            return TylResult.err(TylError.fromJsonFailure(e));
        }
    }

    /**
     * Converts an arbitrary value to a JSON tree.
     *
     * @throws IllegalArgumentException if Jackson cannot convert the value
     */
    public static JsonNode toTree(Object value) {
        return MAPPER.valueToTree(value);
    }
}
