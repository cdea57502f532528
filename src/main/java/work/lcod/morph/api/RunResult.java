package work.lcod.morph.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import work.lcod.morph.runtime.OptimizationMetadata;

/**
 * Outcome of running one registered unit through a {@link MorphRunner}.
 *
 * <p>A successful run carries the unit's output, its optimization metadata and, for builder products,
 * the composition trace recorded at registration. A failed run carries the exception type and message.
 * A {@code null} value on success means a filter rejected the input.
 *
 * @param <T> output type of the unit
 */
public record RunResult<T>(
    Status status,
    String unitName,
    T value,
    OptimizationMetadata optimization,
    List<String> composition,
    String error,
    String errorType,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RunResult {
        Objects.requireNonNull(status, "status");
        composition = composition == null ? List.of() : List.copyOf(composition);
    }

    static <T> RunResult<T> success(
        String unitName,
        T value,
        OptimizationMetadata optimization,
        List<String> composition,
        Instant startedAt
    ) {
        return new RunResult<>(Status.SUCCESS, unitName, value, optimization, composition, null, null, startedAt, Instant.now());
    }

    static <T> RunResult<T> failure(String unitName, Exception cause, Instant startedAt) {
        return new RunResult<>(
            Status.FAILURE,
            unitName,
            null,
            null,
            List.of(),
            cause.getMessage(),
            cause.getClass().getSimpleName(),
            startedAt,
            Instant.now()
        );
    }

    public boolean succeeded() {
        return status == Status.SUCCESS;
    }

    /**
     * @throws IllegalStateException if the run failed
     */
    public T valueOrThrow() {
        if (!succeeded()) {
            throw new IllegalStateException("Run of '" + unitName + "' failed: " + errorType + ": " + error);
        }
        return value;
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("unit", unitName);
        if (succeeded()) {
            serializable.put("value", value);
            if (optimization != null) {
                serializable.put("optimization", optimization.toMap());
            }
            if (!composition.isEmpty()) {
                serializable.put("composition", composition);
            }
        } else {
            serializable.put("error", error);
            serializable.put("errorType", errorType);
        }
        serializable.put("startedAt", startedAt.toString());
        serializable.put("durationMillis", duration().toMillis());
        return serializable;
    }

    /**
     * @throws IllegalStateException if the value cannot be serialized by Jackson
     */
    public String toJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize run result: " + ex.getOriginalMessage(), ex);
        }
    }

    public enum Status {
        SUCCESS,
        FAILURE
    }
}
