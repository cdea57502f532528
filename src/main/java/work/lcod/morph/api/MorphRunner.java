package work.lcod.morph.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.morph.registry.UnitRegistry;
import work.lcod.morph.runtime.ExecutionContext;
import work.lcod.morph.runtime.TransformUnit;

/**
 * Runs registered units by name and reports each outcome as a {@link RunResult}.
 *
 * <p>Failures are captured in the result rather than thrown. Units themselves still propagate their
 * errors unchanged; only this runner converts them.
 */
public final class MorphRunner {
    private static final Logger log = LoggerFactory.getLogger(MorphRunner.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final MorphEngine engine;

    public MorphRunner(MorphEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    public <I, O> RunResult<O> run(String unitName, I input) {
        return run(unitName, input, ExecutionContext.empty());
    }

    public <I, O> RunResult<O> run(String unitName, I input, ExecutionContext ctx) {
        var started = Instant.now();
        try {
            var entry = engine.registry().entry(unitName).orElse(null);
            TransformUnit<I, O> unit = engine.registry().require(unitName);
            O value = unit.apply(input, ctx == null ? ExecutionContext.empty() : ctx);
            log.debug("Run of '{}' succeeded", unitName);
            return RunResult.success(unitName, value, unit.metadata(), composition(entry), started);
        } catch (Exception ex) {
            return failed(unitName, ex, started);
        }
    }

    /**
     * Parses {@code payload} as JSON (objects become maps, arrays lists) and runs the unit on it.
     * A blank payload runs the unit on {@code null}.
     */
    public RunResult<Object> runJson(String unitName, String payload) {
        return runJson(unitName, payload, ExecutionContext.empty());
    }

    public RunResult<Object> runJson(String unitName, String payload, ExecutionContext ctx) {
        Object input;
        try {
            input = parseInput(payload);
        } catch (IllegalArgumentException ex) {
            return failed(unitName, ex, Instant.now());
        }
        return run(unitName, input, ctx);
    }

    public String runToJson(String unitName, String payload) {
        return runJson(unitName, payload).toJson();
    }

    private static <O> RunResult<O> failed(String unitName, Exception ex, Instant started) {
        log.warn("Run of '{}' failed: {}", unitName, ex.toString());
        log.debug("Run of '{}' failure detail", unitName, ex);
        return RunResult.failure(unitName, ex, started);
    }

    private static List<String> composition(UnitRegistry.Entry entry) {
        return entry == null ? List.of() : entry.composition();
    }

    private static Object parseInput(String payload) {
        if (payload == null || payload.isBlank()) {
            return null;
        }
        try {
            return JSON.readValue(payload, Object.class);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid JSON input payload", ex);
        }
    }
}
