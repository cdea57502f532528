package work.lcod.morph.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Context threaded through every {@code apply} call.
 *
 * <p>Its attributes belong to the collaborators that supply and consume payloads; units and pipelines
 * pass the context along and never read or write it themselves.
 */
public final class ExecutionContext {
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();

    public ExecutionContext() {}

    public ExecutionContext(Map<String, ?> initial) {
        if (initial != null) {
            initial.forEach(this::setAttribute);
        }
    }

    public static ExecutionContext empty() {
        return new ExecutionContext();
    }

    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    public void setAttribute(String key, Object value) {
        if (value == null) {
            attributes.remove(key);
        } else {
            attributes.put(key, value);
        }
    }

    public Map<String, Object> attributes() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
