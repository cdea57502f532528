package work.lcod.morph.flow;

import work.lcod.morph.runtime.OptimizationMetadata;

/**
 * Overrides for an inline {@link FluentPipeline#map} step. Unset fields fall back to
 * {@code pure = true, fusible = true, cost = 1, memoizable = true}.
 */
public record MapOptions(String name, Boolean pure, Boolean fusible, Double cost, Boolean memoizable) {
    private static final MapOptions DEFAULTS = new MapOptions(null, null, null, null, null);

    public static MapOptions defaults() {
        return DEFAULTS;
    }

    public MapOptions withName(String value) {
        return new MapOptions(value, pure, fusible, cost, memoizable);
    }

    public MapOptions withPure(boolean value) {
        return new MapOptions(name, value, fusible, cost, memoizable);
    }

    public MapOptions withFusible(boolean value) {
        return new MapOptions(name, pure, value, cost, memoizable);
    }

    public MapOptions withCost(double value) {
        return new MapOptions(name, pure, fusible, value, memoizable);
    }

    public MapOptions withMemoizable(boolean value) {
        return new MapOptions(name, pure, fusible, cost, value);
    }

    OptimizationMetadata toMetadata() {
        return new OptimizationMetadata(
            pure == null || pure,
            fusible == null || fusible,
            cost == null ? 1 : cost,
            memoizable == null || memoizable
        );
    }
}
