package work.lcod.morph.runtime;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Optimization hints carried by every transform unit.
 *
 * <p>{@code cost} is a non-negative relative estimate and is additive under composition.
 * Composite metadata is always derived from the constituents' metadata, never stored separately.
 */
public record OptimizationMetadata(boolean pure, boolean fusible, double cost, boolean memoizable) {
    private static final OptimizationMetadata DEFAULTS = new OptimizationMetadata(true, true, 1, true);
    private static final OptimizationMetadata IDENTITY = new OptimizationMetadata(true, true, 0, true);

    public OptimizationMetadata {
        if (Double.isNaN(cost) || Double.isInfinite(cost)) {
            throw new IllegalArgumentException("Cost must be a finite number: " + cost);
        }
        if (cost < 0) {
            throw new IllegalArgumentException("Cost must be non-negative: " + cost);
        }
    }

    public static OptimizationMetadata defaults() {
        return DEFAULTS;
    }

    public static OptimizationMetadata identity() {
        return IDENTITY;
    }

    public static OptimizationMetadata of(boolean pure, boolean fusible, double cost) {
        return new OptimizationMetadata(pure, fusible, cost, true);
    }

    /**
     * Metadata of running this unit and then {@code next}: flags are AND-ed, costs are summed.
     */
    public OptimizationMetadata andThen(OptimizationMetadata next) {
        return new OptimizationMetadata(
            pure && next.pure,
            fusible && next.fusible,
            cost + next.cost,
            memoizable && next.memoizable
        );
    }

    /**
     * JSON-friendly view with keys {@code pure}, {@code fusible}, {@code cost} and {@code memoizable}.
     */
    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("pure", pure);
        map.put("fusible", fusible);
        map.put("cost", cost);
        map.put("memoizable", memoizable);
        return map;
    }

    public OptimizationMetadata withPure(boolean value) {
        return new OptimizationMetadata(value, fusible, cost, memoizable);
    }

    public OptimizationMetadata withFusible(boolean value) {
        return new OptimizationMetadata(pure, value, cost, memoizable);
    }

    public OptimizationMetadata withCost(double value) {
        return new OptimizationMetadata(pure, fusible, value, memoizable);
    }

    public OptimizationMetadata withMemoizable(boolean value) {
        return new OptimizationMetadata(pure, fusible, cost, value);
    }
}
