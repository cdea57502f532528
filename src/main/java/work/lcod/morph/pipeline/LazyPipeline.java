package work.lcod.morph.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.lcod.morph.runtime.ExecutionContext;
import work.lcod.morph.runtime.OptimizationMetadata;
import work.lcod.morph.runtime.TransformUnit;
import work.lcod.morph.runtime.UnitKind;
import work.lcod.morph.runtime.Units;

/**
 * Holds an explicit step list and runs it only when applied, without building nested composites.
 */
public final class LazyPipeline<I, O> implements TransformUnit<I, O> {
    private static final String DEFAULT_NAME = "LazyPipeline";

    private final List<TransformUnit<?, ?>> steps;
    private final String name;
    private final OptimizationMetadata metadata;

    public LazyPipeline(List<? extends TransformUnit<?, ?>> steps) {
        this(steps, null);
    }

    public LazyPipeline(List<? extends TransformUnit<?, ?>> steps, String name) {
        Objects.requireNonNull(steps, "steps");
        var copy = new ArrayList<TransformUnit<?, ?>>(steps.size());
        for (var step : steps) {
            copy.add(Objects.requireNonNull(step, "step"));
        }
        this.steps = List.copyOf(copy);
        this.name = name == null || name.isBlank() ? DEFAULT_NAME : name;
        var combined = OptimizationMetadata.identity();
        for (var step : this.steps) {
            combined = combined.andThen(step.metadata());
        }
        this.metadata = combined;
    }

    public static <T> LazyPipeline<T, T> identity() {
        return new LazyPipeline<>(List.of(), "Identity");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    @SuppressWarnings("unchecked")
    public O apply(I input, ExecutionContext ctx) throws Exception {
        Object current = input;
        for (var step : steps) {
            current = Units.untyped(step).apply(current, ctx);
        }
        return (O) current;
    }

    @Override
    public OptimizationMetadata metadata() {
        return metadata;
    }

    @Override
    public UnitKind kind() {
        return UnitKind.LAZY;
    }

    @Override
    public List<TransformUnit<?, ?>> children() {
        return steps;
    }

    public List<TransformUnit<?, ?>> steps() {
        return steps;
    }

    @Override
    public <N> LazyPipeline<I, N> then(TransformUnit<? super O, N> next) {
        Objects.requireNonNull(next, "next");
        var extended = new ArrayList<TransformUnit<?, ?>>(steps);
        extended.add(next);
        return new LazyPipeline<>(extended, Units.joinNames(name, next));
    }

    @Override
    public String toString() {
        return "LazyPipeline[" + name + ", steps=" + steps.size() + "]";
    }
}
