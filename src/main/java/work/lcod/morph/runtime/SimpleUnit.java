package work.lcod.morph.runtime;

import java.util.Objects;

/**
 * Leaf unit backed by a {@link UnitFunction}.
 */
public final class SimpleUnit<I, O> implements TransformUnit<I, O> {
    private final String name;
    private final UnitFunction<? super I, ? extends O> function;
    private final OptimizationMetadata metadata;

    public SimpleUnit(String name, UnitFunction<? super I, ? extends O> function) {
        this(name, function, OptimizationMetadata.defaults());
    }

    public SimpleUnit(String name, UnitFunction<? super I, ? extends O> function, OptimizationMetadata metadata) {
        this.name = Objects.requireNonNull(name, "name");
        this.function = Objects.requireNonNull(function, "function");
        this.metadata = metadata == null ? OptimizationMetadata.defaults() : metadata;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public O apply(I input, ExecutionContext ctx) throws Exception {
        return function.apply(input, ctx);
    }

    @Override
    public OptimizationMetadata metadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "SimpleUnit[" + name + "]";
    }
}
