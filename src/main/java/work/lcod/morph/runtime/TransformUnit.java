package work.lcod.morph.runtime;

import java.util.List;

/**
 * Atomic, named, metadata-carrying transformation from an input value to an output value.
 *
 * <p>Units are immutable and may be shared by any number of pipelines. {@code apply} must not mutate
 * its input; failures of the underlying function propagate unchanged.
 *
 * @param <I> input type
 * @param <O> output type
 */
public interface TransformUnit<I, O> {
    String name();

    O apply(I input, ExecutionContext ctx) throws Exception;

    OptimizationMetadata metadata();

    default UnitKind kind() {
        return UnitKind.LEAF;
    }

    /**
     * Direct constituents in execution order; empty for leaves.
     */
    default List<TransformUnit<?, ?>> children() {
        return List.of();
    }

    default <N> TransformUnit<I, N> then(TransformUnit<? super O, N> next) {
        return new SequentialUnit<>(this, next, Units.joinNames(name(), next));
    }
}
