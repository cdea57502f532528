package work.lcod.morph.runtime;

import java.util.List;
import java.util.Objects;

/**
 * Binary composite: the output of {@code first} feeds {@code second}.
 *
 * @param <I> input of the first unit
 * @param <M> intermediate value
 * @param <O> output of the second unit
 */
public final class SequentialUnit<I, M, O> implements TransformUnit<I, O> {
    private final TransformUnit<I, M> first;
    private final TransformUnit<? super M, O> second;
    private final String name;
    private final OptimizationMetadata metadata;

    public SequentialUnit(TransformUnit<I, M> first, TransformUnit<? super M, O> second) {
        this(first, second, null);
    }

    public SequentialUnit(TransformUnit<I, M> first, TransformUnit<? super M, O> second, String name) {
        this.first = Objects.requireNonNull(first, "first");
        this.second = Objects.requireNonNull(second, "second");
        this.name = name == null ? Units.joinNames(first.name(), second) : name;
        this.metadata = first.metadata().andThen(second.metadata());
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public O apply(I input, ExecutionContext ctx) throws Exception {
        M intermediate = first.apply(input, ctx);
        return second.apply(intermediate, ctx);
    }

    @Override
    public OptimizationMetadata metadata() {
        return metadata;
    }

    @Override
    public UnitKind kind() {
        return UnitKind.SEQUENTIAL;
    }

    @Override
    public List<TransformUnit<?, ?>> children() {
        return List.of(first, second);
    }

    public TransformUnit<I, M> first() {
        return first;
    }

    public TransformUnit<? super M, O> second() {
        return second;
    }

    @Override
    public String toString() {
        return "SequentialUnit[" + name + "]";
    }
}
