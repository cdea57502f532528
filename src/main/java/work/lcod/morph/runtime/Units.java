package work.lcod.morph.runtime;

import java.util.List;

/**
 * Factory helpers for building transform units.
 */
public final class Units {
    static final String ARROW = " → ";

    private Units() {}

    public static <I, O> SimpleUnit<I, O> of(String name, UnitFunction<? super I, ? extends O> function) {
        return new SimpleUnit<>(name, function);
    }

    public static <I, O> SimpleUnit<I, O> of(
        String name,
        UnitFunction<? super I, ? extends O> function,
        OptimizationMetadata metadata
    ) {
        return new SimpleUnit<>(name, function, metadata);
    }

    public static <T> IdentityUnit<T> identity() {
        return new IdentityUnit<>();
    }

    public static <T> IdentityUnit<T> identity(String name) {
        return new IdentityUnit<>(name);
    }

    public static <I, M, O> SequentialUnit<I, M, O> compose(TransformUnit<I, M> first, TransformUnit<? super M, O> second) {
        return new SequentialUnit<>(first, second);
    }

    public static <I, M, O> SequentialUnit<I, M, O> compose(
        TransformUnit<I, M> first,
        TransformUnit<? super M, O> second,
        String name
    ) {
        return new SequentialUnit<>(first, second, name);
    }

    public static <I, O> MultiStepUnit<I, O> multiStep(String name, List<? extends TransformUnit<?, ?>> steps) {
        return new MultiStepUnit<>(name, steps);
    }

    public static <I, O> MultiStepUnit<I, O> multiStep(
        String name,
        List<? extends TransformUnit<?, ?>> steps,
        UnitFunction<O, O> postProcess,
        CompositionHints hints
    ) {
        return new MultiStepUnit<>(name, steps, postProcess, hints);
    }

    /**
     * Views a unit of unknown type arguments as an {@code Object -> Object} unit, for code that chains
     * steps whose types were checked when the chain was assembled.
     */
    @SuppressWarnings("unchecked")
    public static TransformUnit<Object, Object> untyped(TransformUnit<?, ?> unit) {
        return (TransformUnit<Object, Object>) unit;
    }

    /**
     * Display name of {@code left} followed by {@code next}.
     */
    public static String joinNames(String left, TransformUnit<?, ?> next) {
        String right = next == null || next.name() == null || next.name().isBlank() ? "unnamed" : next.name();
        return (left == null || left.isBlank() ? "unnamed" : left) + ARROW + right;
    }
}
