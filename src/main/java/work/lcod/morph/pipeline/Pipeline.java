package work.lcod.morph.pipeline;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import work.lcod.morph.runtime.ExecutionContext;
import work.lcod.morph.runtime.IdentityUnit;
import work.lcod.morph.runtime.OptimizationMetadata;
import work.lcod.morph.runtime.SequentialUnit;
import work.lcod.morph.runtime.TransformUnit;
import work.lcod.morph.runtime.Units;

/**
 * Named, immutable wrapper around a root transform unit.
 */
public final class Pipeline<I, O> {
    private static final String DEFAULT_NAME = "Pipeline";
    static final String IDENTITY_NAME = "IdentityPipeline";

    private final TransformUnit<I, O> root;
    private final String name;

    public Pipeline(TransformUnit<I, O> root) {
        this(root, DEFAULT_NAME);
    }

    public Pipeline(TransformUnit<I, O> root, String name) {
        this.root = Objects.requireNonNull(root, "root");
        this.name = name == null || name.isBlank() ? DEFAULT_NAME : name;
    }

    public static <T> Pipeline<T, T> identity() {
        return new Pipeline<>(new IdentityUnit<>(), IDENTITY_NAME);
    }

    /**
     * Rebuilds a pipeline from an ordered step list. The first step becomes the root and each following
     * step is appended as a sequential composite, so flattening the result yields {@code steps} again.
     * An empty list yields an identity pipeline.
     */
    @SuppressWarnings("unchecked")
    public static <I, O> Pipeline<I, O> of(String name, List<? extends TransformUnit<?, ?>> steps) {
        if (steps == null || steps.isEmpty()) {
            TransformUnit<?, ?> identity = new IdentityUnit<>();
            return new Pipeline<>((TransformUnit<I, O>) identity, name == null ? IDENTITY_NAME : name);
        }
        TransformUnit<Object, Object> current = Units.untyped(Objects.requireNonNull(steps.get(0), "step"));
        for (int i = 1; i < steps.size(); i++) {
            current = new SequentialUnit<>(current, Units.untyped(Objects.requireNonNull(steps.get(i), "step")));
        }
        TransformUnit<?, ?> root = current;
        return new Pipeline<>((TransformUnit<I, O>) root, name);
    }

    public O apply(I input, ExecutionContext ctx) throws Exception {
        return root.apply(input, ctx);
    }

    public <N> Pipeline<I, N> then(TransformUnit<? super O, N> next) {
        Objects.requireNonNull(next, "next");
        return new Pipeline<>(root.then(next), Units.joinNames(name, next));
    }

    public TransformUnit<I, O> root() {
        return root;
    }

    public String name() {
        return name;
    }

    public OptimizationMetadata metadata() {
        return root.metadata();
    }

    public double cost() {
        return root.metadata().cost();
    }

    /**
     * Ordered leaf units, using the same flattening the optimizer uses.
     */
    public List<TransformUnit<?, ?>> units() {
        return UnitFlattener.flatten(root);
    }

    public List<String> unitNames() {
        return units().stream().map(TransformUnit::name).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "Pipeline[" + name + "]";
    }
}
