package work.lcod.morph.runtime;

import java.util.Objects;

/**
 * Neutral element of composition: returns its input unchanged at zero cost.
 */
public final class IdentityUnit<T> implements TransformUnit<T, T> {
    public static final String DEFAULT_NAME = "Identity";

    private final String name;

    public IdentityUnit() {
        this(DEFAULT_NAME);
    }

    public IdentityUnit(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public T apply(T input, ExecutionContext ctx) {
        return input;
    }

    @Override
    public OptimizationMetadata metadata() {
        return OptimizationMetadata.identity();
    }

    @Override
    public UnitKind kind() {
        return UnitKind.IDENTITY;
    }

    @Override
    public String toString() {
        return "IdentityUnit[" + name + "]";
    }
}
