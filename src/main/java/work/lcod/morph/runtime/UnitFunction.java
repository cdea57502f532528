package work.lcod.morph.runtime;

/**
 * Function backing a leaf transform unit. Any exception it throws reaches the caller of {@code apply} unchanged.
 */
@FunctionalInterface
public interface UnitFunction<I, O> {
    O apply(I input, ExecutionContext ctx) throws Exception;
}
