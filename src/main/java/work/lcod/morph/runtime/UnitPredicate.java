package work.lcod.morph.runtime;

/**
 * Condition evaluated by guard and branch steps.
 */
@FunctionalInterface
public interface UnitPredicate<I> {
    boolean test(I input, ExecutionContext ctx) throws Exception;
}
