package work.lcod.morph.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * N-ary composite running an ordered list of steps, then an optional post-processor on the final value.
 *
 * <p>Metadata follows different rules than {@link SequentialUnit}:
 * <ul>
 *   <li>{@code pure} requires every step to be pure, and the post-processor (if any) to be asserted pure
 *       through {@link CompositionHints#pure()};</li>
 *   <li>{@code fusible} is never inferred: it holds only when the hints assert it;</li>
 *   <li>{@code cost} is the sum of step costs plus one for a post-processor.</li>
 * </ul>
 * Extending with {@link #then(TransformUnit)} keeps the result a multi-step composite.
 */
public final class MultiStepUnit<I, O> implements TransformUnit<I, O> {
    private final String name;
    private final List<TransformUnit<?, ?>> steps;
    private final UnitFunction<O, O> postProcess;
    private final CompositionHints hints;
    private final TransformUnit<Object, Object> chain;
    private final OptimizationMetadata metadata;

    public MultiStepUnit(String name, List<? extends TransformUnit<?, ?>> steps) {
        this(name, steps, null, CompositionHints.none());
    }

    public MultiStepUnit(
        String name,
        List<? extends TransformUnit<?, ?>> steps,
        UnitFunction<O, O> postProcess,
        CompositionHints hints
    ) {
        this.name = Objects.requireNonNull(name, "name");
        Objects.requireNonNull(steps, "steps");
        var copy = new ArrayList<TransformUnit<?, ?>>(steps.size());
        for (var step : steps) {
            copy.add(Objects.requireNonNull(step, "step"));
        }
        this.steps = List.copyOf(copy);
        this.postProcess = postProcess;
        this.hints = hints == null ? CompositionHints.none() : hints;
        this.chain = fold(this.steps);
        this.metadata = computeMetadata(this.steps, postProcess != null, this.hints);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    @SuppressWarnings("unchecked")
    public O apply(I input, ExecutionContext ctx) throws Exception {
        O result = (O) chain.apply(input, ctx);
        if (postProcess != null) {
            result = postProcess.apply(result, ctx);
        }
        return result;
    }

    @Override
    public OptimizationMetadata metadata() {
        return metadata;
    }

    @Override
    public UnitKind kind() {
        return UnitKind.MULTI_STEP;
    }

    @Override
    public List<TransformUnit<?, ?>> children() {
        return steps;
    }

    public List<TransformUnit<?, ?>> steps() {
        return steps;
    }

    public UnitFunction<O, O> postProcess() {
        return postProcess;
    }

    public CompositionHints hints() {
        return hints;
    }

    /**
     * Appends {@code next} to the step list. An existing post-processor becomes an ordinary trailing step
     * so behavior is unchanged; the returned composite has no post-processor and no hints.
     */
    @Override
    public <N> MultiStepUnit<I, N> then(TransformUnit<? super O, N> next) {
        Objects.requireNonNull(next, "next");
        var combined = new ArrayList<TransformUnit<?, ?>>(steps.size() + 2);
        combined.addAll(steps);
        if (postProcess != null) {
            combined.add(postProcessStep());
        }
        combined.add(next);
        return new MultiStepUnit<>(Units.joinNames(name, next), combined, null, CompositionHints.none());
    }

    private TransformUnit<O, O> postProcessStep() {
        boolean pure = hints.assertsPure();
        return new SimpleUnit<>(
            name + "#post",
            postProcess,
            new OptimizationMetadata(pure, false, 1, pure)
        );
    }

    private static TransformUnit<Object, Object> fold(List<TransformUnit<?, ?>> steps) {
        TransformUnit<Object, Object> current = new IdentityUnit<>();
        for (var step : steps) {
            current = new SequentialUnit<>(current, Units.untyped(step));
        }
        return current;
    }

    private static OptimizationMetadata computeMetadata(
        List<TransformUnit<?, ?>> steps,
        boolean hasPostProcess,
        CompositionHints hints
    ) {
        boolean allPure = true;
        boolean allMemoizable = true;
        double cost = hasPostProcess ? 1 : 0;
        for (var step : steps) {
            var meta = step.metadata();
            allPure &= meta.pure();
            allMemoizable &= meta.memoizable();
            cost += meta.cost();
        }
        boolean postPure = !hasPostProcess || hints.assertsPure();
        boolean pure = allPure && postPure;
        boolean memoizable = hints.memoizable() != null ? hints.memoizable() : pure && allMemoizable;
        return new OptimizationMetadata(pure, hints.assertsFusible(), cost, memoizable);
    }

    @Override
    public String toString() {
        return "MultiStepUnit[" + name + ", steps=" + steps.size() + "]";
    }
}
