package work.lcod.morph.flow;

/**
 * Raised by a {@link FluentPipeline#filter} step when its predicate rejects the input.
 *
 * <p>Builder runs handle it: the outermost run yields {@code null}. It only reaches callers that run
 * filter steps outside a builder, for example a {@code Pipeline} assembled from {@link FluentPipeline#steps()}.
 * Carries no stack trace.
 */
public final class FilteredSignal extends RuntimeException {
    private final String step;

    private FilteredSignal(String step) {
        super("Filtered by " + step, null, false, false);
        this.step = step;
    }

    static FilteredSignal of(String step) {
        return new FilteredSignal(step);
    }

    /**
     * Name of the filter step that rejected the input.
     */
    public String step() {
        return step;
    }
}
