package work.lcod.morph.runtime;

/**
 * Explicit metadata assertions for a {@link MultiStepUnit}. A {@code null} field means "not asserted".
 */
public record CompositionHints(Boolean pure, Boolean fusible, Boolean memoizable) {
    private static final CompositionHints NONE = new CompositionHints(null, null, null);

    public static CompositionHints none() {
        return NONE;
    }

    public static CompositionHints of(Boolean pure, Boolean fusible) {
        return new CompositionHints(pure, fusible, null);
    }

    public boolean assertsPure() {
        return Boolean.TRUE.equals(pure);
    }

    public boolean assertsFusible() {
        return Boolean.TRUE.equals(fusible);
    }
}
