package work.lcod.morph.pipeline;

/**
 * Raised when a pipeline cannot be flattened into a total order of leaf units.
 */
public final class OptimizationException extends RuntimeException {
    public OptimizationException(String message) {
        super(message);
    }
}
