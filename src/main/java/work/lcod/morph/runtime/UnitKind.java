package work.lcod.morph.runtime;

/**
 * Structural tag of a transform unit. The flattener matches on it instead of inspecting concrete classes.
 */
public enum UnitKind {
    /** Opaque unit backed by a single function. */
    LEAF,
    /** The no-op unit; dropped by the optimizer when other steps remain. */
    IDENTITY,
    /** Exactly two children run in order. */
    SEQUENTIAL,
    /** Ordered steps with optional post-processing; opaque to flattening. */
    MULTI_STEP,
    /** Explicit step list executed on demand; expanded by flattening. */
    LAZY
}
