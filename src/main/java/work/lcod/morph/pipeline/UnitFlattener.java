package work.lcod.morph.pipeline;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import work.lcod.morph.runtime.TransformUnit;
import work.lcod.morph.runtime.UnitKind;

/**
 * Expands sequential composites and lazy pipelines into their ordered leaf units (depth-first, left to right).
 *
 * <p>Uses an explicit worklist; multi-step composites, identities and plain leaves are kept as-is.
 */
public final class UnitFlattener {
    private UnitFlattener() {}

    public static List<TransformUnit<?, ?>> flatten(TransformUnit<?, ?> root) {
        Objects.requireNonNull(root, "root");
        var leaves = new ArrayList<TransformUnit<?, ?>>();
        Deque<TransformUnit<?, ?>> work = new ArrayDeque<>();
        work.push(root);
        while (!work.isEmpty()) {
            var unit = work.pop();
            var kind = unit.kind();
            if (kind == null) {
                throw new OptimizationException("Unit '" + unit.name() + "' does not declare its kind");
            }
            switch (kind) {
                case LEAF, IDENTITY, MULTI_STEP -> leaves.add(unit);
                case SEQUENTIAL -> {
                    var children = unit.children();
                    if (children == null || children.size() != 2) {
                        throw new OptimizationException(
                            "Sequential unit '" + unit.name() + "' must have exactly two children");
                    }
                    pushReversed(work, children);
                }
                case LAZY -> {
                    var children = unit.children();
                    if (children == null) {
                        throw new OptimizationException("Lazy unit '" + unit.name() + "' exposes no steps");
                    }
                    pushReversed(work, children);
                }
                default -> throw new OptimizationException("Unsupported unit kind " + kind + " for '" + unit.name() + "'");
            }
        }
        return leaves;
    }

    static boolean isIdentity(TransformUnit<?, ?> unit) {
        return unit.kind() == UnitKind.IDENTITY;
    }

    private static void pushReversed(Deque<TransformUnit<?, ?>> work, List<TransformUnit<?, ?>> children) {
        for (int i = children.size() - 1; i >= 0; i--) {
            var child = children.get(i);
            if (child == null) {
                throw new OptimizationException("Composite contains a null step");
            }
            work.push(child);
        }
    }
}
