package work.lcod.morph.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.morph.runtime.IdentityUnit;
import work.lcod.morph.runtime.SimpleUnit;
import work.lcod.morph.runtime.TransformUnit;
import work.lcod.morph.runtime.Units;

/**
 * Flattens a pipeline, strips interior identities and fuses adjacent fusible steps.
 *
 * <p>The returned pipeline is always a new instance, observably equivalent to the input and never more
 * expensive. A fused unit fails as a whole: intermediate values between its fused halves are not
 * observable, which is why only units declaring {@code fusible} take part.
 */
public final class PipelineOptimizer {
    private static final Logger log = LoggerFactory.getLogger(PipelineOptimizer.class);
    static final String FUSION = " ⊕ ";

    private final boolean fuseAdjacent;
    private final boolean dropIdentities;

    public PipelineOptimizer() {
        this(true, true);
    }

    public PipelineOptimizer(boolean fuseAdjacent, boolean dropIdentities) {
        this.fuseAdjacent = fuseAdjacent;
        this.dropIdentities = dropIdentities;
    }

    public <I, O> Pipeline<I, O> optimize(Pipeline<I, O> pipeline) {
        Objects.requireNonNull(pipeline, "pipeline");
        var flattened = UnitFlattener.flatten(pipeline.root());
        var optimized = optimizeSteps(flattened);
        Pipeline<I, O> rebuilt = Pipeline.of(pipeline.name(), optimized);
        if (log.isDebugEnabled()) {
            log.debug("Optimized pipeline '{}': {} step(s) -> {} step(s), cost {} -> {}",
                pipeline.name(), flattened.size(), optimized.size(), pipeline.cost(), rebuilt.cost());
        }
        return rebuilt;
    }

    public <I, O> Pipeline<I, O> createOptimized(String name, List<? extends TransformUnit<?, ?>> steps) {
        Pipeline<I, O> pipeline = Pipeline.of(name, steps);
        return optimize(pipeline);
    }

    /**
     * Applies identity removal and pairwise fusion to an already flattened step list.
     */
    public List<TransformUnit<?, ?>> optimizeSteps(List<TransformUnit<?, ?>> steps) {
        Objects.requireNonNull(steps, "steps");
        List<TransformUnit<?, ?>> remaining = dropIdentities
            ? withoutIdentities(steps)
            : new ArrayList<TransformUnit<?, ?>>(steps);
        if (!fuseAdjacent) {
            return remaining;
        }
        var result = new ArrayList<TransformUnit<?, ?>>(remaining.size());
        int i = 0;
        while (i < remaining.size()) {
            var current = remaining.get(i);
            if (i + 1 < remaining.size() && isFusible(current) && isFusible(remaining.get(i + 1))) {
                result.add(fuse(current, remaining.get(i + 1)));
                i += 2;
            } else {
                result.add(current);
                i++;
            }
        }
        return result;
    }

    public boolean fuseAdjacent() {
        return fuseAdjacent;
    }

    public boolean dropIdentities() {
        return dropIdentities;
    }

    static boolean isFusible(TransformUnit<?, ?> unit) {
        return unit.metadata().fusible();
    }

    static TransformUnit<?, ?> fuse(TransformUnit<?, ?> first, TransformUnit<?, ?> second) {
        var a = Units.untyped(first);
        var b = Units.untyped(second);
        return new SimpleUnit<Object, Object>(
            first.name() + FUSION + second.name(),
            (input, ctx) -> b.apply(a.apply(input, ctx), ctx),
            first.metadata().andThen(second.metadata()).withFusible(true)
        );
    }

    private static List<TransformUnit<?, ?>> withoutIdentities(List<TransformUnit<?, ?>> steps) {
        var kept = new ArrayList<TransformUnit<?, ?>>(steps.size());
        for (var step : steps) {
            if (!UnitFlattener.isIdentity(step)) {
                kept.add(step);
            }
        }
        if (kept.isEmpty()) {
            kept.add(steps.isEmpty() ? new IdentityUnit<>() : steps.get(0));
        }
        return kept;
    }
}
