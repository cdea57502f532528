package work.lcod.morph.flow;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.morph.pipeline.PipelineOptimizer;
import work.lcod.morph.registry.UnitDescription;
import work.lcod.morph.registry.UnitRegistry;
import work.lcod.morph.runtime.ExecutionContext;
import work.lcod.morph.runtime.IdentityUnit;
import work.lcod.morph.runtime.OptimizationMetadata;
import work.lcod.morph.runtime.SimpleUnit;
import work.lcod.morph.runtime.TransformUnit;
import work.lcod.morph.runtime.UnitFunction;
import work.lcod.morph.runtime.UnitPredicate;
import work.lcod.morph.runtime.Units;

/**
 * Builder accumulating steps and finalizing them into a single transform unit.
 *
 * <p>Filter semantics: a {@link #filter} step passes its input on when the predicate holds; otherwise
 * the remaining steps are skipped and the builder yields {@code null}. A rejection inside a built unit
 * that runs as a step of another builder stops that builder as well. Filter steps taken out through
 * {@link #steps()} and run elsewhere raise {@link FilteredSignal} instead.
 *
 * <p>Not thread-safe. The unit returned by {@link #build()} snapshots the steps and is immutable.
 *
 * @param <I> input type of the first step
 * @param <O> output type of the last step
 */
public final class FluentPipeline<I, O> {
    private static final Logger log = LoggerFactory.getLogger(FluentPipeline.class);
    public static final String PIPELINE_CATEGORY = "pipeline";

    static final String OPTIMIZED_SUFFIX = "-optimized";

    private static final ThreadLocal<int[]> RUN_DEPTH = ThreadLocal.withInitial(() -> new int[1]);
    private static final OptimizationMetadata FILTER_METADATA = new OptimizationMetadata(false, false, 0.1, false);

    private final String name;
    private final UnitRegistry registry;
    private final List<TransformUnit<?, ?>> steps = new ArrayList<>();

    public FluentPipeline(String name, UnitRegistry registry) {
        this(name, registry, null);
    }

    public FluentPipeline(String name, UnitRegistry registry, TransformUnit<I, ?> initial) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Pipeline name must not be blank");
        }
        this.name = name;
        this.registry = Objects.requireNonNull(registry, "registry");
        if (initial != null) {
            steps.add(initial);
        }
    }

    public static <T> FluentPipeline<T, T> create(String name, UnitRegistry registry) {
        return new FluentPipeline<>(name, registry);
    }

    /**
     * Starts a builder from the unit registered under {@code unitName}.
     *
     * @throws work.lcod.morph.registry.UnitNotFoundException if the unit is not registered
     */
    public static <I, O> FluentPipeline<I, O> fromName(String pipelineName, String unitName, UnitRegistry registry) {
        Objects.requireNonNull(registry, "registry");
        TransformUnit<I, Object> initial = registry.require(unitName);
        return new FluentPipeline<>(pipelineName, registry, initial);
    }

    public <T> FluentPipeline<I, T> pipe(TransformUnit<? super O, T> unit) {
        steps.add(Objects.requireNonNull(unit, "unit"));
        return self();
    }

    /**
     * @throws work.lcod.morph.registry.UnitNotFoundException if the unit is not registered
     */
    public <T> FluentPipeline<I, T> pipeByName(String unitName) {
        TransformUnit<Object, Object> unit = registry.require(unitName);
        steps.add(unit);
        return self();
    }

    public FluentPipeline<I, O> filter(UnitPredicate<? super O> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        var stepName = "Filter_" + steps.size();
        steps.add(new SimpleUnit<O, O>(stepName, (input, ctx) -> {
            if (predicate.test(input, ctx)) {
                return input;
            }
            throw FilteredSignal.of(stepName);
        }, FILTER_METADATA));
        return this;
    }

    public <T> FluentPipeline<I, T> map(UnitFunction<? super O, ? extends T> transform) {
        return map(transform, MapOptions.defaults());
    }

    public <T> FluentPipeline<I, T> map(UnitFunction<? super O, ? extends T> transform, MapOptions options) {
        Objects.requireNonNull(transform, "transform");
        var resolved = options == null ? MapOptions.defaults() : options;
        var stepName = resolved.name() == null || resolved.name().isBlank() ? "Map_" + steps.size() : resolved.name();
        steps.add(new SimpleUnit<O, T>(stepName, transform, resolved.toMetadata()));
        return self();
    }

    public <T> FluentPipeline<I, T> branch(
        UnitPredicate<? super O> predicate,
        TransformUnit<? super O, ? extends T> whenTrue,
        TransformUnit<? super O, ? extends T> whenFalse
    ) {
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(whenTrue, "whenTrue");
        Objects.requireNonNull(whenFalse, "whenFalse");
        double cost = 1 + Math.max(whenTrue.metadata().cost(), whenFalse.metadata().cost());
        steps.add(new SimpleUnit<O, T>(
            "Branch_" + steps.size(),
            (input, ctx) -> predicate.test(input, ctx) ? whenTrue.apply(input, ctx) : whenFalse.apply(input, ctx),
            new OptimizationMetadata(false, false, cost, false)
        ));
        return self();
    }

    /**
     * Applies {@code unit} when the predicate holds and passes the input through otherwise.
     */
    public FluentPipeline<I, O> conditionally(UnitPredicate<? super O> predicate, TransformUnit<? super O, ? extends O> unit) {
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(unit, "unit");
        double cost = 1 + unit.metadata().cost();
        steps.add(new SimpleUnit<O, O>(
            "When_" + steps.size(),
            (input, ctx) -> predicate.test(input, ctx) ? unit.apply(input, ctx) : input,
            new OptimizationMetadata(false, false, cost, false)
        ));
        return this;
    }

    public TransformUnit<I, O> build() {
        return build(null);
    }

    /**
     * Finalizes the steps into one unit named after this builder. Builds of two or more steps are
     * registered with their composition trace; an empty build is an identity and a single step is wrapped.
     *
     * @throws work.lcod.morph.registry.DuplicateUnitException if the registry rejects the name
     */
    @SuppressWarnings("unchecked")
    public TransformUnit<I, O> build(UnitDescription description) {
        var snapshot = List.copyOf(steps);
        if (snapshot.isEmpty()) {
            TransformUnit<?, ?> identity = new IdentityUnit<I>(name);
            return (TransformUnit<I, O>) identity;
        }
        if (snapshot.size() == 1) {
            return new SimpleUnit<I, O>(name, (input, ctx) -> (O) runSteps(snapshot, input, ctx), snapshot.get(0).metadata());
        }
        var unit = new SimpleUnit<I, O>(name, (input, ctx) -> (O) runSteps(snapshot, input, ctx), combine(snapshot));
        var described = description == null ? UnitDescription.empty() : description;
        if (described.category() == null) {
            described = described.toBuilder().category(PIPELINE_CATEGORY).build();
        }
        registry.register(unit, described, stepNames(snapshot));
        log.debug("Built pipeline '{}' from {} step(s)", name, snapshot.size());
        return unit;
    }

    /**
     * Runs the accumulated steps without registering anything.
     */
    @SuppressWarnings("unchecked")
    public O apply(I input, ExecutionContext ctx) throws Exception {
        return (O) runSteps(List.copyOf(steps), input, ctx);
    }

    /**
     * Returns a builder named {@code <name>-optimized} in which every run of adjacent fusible steps is
     * fused into one step. Builders with fewer than two steps are returned as they are.
     */
    public FluentPipeline<I, O> optimize() {
        return optimize(new PipelineOptimizer());
    }

    public FluentPipeline<I, O> optimize(PipelineOptimizer optimizer) {
        Objects.requireNonNull(optimizer, "optimizer");
        if (steps.size() <= 1) {
            return this;
        }
        var optimized = List.copyOf(steps);
        var next = optimizer.optimizeSteps(optimized);
        // Each pass fuses pairs; repeat until a whole run has collapsed.
        while (next.size() < optimized.size()) {
            optimized = List.copyOf(next);
            next = optimizer.optimizeSteps(optimized);
        }
        var result = new FluentPipeline<I, O>(name + OPTIMIZED_SUFFIX, registry);
        result.steps.addAll(optimized);
        log.debug("Optimized builder '{}': {} step(s) -> {} step(s)", name, steps.size(), optimized.size());
        return result;
    }

    public String name() {
        return name;
    }

    public List<TransformUnit<?, ?>> steps() {
        return List.copyOf(steps);
    }

    public OptimizationMetadata metadata() {
        return combine(steps);
    }

    public double cost() {
        return combine(steps).cost();
    }

    public String describe() {
        var out = new StringBuilder("Pipeline: ").append(name).append('\n');
        for (int i = 0; i < steps.size(); i++) {
            var step = steps.get(i);
            out.append("  ").append(i).append(". ").append(step.name())
                .append(" (cost: ").append(step.metadata().cost()).append(")\n");
        }
        out.append("Total cost: ").append(cost()).append('\n');
        return out.toString();
    }

    /**
     * Runs {@code steps} in order. A filter rejection inside a nested builder run is passed up so the
     * enclosing run stops too; only the outermost run turns it into {@code null}.
     */
    private static Object runSteps(List<TransformUnit<?, ?>> steps, Object input, ExecutionContext ctx) throws Exception {
        var depth = RUN_DEPTH.get();
        depth[0]++;
        try {
            Object current = input;
            for (var step : steps) {
                current = Units.untyped(step).apply(current, ctx);
            }
            return current;
        } catch (FilteredSignal signal) {
            if (depth[0] > 1) {
                throw signal;
            }
            log.debug("Input rejected by {}", signal.step());
            return null;
        } finally {
            depth[0]--;
        }
    }

    private static OptimizationMetadata combine(List<TransformUnit<?, ?>> steps) {
        var combined = OptimizationMetadata.identity();
        for (var step : steps) {
            combined = combined.andThen(step.metadata());
        }
        return combined;
    }

    private static List<String> stepNames(List<TransformUnit<?, ?>> steps) {
        return steps.stream().map(TransformUnit::name).collect(Collectors.toList());
    }

    @SuppressWarnings("unchecked")
    private <T> FluentPipeline<I, T> self() {
        return (FluentPipeline<I, T>) this;
    }
}
