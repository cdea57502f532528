package work.lcod.morph.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.lcod.morph.flow.FluentPipeline;
import work.lcod.morph.pipeline.Pipeline;
import work.lcod.morph.pipeline.PipelineOptimizer;
import work.lcod.morph.registry.UnitDescription;
import work.lcod.morph.registry.UnitRegistry;
import work.lcod.morph.runtime.TransformUnit;

/**
 * Registry and optimizer wired from one configuration, so builders, catalogs and runners share them.
 * Each engine owns an isolated registry; the host decides how long it lives.
 */
public final class MorphEngine {
    private final EngineConfiguration configuration;
    private final UnitRegistry registry;
    private final PipelineOptimizer optimizer;

    public MorphEngine(EngineConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.registry = new UnitRegistry(configuration.duplicatePolicy());
        this.optimizer = new PipelineOptimizer(configuration.fuseAdjacent(), configuration.dropIdentities());
    }

    public static MorphEngine create() {
        return new MorphEngine(EngineConfiguration.defaults());
    }

    public static MorphEngine create(EngineConfiguration configuration) {
        return new MorphEngine(configuration);
    }

    public <T> FluentPipeline<T, T> createPipeline(String name) {
        return FluentPipeline.create(name, registry);
    }

    public UnitRegistry.Entry register(TransformUnit<?, ?> unit, UnitDescription description) {
        return registry.register(unit, description);
    }

    public <I, O> Optional<TransformUnit<I, O>> lookup(String name) {
        return registry.get(name);
    }

    public <I, O> Pipeline<I, O> optimize(Pipeline<I, O> pipeline) {
        return optimizer.optimize(pipeline);
    }

    /**
     * Builds a pipeline from registered unit names, in order.
     *
     * @throws work.lcod.morph.registry.UnitNotFoundException on the first unknown name
     */
    public <I, O> Pipeline<I, O> assemble(String name, List<String> unitNames) {
        Objects.requireNonNull(unitNames, "unitNames");
        var steps = new ArrayList<TransformUnit<?, ?>>(unitNames.size());
        for (var unitName : unitNames) {
            steps.add(registry.require(unitName));
        }
        return Pipeline.of(name, steps);
    }

    public EngineConfiguration configuration() {
        return configuration;
    }

    public UnitRegistry registry() {
        return registry;
    }

    public PipelineOptimizer optimizer() {
        return optimizer;
    }
}
