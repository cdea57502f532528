package work.lcod.morph.flow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertIterableEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.lcod.morph.pipeline.Pipeline;
import work.lcod.morph.registry.DuplicateUnitException;
import work.lcod.morph.registry.UnitDescription;
import work.lcod.morph.registry.UnitNotFoundException;
import work.lcod.morph.registry.UnitRegistry;
import work.lcod.morph.runtime.ExecutionContext;
import work.lcod.morph.runtime.IdentityUnit;
import work.lcod.morph.runtime.SimpleUnit;
import work.lcod.morph.runtime.TransformUnit;
import work.lcod.morph.runtime.Units;

class FluentPipelineTest {
    private final ExecutionContext ctx = ExecutionContext.empty();
    private UnitRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new UnitRegistry();
    }

    @Test
    void doubleThenIncrement() throws Exception {
        TransformUnit<Integer, Integer> unit = FluentPipeline.<Integer>create("doubleInc", registry)
            .map((x, c) -> x * 2, MapOptions.defaults().withName("double").withCost(1))
            .map((x, c) -> x + 1, MapOptions.defaults().withName("inc").withCost(1))
            .build();

        assertEquals(7, unit.apply(3, ctx));
        assertEquals(2, unit.metadata().cost());
        assertSame(unit, registry.require("doubleInc"));
    }

    @Test
    void branchPicksSideAndIsNotFusible() throws Exception {
        SimpleUnit<Integer, Integer> keep = Units.of("keep", (x, c) -> x);
        SimpleUnit<Integer, Integer> negate = Units.of("negate", (x, c) -> -x);
        TransformUnit<Integer, Integer> abs = FluentPipeline.<Integer>create("abs", registry)
            .branch((x, c) -> x > 0, keep, negate)
            .build();

        assertEquals(5, abs.apply(-5, ctx));
        assertEquals(4, abs.apply(4, ctx));
        assertFalse(abs.metadata().fusible());
        assertFalse(abs.metadata().pure());
        assertEquals(2, abs.metadata().cost());
    }

    @Test
    void emptyBuildReturnsInput() throws Exception {
        TransformUnit<String, String> unit = FluentPipeline.<String>create("nothing", registry).build();
        assertEquals("input", unit.apply("input", ctx));
        assertInstanceOf(IdentityUnit.class, unit);
        assertEquals("nothing", unit.name());
        assertFalse(registry.contains("nothing"));
    }

    @Test
    void singleStepIsWrappedButNotRegistered() throws Exception {
        SimpleUnit<Integer, Integer> inc = Units.of("inc", (x, c) -> x + 1);
        TransformUnit<Integer, Integer> unit = FluentPipeline.<Integer>create("justInc", registry).pipe(inc).build();
        assertEquals("justInc", unit.name());
        assertEquals(inc.metadata(), unit.metadata());
        assertEquals(3, unit.apply(2, ctx));
        assertFalse(registry.contains("justInc"));
    }

    @Test
    void filterShortCircuitsRemainingSteps() throws Exception {
        var mapped = new AtomicInteger();
        var builder = FluentPipeline.<Integer>create("positives", registry)
            .filter((x, c) -> x > 0)
            .map((x, c) -> {
                mapped.incrementAndGet();
                return x * 10;
            });

        assertNull(builder.apply(-1, ctx));
        assertEquals(0, mapped.get());
        assertEquals(20, builder.apply(2, ctx));
        assertEquals(1, mapped.get());

        TransformUnit<Integer, Integer> unit = builder.build();
        assertNull(unit.apply(0, ctx));
        assertFalse(unit.metadata().pure());
        assertFalse(unit.metadata().fusible());
    }

    @Test
    void pipeByNameResolvesRegisteredUnits() throws Exception {
        registry.register(Units.<Integer, Integer>of("inc", (x, c) -> x + 1));
        registry.register(Units.<Integer, Integer>of("square", (x, c) -> x * x));

        TransformUnit<Integer, Integer> unit = FluentPipeline.<Integer>create("incSquare", registry)
            .<Integer>pipeByName("inc")
            .<Integer>pipeByName("square")
            .build();
        assertEquals(16, unit.apply(3, ctx));
    }

    @Test
    void pipeByNameFailsForUnknownUnit() {
        var builder = FluentPipeline.<Integer>create("missing", registry);
        var error = assertThrows(UnitNotFoundException.class, () -> builder.pipeByName("nope"));
        assertEquals("nope", error.unitName());
        assertEquals("Unit not registered: nope", error.getMessage());
    }

    @Test
    void buildRecordsCompositionTrace() {
        FluentPipeline.<Integer>create("traced", registry)
            .map((x, c) -> x * 2, MapOptions.defaults().withName("double"))
            .filter((x, c) -> x > 10)
            .map((x, c) -> x - 1)
            .build(UnitDescription.builder().description("Doubles big numbers").tags("math").build());

        var entry = registry.entry("traced").orElseThrow();
        assertIterableEquals(List.of("double", "Filter_1", "Map_2"), entry.composition());
        assertEquals(FluentPipeline.PIPELINE_CATEGORY, entry.description().category());
        assertEquals("Doubles big numbers", entry.description().description());
        assertEquals(1, registry.findByTag("math").size());
    }

    @Test
    void explicitCategoryIsKept() {
        FluentPipeline.<Integer>create("categorized", registry)
            .map((x, c) -> x + 1)
            .map((x, c) -> x + 2)
            .build(UnitDescription.builder().category("math").build());
        assertEquals("math", registry.entry("categorized").orElseThrow().description().category());
    }

    @Test
    void buildingSameNameTwiceIsRejected() {
        var builder = FluentPipeline.<Integer>create("twice", registry)
            .map((x, c) -> x + 1)
            .map((x, c) -> x + 2);
        builder.build();
        assertThrows(DuplicateUnitException.class, builder::build);
    }

    @Test
    void applyDoesNotRegister() throws Exception {
        var builder = FluentPipeline.<Integer>create("adhoc", registry)
            .map((x, c) -> x + 1)
            .map((x, c) -> x * 3);
        assertEquals(9, builder.apply(2, ctx));
        assertEquals(0, registry.size());
    }

    @Test
    void conditionallyAppliesOnlyWhenPredicateHolds() throws Exception {
        SimpleUnit<String, String> upper = Units.of("upper", (s, c) -> s.toUpperCase());
        var builder = FluentPipeline.<String>create("shout", registry)
            .conditionally((s, c) -> s.endsWith("!"), upper);
        assertEquals("HEY!", builder.apply("hey!", ctx));
        assertEquals("hey", builder.apply("hey", ctx));
        assertEquals(2, builder.cost());
    }

    @Test
    void fromNameStartsWithRegisteredUnit() throws Exception {
        registry.register(Units.<String, Integer>of("length", (s, c) -> s.length()));
        TransformUnit<String, Integer> unit = FluentPipeline.<String, Integer>fromName("lengthPlusOne", "length", registry)
            .map((n, c) -> n + 1)
            .build();
        assertEquals(6, unit.apply("hello", ctx));
        assertIterableEquals(List.of("length", "Map_1"), registry.entry("lengthPlusOne").orElseThrow().composition());
    }

    @Test
    void describeListsStepsAndTotalCost() {
        var builder = FluentPipeline.<Integer>create("described", registry)
            .map((x, c) -> x * 2, MapOptions.defaults().withName("double"))
            .map((x, c) -> x + 1, MapOptions.defaults().withName("inc").withCost(2.5));
        var expected = "Pipeline: described\n"
            + "  0. double (cost: 1.0)\n"
            + "  1. inc (cost: 2.5)\n"
            + "Total cost: 3.5\n";
        assertEquals(expected, builder.describe());
        assertEquals(2, builder.steps().size());
    }

    @Test
    void builderNameIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> FluentPipeline.create(" ", registry));
    }

    @Test
    void mapOptionsFeedMetadata() {
        var builder = FluentPipeline.<Integer>create("opts", registry)
            .map((x, c) -> x, MapOptions.defaults().withPure(false).withMemoizable(false).withCost(4));
        var meta = builder.metadata();
        assertFalse(meta.pure());
        assertTrue(meta.fusible());
        assertFalse(meta.memoizable());
        assertEquals(4, meta.cost());
    }

    @Test
    void rejectionInNestedBuildStopsEnclosingBuilder() throws Exception {
        FluentPipeline.<Integer>create("positives", registry)
            .filter((x, c) -> x > 0)
            .map((x, c) -> x * 2)
            .build();
        var afterNested = new AtomicInteger();
        var outer = FluentPipeline.<Integer>create("outer", registry)
            .<Integer>pipeByName("positives")
            .map((x, c) -> {
                afterNested.incrementAndGet();
                return x + 1;
            });

        assertNull(outer.apply(-1, ctx));
        assertEquals(0, afterNested.get());
        assertEquals(5, outer.apply(2, ctx));

        TransformUnit<Integer, Integer> built = outer.build();
        assertNull(built.apply(-3, ctx));
        assertEquals(1, afterNested.get());
    }

    @Test
    void rejectionInsideBranchStopsBuilder() throws Exception {
        TransformUnit<Integer, Integer> evens = FluentPipeline.<Integer>create("evens", registry)
            .filter((x, c) -> x % 2 == 0)
            .map((x, c) -> x)
            .build();
        var builder = FluentPipeline.<Integer>create("branching", registry)
            .branch((x, c) -> x > 0, evens, Units.<Integer, Integer>of("zero", (x, c) -> 0))
            .map((x, c) -> x + 100);

        assertNull(builder.apply(3, ctx));
        assertEquals(104, builder.apply(4, ctx));
        assertEquals(100, builder.apply(-7, ctx));
    }

    @Test
    void filterStepRunOutsideBuilderRaisesSignal() {
        var builder = FluentPipeline.<Integer>create("loose", registry)
            .filter((x, c) -> x > 0)
            .map((x, c) -> x * 2);
        Pipeline<Integer, Integer> pipeline = Pipeline.of("loose", builder.steps());

        var signal = assertThrows(FilteredSignal.class, () -> pipeline.apply(-1, ctx));
        assertEquals("Filter_0", signal.step());
    }

    @Test
    void optimizeFusesRunsOfFusibleSteps() throws Exception {
        var builder = FluentPipeline.<Integer>create("calc", registry)
            .map((x, c) -> x + 1, MapOptions.defaults().withName("inc"))
            .map((x, c) -> x * 2, MapOptions.defaults().withName("double"))
            .map((x, c) -> x - 3, MapOptions.defaults().withName("minus3"))
            .filter((x, c) -> x > 0)
            .map((x, c) -> x * 10, MapOptions.defaults().withName("times10"));

        FluentPipeline<Integer, Integer> optimized = builder.optimize();
        assertEquals("calc-optimized", optimized.name());
        var names = optimized.steps().stream().map(TransformUnit::name).collect(Collectors.toList());
        assertIterableEquals(List.of("inc ⊕ double ⊕ minus3", "Filter_3", "times10"), names);
        assertEquals(builder.cost(), optimized.cost());
        for (int x = -2; x <= 3; x++) {
            assertEquals(builder.apply(x, ctx), optimized.apply(x, ctx));
        }
        assertEquals(5, builder.steps().size());
        assertEquals(0, registry.size());
    }

    @Test
    void optimizeKeepsShortBuilders() {
        var single = FluentPipeline.<Integer>create("single", registry).map((x, c) -> x + 1);
        assertSame(single, single.optimize());
    }

    @Test
    void optimizedBuilderRegistersUnderItsOwnName() throws Exception {
        TransformUnit<Integer, Integer> unit = FluentPipeline.<Integer>create("pair", registry)
            .map((x, c) -> x + 1)
            .map((x, c) -> x * 3)
            .filter((x, c) -> x < 100)
            .optimize()
            .build();
        assertEquals("pair-optimized", unit.name());
        assertEquals(9, unit.apply(2, ctx));
        assertIterableEquals(List.of("Map_0 ⊕ Map_1", "Filter_2"),
            registry.entry("pair-optimized").orElseThrow().composition());
    }
}
