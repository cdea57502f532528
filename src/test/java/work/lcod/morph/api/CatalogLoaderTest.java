package work.lcod.morph.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertIterableEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.lcod.morph.registry.UnitDescription;
import work.lcod.morph.registry.UnitNotFoundException;
import work.lcod.morph.registry.UnitRegistry;
import work.lcod.morph.runtime.ExecutionContext;
import work.lcod.morph.runtime.Units;

class CatalogLoaderTest {
    private final ExecutionContext ctx = ExecutionContext.empty();
    private MorphEngine engine;

    @BeforeEach
    void setUp() {
        engine = MorphEngine.create();
        engine.register(Units.<String, String>of("trim", (s, c) -> s.trim()), UnitDescription.empty());
        engine.register(Units.<String, String>of("upper", (s, c) -> s.toUpperCase()), UnitDescription.empty());
        engine.register(Units.<String, String>of("exclaim", (s, c) -> s + "!"), UnitDescription.empty());
    }

    @Test
    void registersCatalogPipelines() throws Exception {
        var path = Path.of("src", "test", "resources", "catalogs", "text.yaml").toAbsolutePath();
        var names = CatalogLoader.loadFromLocalFile(path, engine);

        assertIterableEquals(List.of("cleanName", "shout", "trimOnly"), names);
        assertEquals("ADA", engine.registry().<String, String>require("cleanName").apply("  ada ", ctx));
        assertEquals("ADA!", engine.registry().<String, String>require("shout").apply(" ada", ctx));
        assertEquals("x", engine.registry().<String, String>require("trimOnly").apply(" x ", ctx));

        var cleanName = engine.registry().entry("cleanName").orElseThrow();
        assertEquals("text", cleanName.description().category());
        assertEquals("string", cleanName.description().inputType());
        assertIterableEquals(List.of("trim", "upper"), cleanName.composition());
        assertIterableEquals(List.of("cleanName", "shout"), namesOf(engine.registry().findByTag("strings")));

        var trimOnly = engine.registry().entry("trimOnly").orElseThrow();
        assertEquals("pipeline", trimOnly.description().category());
        assertIterableEquals(List.of("trim"), trimOnly.composition());
    }

    @Test
    void unknownStepFails() {
        var path = Path.of("src", "test", "resources", "catalogs", "unknown-step.yaml").toAbsolutePath();
        var error = assertThrows(UnitNotFoundException.class, () -> CatalogLoader.loadFromLocalFile(path, engine));
        assertEquals("doesNotExist", error.unitName());
        assertFalse(engine.registry().contains("broken"));
    }

    @Test
    void parsesInlineYaml() {
        var names = CatalogLoader.parse("pipelines:\n  - name: loud\n    steps: [upper, exclaim]\n", engine);
        assertIterableEquals(List.of("loud"), names);
        assertTrue(engine.registry().contains("loud"));
    }

    @Test
    void emptyCatalogRegistersNothing() {
        assertTrue(CatalogLoader.parse("other: 1\n", engine).isEmpty());
    }

    @Test
    void pipelineWithoutNameIsRejected() {
        assertThrows(IllegalStateException.class, () -> CatalogLoader.parse("pipelines:\n  - steps: [trim]\n", engine));
    }

    @Test
    void missingFileFails() {
        var path = Path.of("src", "test", "resources", "catalogs", "absent.yaml");
        assertThrows(IllegalStateException.class, () -> CatalogLoader.loadFromLocalFile(path, engine));
    }

    private static List<String> namesOf(List<UnitRegistry.Entry> entries) {
        return entries.stream().map(UnitRegistry.Entry::name).collect(Collectors.toList());
    }
}
