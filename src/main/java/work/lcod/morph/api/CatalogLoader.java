package work.lcod.morph.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.morph.flow.FluentPipeline;
import work.lcod.morph.registry.UnitDescription;

/**
 * Loads pipeline catalogs (YAML) and registers each pipeline on an engine.
 *
 * <pre>
 * pipelines:
 *   - name: cleanName
 *     description: Trim then upper-case
 *     category: text
 *     tags: [strings]
 *     steps: [trim, upper]
 * </pre>
 * Steps refer to units already registered on the engine, or to pipelines declared earlier in the same catalog.
 */
public final class CatalogLoader {
    private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private CatalogLoader() {}

    public static List<String> loadFromLocalFile(Path path, MorphEngine engine) {
        try (var in = Files.newInputStream(path)) {
            var names = load(in, engine);
            log.info("Loaded {} pipeline(s) from {}", names.size(), path);
            return names;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read catalog: " + path, ex);
        }
    }

    public static List<String> parse(String yaml, MorphEngine engine) {
        try {
            return register(YAML_MAPPER.readTree(yaml == null ? "" : yaml), engine);
        } catch (IOException ex) {
            throw new IllegalStateException("Invalid catalog: " + ex.getMessage(), ex);
        }
    }

    /**
     * @return names of the pipelines registered, in catalog order
     * @throws work.lcod.morph.registry.UnitNotFoundException if a step names an unknown unit
     */
    public static List<String> load(InputStream in, MorphEngine engine) throws IOException {
        return register(YAML_MAPPER.readTree(in), engine);
    }

    private static List<String> register(JsonNode root, MorphEngine engine) {
        if (root == null || !root.hasNonNull("pipelines")) {
            return List.of();
        }
        var pipelinesNode = root.get("pipelines");
        if (!pipelinesNode.isArray()) {
            throw new IllegalStateException("Catalog 'pipelines' must be a list");
        }
        var registered = new ArrayList<String>();
        for (var node : pipelinesNode) {
            registered.add(registerPipeline(node, engine));
        }
        return registered;
    }

    private static String registerPipeline(JsonNode node, MorphEngine engine) {
        var name = text(node, "name");
        if (name == null || name.isBlank()) {
            throw new IllegalStateException("Catalog pipeline without name");
        }
        var stepNames = new ArrayList<String>();
        var stepsNode = node.get("steps");
        if (stepsNode != null && stepsNode.isArray()) {
            stepsNode.forEach(step -> stepNames.add(step.asText()));
        }

        var description = describe(node);
        FluentPipeline<Object, Object> builder = engine.createPipeline(name);
        for (var step : stepNames) {
            builder.pipeByName(step);
        }
        var unit = builder.build(description);
        if (stepNames.size() < 2) {
            // The builder only registers multi-step builds.
            engine.registry().register(unit, description.category() == null
                ? description.toBuilder().category(FluentPipeline.PIPELINE_CATEGORY).build()
                : description, stepNames);
        }
        log.debug("Catalog pipeline '{}' -> {}", name, stepNames);
        return name;
    }

    private static UnitDescription describe(JsonNode node) {
        var builder = UnitDescription.builder()
            .description(text(node, "description"))
            .category(text(node, "category"))
            .inputType(text(node, "inputType"))
            .outputType(text(node, "outputType"));
        var tagsNode = node.get("tags");
        if (tagsNode != null && tagsNode.isArray()) {
            var tags = new ArrayList<String>();
            tagsNode.forEach(tag -> tags.add(tag.asText()));
            builder.tags(tags);
        }
        return builder.build();
    }

    private static String text(JsonNode node, String field) {
        var value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
