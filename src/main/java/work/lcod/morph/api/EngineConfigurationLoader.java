package work.lcod.morph.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.morph.registry.DuplicatePolicy;

/**
 * Reads {@link EngineConfiguration} from TOML.
 *
 * <pre>
 * [registry]
 * duplicates = "overwrite"
 *
 * [optimizer]
 * fuse = true
 * drop_identities = true
 * </pre>
 * Missing tables and keys keep their defaults.
 */
public final class EngineConfigurationLoader {
    private EngineConfigurationLoader() {}

    public static EngineConfiguration load(Path path) {
        try {
            return parse(Files.readString(path));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read engine configuration: " + path, ex);
        }
    }

    public static EngineConfiguration parse(String toml) {
        TomlParseResult result = Toml.parse(toml == null ? "" : toml);
        if (result.hasErrors()) {
            var errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalStateException("Invalid engine configuration: " + errors);
        }
        return fromToml(result);
    }

    public static EngineConfiguration fromToml(TomlTable table) {
        var builder = EngineConfiguration.builder();
        if (table == null) {
            return builder.build();
        }
        try {
            var registry = table.getTable("registry");
            if (registry != null && registry.getString("duplicates") != null) {
                builder.duplicatePolicy(DuplicatePolicy.from(registry.getString("duplicates")));
            }
            var optimizer = table.getTable("optimizer");
            if (optimizer != null) {
                Boolean fuse = optimizer.getBoolean("fuse");
                if (fuse != null) {
                    builder.fuseAdjacent(fuse);
                }
                Boolean dropIdentities = optimizer.getBoolean("drop_identities");
                if (dropIdentities != null) {
                    builder.dropIdentities(dropIdentities);
                }
            }
        } catch (TomlInvalidTypeException ex) {
            throw new IllegalStateException("Invalid engine configuration: " + ex.getMessage(), ex);
        }
        return builder.build();
    }
}
