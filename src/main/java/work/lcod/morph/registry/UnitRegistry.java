package work.lcod.morph.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.morph.runtime.OptimizationMetadata;
import work.lcod.morph.runtime.TransformUnit;

/**
 * Stores transform units by name together with their descriptions.
 *
 * <p>Safe for concurrent registration and lookup. Entries are only removed through {@link #unregister}
 * or {@link #clear}. The registry does not check type compatibility between units; callers assembling
 * pipelines by name own that.
 */
public final class UnitRegistry {
    private static final Logger log = LoggerFactory.getLogger(UnitRegistry.class);
    public static final String DEFAULT_CATEGORY = "unit";

    private final Map<String, Entry> units = new ConcurrentHashMap<>();
    private final DuplicatePolicy duplicatePolicy;

    public UnitRegistry() {
        this(DuplicatePolicy.REJECT);
    }

    public UnitRegistry(DuplicatePolicy duplicatePolicy) {
        this.duplicatePolicy = duplicatePolicy == null ? DuplicatePolicy.REJECT : duplicatePolicy;
    }

    public Entry register(TransformUnit<?, ?> unit) {
        return register(unit, UnitDescription.empty(), List.of());
    }

    public Entry register(TransformUnit<?, ?> unit, UnitDescription description) {
        return register(unit, description, List.of());
    }

    /**
     * Registers {@code unit} under its name.
     *
     * @param composition ordered constituent names for builder-produced units, empty otherwise
     * @throws DuplicateUnitException if the name is taken and the policy is {@link DuplicatePolicy#REJECT}
     */
    public Entry register(TransformUnit<?, ?> unit, UnitDescription description, List<String> composition) {
        var entry = newEntry(unit, description, composition);
        if (duplicatePolicy == DuplicatePolicy.REJECT) {
            var existing = units.putIfAbsent(entry.name(), entry);
            if (existing != null) {
                throw new DuplicateUnitException(entry.name());
            }
            log.debug("Registered unit '{}'", entry.name());
            return entry;
        }
        var previous = units.put(entry.name(), entry);
        if (previous != null) {
            log.info("Overwrote unit '{}'", entry.name());
        } else {
            log.debug("Registered unit '{}'", entry.name());
        }
        return entry;
    }

    /**
     * Stores {@code unit}, replacing any entry with the same name regardless of the duplicate policy.
     */
    public Entry replace(TransformUnit<?, ?> unit, UnitDescription description) {
        var entry = newEntry(unit, description, List.of());
        var previous = units.put(entry.name(), entry);
        log.debug("Replaced unit '{}' (existed: {})", entry.name(), previous != null);
        return entry;
    }

    @SuppressWarnings("unchecked")
    public <I, O> Optional<TransformUnit<I, O>> get(String name) {
        var entry = name == null ? null : units.get(name);
        if (entry == null) {
            log.debug("Unit '{}' not found", name);
            return Optional.empty();
        }
        return Optional.of((TransformUnit<I, O>) entry.unit());
    }

    /**
     * @throws UnitNotFoundException if nothing is registered under {@code name}
     */
    public <I, O> TransformUnit<I, O> require(String name) {
        Optional<TransformUnit<I, O>> unit = get(name);
        return unit.orElseThrow(() -> new UnitNotFoundException(name));
    }

    public Optional<Entry> entry(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(units.get(name));
    }

    public boolean contains(String name) {
        return name != null && units.containsKey(name);
    }

    public boolean unregister(String name) {
        if (name == null) {
            return false;
        }
        boolean removed = units.remove(name) != null;
        if (removed) {
            log.debug("Unregistered unit '{}'", name);
        }
        return removed;
    }

    public void clear() {
        units.clear();
        log.info("Unit registry cleared");
    }

    public int size() {
        return units.size();
    }

    public List<String> names() {
        var names = new ArrayList<>(units.keySet());
        Collections.sort(names);
        return names;
    }

    public List<Entry> findByCategory(String category) {
        return sorted(entry -> entry.description().category().equals(category));
    }

    public List<Entry> findByTag(String tag) {
        return sorted(entry -> entry.description().tags().contains(tag));
    }

    public Map<String, Entry> entries() {
        return Collections.unmodifiableMap(units);
    }

    public DuplicatePolicy duplicatePolicy() {
        return duplicatePolicy;
    }

    private List<Entry> sorted(Predicate<Entry> filter) {
        return units.values().stream()
            .filter(filter)
            .sorted((a, b) -> a.name().compareTo(b.name()))
            .collect(Collectors.toList());
    }

    private static Entry newEntry(TransformUnit<?, ?> unit, UnitDescription description, List<String> composition) {
        Objects.requireNonNull(unit, "unit");
        var name = unit.name();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Cannot register a unit without a name");
        }
        var described = description == null ? UnitDescription.empty() : description;
        if (described.category() == null) {
            described = described.toBuilder().category(DEFAULT_CATEGORY).build();
        }
        return new Entry(
            name,
            unit,
            described,
            composition == null ? List.of() : List.copyOf(composition)
        );
    }

    public record Entry(String name, TransformUnit<?, ?> unit, UnitDescription description, List<String> composition) {
        public OptimizationMetadata metadata() {
            return unit.metadata();
        }

        public Map<String, Object> toSerializableMap() {
            var map = new LinkedHashMap<String, Object>();
            map.put("name", name);
            map.put("description", description.description());
            map.put("category", description.category());
            map.put("tags", description.tags());
            map.put("inputType", description.inputType());
            map.put("outputType", description.outputType());
            map.put("kind", unit.kind().name().toLowerCase(Locale.ROOT));
            if (!composition.isEmpty()) {
                map.put("composition", composition);
            }
            map.put("optimization", unit.metadata().toMap());
            return map;
        }
    }
}
