package work.lcod.morph.registry;

import java.util.List;

/**
 * Free-form description stored next to a registered unit. A {@code null} category is filled in by
 * whoever registers the unit.
 */
public record UnitDescription(
    String description,
    String category,
    List<String> tags,
    String inputType,
    String outputType
) {
    public static final String UNKNOWN_TYPE = "unknown";

    public UnitDescription {
        description = description == null ? "" : description;
        category = category == null || category.isBlank() ? null : category;
        tags = tags == null ? List.of() : List.copyOf(tags);
        inputType = inputType == null || inputType.isBlank() ? UNKNOWN_TYPE : inputType;
        outputType = outputType == null || outputType.isBlank() ? UNKNOWN_TYPE : outputType;
    }

    public static UnitDescription empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .description(description)
            .category(category)
            .tags(tags)
            .inputType(inputType)
            .outputType(outputType);
    }

    public static final class Builder {
        private String description;
        private String category;
        private List<String> tags = List.of();
        private String inputType;
        private String outputType;

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder tags(String... tags) {
            this.tags = List.of(tags);
            return this;
        }

        public Builder inputType(String inputType) {
            this.inputType = inputType;
            return this;
        }

        public Builder outputType(String outputType) {
            this.outputType = outputType;
            return this;
        }

        public UnitDescription build() {
            return new UnitDescription(description, category, tags, inputType, outputType);
        }
    }
}
