package work.lcod.morph.api;

import java.util.Objects;
import work.lcod.morph.registry.DuplicatePolicy;

/**
 * Immutable configuration used to wire a {@link MorphEngine}.
 */
public record EngineConfiguration(
    DuplicatePolicy duplicatePolicy,
    boolean fuseAdjacent,
    boolean dropIdentities
) {
    public EngineConfiguration {
        Objects.requireNonNull(duplicatePolicy, "duplicatePolicy");
    }

    public static EngineConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private DuplicatePolicy duplicatePolicy = DuplicatePolicy.REJECT;
        private boolean fuseAdjacent = true;
        private boolean dropIdentities = true;

        public Builder duplicatePolicy(DuplicatePolicy duplicatePolicy) {
            this.duplicatePolicy = duplicatePolicy;
            return this;
        }

        public Builder fuseAdjacent(boolean fuseAdjacent) {
            this.fuseAdjacent = fuseAdjacent;
            return this;
        }

        public Builder dropIdentities(boolean dropIdentities) {
            this.dropIdentities = dropIdentities;
            return this;
        }

        public EngineConfiguration build() {
            return new EngineConfiguration(duplicatePolicy, fuseAdjacent, dropIdentities);
        }
    }
}
