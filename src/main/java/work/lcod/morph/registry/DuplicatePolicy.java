package work.lcod.morph.registry;

import java.util.Locale;

/**
 * What {@link UnitRegistry#register} does when the name is already taken.
 */
public enum DuplicatePolicy {
    REJECT,
    OVERWRITE;

    public static DuplicatePolicy from(String value) {
        if (value == null || value.isBlank()) {
            return REJECT;
        }
        try {
            return DuplicatePolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported duplicate policy: " + value);
        }
    }
}
