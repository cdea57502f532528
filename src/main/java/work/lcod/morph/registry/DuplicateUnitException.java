package work.lcod.morph.registry;

/**
 * Registration of a name that is already taken while the registry rejects duplicates.
 */
public final class DuplicateUnitException extends RuntimeException {
    private final String unitName;

    public DuplicateUnitException(String unitName) {
        super("Unit already registered: " + unitName);
        this.unitName = unitName;
    }

    public String unitName() {
        return unitName;
    }
}
