package work.lcod.morph.registry;

/**
 * Lookup of a name that no unit is registered under.
 */
public final class UnitNotFoundException extends RuntimeException {
    private final String unitName;

    public UnitNotFoundException(String unitName) {
        super("Unit not registered: " + unitName);
        this.unitName = unitName;
    }

    public String unitName() {
        return unitName;
    }
}
