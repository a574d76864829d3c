package work.clibind.types;

/**
 * Marks an argument without a default value. An argument whose value is still {@code UNSET}
 * after parsing was required but not given.
 */
public enum Unset {
    VALUE;

    /** Serialized form in static snapshots. */
    public static final String MARKER = "==SUPPRESS==";

    public static boolean isUnset(Object value) {
        return value == VALUE;
    }

    @Override
    public String toString() {
        return MARKER;
    }
}
