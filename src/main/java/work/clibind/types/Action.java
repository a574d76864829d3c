package work.clibind.types;

import java.util.Locale;

/**
 * What the parser does when it meets an argument.
 */
public enum Action {
    STORE(Multiplicity.SINGLE),
    STORE_TRUE(Multiplicity.SINGLE),
    NEGATABLE(Multiplicity.SINGLE),
    APPEND(Multiplicity.APPEND),
    COUNT(Multiplicity.COUNT);

    private final Multiplicity multiplicity;

    Action(Multiplicity multiplicity) {
        this.multiplicity = multiplicity;
    }

    public Multiplicity multiplicity() {
        return multiplicity;
    }

    /**
     * Flags take no value, so they carry no converter.
     */
    public boolean isFlag() {
        return this == STORE_TRUE || this == NEGATABLE || this == COUNT;
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Action fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return STORE;
        }
        try {
            return Action.valueOf(tag.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported argument action: " + tag);
        }
    }
}
