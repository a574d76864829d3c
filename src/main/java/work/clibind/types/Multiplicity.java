package work.clibind.types;

/**
 * How many tokens an argument produces.
 */
public enum Multiplicity {
    SINGLE,
    APPEND,
    COUNT
}
