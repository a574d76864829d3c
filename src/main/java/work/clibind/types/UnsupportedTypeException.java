package work.clibind.types;

/**
 * Raised at registration time when a parameter type cannot be mapped to an argument.
 */
public final class UnsupportedTypeException extends RuntimeException {
    private final String argument;
    private final ArgType type;

    public UnsupportedTypeException(String argument, ArgType type) {
        super("Unsupported type for '" + argument + "': " + type);
        this.argument = argument;
        this.type = type;
    }

    public String argument() {
        return argument;
    }

    public ArgType type() {
        return type;
    }
}
