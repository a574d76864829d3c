package work.clibind.types;

/**
 * Raised at registration time when an argument definition is structurally invalid,
 * e.g. a boolean without an option name.
 */
public final class InvalidArgumentException extends RuntimeException {
    private final String argument;

    public InvalidArgumentException(String argument, String message) {
        super("Invalid argument '" + argument + "': " + message);
        this.argument = argument;
    }

    public String argument() {
        return argument;
    }
}
