package work.clibind.runtime;

/**
 * Raised when a command is registered twice under the same parent.
 */
public final class CommandExistsException extends RuntimeException {
    private final String name;

    public CommandExistsException(String name) {
        super("Command '" + name + "' already exists");
        this.name = name;
    }

    public String name() {
        return name;
    }
}
