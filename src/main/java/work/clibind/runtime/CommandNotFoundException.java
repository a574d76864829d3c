package work.clibind.runtime;

import java.util.List;

/**
 * Raised when the command line names a command that is not registered.
 */
public final class CommandNotFoundException extends RuntimeException {
    private final String name;
    private final List<String> available;

    public CommandNotFoundException(String name, List<String> available) {
        super("Can't find command '" + name + "'. Available: " + String.join(", ", available));
        this.name = name;
        this.available = List.copyOf(available);
    }

    public String name() {
        return name;
    }

    public List<String> available() {
        return available;
    }
}
