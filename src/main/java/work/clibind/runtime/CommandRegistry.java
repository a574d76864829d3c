package work.clibind.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores top-level commands and, per parent name, their subcommands.
 */
public final class CommandRegistry {
    private static final Logger log = LoggerFactory.getLogger(CommandRegistry.class);

    private final Map<String, Command> commands = new LinkedHashMap<>();
    private final Map<String, Map<String, Command>> subcommands = new LinkedHashMap<>();

    /**
     * Registers a command under its parent, or at the top level when it has none.
     */
    public Command register(Command command) {
        Map<String, Command> target = command.parent() == null
            ? commands
            : subcommands.computeIfAbsent(command.parent(), key -> new LinkedHashMap<>());
        if (target.containsKey(command.name())) {
            throw new CommandExistsException(command.name());
        }
        target.put(command.name(), command);
        log.debug("Registered command '{}' with {} argument(s)", command.displayName(), command.args().size());
        return command;
    }

    /**
     * Registers a top-level command without arguments that only hosts subcommands.
     */
    public Command placeholder(String name, String description, CommandFunction function) {
        if (commands.containsKey(name)) {
            throw new CommandExistsException(name);
        }
        Command command = Command.placeholder(name, description, function);
        commands.put(name, command);
        log.debug("Registered placeholder command '{}'", name);
        return command;
    }

    /**
     * Looks up a top-level command. Empty when the name only has subcommands.
     *
     * @throws CommandNotFoundException when neither a command nor subcommands exist for the name
     */
    public Optional<Command> lookup(String name) {
        Command command = commands.get(name);
        if (command == null && !subcommands.containsKey(name)) {
            throw new CommandNotFoundException(name, new ArrayList<>(commands.keySet()));
        }
        return Optional.ofNullable(command);
    }

    public Command get(String name) {
        return commands.get(name);
    }

    public Map<String, Command> subcommandsOf(String parent) {
        Map<String, Command> subs = subcommands.get(parent);
        return subs == null ? Map.of() : Collections.unmodifiableMap(subs);
    }

    public Map<String, Command> commands() {
        return Collections.unmodifiableMap(commands);
    }

    public Map<String, Map<String, Command>> subcommands() {
        return Collections.unmodifiableMap(subcommands);
    }
}
