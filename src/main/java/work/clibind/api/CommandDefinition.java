package work.clibind.api;

import java.util.LinkedHashMap;
import java.util.Map;
import work.clibind.runtime.Command;
import work.clibind.runtime.CommandFunction;
import work.clibind.runtime.Signature;
import work.clibind.types.ArgHint;
import work.clibind.types.ArgType;

/**
 * Collects the parameters of a command before it is registered with {@link #register}.
 *
 * <pre>{@code
 * cli.command("greet")
 *     .description("Say hello.")
 *     .param("name", String.class, ArgHint.positional("Who to greet"))
 *     .param("shout", Boolean.class, false, ArgHint.option("--shout", "Use capitals"))
 *     .register(values -> ...);
 * }</pre>
 */
public final class CommandDefinition {
    private final Cli cli;
    private final String name;
    private final String parent;
    private final boolean allowExtra;
    private final Signature.Builder signature = Signature.builder();
    private final Map<String, ArgHint> hints = new LinkedHashMap<>();
    private String description;

    CommandDefinition(Cli cli, String name, String parent, boolean allowExtra) {
        this.cli = cli;
        this.name = name;
        this.parent = parent;
        this.allowExtra = allowExtra;
    }

    public CommandDefinition description(String description) {
        this.description = description;
        return this;
    }

    /** Untyped parameter, parsed as a string. */
    public CommandDefinition param(String name) {
        signature.param(name);
        return this;
    }

    public CommandDefinition param(String name, ArgType type) {
        signature.param(name, type);
        return this;
    }

    public CommandDefinition param(String name, ArgType type, Object defaultValue) {
        signature.param(name, type, defaultValue);
        return this;
    }

    public CommandDefinition param(String name, ArgType type, ArgHint hint) {
        signature.param(name, type);
        return arg(name, hint);
    }

    public CommandDefinition param(String name, ArgType type, Object defaultValue, ArgHint hint) {
        signature.param(name, type, defaultValue);
        return arg(name, hint);
    }

    public CommandDefinition param(String name, Class<?> type) {
        signature.param(name, type);
        return this;
    }

    public CommandDefinition param(String name, Class<?> type, Object defaultValue) {
        signature.param(name, type, defaultValue);
        return this;
    }

    public CommandDefinition param(String name, Class<?> type, ArgHint hint) {
        signature.param(name, type);
        return arg(name, hint);
    }

    public CommandDefinition param(String name, Class<?> type, Object defaultValue, ArgHint hint) {
        signature.param(name, type, defaultValue);
        return arg(name, hint);
    }

    /**
     * Hint for a parameter. Hints naming parameters that were never declared fail on
     * registration.
     */
    public CommandDefinition arg(String name, ArgHint hint) {
        hints.put(name, hint);
        return this;
    }

    public Command register(CommandFunction function) {
        return cli.register(name, parent, allowExtra, description, signature.build(), hints, function);
    }
}
