package work.clibind.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.clibind.shared.TextFormat;
import work.clibind.types.ArgHint;
import work.clibind.types.ArgType;
import work.clibind.types.ArgumentSpec;
import work.clibind.types.Converter;
import work.clibind.types.ConverterLookup;
import work.clibind.types.InvalidArgumentException;
import work.clibind.types.TypeResolver;

/**
 * A registered command: its function plus the resolved arguments.
 */
public record Command(
    String name,
    CommandFunction function,
    List<ArgumentSpec> args,
    String description,
    boolean allowExtra,
    String parent,
    boolean placeholder
) {
    public Command {
        Objects.requireNonNull(name, "name");
        function = function == null ? CommandFunction.noop() : function;
        args = args == null ? List.of() : List.copyOf(args);
    }

    public static Command placeholder(String name, String description, CommandFunction function) {
        return new Command(name, function, List.of(), description, false, null, true);
    }

    /**
     * Name including the parent, e.g. {@code "remote add"}.
     */
    public String displayName() {
        return parent != null ? parent + " " + name : name;
    }

    public Command withName(String newName) {
        return new Command(newName, function, args, description, allowExtra, parent, placeholder);
    }

    /**
     * Builds a command from a function signature and per-parameter hints. Parameters without a
     * hint become positional arguments; hints for parameters missing from the signature are
     * rejected. The parameter called {@code extraKey} is always typed {@code List<String>}.
     */
    public static Command fromFunction(
        String name,
        Map<String, ArgHint> hints,
        Signature signature,
        CommandFunction function,
        String description,
        String parent,
        boolean allowExtra,
        String extraKey,
        ConverterLookup converters
    ) {
        for (String hinted : hints.keySet()) {
            if (!signature.contains(hinted)) {
                throw new InvalidArgumentException(
                    hinted,
                    "argument not found in function for '" + TextFormat.joinStrings(" ", parent, name) + "'"
                );
            }
        }
        List<ArgumentSpec> args = new ArrayList<>();
        for (Signature.Param param : signature.params()) {
            ArgHint hint = hints.getOrDefault(param.name(), ArgHint.none());
            ArgType type;
            if (param.name().equals(extraKey)) {
                type = ArgType.list(ArgType.STRING);
            } else {
                type = param.type() == null ? ArgType.STRING : param.type();
            }
            ConverterLookup lookup = withFallback(converters, hint.converter());
            ArgumentSpec spec = TypeResolver.resolve(param.name(), hint, type, param.defaultValue(), lookup);
            String displayType = spec.displayType();
            String help = displayType.isEmpty()
                ? spec.help()
                : TextFormat.joinStrings(" ", spec.help(), "(" + displayType + ")");
            args.add(spec.withHelp(help));
        }
        return new Command(name, function, args, description, allowExtra, parent, false);
    }

    /**
     * The table decides first; a hint converter only applies to types the table does not know.
     */
    private static ConverterLookup withFallback(ConverterLookup table, Converter fallback) {
        if (fallback == null) {
            return table;
        }
        if (table == null) {
            return type -> fallback;
        }
        return type -> {
            Converter found = table.find(type);
            return found != null ? found : fallback;
        };
    }
}
