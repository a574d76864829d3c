package work.clibind.parse;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Model.ArgSpec;
import picocli.CommandLine.Model.OptionSpec;
import picocli.CommandLine.ParseResult;
import work.clibind.runtime.Command;
import work.clibind.types.Action;
import work.clibind.types.ArgumentSpec;
import work.clibind.types.Unset;

/**
 * Turns command-line tokens into a map of converted values for one command and, optionally,
 * one of its subcommands.
 */
public final class ArgumentParser {
    private static final Logger log = LoggerFactory.getLogger(ArgumentParser.class);

    /** Key of the chosen subcommand name in the parsed values. */
    public static final String SUBCOMMAND_KEY = "__subcommand__";

    private final ParserSettings settings;
    private final PrintWriter out;

    public ArgumentParser(ParserSettings settings, PrintWriter out) {
        this.settings = settings == null ? ParserSettings.defaults() : settings;
        this.out = out;
    }

    public ParserSettings settings() {
        return settings;
    }

    /**
     * Parses {@code tokens} (without program or command name) for {@code command}.
     *
     * <p>When a subcommand is matched its values are returned together with
     * {@link #SUBCOMMAND_KEY}; the parent's own values are not included.
     *
     * @param allowPartial skip the required-argument check
     * @throws UsageShownException after help or version text was printed
     * @throws CliParserException for anything the user typed wrong
     */
    public Map<String, Object> parse(
        List<String> tokens,
        Command command,
        Map<String, Command> subcommands,
        boolean allowPartial
    ) {
        Grammar grammar = Grammar.build(command, subcommands, settings);
        ParseResult result;
        try {
            result = grammar.root().parseArgs(tokens.toArray(new String[0]));
        } catch (CommandLine.ParameterException ex) {
            throw new CliParserException(ex.getMessage(), ex);
        }
        showHelpIfRequested(result);

        if (!result.hasSubcommand()) {
            List<String> unmatched = result.unmatched();
            if (!subcommands.isEmpty() && command.args().stream().noneMatch(ArgumentSpec::isPositional)) {
                for (String token : unmatched) {
                    if (!token.startsWith("-")) {
                        throw new CliParserException("invalid subcommand: '" + token + "'");
                    }
                }
            }
            Map<String, Object> values = collect(grammar.rootLevel(), result);
            return validate(command, values, unmatched, allowPartial);
        }

        ParseResult subResult = result.subcommand();
        String subName = subResult.commandSpec().name();
        Grammar.Level level = grammar.subLevel(subName);
        if (level == null) {
            throw new CliParserException("invalid subcommand: '" + subName + "'");
        }
        log.debug("Parsing subcommand '{}' of '{}'", subName, command.name());
        Map<String, Object> values = collect(level, subResult);
        validate(level.command(), values, subResult.unmatched(), allowPartial);
        values.put(SUBCOMMAND_KEY, subName);
        return values;
    }

    /**
     * Usage text for a command, listing its subcommands.
     */
    public String usage(Command command, Map<String, Command> subcommands) {
        return Grammar.build(command, subcommands, settings).root().getUsageMessage(CommandLine.Help.Ansi.OFF);
    }

    private void showHelpIfRequested(ParseResult result) {
        ParseResult level = result;
        while (level != null) {
            if (level.isVersionHelpRequested()) {
                out.println(settings.version());
                out.flush();
                throw new UsageShownException("version");
            }
            if (level.isUsageHelpRequested()) {
                out.print(level.commandSpec().commandLine().getUsageMessage(CommandLine.Help.Ansi.OFF));
                out.flush();
                throw new UsageShownException("help");
            }
            level = level.hasSubcommand() ? level.subcommand() : null;
        }
    }

    private Map<String, Object> collect(Grammar.Level level, ParseResult result) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (ArgumentSpec arg : level.command().args()) {
            Grammar.Binding binding = level.bindings().get(arg.id());
            if (binding == null) {
                continue;
            }
            Object fallback = settings.fillDefaults() ? arg.defaultValue() : Unset.VALUE;
            values.put(arg.id(), value(binding, result, fallback));
        }
        return values;
    }

    private Object value(Grammar.Binding binding, ParseResult result, Object fallback) {
        ArgumentSpec arg = binding.arg();
        boolean matched = isMatched(binding.main(), result);
        switch (arg.action()) {
            case STORE_TRUE:
                return matched ? Boolean.TRUE : fallback;
            case NEGATABLE: {
                boolean negated = isMatched(binding.negated(), result);
                if (!matched && !negated) {
                    return fallback;
                }
                if (matched && negated) {
                    OptionSpec main = (OptionSpec) binding.main();
                    return lastIndex(result, main.names()) > lastIndex(result, binding.negated().names());
                }
                return matched;
            }
            case COUNT: {
                if (!matched) {
                    return fallback;
                }
                boolean[] occurrences = binding.main().getValue();
                int base = fallback instanceof Integer start ? start : 0;
                return base + (occurrences == null ? 0 : occurrences.length);
            }
            case APPEND: {
                if (!matched) {
                    return fallback;
                }
                List<?> raw = binding.main().getValue();
                List<Object> converted = new ArrayList<>();
                if (raw != null) {
                    for (Object item : raw) {
                        converted.add(convert(arg, String.valueOf(item)));
                    }
                }
                return converted;
            }
            default: {
                if (!matched) {
                    return fallback;
                }
                String raw = binding.main().getValue();
                return raw == null ? fallback : convert(arg, raw);
            }
        }
    }

    private static boolean isMatched(ArgSpec spec, ParseResult result) {
        if (spec instanceof OptionSpec option) {
            return result.matchedOptions().contains(option);
        }
        return result.matchedPositionals().contains(spec);
    }

    private static int lastIndex(ParseResult result, String[] names) {
        List<String> original = result.originalArgs();
        int last = -1;
        for (String name : names) {
            last = Math.max(last, original.lastIndexOf(name));
        }
        return last;
    }

    private static Object convert(ArgumentSpec arg, String raw) {
        Object value;
        if (arg.converter() == null) {
            value = raw;
        } else {
            try {
                value = arg.converter().convert(raw);
            } catch (CliParserException ex) {
                throw ex;
            } catch (Exception ex) {
                String typeName = arg.type() == null ? "converter" : arg.type().displayName();
                throw new CliParserException(
                    "argument " + arg.displayName() + ": error encountered in " + typeName
                        + " for value: " + raw + "\n" + ex.getMessage(),
                    ex
                );
            }
        }
        List<String> choices = arg.choiceStrings();
        if (choices != null && !choices.contains(ArgumentSpec.choiceString(value))) {
            List<String> quoted = new ArrayList<>(choices.size());
            for (String choice : choices) {
                quoted.add("'" + choice + "'");
            }
            throw new CliParserException(
                "argument " + arg.displayName() + ": invalid choice: '" + raw
                    + "' (choose from " + String.join(", ", quoted) + ")"
            );
        }
        return value;
    }

    private Map<String, Object> validate(
        Command command,
        Map<String, Object> values,
        List<String> unmatched,
        boolean allowPartial
    ) {
        if (command.allowExtra()) {
            values.put(settings.extraKey(), new ArrayList<>(unmatched));
        } else if (!unmatched.isEmpty()) {
            throw new CliParserException("unrecognized arguments: " + String.join(" ", unmatched));
        }
        if (allowPartial) {
            return values;
        }
        List<String> missing = new ArrayList<>();
        for (ArgumentSpec arg : command.args()) {
            if (settings.fillDefaults()) {
                if (!values.containsKey(arg.id()) || Unset.isUnset(values.get(arg.id()))) {
                    missing.add(arg.displayName());
                }
            } else if (isRequiredOption(arg) && values.containsKey(arg.id()) && Unset.isUnset(values.get(arg.id()))) {
                // without filled defaults only options lacking a default are enforced
                missing.add(arg.displayName());
            }
        }
        if (!missing.isEmpty()) {
            throw new CliParserException("the following arguments are required: " + String.join(", ", missing));
        }
        return values;
    }

    private static boolean isRequiredOption(ArgumentSpec arg) {
        return !arg.isPositional() && Unset.isUnset(arg.defaultValue());
    }
}
