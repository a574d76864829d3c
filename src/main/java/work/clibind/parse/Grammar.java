package work.clibind.parse;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import picocli.CommandLine;
import picocli.CommandLine.Model.ArgSpec;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Model.OptionSpec;
import picocli.CommandLine.Model.PositionalParamSpec;
import work.clibind.runtime.Command;
import work.clibind.shared.TextFormat;
import work.clibind.types.Action;
import work.clibind.types.ArgumentSpec;
import work.clibind.types.Unset;

/**
 * picocli model of one command and its subcommands. picocli only splits and matches tokens;
 * every value is declared as a string (or a flag) and converted afterwards.
 */
final class Grammar {
    static final String HELP_OPTION = "--help";
    static final String HELP_SHORT = "-h";
    static final String VERSION_OPTION = "--version";
    private static final String DEFAULT_PROG = "cli";

    private final CommandLine root;
    private final Level rootLevel;
    private final Map<String, Level> subLevels;

    private Grammar(CommandLine root, Level rootLevel, Map<String, Level> subLevels) {
        this.root = root;
        this.rootLevel = rootLevel;
        this.subLevels = subLevels;
    }

    /**
     * Arguments of one command mapped to the picocli specs that match them.
     */
    record Level(Command command, Map<String, Binding> bindings) {}

    /**
     * {@code negated} is only set for negatable flags.
     */
    record Binding(ArgumentSpec arg, ArgSpec main, OptionSpec negated) {}

    CommandLine root() {
        return root;
    }

    Level rootLevel() {
        return rootLevel;
    }

    Level subLevel(String name) {
        return subLevels.get(name);
    }

    static Grammar build(Command command, Map<String, Command> subcommands, ParserSettings settings) {
        String rootName = TextFormat.joinStrings(" ", settings.prog(), command.name());
        CommandSpec rootSpec = CommandSpec.create();
        Level rootLevel = describe(rootSpec, rootName == null ? DEFAULT_PROG : rootName, command, settings);
        CommandLine root = new CommandLine(rootSpec);
        Map<String, Level> subLevels = new LinkedHashMap<>();
        for (Command sub : subcommands.values()) {
            CommandSpec subSpec = CommandSpec.create();
            subLevels.put(sub.name(), describe(subSpec, sub.name(), sub, settings));
            root.addSubcommand(sub.name(), new CommandLine(subSpec));
        }
        return new Grammar(root, rootLevel, subLevels);
    }

    private static Level describe(CommandSpec spec, String name, Command command, ParserSettings settings) {
        spec.name(name);
        if (command.description() != null) {
            spec.usageMessage().description(escape(command.description()));
        }
        spec.parser().unmatchedArgumentsAllowed(true);
        spec.parser().overwrittenOptionsAllowed(true);

        Set<String> used = new HashSet<>();
        for (ArgumentSpec arg : command.args()) {
            if (arg.hint().option() != null) used.add(arg.hint().option());
            if (arg.hint().shortName() != null) used.add(arg.hint().shortName());
        }
        Set<String> names = new HashSet<>();
        if (!used.contains(HELP_OPTION)) {
            List<String> helpNames = new ArrayList<>();
            if (!used.contains(HELP_SHORT)) helpNames.add(HELP_SHORT);
            helpNames.add(HELP_OPTION);
            add(spec, names, null, OptionSpec.builder(helpNames.toArray(new String[0]))
                .usageHelp(true)
                .type(boolean.class)
                .arity("0")
                .description("Show this message and exit.")
                .build());
        }
        if (settings.version() != null && !used.contains(VERSION_OPTION)) {
            add(spec, names, null, OptionSpec.builder(VERSION_OPTION)
                .versionHelp(true)
                .type(boolean.class)
                .arity("0")
                .description("Show the version and exit.")
                .build());
        }

        Map<String, Binding> bindings = new LinkedHashMap<>();
        int position = 0;
        for (ArgumentSpec arg : command.args()) {
            if (arg.id().equals(settings.extraKey())) {
                continue;
            }
            String description = description(arg, settings);
            if (arg.isPositional()) {
                PositionalParamSpec.Builder builder = PositionalParamSpec.builder()
                    .index(String.valueOf(position++))
                    .paramLabel("<" + arg.id() + ">");
                if (arg.action() == Action.APPEND) {
                    builder.type(List.class).auxiliaryTypes(String.class).arity("0..*");
                } else {
                    builder.type(String.class).arity("0..1");
                }
                if (description != null) {
                    builder.description(description);
                }
                PositionalParamSpec positional = builder.build();
                spec.addPositional(positional);
                bindings.put(arg.id(), new Binding(arg, positional, null));
                continue;
            }
            OptionSpec.Builder builder = OptionSpec.builder(optionNames(arg));
            switch (arg.action()) {
                case APPEND:
                    builder.type(List.class).auxiliaryTypes(String.class).arity("1").paramLabel("<" + arg.id() + ">");
                    break;
                case COUNT:
                    builder.type(boolean[].class).arity("0");
                    break;
                case STORE_TRUE:
                case NEGATABLE:
                    builder.type(boolean.class).arity("0");
                    break;
                default:
                    builder.type(String.class).arity("1").paramLabel("<" + arg.id() + ">");
                    break;
            }
            if (description != null) {
                builder.description(description);
            }
            OptionSpec option = builder.build();
            add(spec, names, arg, option);
            OptionSpec negated = null;
            if (arg.action() == Action.NEGATABLE) {
                negated = OptionSpec.builder(arg.negatedOption())
                    .type(boolean.class)
                    .arity("0")
                    .hidden(true)
                    .build();
                add(spec, names, arg, negated);
            }
            bindings.put(arg.id(), new Binding(arg, option, negated));
        }
        return new Level(command, bindings);
    }

    private static void add(CommandSpec spec, Set<String> names, ArgumentSpec arg, OptionSpec option) {
        for (String name : option.names()) {
            if (!names.add(name)) {
                String owner = arg == null ? name : arg.displayName();
                throw new CliParserException("argument " + owner + ": conflicting option string: " + name);
            }
        }
        try {
            spec.addOption(option);
        } catch (CommandLine.InitializationException ex) {
            throw new CliParserException(ex.getMessage(), ex);
        }
    }

    private static String[] optionNames(ArgumentSpec arg) {
        List<String> names = new ArrayList<>(2);
        if (arg.hint().option() != null) names.add(arg.hint().option());
        if (arg.hint().shortName() != null) names.add(arg.hint().shortName());
        return names.toArray(new String[0]);
    }

    private static String description(ArgumentSpec arg, ParserSettings settings) {
        String help = arg.help();
        if (help != null && !settings.fillDefaults() && !Unset.isUnset(arg.defaultValue())) {
            help = help + " (default: " + arg.defaultValue() + ")";
        }
        return help == null ? null : escape(help);
    }

    // picocli runs descriptions through String.format
    private static String escape(String text) {
        return text.replace("%", "%%");
    }
}
