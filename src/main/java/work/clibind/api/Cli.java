package work.clibind.api;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.clibind.doc.MarkdownDocumenter;
import work.clibind.parse.ArgumentParser;
import work.clibind.parse.UsageShownException;
import work.clibind.runtime.Command;
import work.clibind.runtime.CommandFunction;
import work.clibind.runtime.CommandRegistry;
import work.clibind.runtime.Signature;
import work.clibind.shared.TextFormat;
import work.clibind.snapshot.SnapshotCodec;
import work.clibind.snapshot.StaticData;
import work.clibind.types.ArgHint;

/**
 * A command-line interface made of registered commands and subcommands.
 *
 * <p>Register commands with {@link #command(String)} and friends, then hand the process
 * arguments (without the program name) to {@link #run(List)}.
 */
public class Cli {
    private static final Logger log = LoggerFactory.getLogger(Cli.class);

    static final String HELP_ARG = "--help";
    static final String VERSION_ARG = "--version";

    private final CliSettings settings;
    private final CommandRegistry registry;
    private final ArgumentParser parser;

    public Cli() {
        this(CliSettings.defaults());
    }

    public Cli(CliSettings settings) {
        this(settings, new CommandRegistry());
    }

    protected Cli(CliSettings settings, CommandRegistry registry) {
        this.settings = settings;
        this.registry = registry;
        this.parser = new ArgumentParser(settings.parserSettings(), settings.out());
    }

    public CliSettings settings() {
        return settings;
    }

    public CommandRegistry registry() {
        return registry;
    }

    public CommandDefinition command(String name) {
        return new CommandDefinition(this, name, null, false);
    }

    /**
     * Command that collects unrecognized tokens into the parameter named by the extra key.
     */
    public CommandDefinition commandWithExtra(String name) {
        return new CommandDefinition(this, name, null, true);
    }

    public CommandDefinition subcommand(String parent, String name) {
        return new CommandDefinition(this, name, parent, false);
    }

    public CommandDefinition subcommandWithExtra(String parent, String name) {
        return new CommandDefinition(this, name, parent, true);
    }

    /**
     * Parent command without arguments that only shows help for its subcommands.
     */
    public Command placeholder(String name, String description) {
        return registry.placeholder(name, description, CommandFunction.noop());
    }

    Command register(
        String name,
        String parent,
        boolean allowExtra,
        String description,
        Signature signature,
        Map<String, ArgHint> hints,
        CommandFunction function
    ) {
        Command command = Command.fromFunction(
            name,
            hints,
            signature,
            function,
            description,
            parent,
            allowExtra,
            settings.extraKey(),
            settings.converters()
        );
        return registry.register(command);
    }

    public int run(String... args) throws Exception {
        return run(Arrays.asList(args));
    }

    /**
     * Runs the command named by the first argument.
     *
     * @param args process arguments without the program name
     * @return exit code: 0 on success or after help and version output, otherwise the code
     *     returned by an error handler
     * @throws Exception whatever the command throws when no error handler matches
     */
    public int run(List<String> args) throws Exception {
        List<String> runArgs = new ArrayList<>(args);
        PrintWriter out = settings.out();
        if (runArgs.isEmpty() || HELP_ARG.equals(runArgs.get(0))) {
            out.println(formatInfo());
            out.flush();
            return 0;
        }
        Map<String, Command> commands = registry.commands();
        if (commands.size() == 1 && registry.subcommands().size() <= 1) {
            String single = commands.keySet().iterator().next();
            if (!runArgs.get(0).equals(single)) {
                runArgs.add(0, single);
            }
        }
        String name = runArgs.remove(0);
        if (settings.version() != null && VERSION_ARG.equals(name)) {
            out.println(settings.version());
            out.flush();
            return 0;
        }
        return handleErrors(() -> {
            Map<String, Command> subcommands = registry.subcommandsOf(name);
            Command command = registry.lookup(name)
                .orElseGet(() -> registry.placeholder(name, null, CommandFunction.noop()));
            Map<String, Object> values = parse(runArgs, command, subcommands, false);
            Object sub = values.remove(ArgumentParser.SUBCOMMAND_KEY);
            Command target = sub != null ? subcommands.get(sub) : command;
            if (target.placeholder()) {
                out.print(parser.usage(command, subcommands));
                out.flush();
                return;
            }
            log.debug("Running command '{}'", target.displayName());
            target.function().invoke(values);
        });
    }

    /**
     * Parses {@code args} for a single command and invokes it. The arguments contain no command
     * name.
     */
    public int call(Command command, List<String> args) throws Exception {
        Command unnamed = command.withName("");
        return handleErrors(() -> {
            Map<String, Object> values = parse(args, unnamed, Map.of(), false);
            command.function().invoke(values);
        });
    }

    public Map<String, Object> parse(List<String> args, Command command) {
        return parse(args, command, Map.of(), false);
    }

    public Map<String, Object> parse(
        List<String> args,
        Command command,
        Map<String, Command> subcommands,
        boolean allowPartial
    ) {
        return parser.parse(args, command, subcommands, allowPartial);
    }

    /**
     * Overview of the available commands, shown for {@code --help} and when no command is given.
     */
    public String formatInfo() {
        List<String[]> rows = new ArrayList<>();
        Map<String, Map<String, Command>> subcommands = registry.subcommands();
        for (Command command : registry.commands().values()) {
            rows.add(new String[] { "  " + command.name(), TextFormat.formatArgHelp(command.description()) });
            if (subcommands.containsKey(command.name())) {
                rows.add(new String[] { "", subcommandList(subcommands.get(command.name())) });
            }
        }
        for (Map.Entry<String, Map<String, Command>> entry : subcommands.entrySet()) {
            if (!registry.commands().containsKey(entry.getKey())) {
                rows.add(new String[] { "  " + entry.getKey(), subcommandList(entry.getValue()) });
            }
        }
        return TextFormat.joinStrings("\n", settings.help(), "\nAvailable commands:", TextFormat.formatTable(rows));
    }

    private static String subcommandList(Map<String, Command> subs) {
        return "Subcommands: " + String.join(", ", subs.keySet());
    }

    public StaticData toStaticData() {
        return SnapshotCodec.snapshot(
            settings.prog(),
            settings.help(),
            settings.version(),
            settings.extraKey(),
            registry
        );
    }

    /**
     * Writes the static snapshot used by {@link StaticCli}.
     */
    public Path toStatic(Path path) throws IOException {
        SnapshotCodec.write(toStaticData(), path);
        return path;
    }

    public String document() {
        return document(null, null);
    }

    public String document(String title, String description) {
        return document(title, description, MarkdownDocumenter.DEFAULT_COMMENT, Path.of("").toAbsolutePath());
    }

    /**
     * Markdown documentation of every command.
     *
     * @param comment HTML comment placed at the top; {@code null} for none
     * @param pathRoot path defaults are shown relative to this directory
     */
    public String document(String title, String description, String comment, Path pathRoot) {
        return new MarkdownDocumenter(settings.prog(), settings.help(), registry)
            .document(title, description, comment, pathRoot);
    }

    private int handleErrors(CommandBody body) throws Exception {
        try {
            body.run();
            return 0;
        } catch (UsageShownException ex) {
            return ex.exitCode();
        } catch (Exception ex) {
            ErrorHandler handler = findHandler(ex.getClass());
            if (handler == null) {
                throw ex;
            }
            log.debug("Handling {} with registered error handler", ex.getClass().getSimpleName());
            Integer exitCode = handler.handle(ex);
            return exitCode == null ? 0 : exitCode;
        }
    }

    private ErrorHandler findHandler(Class<?> type) {
        for (Class<?> current = type; current != null; current = current.getSuperclass()) {
            ErrorHandler handler = settings.errors().get(current);
            if (handler != null) {
                return handler;
            }
        }
        return null;
    }

    @FunctionalInterface
    private interface CommandBody {
        void run() throws Exception;
    }
}
