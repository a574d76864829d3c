package work.clibind.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.clibind.parse.CliParserException;
import work.clibind.runtime.CommandExistsException;
import work.clibind.runtime.CommandNotFoundException;
import work.clibind.types.ArgHint;
import work.clibind.types.ArgType;
import work.clibind.types.ConverterRegistry;
import work.clibind.types.UnsupportedTypeException;

class CliTest {
    private final StringWriter output = new StringWriter();
    private final List<String> calls = new ArrayList<>();

    private CliSettings.Builder settings() {
        return CliSettings.builder().prog("app").out(new PrintWriter(output));
    }

    private Cli cli(CliSettings.Builder settings) {
        var cli = new Cli(settings.build());
        cli.command("greet")
            .description("Say hello.")
            .param("name", String.class, ArgHint.positional("Who to greet"))
            .param("shout", Boolean.class, false, ArgHint.option("--shout", "Use capitals"))
            .register(values -> calls.add("greet " + values.get("name") + " " + values.get("shout")));
        return cli;
    }

    private Cli cliWithSubcommands(CliSettings.Builder settings) {
        var cli = cli(settings);
        cli.command("parent").register(values -> calls.add("parent"));
        cli.subcommand("parent", "child")
            .param("x", ArgType.INTEGER, 0, ArgHint.option("--x", null))
            .register(values -> calls.add("child " + values.get("x")));
        return cli;
    }

    @Test
    void showsOverviewWithoutArguments() throws Exception {
        var cli = cliWithSubcommands(settings().help("Greeting tools."));
        assertEquals(0, cli.run());
        var info = output.toString();
        assertTrue(info.startsWith("Greeting tools.\n\nAvailable commands:\n"), info);
        assertTrue(info.contains("  greet    Say hello."), info);
        assertTrue(info.contains("Subcommands: child"), info);
        assertEquals(0, cli.run("--help"));
        assertTrue(calls.isEmpty());
    }

    @Test
    void runsSingleCommandWithoutItsName() throws Exception {
        var cli = cli(settings());
        assertEquals(0, cli.run("Ada", "--shout"));
        assertEquals(0, cli.run("greet", "Bob"));
        assertEquals(List.of("greet Ada true", "greet Bob false"), calls);
    }

    @Test
    void dispatchesToSubcommandOnly() throws Exception {
        var cli = cliWithSubcommands(settings());
        assertEquals(0, cli.run("parent", "child", "--x", "1"));
        assertEquals(List.of("child 1"), calls);
        assertEquals(0, cli.run("parent"));
        assertEquals(List.of("child 1", "parent"), calls);
    }

    @Test
    void subcommandsAreNotTopLevelCommands() {
        var cli = cliWithSubcommands(settings());
        var ex = assertThrows(CommandNotFoundException.class, () -> cli.run("child", "--x", "1"));
        assertEquals(List.of("greet", "parent"), ex.available());
    }

    @Test
    void createsPlaceholderForParentlessSubcommands() throws Exception {
        var cli = cliWithSubcommands(settings());
        cli.subcommand("remote", "add")
            .param("url")
            .register(values -> calls.add("add " + values.get("url")));
        cli.subcommand("remote", "remove")
            .param("url")
            .register(values -> calls.add("remove " + values.get("url")));
        assertEquals(0, cli.run("remote", "add", "git@host"));
        assertEquals(List.of("add git@host"), calls);

        assertEquals(0, cli.run("remote"));
        assertTrue(output.toString().contains("Usage: app remote"), output.toString());
        assertTrue(cli.registry().commands().get("remote").placeholder());
    }

    @Test
    void placeholderShowsUsage() throws Exception {
        var cli = cli(settings());
        cli.placeholder("remote", "Manage remotes.");
        cli.subcommand("remote", "add").param("url").register(values -> calls.add("add"));
        assertEquals(0, cli.run("remote"));
        assertTrue(calls.isEmpty());
        assertTrue(output.toString().contains("Manage remotes."), output.toString());
        assertThrows(CommandExistsException.class, () -> cli.placeholder("remote", null));
    }

    @Test
    void printsVersion() throws Exception {
        var cli = cliWithSubcommands(settings().version("1.0.0"));
        assertEquals(0, cli.run("--version"));
        assertEquals("1.0.0", output.toString().strip());
    }

    @Test
    void printsCommandHelp() throws Exception {
        var cli = cliWithSubcommands(settings());
        assertEquals(0, cli.run("greet", "--help"));
        assertTrue(output.toString().contains("Who to greet (String)"), output.toString());
        assertTrue(calls.isEmpty());
    }

    @Test
    void propagatesParseErrors() {
        var cli = cliWithSubcommands(settings());
        var ex = assertThrows(CliParserException.class, () -> cli.run("greet", "--shout"));
        assertEquals("the following arguments are required: name", ex.getMessage());
    }

    @Test
    void handlersReturnExitCodes() throws Exception {
        var seen = new ArrayList<Throwable>();
        var cli = cliWithSubcommands(settings()
            .error(CliParserException.class, error -> {
                seen.add(error);
                return 2;
            })
            .error(CommandNotFoundException.class, error -> null));
        assertEquals(2, cli.run("greet"));
        assertEquals(0, cli.run("nope"));
        assertEquals(1, seen.size());
    }

    @Test
    void handlersCoverSubclasses() throws Exception {
        var cli = new Cli(settings().error(RuntimeException.class, error -> 7).build());
        cli.command("fail").register(values -> {
            throw new IllegalStateException("broken");
        });
        cli.command("io").register(values -> {
            throw new IOException("disk");
        });
        assertEquals(7, cli.run("fail"));
        var ex = assertThrows(IOException.class, () -> cli.run("io"));
        assertEquals("disk", ex.getMessage());
    }

    @Test
    void collectsExtraArguments() throws Exception {
        var cli = new Cli(settings().build());
        cli.commandWithExtra("exec")
            .param("program")
            .param("_extra")
            .register(values -> calls.add(values.get("program") + " " + values.get("_extra")));
        assertEquals(0, cli.run("exec", "ls", "--all", "-l"));
        assertEquals(List.of("ls [--all, -l]"), calls);
    }

    @Test
    void usesConfiguredExtraKey() throws Exception {
        var cli = new Cli(settings().extraKey("rest").build());
        cli.commandWithExtra("exec")
            .param("rest")
            .register(values -> calls.add(String.valueOf(values.get("rest"))));
        assertEquals(0, cli.run("exec", "a", "b"));
        assertEquals(List.of("[a, b]"), calls);
    }

    @Test
    void callsCommandDirectly() throws Exception {
        var cli = cli(settings());
        var greet = cli.registry().get("greet");
        assertEquals(0, cli.call(greet, List.of("Ada")));
        assertEquals(List.of("greet Ada false"), calls);
        assertEquals(0, cli.call(greet, List.of("--help")));
        assertTrue(output.toString().contains("Usage: app "), output.toString());
        assertFalse(output.toString().contains("app greet"), output.toString());
    }

    @Test
    void customConvertersApply() throws Exception {
        var converters = ConverterRegistry.builder()
            .put("Point", value -> {
                var parts = value.split(",");
                return List.of(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
            })
            .build();
        var cli = new Cli(settings().converters(converters).build());
        cli.command("plot")
            .param("at", ArgType.named("Point"))
            .register(values -> calls.add(String.valueOf(values.get("at"))));
        assertEquals(0, cli.run("plot", "1,2"));
        assertEquals(List.of("[1, 2]"), calls);
    }

    @Test
    void registrationErrorsAbortSetup() {
        var cli = cli(settings());
        assertThrows(CommandExistsException.class, () -> cli.command("greet").register(values -> {}));
        assertThrows(UnsupportedTypeException.class,
            () -> cli.command("other").param("thing", ArgType.named("Thing")).register(values -> {}));
        assertFalse(cli.registry().commands().containsKey("other"));
    }

    @Test
    void parseIsAvailableForTesting() {
        var cli = cli(settings());
        var values = cli.parse(List.of("Ada"), cli.registry().get("greet"));
        assertEquals(Map.of("name", "Ada", "shout", false), values);
    }
}
