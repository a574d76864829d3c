package work.clibind.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.clibind.parse.CliParserException;
import work.clibind.types.ArgHint;
import work.clibind.types.ArgType;
import work.clibind.types.Converters;

class StaticCliTest {
    enum Palette { RED, GREEN }

    @TempDir
    Path dir;

    private final StringWriter liveOutput = new StringWriter();
    private final StringWriter staticOutput = new StringWriter();
    private final List<String> calls = new ArrayList<>();

    private Cli liveCli() {
        var cli = new Cli(CliSettings.builder()
            .prog("app")
            .help("Build things.")
            .version("2.0.0")
            .out(new PrintWriter(liveOutput))
            .build());
        cli.command("build")
            .description("Build a target.")
            .param("target", String.class, ArgHint.positional("What to build"))
            .param("tag", ArgType.list(ArgType.STRING), ArgHint.option("--tag", "-t", "Tags to apply"))
            .param("mode", ArgType.literal("fast", "slow"), "fast", ArgHint.option("--mode", "Build mode"))
            .param("jobs", ArgType.INTEGER, 2, ArgHint.option("--jobs", "-j", "Parallel jobs"))
            .param("verbose", ArgType.INTEGER, ArgHint.counter("--verbose", "-v", "More output"))
            .param("color", ArgType.BOOLEAN, true, ArgHint.option("--color", "Colored output"))
            .param("palette", ArgType.enumType(Palette.class), Palette.RED, ArgHint.option("--palette", null))
            .param("input", ArgType.optional(Converters.EXISTING_FILE_PATH), ArgHint.option("--input", "-i", "Input file"))
            .register(values -> calls.add("build " + values.get("target")));
        cli.placeholder("remote", "Manage remotes.");
        cli.subcommand("remote", "add")
            .description("Add a remote.")
            .param("url", String.class, ArgHint.positional("Remote URL"))
            .param("fetch", ArgType.BOOLEAN, false, ArgHint.option("--fetch", "Fetch after adding"))
            .register(values -> calls.add("add " + values.get("url")));
        return cli;
    }

    private StaticCli staticCli(Cli live, boolean debug) throws Exception {
        Path snapshot = live.toStatic(dir.resolve("cli.json"));
        return StaticCli.load(snapshot, debug, CliSettings.builder().out(new PrintWriter(staticOutput)));
    }

    private static String output(StringWriter writer) {
        var text = writer.toString();
        writer.getBuffer().setLength(0);
        return text;
    }

    @Test
    void helpMatchesLiveCli() throws Exception {
        var live = liveCli();
        var stat = staticCli(live, false);
        List<List<String>> invocations = List.of(
            List.of(),
            List.of("build", "--help"),
            List.of("remote"),
            List.of("remote", "--help"),
            List.of("remote", "add", "--help"),
            List.of("--version")
        );
        for (var args : invocations) {
            assertEquals(0, live.run(args));
            assertEquals(0, stat.run(args));
            var expected = output(liveOutput);
            assertFalse(expected.isBlank(), args.toString());
            assertEquals(expected, output(staticOutput), args.toString());
        }
        assertTrue(calls.isEmpty());
    }

    @Test
    void reportsTheSameErrors() throws Exception {
        var live = liveCli();
        var stat = staticCli(live, false);
        List<List<String>> invocations = List.of(
            List.of("build"),
            List.of("build", "x", "--jobs", "many"),
            List.of("build", "x", "--mode", "medium"),
            List.of("build", "x", "--palette", "BLUE"),
            List.of("build", "x", "--input", dir.resolve("missing.txt").toString()),
            List.of("build", "x", "--what"),
            List.of("remote", "rename")
        );
        for (var args : invocations) {
            var expected = assertThrows(CliParserException.class, () -> live.run(args));
            var actual = assertThrows(CliParserException.class, () -> stat.run(args));
            assertEquals(expected.getMessage(), actual.getMessage(), args.toString());
        }
    }

    @Test
    void validInvocationsDoNothing() throws Exception {
        var stat = staticCli(liveCli(), false);
        assertEquals(0, stat.run("build", "x", "-t", "a", "-vv", "--no-color", "--jobs", "4"));
        assertEquals(0, stat.run("remote", "add", "origin", "--fetch"));
        assertTrue(calls.isEmpty());
    }

    @Test
    void restoresDefaults() throws Exception {
        var stat = staticCli(liveCli(), false);
        var build = stat.registry().get("build");
        var values = stat.parse(List.of("x", "-t", "a"), build);
        assertEquals(2, values.get("jobs"));
        assertEquals("fast", values.get("mode"));
        assertEquals(0, values.get("verbose"));
        assertEquals(true, values.get("color"));
        assertEquals("RED", values.get("palette"));
        assertNull(values.get("input"));
        assertEquals(List.of("a"), values.get("tag"));
        assertEquals("Build things.", stat.settings().help());
        assertEquals("app", stat.settings().prog());
    }

    @Test
    void documentsDefaultsLikeLiveCli() throws Exception {
        var live = new Cli(CliSettings.builder().prog("app").build());
        live.command("deploy")
            .param("targets", ArgType.list(ArgType.STRING), List.of("a", "b"), ArgHint.option("--targets", "Targets"))
            .param("sizes", ArgType.list(ArgType.INTEGER), List.of(1, 2), ArgHint.option("--sizes", null))
            .param("palette", ArgType.enumType(Palette.class), Palette.GREEN, ArgHint.option("--palette", null))
            .param("config", Converters.EXISTING_PATH, dir.resolve("data/in.txt"), ArgHint.option("--config", null))
            .register(values -> {});
        live.command("other").register(values -> {});
        var stat = StaticCli.load(live.toStatic(dir.resolve("deploy.json")));

        var restored = stat.registry().get("deploy").args();
        assertEquals(List.of("a", "b"), restored.get(0).defaultValue());
        assertEquals(List.of(1, 2), restored.get(1).defaultValue());
        assertEquals(dir.resolve("data/in.txt"), restored.get(3).defaultValue());

        var markdown = stat.document("App", null, null, dir);
        assertEquals(live.document("App", null, null, dir), markdown);
        assertTrue(markdown.contains("| `[a, b]` |"), markdown);
        assertTrue(markdown.contains("| `Palette.GREEN` |"), markdown);
        assertTrue(markdown.contains("| `data/in.txt` |"), markdown);
    }

    @Test
    void printsDebugMarkers() throws Exception {
        var stat = staticCli(liveCli(), true);
        assertEquals(0, stat.run("build", "--help"));
        var text = output(staticOutput);
        assertTrue(text.startsWith("===== STATIC =====\n"), text);
        assertTrue(text.endsWith("=== END STATIC ===\n"), text);
    }

    @Test
    void rejectsMissingSnapshots() {
        var missing = dir.resolve("missing.json");
        var ex = assertThrows(IllegalArgumentException.class, () -> StaticCli.load(missing));
        assertEquals("Not a valid file path: " + missing, ex.getMessage());
        assertThrows(IllegalArgumentException.class, () -> StaticCli.load(dir));
    }
}
