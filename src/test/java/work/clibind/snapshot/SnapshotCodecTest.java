package work.clibind.snapshot;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.clibind.runtime.Command;
import work.clibind.runtime.CommandFunction;
import work.clibind.runtime.CommandRegistry;
import work.clibind.runtime.Signature;
import work.clibind.types.Action;
import work.clibind.types.ArgHint;
import work.clibind.types.ArgType;
import work.clibind.types.ConverterRegistry;
import work.clibind.types.Unset;

class SnapshotCodecTest {
    @TempDir
    Path dir;

    private static final ConverterRegistry POINTS = ConverterRegistry.builder()
        .put("Point", value -> "point:" + value)
        .build();

    private static CommandRegistry registry() {
        var registry = new CommandRegistry();
        var signature = Signature.builder()
            .param("at", ArgType.named("Point"))
            .param("scale", ArgType.FLOAT, 1.5)
            .param("quiet", ArgType.BOOLEAN, false)
            .build();
        var hints = Map.of(
            "scale", ArgHint.option("--scale", "Zoom factor"),
            "quiet", ArgHint.option("--quiet", "-q", null)
        );
        registry.register(Command.fromFunction("plot", hints, signature, CommandFunction.noop(), "Plot a point.",
            null, false, "_extra", ConverterRegistry.merge(ConverterRegistry.defaults(), POINTS)));
        registry.register(Command.fromFunction("add", Map.of(), Signature.builder().param("url").build(),
            CommandFunction.noop(), null, "remote", false, "_extra", ConverterRegistry.defaults()));
        return registry;
    }

    @Test
    void writesSnakeCaseJson() throws Exception {
        var data = SnapshotCodec.snapshot("app", "", null, "_extra", registry());
        var path = dir.resolve("cli.json");
        SnapshotCodec.write(data, path);

        Map<?, ?> json = new ObjectMapper().readValue(path.toFile(), Map.class);
        assertEquals("app", json.get("prog"));
        assertEquals("_extra", json.get("extra_key"));
        assertTrue(json.containsKey("version"));
        var plot = (Map<?, ?>) ((Map<?, ?>) json.get("commands")).get("plot");
        assertEquals(false, plot.get("allow_extra"));
        assertEquals(false, plot.get("is_placeholder"));
        var at = (Map<?, ?>) ((List<?>) plot.get("args")).get(0);
        assertEquals("Point", at.get("orig_type"));
        assertEquals(true, at.get("has_converter"));
        assertEquals(Unset.MARKER, at.get("default"));
        var quiet = (Map<?, ?>) ((List<?>) plot.get("args")).get(2);
        assertEquals("-q", quiet.get("short"));
        assertEquals("store_true", quiet.get("action"));
        assertNull(quiet.get("type"));
        var remote = (Map<?, ?>) ((Map<?, ?>) json.get("subcommands")).get("remote");
        assertTrue(remote.containsKey("add"));
    }

    @Test
    void readsWhatWasWritten() throws Exception {
        var data = SnapshotCodec.snapshot("app", "Help.", "1.0", "_extra", registry());
        var path = dir.resolve("cli.json");
        SnapshotCodec.write(data, path);
        assertEquals(data, SnapshotCodec.read(path));
    }

    @Test
    void restoresArgumentsWithSuppliedConverters() throws Exception {
        var data = SnapshotCodec.snapshot("app", "", null, "_extra", registry());
        var restored = SnapshotCodec.restore(data, ConverterRegistry.merge(ConverterRegistry.defaults(), POINTS));
        var original = registry().get("plot");
        var plot = restored.get("plot");

        for (int i = 0; i < original.args().size(); i++) {
            var expected = original.args().get(i);
            var actual = plot.args().get(i);
            assertEquals(expected.id(), actual.id());
            assertEquals(expected.help(), actual.help());
            assertEquals(expected.hint().option(), actual.hint().option());
            assertEquals(expected.hint().shortName(), actual.hint().shortName());
            assertEquals(expected.action(), actual.action());
            assertEquals(expected.defaultValue(), actual.defaultValue());
        }
        assertEquals("point:1,2", plot.args().get(0).converter().convert("1,2"));
        assertEquals(Action.STORE_TRUE, plot.args().get(2).action());
        assertEquals("add", restored.subcommandsOf("remote").get("add").name());
    }

    @Test
    void fallsBackToStringsWithoutConverters() throws Exception {
        var data = SnapshotCodec.snapshot("app", "", null, "_extra", registry());
        var plot = SnapshotCodec.restore(data, ConverterRegistry.defaults()).get("plot");
        assertEquals("1,2", plot.args().get(0).converter().convert("1,2"));
        assertEquals(2.5, plot.args().get(1).converter().convert("2.5"));
        assertFalse(plot.placeholder());
    }
}
