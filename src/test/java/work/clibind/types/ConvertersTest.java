package work.clibind.types;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.clibind.parse.CliParserException;

class ConvertersTest {
    @TempDir
    Path dir;

    @Test
    void checksExistingPaths() throws Exception {
        Path file = Files.writeString(dir.resolve("in.txt"), "data");
        assertEquals(file, Converters.existingFilePath(file.toString()));
        assertEquals(dir, Converters.existingDirPath(dir.toString()));

        var notFile = assertThrows(CliParserException.class, () -> Converters.existingFilePath(dir.toString()));
        assertEquals("path is not a file path: " + dir, notFile.getMessage());
        var notDir = assertThrows(CliParserException.class, () -> Converters.existingDirPath(file.toString()));
        assertEquals("path is not a directory path: " + file, notDir.getMessage());
        var missing = assertThrows(CliParserException.class, () -> Converters.existingPath(dir.resolve("nope").toString()));
        assertEquals("path does not exist: " + dir.resolve("nope"), missing.getMessage());
    }

    @Test
    void dashPassesThrough() throws Exception {
        var converter = ConverterRegistry.defaults().get(Converters.EXISTING_FILE_PATH_OR_DASH);
        assertEquals("-", converter.convert("-"));
    }

    @Test
    void parsesUuidsOrKeepsStrings() {
        var id = UUID.randomUUID();
        assertEquals(id, Converters.uuidOrString(id.toString()));
        assertEquals("latest", Converters.uuidOrString("latest"));
    }

    @Test
    void parsesListTokens() throws Exception {
        assertEquals(List.of(1, 2, 3), Converters.listConverter(ArgType.INTEGER).convert("[1, 2,3]"));
        assertEquals(List.of("a", "b"), Converters.listConverter(ArgType.STRING).convert("[\"a\", 'b']"));
        assertEquals(List.of("a", "b", "c"), Converters.listConverter(ArgType.STRING).convert("a, b,c"));
        assertEquals(List.of(0.5), Converters.listConverter(ArgType.FLOAT).convert("0.5"));
        assertEquals(List.of(), Converters.listConverter(ArgType.STRING).convert("[]"));
    }

    @Test
    void mergedOverridesReplaceDefaults() throws Exception {
        var overrides = ConverterRegistry.builder().put(Converters.UUID_TYPE, value -> "custom").build();
        var merged = ConverterRegistry.merge(ConverterRegistry.defaults(), overrides);
        assertEquals("custom", merged.get("UUID").convert("x"));
        assertEquals(123L, merged.get(Converters.LONG).convert("123"));
    }

    @Test
    void findsByOriginOnlyForGenericNames() {
        var table = ConverterRegistry.builder().put("Box", value -> value).build();
        assertEquals(table.get("Box"), table.findByName("Box<Integer>"));
        assertNull(table.findByName("Crate"));
        assertNull(table.find(ArgType.named("Crate")));
    }
}
