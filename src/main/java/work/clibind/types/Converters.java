package work.clibind.types;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import work.clibind.parse.CliParserException;

/**
 * Builtin converters and the named types they are registered for.
 */
public final class Converters {
    public static final ArgType EXISTING_PATH = ArgType.named("ExistingPath", ArgType.PATH);
    public static final ArgType EXISTING_FILE_PATH = ArgType.named("ExistingFilePath", ArgType.PATH);
    public static final ArgType EXISTING_DIR_PATH = ArgType.named("ExistingDirPath", ArgType.PATH);

    public static final ArgType EXISTING_PATH_OR_DASH = ArgType.union(EXISTING_PATH, ArgType.literal("-"));
    public static final ArgType EXISTING_FILE_PATH_OR_DASH = ArgType.union(EXISTING_FILE_PATH, ArgType.literal("-"));
    public static final ArgType EXISTING_DIR_PATH_OR_DASH = ArgType.union(EXISTING_DIR_PATH, ArgType.literal("-"));
    public static final ArgType PATH_OR_DASH = ArgType.union(ArgType.PATH, ArgType.literal("-"));

    public static final ArgType UUID_TYPE = ArgType.of(UUID.class);
    public static final ArgType STR_OR_UUID = ArgType.union(ArgType.STRING, UUID_TYPE);
    public static final ArgType LONG = ArgType.of(Long.class);
    public static final ArgType FLOAT32 = ArgType.of(Float.class);

    private static final List<ArgType> NAMED_TYPES = List.of(
        EXISTING_PATH, EXISTING_FILE_PATH, EXISTING_DIR_PATH,
        EXISTING_PATH_OR_DASH, EXISTING_FILE_PATH_OR_DASH, EXISTING_DIR_PATH_OR_DASH,
        PATH_OR_DASH, UUID_TYPE, STR_OR_UUID, LONG, FLOAT32
    );

    private static final String DASH = "-";

    private Converters() {}

    static ConverterRegistry defaults() {
        return ConverterRegistry.builder()
            .put(EXISTING_PATH, Converters::existingPath)
            .put(EXISTING_FILE_PATH, Converters::existingFilePath)
            .put(EXISTING_DIR_PATH, Converters::existingDirPath)
            .put(EXISTING_PATH_OR_DASH, value -> DASH.equals(value) ? value : existingPath(value))
            .put(EXISTING_FILE_PATH_OR_DASH, value -> DASH.equals(value) ? value : existingFilePath(value))
            .put(EXISTING_DIR_PATH_OR_DASH, value -> DASH.equals(value) ? value : existingDirPath(value))
            .put(PATH_OR_DASH, value -> DASH.equals(value) ? value : Path.of(value))
            .put(UUID_TYPE, UUID::fromString)
            .put(STR_OR_UUID, Converters::uuidOrString)
            .put(LONG, Long::parseLong)
            .put(FLOAT32, Float::parseFloat)
            .build();
    }

    /**
     * Type with a builtin converter registered under {@code canonicalName}, or {@code null}.
     */
    public static ArgType builtinType(String canonicalName) {
        for (ArgType type : NAMED_TYPES) {
            if (type.canonicalName().equals(canonicalName)) {
                return type;
            }
        }
        return null;
    }

    /**
     * Converter for one of the primitive value types; {@code null} for anything else.
     */
    public static Converter primitive(ArgType type) {
        return switch (type.kind()) {
            case STRING -> value -> value;
            case INTEGER -> Integer::parseInt;
            case FLOAT -> Double::parseDouble;
            case PATH -> Path::of;
            default -> null;
        };
    }

    /**
     * Primitive type of a literal value, used to convert tokens so they compare equal to the literal.
     */
    public static ArgType typeOfValue(Object value) {
        if (value instanceof Integer) return ArgType.INTEGER;
        if (value instanceof Double) return ArgType.FLOAT;
        if (value instanceof Path) return ArgType.PATH;
        return ArgType.STRING;
    }

    public static Path existingPath(String value) {
        Path path = Path.of(value);
        if (!Files.exists(path)) {
            throw new CliParserException("path does not exist: " + value);
        }
        return path;
    }

    public static Path existingFilePath(String value) {
        Path path = existingPath(value);
        if (!Files.isRegularFile(path)) {
            throw new CliParserException("path is not a file path: " + value);
        }
        return path;
    }

    public static Path existingDirPath(String value) {
        Path path = existingPath(value);
        if (!Files.isDirectory(path)) {
            throw new CliParserException("path is not a directory path: " + value);
        }
        return path;
    }

    public static Object uuidOrString(String value) {
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException ex) {
            return value;
        }
    }

    /**
     * Converter for a single token holding a whole list: {@code a,b,c}, {@code [1, 2]},
     * {@code ["a", "b"]} or {@code ['a', 'b']}. Items are converted with the given primitive type.
     */
    public static Converter listConverter(ArgType itemType) {
        Converter item = primitive(itemType);
        Converter itemConverter = item != null ? item : primitive(ArgType.STRING);
        return value -> {
            String text = value.strip();
            if (text.startsWith("[") && text.endsWith("]")) {
                text = text.substring(1, text.length() - 1);
            }
            List<Object> result = new ArrayList<>();
            for (String part : text.split(",")) {
                String token = unquote(part.strip());
                if (!token.isEmpty()) {
                    result.add(itemConverter.convert(token));
                }
            }
            return result;
        };
    }

    private static String unquote(String token) {
        if (token.length() >= 2) {
            char first = token.charAt(0);
            char last = token.charAt(token.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return token.substring(1, token.length() - 1).strip();
            }
        }
        return token;
    }
}
