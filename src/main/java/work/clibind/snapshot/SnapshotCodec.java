package work.clibind.snapshot;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.clibind.runtime.Command;
import work.clibind.runtime.CommandFunction;
import work.clibind.runtime.CommandRegistry;
import work.clibind.types.Action;
import work.clibind.types.ArgHint;
import work.clibind.types.ArgType;
import work.clibind.types.ArgumentSpec;
import work.clibind.types.Converter;
import work.clibind.types.ConverterRegistry;
import work.clibind.types.Converters;
import work.clibind.types.Unset;

/**
 * Converts a command registry to its static JSON form and back.
 *
 * <p>Restored commands do nothing when invoked. Converters are recovered by type name from the
 * supplied table, then from the primitive converter of the resolved type, then plain strings.
 */
public final class SnapshotCodec {
    private static final Logger log = LoggerFactory.getLogger(SnapshotCodec.class);
    private static final ObjectMapper JSON = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private SnapshotCodec() {}

    public static StaticData snapshot(String prog, String help, String version, String extraKey, CommandRegistry registry) {
        Map<String, StaticCommand> commands = new LinkedHashMap<>();
        for (Command command : registry.commands().values()) {
            commands.put(command.name(), toStatic(command));
        }
        Map<String, Map<String, StaticCommand>> subcommands = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Command>> entry : registry.subcommands().entrySet()) {
            Map<String, StaticCommand> subs = new LinkedHashMap<>();
            for (Command sub : entry.getValue().values()) {
                subs.put(sub.name(), toStatic(sub));
            }
            subcommands.put(entry.getKey(), subs);
        }
        return new StaticData(prog, help, version, extraKey, commands, subcommands);
    }

    public static CommandRegistry restore(StaticData data, ConverterRegistry converters) {
        ConverterRegistry table = converters == null ? ConverterRegistry.defaults() : converters;
        CommandRegistry registry = new CommandRegistry();
        for (StaticCommand command : data.commands().values()) {
            registry.register(fromStatic(command, table));
        }
        for (Map<String, StaticCommand> subs : data.subcommands().values()) {
            for (StaticCommand sub : subs.values()) {
                registry.register(fromStatic(sub, table));
            }
        }
        return registry;
    }

    public static void write(StaticData data, Path path) throws IOException {
        JSON.writeValue(path.toFile(), data);
        log.debug("Wrote static snapshot with {} command(s) to {}", data.commands().size(), path);
    }

    /**
     * @throws IllegalArgumentException when {@code path} is not an existing regular file
     */
    public static StaticData read(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Not a valid file path: " + path);
        }
        StaticData data = JSON.readValue(path.toFile(), StaticData.class);
        log.debug("Read static snapshot with {} command(s) from {}", data.commands().size(), path);
        return data;
    }

    static StaticCommand toStatic(Command command) {
        List<StaticArg> args = new ArrayList<>(command.args().size());
        for (ArgumentSpec arg : command.args()) {
            args.add(toStatic(arg));
        }
        return new StaticCommand(
            command.name(),
            args,
            command.description(),
            command.allowExtra(),
            command.parent(),
            command.placeholder()
        );
    }

    static StaticArg toStatic(ArgumentSpec arg) {
        return new StaticArg(
            arg.id(),
            arg.hint().option(),
            arg.hint().shortName(),
            arg.hint().help(),
            stringifyDefault(arg.defaultValue()),
            arg.help(),
            arg.action().tag(),
            arg.choiceStrings(),
            arg.hasConverter(),
            arg.type() == null ? null : arg.type().canonicalName(),
            arg.origType() == null ? null : arg.origType().canonicalName()
        );
    }

    static Command fromStatic(StaticCommand command, ConverterRegistry table) {
        List<ArgumentSpec> args = new ArrayList<>(command.args().size());
        for (StaticArg arg : command.args()) {
            args.add(fromStatic(arg, table));
        }
        return new Command(
            command.name(),
            CommandFunction.noop(),
            args,
            command.description(),
            command.allowExtra(),
            command.parent(),
            command.placeholder()
        );
    }

    static ArgumentSpec fromStatic(StaticArg arg, ConverterRegistry table) {
        Action action = Action.fromTag(arg.action());
        ArgType type = typeNamed(arg.type());
        ArgType origType = typeNamed(arg.origType());
        Converter converter = action.isFlag() ? null : restoreConverter(arg, type, table);
        ArgHint hint = new ArgHint(arg.option(), arg.shortName(), arg.origHelp(), null, action == Action.COUNT);
        List<Object> choices = arg.choices() == null ? null : new ArrayList<>(arg.choices());
        return new ArgumentSpec(
            arg.id(),
            hint,
            type,
            converter,
            origType,
            restoreDefault(arg.defaultValue(), action, type),
            action,
            choices,
            arg.hasConverter(),
            arg.help()
        );
    }

    static String stringifyDefault(Object value) {
        if (value == null) {
            return null;
        }
        if (Unset.isUnset(value)) {
            return Unset.MARKER;
        }
        return ArgumentSpec.choiceString(value);
    }

    private static Object restoreDefault(String raw, Action action, ArgType type) {
        if (raw == null) {
            return null;
        }
        if (Unset.MARKER.equals(raw)) {
            return Unset.VALUE;
        }
        switch (action) {
            case COUNT:
                try {
                    return Integer.parseInt(raw);
                } catch (NumberFormatException ex) {
                    return 0;
                }
            case STORE_TRUE:
            case NEGATABLE:
                return Boolean.parseBoolean(raw);
            case STORE:
                return convertDefault(raw, type == null ? null : primitiveOf(type));
            case APPEND:
                return convertDefault(raw, Converters.listConverter(type == null ? ArgType.STRING : primitiveType(type)));
            default:
                return raw;
        }
    }

    private static Object convertDefault(String raw, Converter converter) {
        if (converter == null) {
            return raw;
        }
        try {
            return converter.convert(raw);
        } catch (Exception ex) {
            log.debug("Keeping default '{}' as string: {}", raw, ex.getMessage());
            return raw;
        }
    }

    // ExistingPath and friends fall back to the converter of their supertype
    private static Converter primitiveOf(ArgType type) {
        Converter primitive = Converters.primitive(type);
        if (primitive == null && type.supertype().isPresent()) {
            primitive = Converters.primitive(type.supertype().get());
        }
        return primitive;
    }

    private static ArgType primitiveType(ArgType type) {
        if (Converters.primitive(type) != null) {
            return type;
        }
        return type.supertype().filter(supertype -> Converters.primitive(supertype) != null).orElse(ArgType.STRING);
    }

    private static Converter restoreConverter(StaticArg arg, ArgType type, ConverterRegistry table) {
        Converter converter = arg.origType() == null ? null : table.findByName(arg.origType());
        if (converter == null && arg.type() != null) {
            converter = table.findByName(arg.type());
        }
        if (converter == null && type != null) {
            converter = Converters.primitive(type);
        }
        return converter != null ? converter : Converters.primitive(ArgType.STRING);
    }

    private static ArgType typeNamed(String canonicalName) {
        if (canonicalName == null) {
            return null;
        }
        ArgType builtin = Converters.builtinType(canonicalName);
        return builtin != null ? builtin : ArgType.fromCanonicalName(canonicalName);
    }
}
