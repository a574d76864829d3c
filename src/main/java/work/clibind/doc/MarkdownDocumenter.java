package work.clibind.doc;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.clibind.runtime.Command;
import work.clibind.runtime.CommandRegistry;
import work.clibind.shared.TextFormat;
import work.clibind.types.Action;
import work.clibind.types.ArgType;
import work.clibind.types.ArgumentSpec;
import work.clibind.types.Unset;

/**
 * Renders the commands of a registry as Markdown: one heading per command and an argument
 * table listing names, types, descriptions and defaults.
 */
public final class MarkdownDocumenter {
    public static final String DEFAULT_COMMENT = "This file is auto-generated";

    private static final String[] HEADER = { "Argument", "Type", "Description", "Default" };

    private final String prog;
    private final String help;
    private final CommandRegistry registry;

    public MarkdownDocumenter(String prog, String help, CommandRegistry registry) {
        this.prog = prog;
        this.help = help;
        this.registry = registry;
    }

    /**
     * @param title top-level heading; when set, the CLI heading moves one level down
     * @param description paragraph below the title
     * @param comment HTML comment at the top, {@code null} for none
     * @param pathRoot directory path defaults are shown relative to, {@code null} to keep them as is
     */
    public String document(String title, String description, String comment, Path pathRoot) {
        List<String> lines = new ArrayList<>();
        int startHeading = title != null ? 2 : 1;
        if (comment != null) {
            lines.add("<!-- " + comment + " -->");
        }
        if (title != null) {
            lines.add("# " + title);
        }
        if (description != null) {
            lines.add(TextFormat.collapseWhitespace(description));
        }
        boolean hasProg = prog != null && !prog.isEmpty();
        String prefix = hasProg ? prog + " " : "";
        lines.add(heading(startHeading) + " " + (hasProg ? "`" + prog + "`" : "CLI"));
        if (help != null && !help.isEmpty()) {
            lines.add(help);
        }
        Map<String, Map<String, Command>> subcommands = registry.subcommands();
        for (Command command : registry.commands().values()) {
            lines.addAll(command(command, startHeading + 1, prefix, pathRoot));
            for (Command sub : subcommands.getOrDefault(command.name(), Map.of()).values()) {
                lines.addAll(command(sub, startHeading + 2, prefix, pathRoot));
            }
        }
        // subcommands whose parent was never registered
        for (Map.Entry<String, Map<String, Command>> entry : subcommands.entrySet()) {
            if (registry.commands().containsKey(entry.getKey())) {
                continue;
            }
            lines.add(heading(startHeading + 1) + " `" + prefix + entry.getKey() + "`");
            for (Command sub : entry.getValue().values()) {
                lines.addAll(command(sub, startHeading + 2, prefix, pathRoot));
            }
        }
        return String.join("\n\n", lines);
    }

    private static List<String> command(Command command, int level, String prefix, Path pathRoot) {
        List<String> lines = new ArrayList<>();
        lines.add(heading(level) + " `" + prefix + command.displayName() + "`");
        if (command.description() != null && !command.description().isBlank()) {
            lines.add(TextFormat.collapseWhitespace(command.description()));
        }
        if (command.args().isEmpty()) {
            return lines;
        }
        StringBuilder table = new StringBuilder();
        table.append(row(HEADER)).append('\n');
        table.append(row(new String[] { "---", "---", "---", "---" }));
        for (ArgumentSpec arg : command.args()) {
            String name = "`" + arg.displayName() + "`";
            if (arg.action() == Action.NEGATABLE && Boolean.TRUE.equals(arg.defaultValue())) {
                name += "/`" + arg.negatedOption() + "`";
            }
            if (arg.hint().shortName() != null) {
                name += ", `" + arg.hint().shortName() + "`";
            }
            String defaultValue = Unset.isUnset(arg.defaultValue())
                ? ""
                : "`" + formatDefault(arg, pathRoot) + "`";
            String type = arg.displayType();
            String typeCode = type.isEmpty() ? "" : "`" + type + "`";
            String description = arg.hint().help() == null ? "" : arg.hint().help();
            table.append('\n').append(row(new String[] { name, typeCode, description, defaultValue }));
        }
        lines.add(table.toString());
        return lines;
    }

    private static String formatDefault(ArgumentSpec arg, Path pathRoot) {
        Object value = arg.defaultValue();
        // enum defaults restored from a snapshot are plain constant names
        if (value instanceof String name && arg.choices() != null && arg.type() != null
            && arg.type().kind() == ArgType.Kind.NAMED) {
            return arg.type().origin() + "." + name;
        }
        return formatDefault(value, pathRoot);
    }

    static String formatDefault(Object value, Path pathRoot) {
        if (value instanceof Path path) {
            if (pathRoot != null && path.startsWith(pathRoot)) {
                return pathRoot.relativize(path).toString();
            }
            return path.toString();
        }
        if (value instanceof String text) {
            return '"' + text + '"';
        }
        if (value instanceof Enum<?> constant) {
            return constant.getDeclaringClass().getSimpleName() + "." + constant.name();
        }
        return String.valueOf(value);
    }

    private static String row(String[] cells) {
        return "| " + String.join(" | ", cells) + " |";
    }

    private static String heading(int level) {
        return "#".repeat(level);
    }
}
