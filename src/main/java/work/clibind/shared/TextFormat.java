package work.clibind.shared;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Small text helpers for help output and documentation.
 */
public final class TextFormat {
    private static final int MAX_COLUMN_WIDTH = 50;
    private static final int DEFAULT_HELP_WIDTH = 70;
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextFormat() {}

    /**
     * Joins the non-empty parts with the separator; {@code null} when nothing is left.
     */
    public static String joinStrings(String separator, String... parts) {
        List<String> kept = new ArrayList<>();
        for (String part : parts) {
            if (part != null && !part.isEmpty()) {
                kept.add(part);
            }
        }
        return kept.isEmpty() ? null : String.join(separator, kept);
    }

    /**
     * Left-aligned table; columns are as wide as their widest cell, capped at 50, and separated
     * by three spaces. Surrounded by newlines.
     */
    public static String formatTable(List<String[]> rows) {
        int columns = 0;
        for (String[] row : rows) {
            columns = Math.max(columns, row.length);
        }
        int[] widths = new int[columns];
        for (String[] row : rows) {
            for (int i = 0; i < row.length; i++) {
                widths[i] = Math.max(widths[i], length(row[i]));
            }
        }
        List<String> lines = new ArrayList<>();
        for (String[] row : rows) {
            List<String> cells = new ArrayList<>();
            for (int i = 0; i < row.length; i++) {
                cells.add(pad(row[i] == null ? "" : row[i], Math.min(widths[i], MAX_COLUMN_WIDTH)));
            }
            lines.add(String.join("   ", cells));
        }
        return "\n" + String.join("\n", lines) + "\n";
    }

    public static String formatArgHelp(String text) {
        return formatArgHelp(text, DEFAULT_HELP_WIDTH);
    }

    /**
     * Shortens a description to at most {@code maxWidth} characters, cutting at the last sentence
     * end or, failing that, the last word boundary and adding an ellipsis.
     */
    public static String formatArgHelp(String text, int maxWidth) {
        String stripped = text == null ? "" : text.strip();
        if (stripped.length() <= maxWidth) {
            return stripped;
        }
        String cut = stripped.substring(0, maxWidth);
        int sentence = cut.lastIndexOf('.');
        if (sentence > 0) {
            return cut.substring(0, sentence) + ".";
        }
        int word = cut.lastIndexOf(' ');
        return (word > 0 ? cut.substring(0, word) : cut) + "...";
    }

    /**
     * Collapses all whitespace runs into single spaces.
     */
    public static String collapseWhitespace(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }

    private static int length(String cell) {
        return cell == null ? 0 : cell.length();
    }

    private static String pad(String cell, int width) {
        if (cell.length() >= width) {
            return cell;
        }
        return cell + " ".repeat(width - cell.length());
    }
}
