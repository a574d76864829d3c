package work.clibind.parse;

/**
 * Parser-wide settings shared by every command of one CLI.
 *
 * @param prog program name shown in usage lines, may be {@code null}
 * @param version version printed by {@code --version}; {@code null} disables the option
 * @param extraKey name under which unmatched tokens are stored for commands that accept them
 * @param fillDefaults whether missing arguments get their defaults; when off they stay
 *     {@link work.clibind.types.Unset#VALUE} and no required check happens
 */
public record ParserSettings(String prog, String version, String extraKey, boolean fillDefaults) {
    public static final String DEFAULT_EXTRA_KEY = "_extra";

    public ParserSettings {
        extraKey = extraKey == null ? DEFAULT_EXTRA_KEY : extraKey;
    }

    public static ParserSettings defaults() {
        return new ParserSettings(null, null, DEFAULT_EXTRA_KEY, true);
    }
}
