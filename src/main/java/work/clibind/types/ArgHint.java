package work.clibind.types;

/**
 * Per-parameter settings supplied when a command is registered.
 *
 * @param option long option name such as {@code --name}; {@code null} for positional arguments
 * @param shortName short option name such as {@code -n}
 * @param help help text
 * @param converter explicit converter, used when the converter table has none for the type
 * @param count whether repeated use of the flag is counted ({@code -vvv} gives 3)
 */
public record ArgHint(String option, String shortName, String help, Converter converter, boolean count) {
    private static final ArgHint NONE = new ArgHint(null, null, null, null, false);

    public static ArgHint none() {
        return NONE;
    }

    public static ArgHint positional(String help) {
        return new ArgHint(null, null, help, null, false);
    }

    public static ArgHint option(String option, String help) {
        return new ArgHint(option, null, help, null, false);
    }

    public static ArgHint option(String option, String shortName, String help) {
        return new ArgHint(option, shortName, help, null, false);
    }

    public static ArgHint counter(String option, String shortName, String help) {
        return new ArgHint(option, shortName, help, null, true);
    }

    public ArgHint withConverter(Converter converter) {
        return new ArgHint(option, shortName, help, converter, count);
    }

    public boolean isPositional() {
        return option == null && shortName == null;
    }
}
