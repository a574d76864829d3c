package work.clibind.parse;

/**
 * Lightweight runtime exception used to stop processing once help or version text was printed.
 */
public final class UsageShownException extends RuntimeException {
    private final int exitCode;

    public UsageShownException(String what) {
        this(what, 0);
    }

    public UsageShownException(String what, int exitCode) {
        super(what, null, false, false);
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
