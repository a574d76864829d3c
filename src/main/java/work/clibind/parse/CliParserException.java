package work.clibind.parse;

/**
 * Any failure while parsing or validating command-line arguments: bad values, missing
 * required arguments, unrecognized tokens, unknown subcommands.
 */
public class CliParserException extends RuntimeException {
    public CliParserException(String message) {
        super(message);
    }

    public CliParserException(String message, Throwable cause) {
        super(message, cause);
    }
}
