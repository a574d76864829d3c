package work.clibind.cli;

import picocli.CommandLine;
import work.clibind.parse.CliParserException;
import work.clibind.runtime.CommandNotFoundException;

/**
 * Prints failures of {@code run} and {@code docs} as one line on stderr.
 *
 * <p>Mistakes in the arguments handed to a snapshot CLI are usage errors: they are prefixed
 * with {@code error:} and exit with {@link CommandLine.ExitCode#USAGE}.
 * Set {@code -Dclibind.debug=true} to also get the stack trace.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "clibind.debug";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        boolean usage = ex instanceof CliParserException || ex instanceof CommandNotFoundException;
        String message = usage ? "error: " + describe(ex) : describe(ex);
        commandLine.getErr().println(commandLine.getColorScheme().errorText(message));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(commandLine.getErr());
        }
        commandLine.getErr().flush();
        return usage ? CommandLine.ExitCode.USAGE : commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Throwable ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            Throwable cause = ex.getCause();
            return cause != null && cause != ex ? describe(cause) : ex.getClass().getSimpleName();
        }
        return message;
    }
}
