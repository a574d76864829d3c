package work.clibind.api;

/**
 * Callback for exceptions raised while parsing or running a command.
 */
@FunctionalInterface
public interface ErrorHandler {
    /**
     * @return exit code to end the run with, or {@code null} to treat the error as handled
     */
    Integer handle(Throwable error);
}
