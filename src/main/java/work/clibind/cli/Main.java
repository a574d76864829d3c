package work.clibind.cli;

import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    static int execute(String... args) {
        return commandLine().execute(args);
    }

    static CommandLine commandLine() {
        CommandLine commandLine = new CommandLine(new ClibindCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler());
        // everything after the snapshot path belongs to the snapshot's own CLI
        commandLine.getSubcommands().get("run").setStopAtPositional(true);
        return commandLine;
    }
}
