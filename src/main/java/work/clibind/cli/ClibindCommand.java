package work.clibind.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "clibind",
    description = "Work with static snapshots of clibind command-line interfaces.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = { RunSnapshotCommand.class, DocsCommand.class }
)
final class ClibindCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }
}
