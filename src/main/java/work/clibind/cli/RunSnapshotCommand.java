package work.clibind.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.clibind.api.CliSettings;
import work.clibind.api.StaticCli;

@CommandLine.Command(
    name = "run",
    description = "Run a static CLI snapshot: shows its help and reports argument errors without the real commands.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class RunSnapshotCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--debug", description = "Print markers around the static run.")
    private boolean debug;

    @CommandLine.Parameters(index = "0", paramLabel = "SNAPSHOT", description = "Snapshot JSON file.")
    private Path snapshot;

    @CommandLine.Parameters(index = "1..*", paramLabel = "ARGS", description = "Arguments passed to the snapshot CLI.")
    private List<String> args = new ArrayList<>();

    @Override
    public Integer call() throws Exception {
        StaticCli cli = StaticCli.load(snapshot, debug, CliSettings.builder().out(spec.commandLine().getOut()));
        return cli.run(args);
    }
}
