package work.clibind.api;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import work.clibind.snapshot.SnapshotCodec;
import work.clibind.snapshot.StaticData;

/**
 * A {@link Cli} loaded from a static snapshot. It shows help and reports argument errors
 * without the real command implementations; its commands do nothing when run.
 */
public final class StaticCli extends Cli {
    static final String DEBUG_START = "===== STATIC =====";
    static final String DEBUG_END = "=== END STATIC ===";

    private final Path path;
    private final StaticData data;
    private final boolean debug;

    private StaticCli(CliSettings settings, StaticData data, Path path, boolean debug) {
        super(settings, SnapshotCodec.restore(data, settings.converters()));
        this.path = path;
        this.data = data;
        this.debug = debug;
    }

    public static StaticCli load(Path path) throws IOException {
        return load(path, false);
    }

    public static StaticCli load(Path path, boolean debug) throws IOException {
        return load(path, debug, CliSettings.builder());
    }

    /**
     * Loads a snapshot. Program name, help, version and extra key come from the snapshot; custom
     * converters, error handlers and the output writer from {@code settings}.
     *
     * @throws IllegalArgumentException when {@code path} is not an existing file
     */
    public static StaticCli load(Path path, boolean debug, CliSettings.Builder settings) throws IOException {
        StaticData data = SnapshotCodec.read(path);
        CliSettings merged = settings
            .prog(data.prog())
            .help(data.help())
            .version(data.version())
            .extraKey(data.extraKey())
            .build();
        return new StaticCli(merged, data, path, debug);
    }

    public Path path() {
        return path;
    }

    public StaticData data() {
        return data;
    }

    @Override
    public int run(List<String> args) throws Exception {
        if (debug) {
            settings().out().println(DEBUG_START);
        }
        int exitCode = super.run(args);
        if (debug) {
            settings().out().println(DEBUG_END);
            settings().out().flush();
        }
        return exitCode;
    }
}
