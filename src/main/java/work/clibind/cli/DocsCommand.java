package work.clibind.cli;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.clibind.api.StaticCli;
import work.clibind.doc.MarkdownDocumenter;

@CommandLine.Command(
    name = "docs",
    description = "Generate Markdown documentation for a static CLI snapshot.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class DocsCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(DocsCommand.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "SNAPSHOT", description = "Snapshot JSON file.")
    private Path snapshot;

    @CommandLine.Option(names = "--title", description = "Title of the document.")
    private String title;

    @CommandLine.Option(names = "--description", description = "Paragraph below the title.")
    private String description;

    @CommandLine.Option(names = "--comment", description = "HTML comment at the top.", defaultValue = MarkdownDocumenter.DEFAULT_COMMENT)
    private String comment;

    @CommandLine.Option(names = "--no-comment", description = "Leave out the HTML comment.")
    private boolean noComment;

    @CommandLine.Option(names = "--path-root", description = "Directory path defaults are shown relative to.")
    private Path pathRoot;

    @CommandLine.Option(names = { "-o", "--output" }, description = "Write to this file instead of stdout.")
    private Path output;

    @Override
    public Integer call() throws Exception {
        StaticCli cli = StaticCli.load(snapshot);
        Path root = pathRoot != null ? pathRoot : Path.of("").toAbsolutePath();
        String markdown = cli.document(title, description, noComment ? null : comment, root);
        if (output == null) {
            spec.commandLine().getOut().println(markdown);
            spec.commandLine().getOut().flush();
            return 0;
        }
        Files.writeString(output, markdown + "\n", StandardCharsets.UTF_8);
        log.info("Wrote documentation for {} to {}", snapshot, output);
        return 0;
    }
}
