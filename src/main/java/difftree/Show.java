package difftree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

import static difftree.Util.bytesToHumanReadableFormat;

@Command(name = "show", mixinStandardHelpOptions = true, description = "show the changes of an archive diff")
public class Show implements Callable<Integer> {

    private final Logger logger = LoggerFactory.getLogger("difftree");

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private DiffInput input;

    @Option(names = {"--mode"}, description = "How to display the changes: ${COMPLETION-CANDIDATES}",
            paramLabel = "mode", required = false)
    private DisplayMode mode;

    @Option(names = {"--sort"}, description = "The column to sort by: ${COMPLETION-CANDIDATES}",
            paramLabel = "column", required = false)
    private SortColumn sortColumn;

    @Option(names = {"--descending"}, description = "Sort in descending order",
            paramLabel = "descending", required = false)
    private Boolean descending;

    @Option(names = {"--folders-on-top"}, description = "Keep folders above files when sorting",
            paramLabel = "folders-on-top", required = false)
    private Boolean foldersOnTop;

    @Option(names = {"--details"}, description = "Show mode, owner and content changes of every row",
            paramLabel = "details", required = false)
    private boolean details;

    @Option(names = {"--summary"}, description = "Print the number of changes at the end",
            paramLabel = "summary", required = false)
    private boolean summary;

    private ConfigProvider configProvider;

    public Show() {
    }

    public Show(ConfigProvider configProvider) {
        this.configProvider = configProvider;
    }

    @Override
    public Integer call() throws Exception {
        if (configProvider == null) {
            configProvider = new PropertiesConfigProvider();
        }
        PrintWriter out = spec.commandLine().getOut();
        DiffTree tree;
        try {
            tree = new DiffLoader(configProvider).load(input.read(), input.isJsonLines(configProvider));
        } catch (DiffParseException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return 1;
        }
        if (mode != null) {
            tree.setMode(mode);
        }
        DiffSortPolicy sortPolicy = new DiffSortPolicy(tree,
                sortColumn != null ? sortColumn : configProvider.getSortColumn(),
                descending != null ? !descending : configProvider.isSortAscending(),
                foldersOnTop != null ? foldersOnTop : configProvider.isFoldersOnTop());
        logger.debug("showing diff in {} mode", tree.getMode());
        new DiffTreePrinter(tree, sortPolicy, details).print(out);

        if (summary) {
            DiffSummary diffSummary = DiffSummary.of(tree);
            out.println();
            out.println("added: " + diffSummary.added().size()
                    + ", removed: " + diffSummary.removed().size()
                    + ", modified: " + diffSummary.modified().size()
                    + ", total size change: " + bytesToHumanReadableFormat(diffSummary.totalSizeDelta()));
            out.flush();
        }
        return 0;
    }
}
