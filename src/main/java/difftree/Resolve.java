package difftree;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "resolve", mixinStandardHelpOptions = true, description = "find the row displaying a path")
public class Resolve implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private DiffInput input;

    @Option(names = {"--mode"}, description = "The display mode to resolve the path in: ${COMPLETION-CANDIDATES}",
            paramLabel = "mode", required = false)
    private DisplayMode mode;

    @Parameters(index = "0", description = "The path to resolve", paramLabel = "path")
    private String path;

    private ConfigProvider configProvider;

    public Resolve() {
    }

    public Resolve(ConfigProvider configProvider) {
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
        Optional<ViewPosition> position = tree.resolve(TreePath.of(path));
        if (position.isEmpty()) {
            spec.commandLine().getErr().println("'" + path + "' is not displayed in " + tree.getMode() + " mode");
            return 1;
        }
        ViewPosition viewPosition = position.get();
        out.println("displayed: " + viewPosition.displayed().toAbsoluteString());
        out.println("parent: " + viewPosition.parent().toAbsoluteString());
        out.println("row: " + viewPosition.row());
        tree.payloadAt(viewPosition.displayed()).ifPresent(payload -> out.println("change: " + payload.describe()));
        out.flush();
        return 0;
    }
}
