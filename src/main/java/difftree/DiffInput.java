package difftree;

import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;

/**
 * Where diff output is read from, shared by all commands.
 */
public class DiffInput {

    @Option(names = {"--file"}, description = "File containing the diff output, stdin if not given",
            paramLabel = "file", required = false)
    private File file;

    @Option(names = {"--json-lines"}, description = "The diff output is in JSON lines format",
            paramLabel = "json-lines", required = false)
    private Boolean jsonLines;

    String read() throws IOException {
        if (file == null) {
            return Util.readDiffOutput(System.in);
        }
        return Util.readDiffOutput(file.toPath());
    }

    boolean isJsonLines(ConfigProvider configProvider) {
        return jsonLines != null ? jsonLines : configProvider.isJsonLines();
    }
}
