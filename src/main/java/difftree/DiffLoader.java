package difftree;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

import static difftree.Util.bytesToHumanReadableFormat;

/**
 * Loads archive diff output into a {@link DiffTree}.
 * <p>
 * The output is parsed completely before the tree is built, so a parse error never leaves a partially
 * filled tree behind. The returned tree is complete and can be handed to another thread for display.
 */
public class DiffLoader {

    private static final String DIVIDER = "******";

    private final Logger logger = LoggerFactory.getLogger("difftree");
    private final ConfigProvider configProvider;

    public DiffLoader() throws IOException {
        this(new PropertiesConfigProvider());
    }

    public DiffLoader(ConfigProvider configProvider) {
        this.configProvider = configProvider;
    }

    public DiffTree load(String output) {
        return load(output, configProvider.isJsonLines());
    }

    public DiffTree load(String output, boolean jsonLines) {
        DiffParser parser = jsonLines ? new JsonDiffParser() : new TextDiffParser();
        logger.debug("parsing {} diff output with {} characters", jsonLines ? "json lines" : "text", output.length());
        List<PathTree.Entry<DiffPayload>> entries;
        try {
            entries = parser.parse(output);
        } catch (DiffParseException e) {
            logger.error("Couldn't load diff output, nothing was loaded: {}", e.getMessage());
            throw e;
        }
        return publish(entries);
    }

    /**
     * Loads a single JSON record, which is what a diff with one changed path produces.
     */
    public DiffTree load(JsonNode record) {
        List<PathTree.Entry<DiffPayload>> entries;
        try {
            entries = List.of(new JsonDiffParser().parseRecord(record));
        } catch (DiffParseException e) {
            logger.error("Couldn't load diff record, nothing was loaded: {}", e.getMessage());
            throw e;
        }
        return publish(entries);
    }

    private DiffTree publish(List<PathTree.Entry<DiffPayload>> entries) {
        DiffTree tree = new DiffTree();
        tree.insertAll(entries);
        tree.setMode(configProvider.getDisplayMode());
        logSummary(entries.size(), DiffSummary.of(tree));
        return tree;
    }

    private void logSummary(int recordCount, DiffSummary summary) {
        logger.info(DIVIDER);
        logger.info("loaded {} diff records into {} changed paths", recordCount, summary.changedCount());
        logger.info("added: {}, removed: {}, modified: {}", summary.added().size(), summary.removed().size(), summary.modified().size());
        logger.info("total size change {}", bytesToHumanReadableFormat(summary.totalSizeDelta()));
        logger.info(DIVIDER);
        if (logger.isDebugEnabled()) {
            for (TreePath path : summary.added()) {
                logger.debug("{} was added", path);
            }
            for (TreePath path : summary.removed()) {
                logger.debug("{} was removed", path);
            }
            for (TreePath path : summary.modified()) {
                logger.debug("{} was modified", path);
            }
        }
    }
}
