package difftree;

import java.util.List;

/**
 * Turns the complete output of an archive diff into tree entries.
 * <p>
 * Parsing is all or nothing: the first record that can't be understood fails the whole output
 * with a {@link DiffParseException}.
 */
public interface DiffParser {

    List<PathTree.Entry<DiffPayload>> parse(String output);
}
