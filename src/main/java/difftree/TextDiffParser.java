package difftree;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static difftree.Util.sizeToBytes;

/**
 * Parses the plain text output of an archive diff, one changed path per line:
 *
 * <pre>
 * [-rw-rw-r-- -> lrwxrwxrwx] home/theuser/Documents/testdir/file2
 *     +32 B     -36 B [-r--rw---- -> -rwxrwx--x] home/theuser/Documents/testfile.txt
 * added directory     home/theuser/Documents/newfolder
 * removed         0 B home/theuser/Documents/testdir/file1
 * added          20 B home/theuser/Documents/testdir/file4
 * changed link        home/theuser/Documents/testlink
 * changed link [theuser:dip -> theuser:theuser] home/theuser/Documents/testlink
 * </pre>
 * <p>
 * Content modifications without the amount of added and removed bytes can't be expressed
 * in this format.
 */
public class TextDiffParser implements DiffParser {

    private static final String ADDED_REMOVED =
            "(?<ar>added|removed) (?<arType>directory|link|\\s*(?<size>[\\d.]+) (?<sizeUnit>\\w+))\\s*";
    private static final String CHANGED_LINK = "changed link\\s+";
    private static final String MODIFIED =
            "\\s*\\+?(?<added>[\\d.]+) (?<addedUnit>\\w+)\\s*-?(?<removed>[\\d.]+) (?<removedUnit>\\w+)";
    private static final String MODE = "\\[(?<oldMode>[\\w-]{10}) -> (?<newMode>[\\w-]{10})\\]";
    private static final String OWNER =
            "\\[(?<oldUser>[\\w .-]+):(?<oldGroup>[\\w .-]+) -> (?<newUser>[\\w .-]+):(?<newGroup>[\\w .-]+)\\]";

    private static final Pattern CHANGED_FILE = Pattern.compile(
            "(?:(?:" + ADDED_REMOVED + " )"
                    + "|(?:(?<cl>" + CHANGED_LINK + ")?"
                    + "(?<modified>" + MODIFIED + "\\s+)?"
                    + "(?<owner>" + OWNER + "\\s+)?"
                    + "(?<mode>" + MODE + "\\s+)?))"
                    + "(?<path>.*)", Pattern.UNICODE_CHARACTER_CLASS);

    @Override
    public List<PathTree.Entry<DiffPayload>> parse(String output) {
        return parse(output.lines().toList());
    }

    public List<PathTree.Entry<DiffPayload>> parse(List<String> lines) {
        List<PathTree.Entry<DiffPayload>> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            result.add(parseLine(line));
        }
        return result;
    }

    public PathTree.Entry<DiffPayload> parseLine(String line) {
        Matcher matcher = CHANGED_FILE.matcher(line);
        if (!matcher.matches()) {
            throw new DiffParseException("Couldn't parse diff output", line);
        }
        TreePath path = TreePath.of(matcher.group("path").strip());
        if (path.isRoot()) {
            throw new DiffParseException("Missing path in diff output", line);
        }

        DiffPayload.Builder builder = DiffPayload.builder();
        try {
            if (matcher.group("ar") != null) {
                addedOrRemoved(matcher, builder);
            } else {
                if (matcher.group("cl") != null) {
                    builder.changedLink();
                }
                if (matcher.group("modified") != null) {
                    builder.modified(sizeToBytes(matcher.group("added"), matcher.group("addedUnit")),
                            sizeToBytes(matcher.group("removed"), matcher.group("removedUnit")));
                }
                if (matcher.group("owner") != null) {
                    builder.owner(matcher.group("oldUser"), matcher.group("oldGroup"),
                            matcher.group("newUser"), matcher.group("newGroup"));
                }
                if (matcher.group("mode") != null) {
                    builder.mode(matcher.group("oldMode"), matcher.group("newMode"));
                }
            }
        } catch (DiffParseException e) {
            throw new DiffParseException("Couldn't parse diff output (" + e.getMessage() + ")", line, e);
        }
        if (!builder.hasFacts()) {
            throw new DiffParseException("No change found in diff output", line);
        }
        return new PathTree.Entry<>(path, builder.build());
    }

    private void addedOrRemoved(Matcher matcher, DiffPayload.Builder builder) {
        FileType fileType = FileType.FILE;
        long size = 0;
        String type = matcher.group("arType");
        if (type.equals("directory")) {
            fileType = FileType.DIRECTORY;
        } else if (type.equals("link")) {
            fileType = FileType.LINK;
        } else {
            size = sizeToBytes(matcher.group("size"), matcher.group("sizeUnit"));
        }
        if (matcher.group("ar").equals("added")) {
            builder.added(fileType, size);
        } else {
            builder.removed(fileType, size);
        }
    }
}
