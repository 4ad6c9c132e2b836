package difftree;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A relative path made of segments, independent of the local filesystem.
 * <p>
 * The empty path is the {@link #ROOT} of a {@link PathTree}.
 */
public record TreePath(List<String> segments) implements Comparable<TreePath> {

    public static final String SEPARATOR = "/";

    public static final TreePath ROOT = new TreePath(List.of());

    public TreePath {
        segments = List.copyOf(segments);
        for (String segment : segments) {
            if (segment.isEmpty() || segment.contains(SEPARATOR)) {
                throw new IllegalArgumentException("invalid path segment '" + segment + "'");
            }
        }
    }

    /**
     * Splits a path as printed by the backup tool. Leading slashes, empty segments
     * and "." segments are dropped.
     */
    public static TreePath of(String path) {
        List<String> segments = new ArrayList<>();
        for (String part : path.split(SEPARATOR)) {
            if (part.isEmpty() || part.equals(".")) {
                continue;
            }
            segments.add(part);
        }
        return segments.isEmpty() ? ROOT : new TreePath(segments);
    }

    public static TreePath of(String first, String... more) {
        List<String> segments = new ArrayList<>();
        segments.add(first);
        segments.addAll(List.of(more));
        return new TreePath(segments);
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public int depth() {
        return segments.size();
    }

    /**
     * The last segment, or the empty string for the root.
     */
    public String name() {
        return isRoot() ? "" : segments.get(segments.size() - 1);
    }

    @Nullable
    public TreePath parent() {
        if (isRoot()) {
            return null;
        }
        return prefix(segments.size() - 1);
    }

    public TreePath prefix(int length) {
        return new TreePath(segments.subList(0, length));
    }

    public TreePath resolve(String segment) {
        List<String> result = new ArrayList<>(segments);
        result.add(segment);
        return new TreePath(result);
    }

    public boolean startsWith(TreePath other) {
        return other.depth() <= depth() && segments.subList(0, other.depth()).equals(other.segments);
    }

    /**
     * The path of {@code descendant} relative to this path.
     */
    public TreePath relativize(TreePath descendant) {
        if (!descendant.startsWith(this)) {
            throw new IllegalArgumentException(descendant + " is not below " + this);
        }
        return new TreePath(descendant.segments.subList(depth(), descendant.depth()));
    }

    public String toAbsoluteString() {
        return SEPARATOR + this;
    }

    @Override
    public int compareTo(TreePath other) {
        int common = Math.min(depth(), other.depth());
        for (int i = 0; i < common; i++) {
            int result = segments.get(i).compareTo(other.segments.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(depth(), other.depth());
    }

    @Override
    public String toString() {
        return String.join(SEPARATOR, segments);
    }
}
