package difftree;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of a {@link PathTree}.
 * <p>
 * Children are only ever added or removed through the owning tree. The parent reference
 * is a plain back reference, the parent owns its children.
 */
public final class PathTreeNode<T> {

    private final TreePath path;
    private final String segment;
    @Nullable
    private T payload;
    private final List<PathTreeNode<T>> children = new ArrayList<>();
    private final Map<String, PathTreeNode<T>> childrenBySegment = new HashMap<>();
    @Nullable
    private PathTreeNode<T> parent;

    PathTreeNode(TreePath path, String segment, @Nullable T payload) {
        this.path = path;
        this.segment = segment;
        this.payload = payload;
    }

    void add(PathTreeNode<T> child) {
        if (childrenBySegment.containsKey(child.segment)) {
            throw new IllegalStateException("segment '" + child.segment + "' is already a child of '" + path + "'");
        }
        child.parent = this;
        children.add(child);
        childrenBySegment.put(child.segment, child);
    }

    void remove(PathTreeNode<T> child) {
        if (!children.remove(child)) {
            throw new IllegalStateException(child.path + " is not a child of '" + path + "'");
        }
        childrenBySegment.remove(child.segment);
        child.parent = null;
    }

    void setPayload(@Nullable T payload) {
        this.payload = payload;
    }

    @Nullable
    public PathTreeNode<T> child(String segment) {
        return childrenBySegment.get(segment);
    }

    /**
     * Walks down the given relative path.
     */
    @Nullable
    public PathTreeNode<T> descendant(TreePath relativePath) {
        PathTreeNode<T> node = this;
        for (String part : relativePath.segments()) {
            node = node.child(part);
            if (node == null) {
                return null;
            }
        }
        return node;
    }

    public int indexOf(PathTreeNode<T> child) {
        return children.indexOf(child);
    }

    public TreePath getPath() {
        return path;
    }

    public String getSegment() {
        return segment;
    }

    @Nullable
    public T getPayload() {
        return payload;
    }

    public List<PathTreeNode<T>> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public int childCount() {
        return children.size();
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    @Nullable
    public PathTreeNode<T> getParent() {
        return parent;
    }

    public boolean isRoot() {
        return path.isRoot();
    }

    @Override
    public String toString() {
        List<String> childSegments = children.stream().map(PathTreeNode::getSegment).toList();
        return "PathTreeNode<'" + path + "', '" + segment + "', " + payload + ", " + childSegments + ">";
    }
}
