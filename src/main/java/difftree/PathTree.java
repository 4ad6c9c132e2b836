package difftree;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A tree of paths with a payload per node that can be displayed as a tree, a simplified tree
 * or a flat list.
 * <p>
 * Nodes are created for every prefix of an inserted path. Only the last one receives the inserted
 * payload, the others stay without payload until a record for them is inserted as well.
 * <p>
 * Besides the tree itself a flat list of all nodes accepted by {@link #includeInFlat(PathTreeNode)}
 * is kept in insertion order, which makes row lookups in {@link DisplayMode#FLAT} mode O(1).
 * <p>
 * Not thread safe: build the tree completely before handing it to readers.
 *
 * @param <T> the payload type
 */
public class PathTree<T> {

    public record Entry<T>(TreePath path, @Nullable T payload) {
    }

    private static final Logger logger = LoggerFactory.getLogger(PathTree.class);

    private final PathTreeNode<T> root = new PathTreeNode<>(TreePath.ROOT, "", null);
    private final List<PathTreeNode<T>> flattened = new ArrayList<>();
    private final List<PathTreeListener> listeners = new ArrayList<>();
    private DisplayMode mode = DisplayMode.TREE;

    public void addListener(PathTreeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(PathTreeListener listener) {
        listeners.remove(listener);
    }

    public PathTreeNode<T> getRoot() {
        return root;
    }

    public DisplayMode getMode() {
        return mode;
    }

    /**
     * Switches the display mode. All rows have to be read again afterwards.
     */
    public void setMode(DisplayMode mode) {
        if (this.mode == mode) {
            return;
        }
        logger.debug("switching display mode from {} to {}", this.mode, mode);
        this.mode = mode;
        for (PathTreeListener listener : listeners) {
            listener.modelReset();
        }
    }

    public void insertAll(List<Entry<T>> entries) {
        for (Entry<T> entry : entries) {
            insert(entry.path(), entry.payload());
        }
    }

    /**
     * Inserts a path, creating all missing ancestors. An existing node gets the payload merged
     * with {@link #mergePayload(PathTreeNode, Object)}.
     *
     * @return the node of {@code path}
     */
    public PathTreeNode<T> insert(TreePath path, @Nullable T payload) {
        if (path.isRoot()) {
            throw new IllegalArgumentException("the root can't be inserted");
        }
        PathTreeNode<T> node = root;
        for (int i = 0; i < path.depth() - 1; i++) {
            node = addChild(node, path.prefix(i + 1), null);
        }
        return addChild(node, path, payload);
    }

    private PathTreeNode<T> addChild(PathTreeNode<T> parent, TreePath path, @Nullable T payload) {
        PathTreeNode<T> existing = parent.child(path.name());
        if (existing != null) {
            if (mergePayload(existing, payload)) {
                payloadMerged(existing);
            }
            return existing;
        }

        PathTreeNode<T> child = new PathTreeNode<>(path, path.name(), payload);
        if (mode == DisplayMode.FLAT) {
            // listeners may look up the new row, so it has to be complete first
            parent.add(child);
            processNewNode(child);
            if (includeInFlat(child)) {
                appendFlat(child);
            }
            return child;
        }

        int row = parent.childCount();
        // adding a first or second child changes how a simplifiable parent is collapsed
        boolean relayout = collapsesWith(parent, parent.childCount() + 1);
        TreePath eventParent = relayout ? visibleParentOfRow(parent) : parent.getPath();
        parent.add(child);
        if (relayout) {
            fireLayoutChanged(eventParent);
        } else {
            fireRowsInserted(eventParent, row, row);
        }
        if (includeInFlat(child)) {
            flattened.add(child);
        }
        processNewNode(child);
        return child;
    }

    private void payloadMerged(PathTreeNode<T> node) {
        if (!flattened.contains(node) && includeInFlat(node)) {
            if (mode == DisplayMode.FLAT) {
                appendFlat(node);
            } else {
                flattened.add(node);
            }
        }
        if (mode == DisplayMode.SIMPLIFIED_TREE) {
            // the merged payload may make the node unsimplifiable
            fireLayoutChanged(visibleParentOfRow(node));
        } else {
            fireDataChanged(node.getPath());
        }
    }

    private void appendFlat(PathTreeNode<T> node) {
        int row = flattened.size();
        flattened.add(node);
        fireRowsInserted(TreePath.ROOT, row, row);
    }

    /**
     * Removes the node of {@code path} together with its descendants.
     *
     * @return false if there is no such node
     */
    public boolean remove(TreePath path) {
        PathTreeNode<T> node = lookup(path);
        if (node == null || node.isRoot()) {
            logger.debug("nothing to remove at '{}'", path);
            return false;
        }
        beforeRemove(node);

        PathTreeNode<T> parent = node.getParent();
        int row = parent.indexOf(node);
        boolean relayout = collapsesWith(parent, parent.childCount() - 1);
        TreePath eventParent = relayout ? visibleParentOfRow(parent) : parent.getPath();

        List<PathTreeNode<T>> subtree = new ArrayList<>();
        collectPostOrder(node, subtree);
        for (PathTreeNode<T> removed : subtree) {
            int flatRow = flattened.indexOf(removed);
            if (flatRow >= 0) {
                flattened.remove(flatRow);
                if (mode == DisplayMode.FLAT) {
                    fireRowsRemoved(TreePath.ROOT, flatRow, flatRow);
                }
            }
        }
        parent.remove(node);
        logger.debug("removed '{}' with {} nodes", path, subtree.size());

        if (mode != DisplayMode.FLAT) {
            if (relayout) {
                fireLayoutChanged(eventParent);
            } else {
                fireRowsRemoved(eventParent, row, row);
            }
        }
        return true;
    }

    private void collectPostOrder(PathTreeNode<T> node, List<PathTreeNode<T>> result) {
        for (PathTreeNode<T> child : node.getChildren()) {
            collectPostOrder(child, result);
        }
        result.add(node);
    }

    /**
     * Whether a change of the child count of {@code parent} to {@code newChildCount} changes
     * the chain it is collapsed into.
     */
    private boolean collapsesWith(PathTreeNode<T> parent, int newChildCount) {
        if (mode != DisplayMode.SIMPLIFIED_TREE || parent.isRoot() || !canSimplify(parent)) {
            return false;
        }
        return parent.childCount() == 1 || newChildCount == 1;
    }

    @Nullable
    public PathTreeNode<T> lookup(TreePath path) {
        return root.descendant(path);
    }

    public Optional<T> payloadAt(TreePath path) {
        PathTreeNode<T> node = lookup(path);
        return node == null ? Optional.empty() : Optional.ofNullable(node.getPayload());
    }

    /**
     * The number of rows below the displayed row of {@code parentPath}.
     */
    public int rowCount(TreePath parentPath) {
        if (mode == DisplayMode.FLAT) {
            return parentPath.isRoot() ? flattened.size() : 0;
        }
        PathTreeNode<T> parent = displayedNode(parentPath);
        return parent == null ? 0 : parent.childCount();
    }

    /**
     * The path displayed in {@code row} below {@code parentPath}, empty for an invalid row.
     */
    public Optional<TreePath> childAt(TreePath parentPath, int row) {
        PathTreeNode<T> child = visibleChild(parentPath, row);
        return child == null ? Optional.empty() : Optional.of(child.getPath());
    }

    @Nullable
    private PathTreeNode<T> visibleChild(TreePath parentPath, int row) {
        if (mode == DisplayMode.FLAT) {
            if (!parentPath.isRoot() || row < 0 || row >= flattened.size()) {
                return null;
            }
            return flattened.get(row);
        }
        PathTreeNode<T> parent = displayedNode(parentPath);
        if (parent == null || row < 0 || row >= parent.childCount()) {
            return null;
        }
        PathTreeNode<T> child = parent.getChildren().get(row);
        return mode == DisplayMode.SIMPLIFIED_TREE ? collapse(child) : child;
    }

    /**
     * The displayed nodes below {@code parentPath} in row order.
     */
    public List<PathTreeNode<T>> visibleChildren(TreePath parentPath) {
        if (mode == DisplayMode.FLAT) {
            return parentPath.isRoot() ? Collections.unmodifiableList(flattened) : List.of();
        }
        PathTreeNode<T> parent = displayedNode(parentPath);
        if (parent == null) {
            return List.of();
        }
        if (mode == DisplayMode.TREE) {
            return parent.getChildren();
        }
        List<PathTreeNode<T>> result = new ArrayList<>(parent.childCount());
        for (PathTreeNode<T> child : parent.getChildren()) {
            result.add(collapse(child));
        }
        return result;
    }

    /**
     * The displayed parent row of {@code path}, empty for top level rows, in flat mode
     * and for unknown paths.
     */
    public Optional<TreePath> parentOf(TreePath path) {
        if (mode == DisplayMode.FLAT) {
            return Optional.empty();
        }
        PathTreeNode<T> node = displayedNode(path);
        if (node == null || node.isRoot()) {
            return Optional.empty();
        }
        PathTreeNode<T> parent = rowHead(node).getParent();
        return parent.isRoot() ? Optional.empty() : Optional.of(parent.getPath());
    }

    /**
     * The row of {@code path} below its displayed parent, -1 if it is not displayed.
     */
    public int rowOf(TreePath path) {
        return resolve(path).map(ViewPosition::row).orElse(-1);
    }

    /**
     * Resolves a path to the row showing it in the current mode. A node collapsed into a
     * simplified chain resolves to the row of that chain.
     */
    public Optional<ViewPosition> resolve(TreePath path) {
        PathTreeNode<T> node = lookup(path);
        if (node == null || node.isRoot()) {
            return Optional.empty();
        }
        if (mode == DisplayMode.FLAT) {
            int row = flattened.indexOf(node);
            return row < 0 ? Optional.empty() : Optional.of(new ViewPosition(TreePath.ROOT, row, path));
        }
        PathTreeNode<T> displayed = mode == DisplayMode.SIMPLIFIED_TREE ? collapse(node) : node;
        PathTreeNode<T> head = rowHead(displayed);
        PathTreeNode<T> parent = head.getParent();
        return Optional.of(new ViewPosition(parent.getPath(), parent.indexOf(head), displayed.getPath()));
    }

    /**
     * The text shown for a row: the full path in flat mode, the path relative to the displayed parent
     * in simplified mode and the segment otherwise.
     */
    public String displayName(TreePath path) {
        return switch (mode) {
            case FLAT -> path.toString();
            case SIMPLIFIED_TREE -> parentOf(path).orElse(TreePath.ROOT).relativize(path).toString();
            case TREE -> path.name();
        };
    }

    /**
     * All nodes except the root, depth first in insertion order.
     */
    public List<PathTreeNode<T>> nodes() {
        List<PathTreeNode<T>> result = new ArrayList<>();
        for (PathTreeNode<T> child : root.getChildren()) {
            collectPreOrder(child, result);
        }
        return result;
    }

    private void collectPreOrder(PathTreeNode<T> node, List<PathTreeNode<T>> result) {
        result.add(node);
        for (PathTreeNode<T> child : node.getChildren()) {
            collectPreOrder(child, result);
        }
    }

    public List<PathTreeNode<T>> flattened() {
        return Collections.unmodifiableList(flattened);
    }

    /**
     * The node shown for {@code path}, following simplified chains down in simplified mode.
     */
    @Nullable
    private PathTreeNode<T> displayedNode(TreePath path) {
        PathTreeNode<T> node = lookup(path);
        if (node == null || node.isRoot() || mode != DisplayMode.SIMPLIFIED_TREE) {
            return node;
        }
        return collapse(node);
    }

    private PathTreeNode<T> collapse(PathTreeNode<T> node) {
        while (node.childCount() == 1 && canSimplify(node)) {
            node = node.getChildren().get(0);
        }
        return node;
    }

    /**
     * The first node of the chain a displayed node was collapsed from, the node itself outside of
     * simplified mode.
     */
    private PathTreeNode<T> rowHead(PathTreeNode<T> node) {
        if (mode != DisplayMode.SIMPLIFIED_TREE) {
            return node;
        }
        PathTreeNode<T> parent = node.getParent();
        while (!parent.isRoot() && parent.childCount() == 1 && canSimplify(parent)) {
            node = parent;
            parent = node.getParent();
        }
        return node;
    }

    private TreePath visibleParentOfRow(PathTreeNode<T> node) {
        return rowHead(node).getParent().getPath();
    }

    /**
     * Merges {@code payload} into an existing node. The first payload wins.
     *
     * @return whether the payload of the node changed
     */
    protected boolean mergePayload(PathTreeNode<T> node, @Nullable T payload) {
        if (payload == null) {
            return false;
        }
        if (node.getPayload() != null) {
            logger.debug("keeping the existing payload of '{}'", node.getPath());
            return false;
        }
        node.setPayload(payload);
        return true;
    }

    /**
     * Called once for every created node after it was added to the tree.
     */
    protected void processNewNode(PathTreeNode<T> node) {
    }

    /**
     * Called before a node and its descendants are removed.
     */
    protected void beforeRemove(PathTreeNode<T> node) {
    }

    /**
     * Whether a node is part of the flat representation. Evaluated when the node is created
     * and again when it receives a payload later.
     */
    protected boolean includeInFlat(PathTreeNode<T> node) {
        return true;
    }

    /**
     * Whether a node with a single child may be collapsed with it in simplified mode.
     */
    protected boolean canSimplify(PathTreeNode<T> node) {
        return true;
    }

    protected void fireDataChanged(TreePath path) {
        for (PathTreeListener listener : listeners) {
            listener.dataChanged(path);
        }
    }

    private void fireRowsInserted(TreePath parent, int first, int last) {
        for (PathTreeListener listener : listeners) {
            listener.rowsInserted(parent, first, last);
        }
    }

    private void fireRowsRemoved(TreePath parent, int first, int last) {
        for (PathTreeListener listener : listeners) {
            listener.rowsRemoved(parent, first, last);
        }
    }

    private void fireLayoutChanged(TreePath parent) {
        for (PathTreeListener listener : listeners) {
            listener.layoutChanged(parent);
        }
    }
}
