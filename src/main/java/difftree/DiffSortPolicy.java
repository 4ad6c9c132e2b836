package difftree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Orders the rows below one parent of a {@link DiffTree} in its current display mode.
 * <p>
 * With folders on top, rows with children always come before rows without, in both directions.
 */
public class DiffSortPolicy implements Comparator<PathTreeNode<DiffPayload>> {

    // unchanged placeholders are sorted along with modified rows
    private static final Map<ChangeType, Integer> CHANGE_ORDER = new EnumMap<>(Map.of(
            ChangeType.ADDED, 1,
            ChangeType.MODIFIED, 2,
            ChangeType.NONE, 2,
            ChangeType.REMOVED, 3));

    private final DiffTree tree;
    private final SortColumn column;
    private final boolean ascending;
    private final boolean foldersOnTop;

    public DiffSortPolicy(DiffTree tree, SortColumn column, boolean ascending, boolean foldersOnTop) {
        this.tree = tree;
        this.column = column;
        this.ascending = ascending;
        this.foldersOnTop = foldersOnTop;
    }

    public List<PathTreeNode<DiffPayload>> sortedRows(TreePath parent) {
        List<PathTreeNode<DiffPayload>> rows = new ArrayList<>(tree.visibleChildren(parent));
        rows.sort(this);
        return rows;
    }

    @Override
    public int compare(PathTreeNode<DiffPayload> left, PathTreeNode<DiffPayload> right) {
        if (foldersOnTop && left.hasChildren() != right.hasChildren()) {
            return left.hasChildren() ? -1 : 1;
        }
        int result = compareKeys(left, right);
        return ascending ? result : -result;
    }

    private int compareKeys(PathTreeNode<DiffPayload> left, PathTreeNode<DiffPayload> right) {
        return switch (column) {
            case NAME -> compareNames(left, right);
            case CHANGE -> Integer.compare(changeOrder(left), changeOrder(right));
            case SIZE -> Long.compare(sizeDelta(left), sizeDelta(right));
        };
    }

    private int compareNames(PathTreeNode<DiffPayload> left, PathTreeNode<DiffPayload> right) {
        return switch (tree.getMode()) {
            case FLAT -> left.getPath().compareTo(right.getPath());
            case SIMPLIFIED_TREE -> firstDisplayedSegment(left).compareTo(firstDisplayedSegment(right));
            case TREE -> left.getSegment().compareTo(right.getSegment());
        };
    }

    /**
     * The first segment below the displayed parent, i.e. the start of a simplified chain.
     */
    private String firstDisplayedSegment(PathTreeNode<DiffPayload> node) {
        TreePath parent = tree.parentOf(node.getPath()).orElse(TreePath.ROOT);
        return node.getPath().segments().get(parent.depth());
    }

    static int changeOrder(PathTreeNode<DiffPayload> node) {
        DiffPayload payload = node.getPayload();
        return CHANGE_ORDER.get(payload == null ? ChangeType.NONE : payload.change());
    }

    private static long sizeDelta(PathTreeNode<DiffPayload> node) {
        DiffPayload payload = node.getPayload();
        return payload == null ? 0 : payload.sizeDelta();
    }
}
