package difftree;

import java.util.ArrayList;
import java.util.List;

/**
 * What a loaded diff contains.
 *
 * @param unchanged      placeholder directories that were not reported themselves
 * @param totalSizeDelta the size change of the whole archive
 */
public record DiffSummary(List<TreePath> added,
                          List<TreePath> removed,
                          List<TreePath> modified,
                          int unchanged,
                          long totalSizeDelta) {

    public static DiffSummary of(DiffTree tree) {
        List<TreePath> added = new ArrayList<>();
        List<TreePath> removed = new ArrayList<>();
        List<TreePath> modified = new ArrayList<>();
        int unchanged = 0;
        for (PathTreeNode<DiffPayload> node : tree.nodes()) {
            DiffPayload payload = node.getPayload();
            if (payload == null) {
                throw new IllegalStateException("Item " + node.getPath() + " without data");
            }
            switch (payload.change()) {
                case ADDED -> added.add(node.getPath());
                case REMOVED -> removed.add(node.getPath());
                case MODIFIED -> modified.add(node.getPath());
                case NONE -> unchanged++;
            }
        }
        long totalSizeDelta = 0;
        for (PathTreeNode<DiffPayload> topLevel : tree.getRoot().getChildren()) {
            totalSizeDelta += topLevel.getPayload().sizeDelta();
        }
        return new DiffSummary(List.copyOf(added), List.copyOf(removed), List.copyOf(modified), unchanged, totalSizeDelta);
    }

    public int changedCount() {
        return added.size() + removed.size() + modified.size();
    }
}
