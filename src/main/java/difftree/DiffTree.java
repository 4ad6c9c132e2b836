package difftree;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The path tree of a diff between two archives.
 * <p>
 * Every node carries a {@link DiffPayload}. Ancestors that were not reported themselves get a
 * {@link DiffPayload#placeholder() placeholder}. The {@code sizeDelta} of every node includes the
 * size deltas of all its descendants.
 */
public class DiffTree extends PathTree<DiffPayload> {

    private static final Logger logger = LoggerFactory.getLogger(DiffTree.class);

    @Override
    protected void processNewNode(PathTreeNode<DiffPayload> node) {
        if (node.getPayload() == null) {
            node.setPayload(DiffPayload.placeholder());
        }
        addSizeToAncestors(node, node.getPayload().sizeDelta());
    }

    /**
     * A placeholder is replaced by the reported data, keeping the size collected from its
     * descendants. Reported data is never replaced.
     */
    @Override
    protected boolean mergePayload(PathTreeNode<DiffPayload> node, @Nullable DiffPayload payload) {
        if (payload == null) {
            return false;
        }
        DiffPayload existing = node.getPayload();
        if (existing == null) {
            node.setPayload(payload);
            addSizeToAncestors(node, payload.sizeDelta());
            return true;
        }
        if (!existing.isPlaceholder()) {
            logger.debug("Keeping earlier change data for {}, ignoring {}", node.getPath(), payload);
            return false;
        }
        node.setPayload(payload.withSizeDelta(existing.sizeDelta() + payload.sizeDelta()));
        addSizeToAncestors(node, payload.sizeDelta());
        return true;
    }

    @Override
    protected void beforeRemove(PathTreeNode<DiffPayload> node) {
        DiffPayload payload = node.getPayload();
        if (payload != null) {
            addSizeToAncestors(node, -payload.sizeDelta());
        }
    }

    /**
     * Unchanged placeholders are left out of the flat list. The payload may not be set yet.
     */
    @Override
    protected boolean includeInFlat(PathTreeNode<DiffPayload> node) {
        DiffPayload payload = node.getPayload();
        return payload != null && !payload.isPlaceholder();
    }

    /**
     * Only unchanged items may be collapsed, otherwise their change wouldn't be displayed.
     */
    @Override
    protected boolean canSimplify(PathTreeNode<DiffPayload> node) {
        DiffPayload payload = node.getPayload();
        return payload == null || payload.isPlaceholder();
    }

    private void addSizeToAncestors(PathTreeNode<DiffPayload> node, long size) {
        if (size == 0) {
            return;
        }
        PathTreeNode<DiffPayload> ancestor = node.getParent();
        while (ancestor != null && !ancestor.isRoot()) {
            DiffPayload payload = ancestor.getPayload();
            if (payload == null) {
                throw new IllegalStateException("Item " + ancestor.getPath() + " without data");
            }
            ancestor.setPayload(payload.withSizeDelta(payload.sizeDelta() + size));
            fireDataChanged(ancestor.getPath());
            ancestor = ancestor.getParent();
        }
    }
}
