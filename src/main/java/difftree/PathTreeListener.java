package difftree;

/**
 * Structural change notifications of a {@link PathTree}.
 * <p>
 * Parents are given as the path of the displayed parent row, {@link TreePath#ROOT} for top level rows.
 */
public interface PathTreeListener {

    default void rowsInserted(TreePath parent, int first, int last) {
    }

    default void rowsRemoved(TreePath parent, int first, int last) {
    }

    /**
     * The rows below {@code parent} changed shape, e.g. a simplified chain got longer or was split.
     */
    default void layoutChanged(TreePath parent) {
    }

    default void dataChanged(TreePath path) {
    }

    /**
     * Everything needs to be read again, e.g. after the display mode changed.
     */
    default void modelReset() {
    }
}
