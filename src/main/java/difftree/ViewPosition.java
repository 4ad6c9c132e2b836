package difftree;

/**
 * Where a path is shown in the current display mode.
 *
 * @param parent    the displayed parent row, {@link TreePath#ROOT} for top level rows
 * @param row       the row below {@code parent}
 * @param displayed the path of the node actually shown in that row. Differs from the resolved path
 *                  when it was collapsed into a simplified chain.
 */
public record ViewPosition(TreePath parent, int row, TreePath displayed) {
}
