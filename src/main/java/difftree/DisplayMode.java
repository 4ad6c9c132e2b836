package difftree;

/**
 * The projections a {@link PathTree} can be displayed in.
 */
public enum DisplayMode {
    /**
     * Every node at its natural depth.
     */
    TREE,
    /**
     * Chains of nodes with a single child are shown as one row.
     */
    SIMPLIFIED_TREE,
    /**
     * A plain list of the nodes accepted by the flat filter.
     */
    FLAT
}
