package difftree;

/**
 * The reduced classification of a change, used for sorting and colouring rows.
 * The detailed facts are kept in {@link DiffPayload#facts()}.
 */
public enum ChangeType {
    /**
     * Only used for placeholder ancestors that were not reported themselves.
     */
    NONE("", "unchanged"),
    ADDED("A", "added"),
    REMOVED("D", "removed"),
    MODIFIED("M", "modified");

    private final String shortCode;
    private final String label;

    ChangeType(String shortCode, String label) {
        this.shortCode = shortCode;
        this.label = label;
    }

    public String shortCode() {
        return shortCode;
    }

    public String label() {
        return label;
    }
}
