package difftree;

/**
 * A single kind of change reported for a path. Several facts may be reported for the same path.
 */
public enum ChangeFact {
    ADDED(ChangeType.ADDED),
    REMOVED(ChangeType.REMOVED),
    // contents changed
    MODIFIED(ChangeType.MODIFIED),
    // the target of a symlink changed
    CHANGED_LINK(ChangeType.MODIFIED),
    MODE(ChangeType.MODIFIED),
    OWNER(ChangeType.MODIFIED);

    private final ChangeType changeType;

    ChangeFact(ChangeType changeType) {
        this.changeType = changeType;
    }

    public ChangeType changeType() {
        return changeType;
    }
}
