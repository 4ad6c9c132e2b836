package difftree;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static difftree.Util.bytesToHumanReadableFormat;

/**
 * All changes reported for one path, merged into one value.
 * <p>
 * For directories {@code sizeDelta} also contains the size changes of all descendants.
 *
 * @param kind         the type of the changed item
 * @param change       the reduced classification, {@link ChangeType#NONE} only for placeholders
 * @param sizeDelta    bytes added (positive) or removed (negative)
 * @param modeChange   the permission change, if any
 * @param ownerChange  the ownership change, if any
 * @param contentDelta the bytes added and removed by a content change, if both are known
 * @param facts        all change facts reported for the path
 */
public record DiffPayload(FileType kind,
                          ChangeType change,
                          long sizeDelta,
                          @Nullable ModeChange modeChange,
                          @Nullable OwnerChange ownerChange,
                          @Nullable ContentDelta contentDelta,
                          Set<ChangeFact> facts) {

    public record ModeChange(String oldMode, String newMode) {
    }

    public record OwnerChange(String oldUser, String oldGroup, String newUser, String newGroup) {
    }

    public record ContentDelta(long added, long removed) {
    }

    public DiffPayload {
        facts = Set.copyOf(facts);
    }

    /**
     * The payload of an ancestor that was only created because a deeper path was reported.
     */
    public static DiffPayload placeholder() {
        return new DiffPayload(FileType.DIRECTORY, ChangeType.NONE, 0, null, null, null, Set.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isPlaceholder() {
        return change == ChangeType.NONE;
    }

    public DiffPayload withSizeDelta(long newSizeDelta) {
        return new DiffPayload(kind, change, newSizeDelta, modeChange, ownerChange, contentDelta, facts);
    }

    /**
     * A one line summary, e.g. {@code File modified, added 77.8 kB, deleted 1.2 kB, -rw-rw-rw- -> -rw-r--r--}.
     */
    public String describe() {
        List<String> parts = new ArrayList<>();
        parts.add(kind.label() + " " + change.label());
        if (contentDelta != null) {
            parts.add("added " + bytesToHumanReadableFormat(contentDelta.added())
                    + ", deleted " + bytesToHumanReadableFormat(contentDelta.removed()));
        }
        if (modeChange != null) {
            parts.add(modeChange.oldMode() + " -> " + modeChange.newMode());
        }
        if (ownerChange != null) {
            parts.add(ownerChange.oldUser() + ":" + ownerChange.oldGroup()
                    + " -> " + ownerChange.newUser() + ":" + ownerChange.newGroup());
        }
        return String.join(", ", parts);
    }

    /**
     * Collects the change facts of one record in the order they are reported.
     * Added or removed wins over any modification.
     */
    public static final class Builder {

        private FileType kind = FileType.FILE;
        @Nullable
        private ChangeType addedOrRemoved;
        private long sizeDelta;
        @Nullable
        private ModeChange modeChange;
        @Nullable
        private OwnerChange ownerChange;
        @Nullable
        private ContentDelta contentDelta;
        private final Set<ChangeFact> facts = EnumSet.noneOf(ChangeFact.class);

        private Builder() {
        }

        public Builder added(FileType kind, long size) {
            facts.add(ChangeFact.ADDED);
            this.kind = kind;
            this.addedOrRemoved = ChangeType.ADDED;
            this.sizeDelta = size;
            return this;
        }

        public Builder removed(FileType kind, long size) {
            facts.add(ChangeFact.REMOVED);
            this.kind = kind;
            this.addedOrRemoved = ChangeType.REMOVED;
            this.sizeDelta = -size;
            return this;
        }

        /**
         * Contents changed but the amount of changed data is unknown.
         */
        public Builder modified() {
            facts.add(ChangeFact.MODIFIED);
            return this;
        }

        public Builder modified(long added, long removed) {
            facts.add(ChangeFact.MODIFIED);
            this.contentDelta = new ContentDelta(added, removed);
            this.sizeDelta = added - removed;
            return this;
        }

        public Builder changedLink() {
            facts.add(ChangeFact.CHANGED_LINK);
            this.kind = FileType.LINK;
            return this;
        }

        public Builder mode(String oldMode, String newMode) {
            facts.add(ChangeFact.MODE);
            this.modeChange = new ModeChange(oldMode, newMode);
            return this;
        }

        public Builder owner(String oldUser, String oldGroup, String newUser, String newGroup) {
            facts.add(ChangeFact.OWNER);
            this.ownerChange = new OwnerChange(oldUser, oldGroup, newUser, newGroup);
            return this;
        }

        public boolean hasFacts() {
            return !facts.isEmpty();
        }

        public DiffPayload build() {
            if (facts.isEmpty()) {
                throw new IllegalStateException("a diff payload needs at least one change fact");
            }
            ChangeType change = addedOrRemoved != null ? addedOrRemoved : ChangeType.MODIFIED;
            return new DiffPayload(kind, change, sizeDelta, modeChange, ownerChange, contentDelta, facts);
        }
    }
}
