package difftree;

public interface ConfigProvider {

    DisplayMode getDisplayMode();

    SortColumn getSortColumn();

    boolean isSortAscending();

    boolean isFoldersOnTop();

    /**
     * Whether diff output is expected as JSON lines instead of plain text.
     */
    boolean isJsonLines();
}
