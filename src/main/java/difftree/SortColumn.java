package difftree;

public enum SortColumn {
    NAME("Name"),
    CHANGE("Change"),
    SIZE("Size");

    private final String header;

    SortColumn(String header) {
        this.header = header;
    }

    public String header() {
        return header;
    }
}
