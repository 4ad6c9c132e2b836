package difftree;

public enum FileType {
    FILE("File"),
    DIRECTORY("Directory"),
    LINK("Link");

    private final String label;

    FileType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
