package difftree;

import java.io.PrintWriter;

import static difftree.Util.bytesToHumanReadableFormat;

/**
 * Prints the visible rows of a {@link DiffTree} in its current display mode, indented by depth.
 */
public class DiffTreePrinter {

    private static final String ROW_FORMAT = "%-60s %-6s %12s";
    private static final String INDENT = "  ";

    private final DiffTree tree;
    private final DiffSortPolicy sortPolicy;
    private final boolean details;

    public DiffTreePrinter(DiffTree tree, DiffSortPolicy sortPolicy, boolean details) {
        this.tree = tree;
        this.sortPolicy = sortPolicy;
        this.details = details;
    }

    public void print(PrintWriter out) {
        out.println(String.format(ROW_FORMAT, SortColumn.NAME.header(), SortColumn.CHANGE.header(), SortColumn.SIZE.header()).stripTrailing());
        printRows(out, TreePath.ROOT, 0);
        out.flush();
    }

    private void printRows(PrintWriter out, TreePath parent, int depth) {
        for (PathTreeNode<DiffPayload> node : sortPolicy.sortedRows(parent)) {
            out.println(formatRow(node, depth));
            if (tree.getMode() != DisplayMode.FLAT) {
                printRows(out, node.getPath(), depth + 1);
            }
        }
    }

    String formatRow(PathTreeNode<DiffPayload> node, int depth) {
        DiffPayload payload = node.getPayload();
        if (payload == null) {
            throw new IllegalStateException("Item " + node.getPath() + " without data");
        }
        String name = INDENT.repeat(depth) + tree.displayName(node.getPath());
        String row = String.format(ROW_FORMAT, name, payload.change().shortCode(), bytesToHumanReadableFormat(payload.sizeDelta()));
        if (details) {
            row += "  " + payload.describe();
        }
        return row;
    }
}
