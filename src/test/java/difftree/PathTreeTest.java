package difftree;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PathTreeTest {

    private PathTree<String> tree;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        tree = new PathTree<>();
        listener = new RecordingListener();
        tree.addListener(listener);
    }

    private static TreePath path(String path) {
        return TreePath.of(path);
    }

    @Test
    void insertCreatesAncestorsWithoutPayload() {
        PathTreeNode<String> node = tree.insert(path("a/b/c"), "c-data");

        assertThat(node.getPath()).isEqualTo(path("a/b/c"));
        assertThat(node.getSegment()).isEqualTo("c");
        assertThat(tree.lookup(path("a")).getPayload()).isNull();
        assertThat(tree.lookup(path("a/b")).getPayload()).isNull();
        assertThat(tree.payloadAt(path("a/b/c"))).contains("c-data");
        assertThat(tree.lookup(path("a/b")).getParent()).isSameAs(tree.lookup(path("a")));
        assertThat(tree.lookup(path("a")).getParent()).isSameAs(tree.getRoot());
        assertThat(tree.lookup(path("a/x"))).isNull();
        assertThat(tree.payloadAt(path("a/x"))).isEmpty();
    }

    @Test
    void laterInsertFillsMissingPayloadButNeverReplacesIt() {
        tree.insert(path("a/b"), "b-data");
        tree.insert(path("a"), "first");
        tree.insert(path("a"), "second");

        assertThat(tree.payloadAt(path("a"))).contains("first");
        assertThat(tree.nodes()).hasSize(2);
    }

    @Test
    void insertingTheSamePathWithoutPayloadTwiceIsANoOp() {
        tree.insert(path("a/b"), null);
        List<PathTreeNode<String>> before = tree.nodes();
        int events = listener.events.size();

        PathTreeNode<String> again = tree.insert(path("a/b"), null);

        assertThat(again).isSameAs(tree.lookup(path("a/b")));
        assertThat(tree.nodes()).containsExactlyElementsOf(before);
        assertThat(again.getPayload()).isNull();
        assertThat(listener.events).hasSize(events);
    }

    @Test
    void rootCantBeInserted() {
        assertThatThrownBy(() -> tree.insert(TreePath.ROOT, "x")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void duplicateSegmentsAreAProgrammingError() {
        PathTreeNode<String> parent = tree.insert(path("a"), null);
        parent.add(new PathTreeNode<>(path("a/b"), "b", null));
        assertThatThrownBy(() -> parent.add(new PathTreeNode<>(path("a/b"), "b", null)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'b'");
    }

    @Test
    void treeModeIndexing() {
        tree.insert(path("a/b"), "b");
        tree.insert(path("a/c"), "c");
        tree.insert(path("d"), "d");

        assertThat(tree.rowCount(TreePath.ROOT)).isEqualTo(2);
        assertThat(tree.childAt(TreePath.ROOT, 0)).contains(path("a"));
        assertThat(tree.childAt(TreePath.ROOT, 1)).contains(path("d"));
        assertThat(tree.rowCount(path("a"))).isEqualTo(2);
        assertThat(tree.childAt(path("a"), 1)).contains(path("a/c"));
        assertThat(tree.parentOf(path("a/c"))).contains(path("a"));
        assertThat(tree.parentOf(path("a"))).isEmpty();
        assertThat(tree.rowOf(path("a/c"))).isEqualTo(1);
        assertThat(tree.rowOf(path("d"))).isEqualTo(1);
        assertThat(tree.displayName(path("a/c"))).isEqualTo("c");
    }

    @Test
    void invalidRowsAndUnknownPathsGiveEmptyResults() {
        tree.insert(path("a/b"), "b");

        assertThat(tree.childAt(TreePath.ROOT, 1)).isEmpty();
        assertThat(tree.childAt(TreePath.ROOT, -1)).isEmpty();
        assertThat(tree.childAt(path("x"), 0)).isEmpty();
        assertThat(tree.rowCount(path("x"))).isZero();
        assertThat(tree.rowOf(path("x"))).isEqualTo(-1);
        assertThat(tree.parentOf(path("x"))).isEmpty();
        assertThat(tree.resolve(path("x"))).isEmpty();
        assertThat(tree.resolve(TreePath.ROOT)).isEmpty();
    }

    @Test
    void simplifiedModeCollapsesSingleChildChains() {
        tree.insert(path("a/b/c/d"), "d");
        tree.insert(path("a/b/e"), "e");
        tree.setMode(DisplayMode.SIMPLIFIED_TREE);

        assertThat(tree.rowCount(TreePath.ROOT)).isEqualTo(1);
        assertThat(tree.childAt(TreePath.ROOT, 0)).contains(path("a/b"));
        assertThat(tree.rowCount(path("a/b"))).isEqualTo(2);
        assertThat(tree.childAt(path("a/b"), 0)).contains(path("a/b/c/d"));
        assertThat(tree.childAt(path("a/b"), 1)).contains(path("a/b/e"));
        assertThat(tree.parentOf(path("a/b/c/d"))).contains(path("a/b"));
        assertThat(tree.parentOf(path("a/b"))).isEmpty();
        assertThat(tree.displayName(path("a/b"))).isEqualTo("a/b");
        assertThat(tree.displayName(path("a/b/c/d"))).isEqualTo("c/d");

        // collapsed nodes resolve to the row of their chain
        assertThat(tree.resolve(path("a"))).contains(new ViewPosition(TreePath.ROOT, 0, path("a/b")));
        assertThat(tree.resolve(path("a/b/c"))).contains(new ViewPosition(path("a/b"), 0, path("a/b/c/d")));
        assertThat(tree.rowCount(path("a"))).isEqualTo(2);
    }

    @Test
    void simplifiedRowOfAChainIsTheRowOfItsFirstNode() {
        tree.insert(path("x"), "x");
        tree.insert(path("a/b/c"), "c");
        tree.insert(path("a/b/d"), "d");
        tree.setMode(DisplayMode.SIMPLIFIED_TREE);

        assertThat(tree.rowOf(path("a/b"))).isEqualTo(1);
        assertThat(tree.childAt(TreePath.ROOT, 1)).contains(path("a/b"));
        assertThat(tree.parentOf(path("a/b/c"))).contains(path("a/b"));
        assertThat(tree.rowOf(path("a/b/d"))).isEqualTo(1);
    }

    @Test
    void flatModeListsNodesInInsertionOrder() {
        tree.insert(path("a/b"), "b");
        tree.insert(path("c"), "c");
        tree.insert(path("a/d"), "d");
        tree.setMode(DisplayMode.FLAT);

        assertThat(tree.rowCount(TreePath.ROOT)).isEqualTo(4);
        List<TreePath> rows = new ArrayList<>();
        for (int row = 0; row < tree.rowCount(TreePath.ROOT); row++) {
            rows.add(tree.childAt(TreePath.ROOT, row).orElseThrow());
        }
        assertThat(rows).containsExactly(path("a"), path("a/b"), path("c"), path("a/d"));
        assertThat(tree.rowCount(path("a"))).isZero();
        assertThat(tree.childAt(TreePath.ROOT, 4)).isEmpty();
        assertThat(tree.parentOf(path("a/d"))).isEmpty();
        assertThat(tree.rowOf(path("a/d"))).isEqualTo(3);
        assertThat(tree.displayName(path("a/d"))).isEqualTo("a/d");
    }

    @Test
    void modeSwitchingIsAPureProjection() {
        tree.insert(path("a/b/c"), "c");
        tree.insert(path("a/d"), "d");
        tree.insert(path("e"), "e");

        Map<TreePath, Optional<String>> inTreeMode = payloads();
        for (DisplayMode mode : DisplayMode.values()) {
            tree.setMode(mode);
            assertThat(payloads()).isEqualTo(inTreeMode);
            if (mode != DisplayMode.FLAT) {
                for (PathTreeNode<String> node : tree.nodes()) {
                    assertThat(tree.resolve(node.getPath())).isPresent();
                }
            }
        }
    }

    private Map<TreePath, Optional<String>> payloads() {
        return tree.nodes().stream()
                .map(PathTreeNode::getPath)
                .collect(Collectors.toMap(Function.identity(), tree::payloadAt));
    }

    @Test
    void settingTheModeResetsTheModelOnce() {
        tree.setMode(DisplayMode.FLAT);
        tree.setMode(DisplayMode.FLAT);

        assertThat(listener.events).containsExactly("reset");
        assertThat(tree.getMode()).isEqualTo(DisplayMode.FLAT);
    }

    @Test
    void insertNotificationsInTreeMode() {
        tree.insert(path("a/b"), "b");
        tree.insert(path("a/c"), "c");

        assertThat(listener.events).containsExactly(
                "inserted  0 0",
                "inserted a 0 0",
                "inserted a 1 1");
    }

    @Test
    void insertNotificationsInFlatMode() {
        tree.setMode(DisplayMode.FLAT);
        listener.events.clear();
        tree.insert(path("a/b"), "b");

        assertThat(listener.events).containsExactly(
                "inserted  0 0",
                "inserted  1 1");
    }

    @Test
    void flatRowsAreCompleteWhenListenersHearOfThem() {
        DiffTree diffTree = new DiffTree();
        diffTree.setMode(DisplayMode.FLAT);
        List<String> seen = new ArrayList<>();
        diffTree.addListener(new PathTreeListener() {
            @Override
            public void rowsInserted(TreePath parent, int first, int last) {
                TreePath row = diffTree.childAt(parent, first).orElseThrow();
                seen.add(row + " " + diffTree.resolve(row).isPresent() + " " + diffTree.payloadAt(row).isPresent());
            }
        });

        diffTree.insert(path("a/b"), DiffPayload.builder().added(FileType.FILE, 5).build());

        assertThat(seen).containsExactly("a/b true true");
        assertThat(diffTree.payloadAt(path("a")).orElseThrow().sizeDelta()).isEqualTo(5);
    }

    @Test
    void changingAChainInSimplifiedModeChangesTheLayout() {
        tree.setMode(DisplayMode.SIMPLIFIED_TREE);
        listener.events.clear();
        tree.insert(path("a/b"), "b");
        tree.insert(path("a/c"), "c");

        assertThat(listener.events).containsExactly(
                "inserted  0 0",
                "layout ",
                "layout ");
    }

    @Test
    void mergingAPayloadSignalsADataChange() {
        tree.insert(path("a/b"), "b");
        listener.events.clear();
        tree.insert(path("a"), "a");

        assertThat(listener.events).containsExactly("data a");
    }

    @Test
    void removingAMissingPathIsANoOp() {
        tree.insert(path("a"), "a");

        assertThat(tree.remove(path("b"))).isFalse();
        assertThat(tree.remove(path("a/b"))).isFalse();
        assertThat(tree.remove(TreePath.ROOT)).isFalse();
        assertThat(tree.nodes()).hasSize(1);
    }

    @Test
    void removeDropsTheWholeSubtreeFromEveryIndex() {
        tree.insert(path("a/b/c"), "c");
        tree.insert(path("a/d"), "d");
        tree.insert(path("e"), "e");
        listener.events.clear();

        assertThat(tree.remove(path("a/b"))).isTrue();

        assertThat(tree.lookup(path("a/b"))).isNull();
        assertThat(tree.lookup(path("a/b/c"))).isNull();
        assertThat(tree.flattened()).extracting(PathTreeNode::getPath)
                .containsExactly(path("a"), path("a/d"), path("e"));
        assertThat(listener.events).containsExactly("removed a 0 0");
        assertThat(tree.childAt(path("a"), 0)).contains(path("a/d"));
    }

    @Test
    void removeInFlatModeRemovesDescendantRowsFirst() {
        tree.insert(path("a/b/c"), "c");
        tree.insert(path("e"), "e");
        tree.setMode(DisplayMode.FLAT);
        listener.events.clear();

        tree.remove(path("a"));

        assertThat(listener.events).containsExactly(
                "removed  2 2",
                "removed  1 1",
                "removed  0 0");
        assertThat(tree.rowCount(TreePath.ROOT)).isEqualTo(1);
        assertThat(tree.childAt(TreePath.ROOT, 0)).contains(path("e"));
        assertThat(tree.nodes()).extracting(PathTreeNode::getPath).containsExactly(path("e"));
    }

    @Test
    void removeInSimplifiedModeCanJoinAChain() {
        tree.insert(path("a/b"), "b");
        tree.insert(path("a/c"), "c");
        tree.setMode(DisplayMode.SIMPLIFIED_TREE);
        listener.events.clear();

        tree.remove(path("a/c"));

        assertThat(listener.events).containsExactly("layout ");
        assertThat(tree.childAt(TreePath.ROOT, 0)).contains(path("a/b"));
    }

    private static class RecordingListener implements PathTreeListener {

        final List<String> events = new ArrayList<>();

        @Override
        public void rowsInserted(TreePath parent, int first, int last) {
            events.add("inserted " + parent + " " + first + " " + last);
        }

        @Override
        public void rowsRemoved(TreePath parent, int first, int last) {
            events.add("removed " + parent + " " + first + " " + last);
        }

        @Override
        public void layoutChanged(TreePath parent) {
            events.add("layout " + parent);
        }

        @Override
        public void dataChanged(TreePath path) {
            events.add("data " + path);
        }

        @Override
        public void modelReset() {
            events.add("reset");
        }
    }
}
