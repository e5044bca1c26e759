package io.github.manjago.arbor.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TreeIndexTest {

    private final SymbolTable table = SymbolTable.defaults();

    /**
     * [+, [*, [x0], [1]], [x1]]
     */
    private Node tree;

    @BeforeEach
    void setUp() {
        tree = table.node("+",
                table.node("*", table.node("x0"), table.node("1")),
                table.node("x1"));
    }

    // Independent recursive pre-order, for cross-checking
    private static void collect(Node node, int depth, List<Node> nodes, List<Integer> depths) {
        nodes.add(node);
        depths.add(depth);
        for (Node child : node.getChildren()) {
            collect(child, depth + 1, nodes, depths);
        }
    }

    @Nested
    @DisplayName("Fixed tree")
    class FixedTree {

        @Test
        @DisplayName("Nodes are numbered pre-order, left to right, from 0")
        void preOrderNumbering() {
            String[] expected = {"+", "*", "x0", "1", "x1"};
            for (int i = 0; i < expected.length; i++) {
                assertEquals(expected[i], TreeIndex.nodeAt(tree, i).getSymbol(), "index " + i);
            }
        }

        @Test
        @DisplayName("Depths follow the same numbering, root = 0")
        void depths() {
            int[] expected = {0, 1, 2, 2, 1};
            for (int i = 0; i < expected.length; i++) {
                assertEquals(expected[i], TreeIndex.depthAt(tree, i), "index " + i);
            }
        }

        @Test
        @DisplayName("Count and max depth")
        void countAndMaxDepth() {
            assertEquals(5, TreeIndex.countNodes(tree));
            assertEquals(2, TreeIndex.maxDepth(tree));
        }

        @Test
        @DisplayName("Index 0 is the root itself")
        void rootIsIndexZero() {
            assertSame(tree, TreeIndex.nodeAt(tree, 0));
        }

        @ParameterizedTest
        @ValueSource(ints = {-1, 5, 100})
        @DisplayName("Out-of-range index fails for every lookup")
        void outOfRange(int index) {
            assertThrows(IndexOutOfRangeException.class, () -> TreeIndex.nodeAt(tree, index));
            assertThrows(IndexOutOfRangeException.class, () -> TreeIndex.depthAt(tree, index));
            assertThrows(IndexOutOfRangeException.class,
                    () -> TreeIndex.replaceAt(tree, index, Node.leaf("1")));
        }

        @Test
        @DisplayName("indicesWhere returns matching indices in order")
        void indicesWhere() {
            List<Integer> functions = TreeIndex.indicesWhere(tree, n -> !n.isLeaf());
            assertEquals(List.of(0, 1), functions);

            List<Integer> leaves = TreeIndex.indicesWhere(tree, Node::isLeaf);
            assertEquals(List.of(2, 3, 4), leaves);
        }
    }

    @Nested
    @DisplayName("Single terminal")
    class SingleTerminal {

        @Test
        @DisplayName("[x0] has one node and depth 0")
        void singleNode() {
            Node leaf = table.node("x0");
            assertEquals(1, TreeIndex.countNodes(leaf));
            assertEquals(0, TreeIndex.maxDepth(leaf));
            assertEquals(0, TreeIndex.depthAt(leaf, 0));
            assertSame(leaf, TreeIndex.nodeAt(leaf, 0));
        }
    }

    @Nested
    @DisplayName("Replacement")
    class Replacement {

        @Test
        @DisplayName("Replacing an inner subtree keeps the parent link")
        void keepsParentLink() {
            Node before = tree.getChild(0);

            TreeIndex.replaceAt(tree, 1, table.node("x1"));

            assertSame(before, tree.getChild(0), "parent still points at the same node object");
            assertEquals("x1", tree.getChild(0).getSymbol());
            assertTrue(tree.getChild(0).isLeaf());
            assertEquals(3, TreeIndex.countNodes(tree));
            assertTrue(table.isWellFormed(tree));
        }

        @Test
        @DisplayName("Replacing the root changes the tree in place")
        void replaceRoot() {
            Node replacement = table.node("-", table.node("1"), table.node("x0"));

            TreeIndex.replaceAt(tree, 0, replacement);

            assertEquals("-", tree.getSymbol());
            assertEquals("[-, [1], [x0]]", tree.toString());
        }

        @Test
        @DisplayName("Replacing a leaf with a subtree grows the tree")
        void replaceLeafWithSubtree() {
            TreeIndex.replaceAt(tree, 4, table.node("/", table.node("x0"), table.node("x1")));

            assertEquals(7, TreeIndex.countNodes(tree));
            assertEquals("/", TreeIndex.nodeAt(tree, 4).getSymbol());
            assertEquals(2, TreeIndex.depthAt(tree, 5));
        }
    }

    @Nested
    @DisplayName("Round trip on random trees")
    class RoundTrip {

        @ParameterizedTest
        @ValueSource(longs = {1, 2, 3, 17, 42, 1234, 99999})
        @DisplayName("nodeAt and depthAt agree with an independent traversal")
        void agreesWithRecursiveTraversal(long seed) {
            TreeGrower grower = new TreeGrower(table, new GpRng(seed));
            for (int t = 0; t < 30; t++) {
                Node random = grower.grow("+", 0, 1 + t % 6, GrowthMethod.GROW);

                List<Node> nodes = new ArrayList<>();
                List<Integer> depths = new ArrayList<>();
                collect(random, 0, nodes, depths);

                assertEquals(nodes.size(), TreeIndex.countNodes(random));
                assertEquals(depths.stream().mapToInt(Integer::intValue).max().orElseThrow(),
                        TreeIndex.maxDepth(random));
                for (int i = 0; i < nodes.size(); i++) {
                    assertSame(nodes.get(i), TreeIndex.nodeAt(random, i), "node at " + i);
                    assertEquals(depths.get(i).intValue(), TreeIndex.depthAt(random, i), "depth at " + i);
                }
                assertEquals(nodes, TreeIndex.preOrder(random));
            }
        }
    }
}
