package io.github.manjago.arbor.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Predicate;

/**
 * Node addressing for expression trees.
 *
 * There is exactly one scheme: pre-order, depth-first, left-to-right, 0-based.
 * The root is index 0 and depth 0; a node's first child follows it directly.
 * <pre>
 *        [+]          index: + = 0, * = 1, x0 = 2, 1 = 3, x1 = 4
 *       /   \         depth: + = 0, * = 1, x0 = 2, 1 = 2, x1 = 1
 *     [*]   [x1]
 *    /   \
 *  [x0]  [1]
 * </pre>
 * Index lookups all go through {@link #walk}.
 */
public final class TreeIndex {

    private TreeIndex() {}

    /**
     * Visitor for {@link #walk}. Returning false stops the walk.
     */
    @FunctionalInterface
    public interface Visitor {
        boolean visit(Node node, int index, int depth);
    }

    /**
     * Visit nodes in canonical order until the visitor returns false.
     */
    public static void walk(Node root, Visitor visitor) {
        Deque<Node> nodes = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        nodes.push(root);
        depths.push(0);
        int index = 0;
        while (!nodes.isEmpty()) {
            Node node = nodes.pop();
            int depth = depths.pop();
            if (!visitor.visit(node, index++, depth)) {
                return;
            }
            // Right to left so the leftmost child is popped first
            for (int i = node.childCount() - 1; i >= 0; i--) {
                nodes.push(node.getChild(i));
                depths.push(depth + 1);
            }
        }
    }

    public static int countNodes(Node root) {
        int count = 1;
        for (Node child : root.getChildren()) {
            count += countNodes(child);
        }
        return count;
    }

    /**
     * Depth of the deepest leaf; a single node has depth 0.
     */
    public static int maxDepth(Node root) {
        int deepest = 0;
        for (Node child : root.getChildren()) {
            deepest = Math.max(deepest, 1 + maxDepth(child));
        }
        return deepest;
    }

    /**
     * @throws IndexOutOfRangeException if {@code index} is not in [0, countNodes)
     */
    public static Node nodeAt(Node root, int index) {
        Node[] found = new Node[1];
        locate(root, index, (node, i, depth) -> found[0] = node);
        return found[0];
    }

    /**
     * Depth of the node at {@code index}, root = 0.
     *
     * @throws IndexOutOfRangeException if {@code index} is not in [0, countNodes)
     */
    public static int depthAt(Node root, int index) {
        int[] found = new int[1];
        locate(root, index, (node, i, depth) -> found[0] = depth);
        return found[0];
    }

    /**
     * Replace the subtree at {@code index} in place. The node object at that
     * position is kept (so its parent link stays valid) and takes over the
     * symbol and children of {@code subtree}, which the caller must not reuse.
     *
     * @throws IndexOutOfRangeException if {@code index} is not in [0, countNodes)
     */
    public static void replaceAt(Node root, int index, Node subtree) {
        nodeAt(root, index).replaceWith(subtree);
    }

    /**
     * Indices of all nodes matching the predicate, ascending.
     */
    public static List<Integer> indicesWhere(Node root, Predicate<Node> predicate) {
        List<Integer> result = new ArrayList<>();
        walk(root, (node, index, depth) -> {
            if (predicate.test(node)) {
                result.add(index);
            }
            return true;
        });
        return result;
    }

    /**
     * All nodes in canonical order.
     */
    public static List<Node> preOrder(Node root) {
        List<Node> result = new ArrayList<>();
        walk(root, (node, index, depth) -> result.add(node));
        return result;
    }

    @FunctionalInterface
    private interface Hit {
        void accept(Node node, int index, int depth);
    }

    private static void locate(Node root, int target, Hit hit) {
        if (target < 0) {
            throw new IndexOutOfRangeException("Node", target, countNodes(root));
        }
        boolean[] seen = new boolean[1];
        walk(root, (node, index, depth) -> {
            if (index == target) {
                hit.accept(node, index, depth);
                seen[0] = true;
                return false;
            }
            return true;
        });
        if (!seen[0]) {
            throw new IndexOutOfRangeException("Node", target, countNodes(root));
        }
    }
}
