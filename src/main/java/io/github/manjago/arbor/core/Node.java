package io.github.manjago.arbor.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A node of an expression tree: a symbol and its ordered children.
 *
 * A node does not know arities; well-formedness (child count equal to the
 * symbol's arity) is checked by {@link SymbolTable#validate(Node)} and kept by
 * every operation that builds or edits trees.
 *
 * Nodes are mutable only through {@link #replaceWith(Node)}, which swaps the
 * contents of this node in place so that the parent's link to it stays valid.
 */
public final class Node {

    private String symbol;
    private List<Node> children;

    public Node(String symbol, List<Node> children) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.children = new ArrayList<>(children);
    }

    /**
     * Node without children.
     */
    public static Node leaf(String symbol) {
        return new Node(symbol, List.of());
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Read-only view of the children, left to right.
     */
    public List<Node> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public Node getChild(int i) {
        return children.get(i);
    }

    public int childCount() {
        return children.size();
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Take over the symbol and descendants of {@code source}.
     * The caller hands ownership of {@code source} to this node and must not
     * use it afterwards.
     */
    public void replaceWith(Node source) {
        if (source == this) {
            return;
        }
        this.symbol = source.symbol;
        this.children = new ArrayList<>(source.children);
    }

    /**
     * Fully independent copy of this subtree.
     */
    public Node deepCopy() {
        List<Node> copies = new ArrayList<>(children.size());
        for (Node child : children) {
            copies.add(child.deepCopy());
        }
        return new Node(symbol, copies);
    }

    /**
     * Infix rendering, e.g. {@code ((x0 + 1) * x1)}.
     */
    public String toInfix() {
        if (children.isEmpty()) {
            return symbol;
        }
        if (children.size() == 2) {
            return "(" + children.get(0).toInfix() + " " + symbol + " " + children.get(1).toInfix() + ")";
        }
        StringBuilder sb = new StringBuilder(symbol).append('(');
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(children.get(i).toInfix());
        }
        return sb.append(')').toString();
    }

    // ========== Object methods ==========

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Node other)) return false;
        return symbol.equals(other.symbol) && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbol, children);
    }

    /**
     * Bracketed prefix form, e.g. {@code [+, [x0], [1]]}.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[").append(symbol);
        for (Node child : children) {
            sb.append(", ").append(child);
        }
        return sb.append(']').toString();
    }
}
