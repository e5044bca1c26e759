package io.github.manjago.arbor.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Random, arity-driven tree construction.
 *
 * Depths are tree depths (root = 0). A symbol picked for depth {@code d} is a
 * terminal whenever {@code d >= maxDepth}, so no node is ever placed below
 * {@code maxDepth}, and every node gets exactly arity-many children.
 */
public final class TreeGrower {

    private static final Logger log = LoggerFactory.getLogger(TreeGrower.class);

    private final SymbolTable symbols;
    private final GpRng rng;

    public TreeGrower(SymbolTable symbols, GpRng rng) {
        this.symbols = symbols;
        this.rng = rng;
    }

    /**
     * Pick a symbol for a node at {@code depth}.
     * <ul>
     *   <li>{@code depth >= maxDepth}: uniform terminal</li>
     *   <li>{@link GrowthMethod#FULL}: uniform function</li>
     *   <li>{@link GrowthMethod#GROW}: terminal or function with probability 0.5 each</li>
     * </ul>
     */
    public String pickSymbol(int depth, int maxDepth, GrowthMethod method) {
        if (depth >= maxDepth) {
            return rng.choice(symbols.terminals());
        }
        if (method == GrowthMethod.GROW && rng.nextBoolean()) {
            return rng.choice(symbols.terminals());
        }
        return rng.choice(symbols.functions());
    }

    /**
     * Grow a subtree rooted at {@code rootSymbol}, which sits at {@code depth}.
     * Children are picked for {@code depth + 1} and grown depth-first, left to right.
     */
    public Node grow(String rootSymbol, int depth, int maxDepth, GrowthMethod method) {
        int arity = symbols.arity(rootSymbol);
        List<Node> children = new ArrayList<>(arity);
        for (int i = 0; i < arity; i++) {
            String childSymbol = pickSymbol(depth + 1, maxDepth, method);
            children.add(grow(childSymbol, depth + 1, maxDepth, method));
        }
        return new Node(rootSymbol, children);
    }

    /**
     * Fresh subtree to be planted at {@code depth}, as used by mutation.
     *
     * The root is picked GROW-style; if it is a function, the method for the
     * rest of the subtree is drawn fairly between FULL and GROW.
     */
    public Node randomSubtree(int depth, int maxDepth) {
        String root = pickSymbol(depth, maxDepth, GrowthMethod.GROW);
        if (symbols.isTerminal(root)) {
            return Node.leaf(root);
        }
        GrowthMethod method = GrowthMethod.random(rng);
        return grow(root, depth, maxDepth, method);
    }

    /**
     * Ramped half-and-half initialization.
     *
     * Individual {@code i} uses a random method and depth limit
     * {@code (i mod maxDepth) + 1}, spreading shapes and sizes over the population.
     */
    public List<Individual> rampedHalfHalf(int populationSize, int maxDepth) {
        List<Individual> individuals = new ArrayList<>(populationSize);
        for (int i = 0; i < populationSize; i++) {
            GrowthMethod method = GrowthMethod.random(rng);
            int depthLimit = (i % maxDepth) + 1;
            String root = pickSymbol(1, depthLimit, method);
            Node tree = symbols.isFunction(root)
                    ? grow(root, 0, depthLimit, method)
                    : Node.leaf(root);
            individuals.add(new Individual(tree));
            log.debug("Initial tree {} ({}, depth limit {}): {}", i, method, depthLimit, tree);
        }
        return individuals;
    }
}
