package io.github.manjago.arbor.variation;

import io.github.manjago.arbor.core.GpRng;
import io.github.manjago.arbor.core.Individual;
import io.github.manjago.arbor.core.InvalidConfigurationException;
import io.github.manjago.arbor.core.Node;
import io.github.manjago.arbor.core.SymbolTable;
import io.github.manjago.arbor.core.TreeIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Subtree crossover between two parents.
 *
 * Children start as deep copies of the parents. When crossover fires, a
 * random node of the first child is chosen; if it is a function, a random
 * node of the second child with the same arity (any symbol) is chosen and the
 * two subtrees are exchanged by value. Matching on arity is what keeps both
 * children well-formed: each subtree lands where exactly that many children
 * are expected.
 *
 * Terminal crossover points, and points with no arity match, leave both
 * children as plain copies.
 */
public class SubtreeCrossover {

    private static final Logger log = LoggerFactory.getLogger(SubtreeCrossover.class);

    /**
     * The two children of one crossover, in parent order.
     */
    public record Offspring(Individual first, Individual second) {
        public List<Individual> asList() {
            return List.of(first, second);
        }
    }

    private final double probability;
    private final SymbolTable symbols;
    private final GpRng rng;

    public SubtreeCrossover(double probability, SymbolTable symbols, GpRng rng) {
        if (!(probability >= 0.0 && probability <= 1.0)) {
            throw new InvalidConfigurationException("crossover-probability must be in [0, 1], got " + probability);
        }
        this.probability = probability;
        this.symbols = symbols;
        this.rng = rng;
    }

    public Offspring crossover(Individual parentA, Individual parentB) {
        Individual childA = parentA.unevaluatedCopy();
        Individual childB = parentB.unevaluatedCopy();

        boolean fire = rng.nextBoolean(probability);
        if (!fire || childA.size() < 2 || childB.size() < 2) {
            return new Offspring(childA, childB);
        }

        int indexA = rng.nextInt(childA.size());
        exchange(childA.getGenome(), childB.getGenome(), indexA);
        return new Offspring(childA, childB);
    }

    /**
     * Exchange the subtree at {@code indexA} of {@code a} with a same-arity subtree of {@code b}.
     *
     * @return true if the trees were changed
     */
    boolean exchange(Node a, Node b, int indexA) {
        Node nodeA = TreeIndex.nodeAt(a, indexA);
        int arity = symbols.arity(nodeA.getSymbol());
        if (arity == 0) {
            log.debug("Crossover point {} is terminal '{}', no exchange", indexA, nodeA.getSymbol());
            return false;
        }

        List<Integer> candidates = TreeIndex.indicesWhere(b, n -> symbols.arity(n.getSymbol()) == arity);
        if (candidates.isEmpty()) {
            log.debug("No arity-{} node in second parent, no exchange", arity);
            return false;
        }
        int indexB = rng.choice(candidates);

        Node fromA = nodeA.deepCopy();
        Node fromB = TreeIndex.nodeAt(b, indexB).deepCopy();
        TreeIndex.replaceAt(a, indexA, fromB);
        TreeIndex.replaceAt(b, indexB, fromA);

        log.debug("Crossover exchanged index {} ({}) with index {} ({})",
                indexA, fromA.getSymbol(), indexB, fromB.getSymbol());
        return true;
    }
}
