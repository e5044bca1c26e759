package io.github.manjago.arbor.variation;

import io.github.manjago.arbor.core.GpRng;
import io.github.manjago.arbor.core.Individual;
import io.github.manjago.arbor.core.InvalidConfigurationException;
import io.github.manjago.arbor.core.Node;
import io.github.manjago.arbor.core.TreeGrower;
import io.github.manjago.arbor.core.TreeIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subtree mutation: replace a random subtree with a freshly grown one.
 *
 * The new subtree is grown for the depth of the node it replaces, so the
 * mutated tree never gets deeper than {@code maxDepth}.
 */
public class SubtreeMutation {

    private static final Logger log = LoggerFactory.getLogger(SubtreeMutation.class);

    private final double probability;
    private final int maxDepth;
    private final TreeGrower grower;
    private final GpRng rng;

    public SubtreeMutation(double probability, int maxDepth, TreeGrower grower, GpRng rng) {
        if (!(probability >= 0.0 && probability <= 1.0)) {
            throw new InvalidConfigurationException("mutation-probability must be in [0, 1], got " + probability);
        }
        if (maxDepth < 1) {
            throw new InvalidConfigurationException("max-depth must be at least 1, got " + maxDepth);
        }
        this.probability = probability;
        this.maxDepth = maxDepth;
        this.grower = grower;
        this.rng = rng;
    }

    /**
     * @return a new, unevaluated individual; the argument is left untouched
     */
    public Individual mutate(Individual individual) {
        Individual mutant = individual.unevaluatedCopy();
        if (!rng.nextBoolean(probability)) {
            return mutant;
        }

        Node genome = mutant.getGenome();
        int index = rng.nextInt(TreeIndex.countNodes(genome));
        int depth = TreeIndex.depthAt(genome, index);
        Node subtree = grower.randomSubtree(depth, maxDepth);

        if (log.isDebugEnabled()) {
            log.debug("Mutation at index {} (depth {}): {} -> {}",
                    index, depth, TreeIndex.nodeAt(genome, index), subtree);
        }
        TreeIndex.replaceAt(genome, index, subtree);
        return mutant;
    }
}
