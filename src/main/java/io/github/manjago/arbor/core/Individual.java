package io.github.manjago.arbor.core;

import java.util.Comparator;

/**
 * A candidate solution: one expression tree and its fitness.
 *
 * Fitness is the negated mean squared error over the fitness cases, so 0 is a
 * perfect fit and higher is better. Until evaluated there is no fitness;
 * reading it throws.
 *
 * Each individual owns its genome exclusively. Copies never share nodes.
 */
public final class Individual {

    /**
     * Evaluation lifecycle.
     */
    public enum FitnessState {
        UNEVALUATED,
        EVALUATED,
        /** Evaluation threw; the run is being aborted */
        FAILED
    }

    /** Best first. Only valid for evaluated individuals. */
    public static final Comparator<Individual> BY_FITNESS_DESCENDING =
            Comparator.comparingDouble(Individual::getFitness).reversed();

    private final Node genome;
    private FitnessState state = FitnessState.UNEVALUATED;
    private double fitness = Double.NaN;

    /**
     * Create an unevaluated individual owning {@code genome}.
     */
    public Individual(Node genome) {
        this.genome = genome;
    }

    public Node getGenome() {
        return genome;
    }

    public FitnessState getState() {
        return state;
    }

    public boolean isEvaluated() {
        return state == FitnessState.EVALUATED;
    }

    /**
     * @throws IllegalStateException if the individual has not been evaluated
     */
    public double getFitness() {
        if (state != FitnessState.EVALUATED) {
            throw new IllegalStateException("Fitness not available: " + state);
        }
        return fitness;
    }

    // ========== Lifecycle ==========

    public void assignFitness(double value) {
        this.fitness = value;
        this.state = FitnessState.EVALUATED;
    }

    public void markFailed() {
        this.fitness = Double.NaN;
        this.state = FitnessState.FAILED;
    }

    /**
     * Independent copy keeping the fitness (used to carry elites over).
     */
    public Individual copy() {
        Individual copy = new Individual(genome.deepCopy());
        copy.state = state;
        copy.fitness = fitness;
        return copy;
    }

    /**
     * Independent copy with fitness reset, the starting point of every offspring.
     */
    public Individual unevaluatedCopy() {
        return new Individual(genome.deepCopy());
    }

    // ========== Shape ==========

    public int size() {
        return TreeIndex.countNodes(genome);
    }

    public int depth() {
        return TreeIndex.maxDepth(genome);
    }

    // ========== Object methods ==========

    @Override
    public String toString() {
        String f = state == FitnessState.EVALUATED ? String.valueOf(fitness) : state.name();
        return "{genome: " + genome + ", fitness: " + f + "}";
    }
}
