package io.github.manjago.arbor.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, fixed snapshot of individuals.
 *
 * The list is immutable; the individuals themselves are owned by whoever built
 * the population and are not copied here.
 */
public final class Population {

    private final List<Individual> individuals;

    public Population(List<Individual> individuals) {
        this.individuals = List.copyOf(individuals);
    }

    public List<Individual> individuals() {
        return individuals;
    }

    public Individual get(int i) {
        return individuals.get(i);
    }

    public int size() {
        return individuals.size();
    }

    public boolean isEmpty() {
        return individuals.isEmpty();
    }

    /**
     * Same individuals, best first. Stable: equal fitness keeps insertion order.
     *
     * @throws IllegalStateException if any individual is unevaluated
     */
    public Population ranked() {
        List<Individual> sorted = new ArrayList<>(individuals);
        sorted.sort(Individual.BY_FITNESS_DESCENDING);
        return new Population(sorted);
    }

    /**
     * Highest fitness; the first one encountered on ties.
     */
    public Individual best() {
        if (individuals.isEmpty()) {
            throw new IllegalStateException("Empty population has no best individual");
        }
        Individual best = individuals.get(0);
        for (Individual ind : individuals) {
            if (ind.getFitness() > best.getFitness()) {
                best = ind;
            }
        }
        return best;
    }

    @Override
    public String toString() {
        return "Population[size=" + individuals.size() + "]";
    }
}
