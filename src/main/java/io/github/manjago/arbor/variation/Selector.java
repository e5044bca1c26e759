package io.github.manjago.arbor.variation;

import io.github.manjago.arbor.core.Individual;
import io.github.manjago.arbor.core.Population;

import java.util.List;

/**
 * Picks parents from an evaluated population.
 *
 * Winners are the population's own individuals, not copies; variation
 * operators copy before they change anything.
 */
public interface Selector {

    /**
     * Select {@code count} parents. The same individual may be picked more than once.
     *
     * @param population evaluated population to select from
     * @param count number of winners
     * @return winners in the order they were selected
     */
    List<Individual> select(Population population, int count);
}
