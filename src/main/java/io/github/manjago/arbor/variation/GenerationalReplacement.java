package io.github.manjago.arbor.variation;

import io.github.manjago.arbor.core.Individual;
import io.github.manjago.arbor.core.InvalidConfigurationException;
import io.github.manjago.arbor.core.Population;

import java.util.ArrayList;
import java.util.List;

/**
 * Generational replacement with elitism.
 *
 * Copies of the {@code eliteSize} best of the old population join the new
 * one, the combined set is ranked, and the best {@code populationSize}
 * survive. With at least one elite the best fitness never drops from one
 * generation to the next; with none the old population is simply discarded.
 */
public class GenerationalReplacement {

    private final int populationSize;
    private final int eliteSize;

    public GenerationalReplacement(int populationSize, int eliteSize) {
        if (eliteSize < 0 || eliteSize > populationSize) {
            throw new InvalidConfigurationException(String.format(
                    "elite-size must be in [0, %d], got %d", populationSize, eliteSize));
        }
        this.populationSize = populationSize;
        this.eliteSize = eliteSize;
    }

    public int getEliteSize() {
        return eliteSize;
    }

    /**
     * @param offspring evaluated new population
     * @param previous evaluated population it replaces
     * @return next generation, ranked best first
     */
    public Population replace(Population offspring, Population previous) {
        List<Individual> combined = new ArrayList<>(offspring.individuals());
        List<Individual> elites = previous.ranked().individuals();
        for (int i = 0; i < Math.min(eliteSize, elites.size()); i++) {
            combined.add(elites.get(i).copy());
        }
        combined.sort(Individual.BY_FITNESS_DESCENDING);
        return new Population(combined.subList(0, Math.min(populationSize, combined.size())));
    }
}
