package io.github.manjago.arbor.search;

import io.github.manjago.arbor.config.RunConfig;
import io.github.manjago.arbor.core.Evaluator;
import io.github.manjago.arbor.core.GpException;
import io.github.manjago.arbor.core.GpRng;
import io.github.manjago.arbor.core.Individual;
import io.github.manjago.arbor.core.Population;
import io.github.manjago.arbor.core.TreeGrower;
import io.github.manjago.arbor.fitness.FitnessCases;
import io.github.manjago.arbor.fitness.FitnessEvaluator;
import io.github.manjago.arbor.variation.GenerationalReplacement;
import io.github.manjago.arbor.variation.Selector;
import io.github.manjago.arbor.variation.SubtreeCrossover;
import io.github.manjago.arbor.variation.SubtreeMutation;
import io.github.manjago.arbor.variation.TournamentSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Generational GP search.
 *
 * Owns the population and the generation counter; every other component gets
 * individuals in and hands new ones back. Each generation:
 * <ol>
 *   <li>select population-size parents by tournament</li>
 *   <li>cross random parent pairs until the new population is full</li>
 *   <li>mutate every child</li>
 *   <li>evaluate all children</li>
 *   <li>merge elites of the previous population, rank, truncate</li>
 * </ol>
 * Single-threaded. All randomness comes from one {@link GpRng} in a fixed
 * order, so a seed reproduces a run exactly.
 */
public class SearchLoop {

    private static final Logger log = LoggerFactory.getLogger(SearchLoop.class);

    private final RunConfig config;
    private final long seed;
    private final GpRng rng;

    // Components
    private final TreeGrower grower;
    private final FitnessEvaluator fitness;
    private final Selector selector;
    private final SubtreeCrossover crossover;
    private final SubtreeMutation mutation;
    private final GenerationalReplacement replacement;

    // State
    private SearchState state = SearchState.NEW;
    private Population population;
    private int generation = 0;
    private GenerationStats lastStats;

    // Event listener
    private SearchListener listener = SearchListener.NOOP;

    /**
     * @param config run parameters, validated here
     * @param trainingCases cases fitness is measured on
     */
    public SearchLoop(RunConfig config, FitnessCases trainingCases) {
        this.config = config.validate();
        this.seed = config.effectiveSeed();
        this.rng = new GpRng(seed);
        this.grower = new TreeGrower(config.symbols(), rng);
        this.fitness = new FitnessEvaluator(new Evaluator(config.symbols()), trainingCases);
        this.selector = new TournamentSelector(config.tournamentSize(), rng);
        this.crossover = new SubtreeCrossover(config.crossoverProbability(), config.symbols(), rng);
        this.mutation = new SubtreeMutation(config.mutationProbability(), config.maxDepth(), grower, rng);
        this.replacement = new GenerationalReplacement(config.populationSize(), config.eliteSize());

        log.info("Search created (seed: {}, {} training cases)", seed, trainingCases.size());
    }

    /**
     * Set event listener for search events.
     */
    public void setListener(SearchListener listener) {
        this.listener = listener != null ? listener : SearchListener.NOOP;
    }

    /**
     * Build the initial population by ramped half-and-half.
     */
    public void initialize() {
        requireState(state == SearchState.NEW, "initialize");
        population = new Population(grower.rampedHalfHalf(config.populationSize(), config.maxDepth()));
        state = SearchState.INITIALIZED;
        log.debug("Initialized {} individuals", population.size());
    }

    /**
     * Evaluate the initial population.
     */
    public void evaluateInitial() {
        requireState(state == SearchState.INITIALIZED, "evaluate initial population");
        fitness.evaluateAll(population.individuals());
        state = SearchState.EVALUATED;
        lastStats = GenerationStats.of(0, population);
        log.info("Initial population: best fitness {}", lastStats.bestFitness());
        listener.onInitialized(lastStats);
    }

    /**
     * Run one generation.
     *
     * @return the new population, best first
     */
    public Population step() {
        requireState(state.canStep(), "step");
        int size = config.populationSize();

        state = SearchState.SELECTING;
        List<Individual> parents = selector.select(population, size);

        state = SearchState.VARYING;
        List<Individual> offspring = new ArrayList<>(size + 1);
        while (offspring.size() < size) {
            int first = rng.nextInt(parents.size());
            int second = pairedIndex(first, parents.size());
            offspring.addAll(crossover.crossover(parents.get(first), parents.get(second)).asList());
        }
        // Crossover yields pairs; an odd population size leaves one extra child
        List<Individual> children = new ArrayList<>(size);
        for (Individual child : offspring.subList(0, size)) {
            children.add(mutation.mutate(child));
        }

        state = SearchState.EVALUATING;
        fitness.evaluateAll(children);

        state = SearchState.REPLACING;
        population = replacement.replace(new Population(children), population);
        generation++;

        lastStats = GenerationStats.of(generation, population);
        log.info("{}", lastStats);
        listener.onGeneration(lastStats, population);
        return population;
    }

    /**
     * Run the whole search from the current state to termination.
     *
     * @return best individual of the final population
     */
    public SearchResult run() {
        requireState(state != SearchState.TERMINATED, "run");
        try {
            if (state == SearchState.NEW) {
                initialize();
            }
            if (state == SearchState.INITIALIZED) {
                evaluateInitial();
            }
            log.info("Starting search for {} generations", config.generations());
            while (generation < config.generations()) {
                step();
            }
        } catch (GpException e) {
            log.error("Search aborted in generation {} ({}): {}", generation + 1, state, e.getMessage());
            throw e;
        }

        state = SearchState.TERMINATED;
        SearchResult result = new SearchResult(population.best(), generation, seed, lastStats);
        log.info("Search finished after {} generations, best fitness {}",
                generation, result.best().getFitness());
        listener.onComplete(result);
        return result;
    }

    /**
     * Second parent of a pair: a different position of the parent list, unless there is only one.
     */
    private int pairedIndex(int first, int count) {
        if (count < 2) {
            return first;
        }
        int second = rng.nextInt(count - 1);
        return second >= first ? second + 1 : second;
    }

    private void requireState(boolean ok, String action) {
        if (!ok) {
            throw new IllegalStateException("Cannot " + action + " in state " + state);
        }
    }

    // ========== Getters ==========

    public RunConfig getConfig() { return config; }
    public long getSeed() { return seed; }
    public SearchState getState() { return state; }
    public int getGeneration() { return generation; }
    public Population getPopulation() { return population; }
    public GenerationStats getLastStats() { return lastStats; }
    public FitnessEvaluator getFitnessEvaluator() { return fitness; }
}
