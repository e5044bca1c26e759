package io.github.manjago.arbor.search;

import io.github.manjago.arbor.core.Population;

/**
 * Listener for search events.
 *
 * Implement this interface to render progress, e.g. one statistics line per
 * generation on the console.
 */
public interface SearchListener {

    /**
     * Called once the initial population has been evaluated.
     *
     * @param stats statistics of the initial population (generation 0)
     */
    default void onInitialized(GenerationStats stats) {}

    /**
     * Called after every generation's replacement.
     *
     * @param stats statistics of the new population
     * @param ranked the new population, best first
     */
    default void onGeneration(GenerationStats stats, Population ranked) {}

    /**
     * Called when all generations have run.
     *
     * @param result best individual and run summary
     */
    default void onComplete(SearchResult result) {}

    /**
     * No-op listener that does nothing.
     */
    SearchListener NOOP = new SearchListener() {};
}
