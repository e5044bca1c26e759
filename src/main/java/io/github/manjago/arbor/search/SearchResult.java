package io.github.manjago.arbor.search;

import io.github.manjago.arbor.core.Individual;

/**
 * Outcome of a completed search.
 *
 * @param best fittest individual of the final population (training fitness)
 * @param generations generations run
 * @param seed seed the run used, enough to replay it
 * @param finalStats statistics of the final population
 */
public record SearchResult(Individual best, int generations, long seed, GenerationStats finalStats) {
}
