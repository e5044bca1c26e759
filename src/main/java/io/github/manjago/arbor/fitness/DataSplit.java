package io.github.manjago.arbor.fitness;

/**
 * Disjoint training and held-out test cases, fixed before the search starts.
 */
public record DataSplit(FitnessCases train, FitnessCases test) {
}
