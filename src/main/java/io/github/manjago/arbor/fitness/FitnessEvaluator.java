package io.github.manjago.arbor.fitness;

import io.github.manjago.arbor.core.EmptyFitnessCaseSetException;
import io.github.manjago.arbor.core.Evaluator;
import io.github.manjago.arbor.core.GpException;
import io.github.manjago.arbor.core.Individual;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns fitness: the negated mean squared error over a set of cases.
 *
 * There is no partial fitness. If the evaluator fails on any case the
 * individual is marked failed and the error propagates. An error that is
 * not a number (e.g. from {@code inf - inf}) ranks worst.
 */
public final class FitnessEvaluator {

    private static final Logger log = LoggerFactory.getLogger(FitnessEvaluator.class);

    private final Evaluator evaluator;
    private final FitnessCases cases;

    public FitnessEvaluator(Evaluator evaluator, FitnessCases cases) {
        this.evaluator = evaluator;
        this.cases = cases;
    }

    public FitnessCases getCases() {
        return cases;
    }

    /**
     * Evaluate against this evaluator's cases and store the fitness.
     */
    public void evaluate(Individual individual) {
        individual.assignFitness(fitnessOf(individual, cases));
    }

    /**
     * Evaluate every individual, in order.
     */
    public void evaluateAll(Iterable<Individual> individuals) {
        for (Individual ind : individuals) {
            evaluate(ind);
        }
    }

    /**
     * Fresh evaluated copy against other cases, e.g. held-out data.
     * The original keeps its training fitness.
     */
    public Individual evaluateCopy(Individual individual, FitnessCases otherCases) {
        Individual copy = individual.unevaluatedCopy();
        copy.assignFitness(fitnessOf(copy, otherCases));
        return copy;
    }

    private double fitnessOf(Individual individual, FitnessCases set) {
        if (set.isEmpty()) {
            individual.markFailed();
            throw new EmptyFitnessCaseSetException("Cannot evaluate fitness on an empty case set");
        }
        double sum = 0.0;
        try {
            for (int i = 0; i < set.size(); i++) {
                double error = evaluator.evaluate(individual.getGenome(), set.rawInput(i)) - set.target(i);
                sum += error * error;
            }
        } catch (GpException e) {
            individual.markFailed();
            log.debug("Evaluation failed for {}: {}", individual.getGenome(), e.getMessage());
            throw e;
        }
        if (Double.isNaN(sum)) {
            return Double.NEGATIVE_INFINITY;
        }
        // 0.0 - x rather than -x: a perfect fit is +0.0, not -0.0
        return 0.0 - sum / set.size();
    }
}
