package io.github.manjago.arbor.search;

import io.github.manjago.arbor.core.Individual;
import io.github.manjago.arbor.core.Population;

/**
 * Snapshot of population statistics for one generation.
 *
 * Standard deviations are population deviations (divided by n).
 */
public record GenerationStats(
    int generation,
    double fitnessMean,
    double fitnessStd,
    double sizeMean,
    double sizeStd,
    double depthMean,
    double depthStd,
    Individual best
) {

    /**
     * Compute statistics of an evaluated population.
     */
    public static GenerationStats of(int generation, Population population) {
        int n = population.size();
        double[] fitness = new double[n];
        double[] size = new double[n];
        double[] depth = new double[n];
        for (int i = 0; i < n; i++) {
            Individual ind = population.get(i);
            fitness[i] = ind.getFitness();
            size[i] = ind.size();
            depth[i] = ind.depth();
        }
        double fitnessMean = mean(fitness);
        double sizeMean = mean(size);
        double depthMean = mean(depth);
        return new GenerationStats(
            generation,
            fitnessMean, std(fitness, fitnessMean),
            sizeMean, std(size, sizeMean),
            depthMean, std(depth, depthMean),
            population.best()
        );
    }

    public double bestFitness() {
        return best.getFitness();
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    private static double std(double[] values, double mean) {
        double sum = 0;
        for (double v : values) {
            sum += (v - mean) * (v - mean);
        }
        return Math.sqrt(sum / values.length);
    }

    /**
     * One-line summary, e.g. {@code Gen:3 fit_ave:-1.25+-0.500 size_ave:5.40+-2.010 depth_ave:1.80+-0.748 ...}.
     */
    @Override
    public String toString() {
        return String.format("Gen:%d fit_ave:%.2f+-%.3f size_ave:%.2f+-%.3f depth_ave:%.2f+-%.3f %s",
                generation,
                fitnessMean, fitnessStd,
                sizeMean, sizeStd,
                depthMean, depthStd,
                best);
    }
}
