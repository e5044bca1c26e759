package io.github.manjago.arbor.fitness;

import io.github.manjago.arbor.core.InvalidConfigurationException;

import java.util.Arrays;

/**
 * Immutable table of exemplars: input vectors and the target for each.
 *
 * All input vectors have the same width.
 */
public final class FitnessCases {

    private final double[][] inputs;
    private final double[] targets;

    public FitnessCases(double[][] inputs, double[] targets) {
        if (inputs.length != targets.length) {
            throw new IllegalArgumentException(String.format(
                    "%d input rows but %d targets", inputs.length, targets.length));
        }
        this.inputs = new double[inputs.length][];
        for (int i = 0; i < inputs.length; i++) {
            if (i > 0 && inputs[i].length != inputs[0].length) {
                throw new IllegalArgumentException(String.format(
                        "Row %d has %d inputs, expected %d", i, inputs[i].length, inputs[0].length));
            }
            this.inputs[i] = inputs[i].clone();
        }
        this.targets = targets.clone();
    }

    public int size() {
        return targets.length;
    }

    public boolean isEmpty() {
        return targets.length == 0;
    }

    /**
     * Number of explanatory variables per case (0 for an empty table).
     */
    public int width() {
        return inputs.length == 0 ? 0 : inputs[0].length;
    }

    public double[] input(int i) {
        return inputs[i].clone();
    }

    public double target(int i) {
        return targets[i];
    }

    /** Shared array, never handed outside this package. */
    double[] rawInput(int i) {
        return inputs[i];
    }

    /**
     * Split by row order: the first {@code floor(size * trainFraction)} rows
     * train, the rest are held out.
     *
     * @throws InvalidConfigurationException if the fraction is not in (0, 1)
     */
    public DataSplit split(double trainFraction) {
        if (!(trainFraction > 0.0 && trainFraction < 1.0)) {
            throw new InvalidConfigurationException("test-train-split must be in (0, 1), got " + trainFraction);
        }
        int cut = (int) Math.floor(size() * trainFraction);
        return new DataSplit(slice(0, cut), slice(cut, size()));
    }

    private FitnessCases slice(int from, int to) {
        double[][] in = Arrays.copyOfRange(inputs, from, to);
        double[] out = Arrays.copyOfRange(targets, from, to);
        return new FitnessCases(in, out);
    }

    @Override
    public String toString() {
        return String.format("FitnessCases[size=%d, width=%d]", size(), width());
    }
}
