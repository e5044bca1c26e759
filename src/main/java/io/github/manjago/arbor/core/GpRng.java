package io.github.manjago.arbor.core;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

import java.util.List;

/**
 * The one random stream of a run.
 *
 * Every stochastic decision (symbol choice, growth method, tournament draws,
 * crossover and mutation points) is drawn from a single instance, in a fixed
 * order, so a seed fully determines a run. The generator is
 * XoRoShiRo128++ from Commons RNG; recorded seeds only replay while it stays
 * the same.
 */
public final class GpRng {

    private static final RandomSource ALGORITHM = RandomSource.XO_RO_SHI_RO_128_PP;

    private final long initialSeed;
    private final UniformRandomProvider rng;

    public GpRng(long seed) {
        this.initialSeed = seed;
        this.rng = ALGORITHM.create(seed);
    }

    /**
     * Returns uniformly distributed int in [0, bound).
     */
    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }

    /**
     * Returns uniformly distributed double in [0, 1).
     */
    public double nextDouble() {
        return rng.nextDouble();
    }

    /**
     * Returns true with probability p.
     */
    public boolean nextBoolean(double probability) {
        return rng.nextDouble() < probability;
    }

    /**
     * Returns uniformly distributed boolean.
     */
    public boolean nextBoolean() {
        return rng.nextBoolean();
    }

    /**
     * Uniform pick from a non-empty list. Consumes exactly one draw.
     */
    public <T> T choice(List<T> items) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Cannot choose from an empty list");
        }
        return items.get(rng.nextInt(items.size()));
    }

    /**
     * Seed this stream was created with (for logging and replay).
     */
    public long getInitialSeed() {
        return initialSeed;
    }
}
