package io.github.manjago.arbor.core;

/**
 * How {@link TreeGrower} picks symbols above the depth limit.
 */
public enum GrowthMethod {

    /** Functions only, so every branch reaches the depth limit */
    FULL,

    /** Terminal or function with equal chance, giving ragged trees */
    GROW;

    /**
     * One fair draw between the two methods.
     */
    public static GrowthMethod random(GpRng rng) {
        return rng.nextBoolean() ? FULL : GROW;
    }
}
