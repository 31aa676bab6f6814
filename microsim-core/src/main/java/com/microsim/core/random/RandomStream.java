package com.microsim.core.random;

import java.util.SplittableRandom;

/**
 * One named, independently seeded generator.
 * <p>
 * Owns its generator state exclusively: draws here never touch any other
 * stream. Not thread-safe; a stream belongs to exactly one run, and a run is
 * single-threaded.
 * </p>
 */
public final class RandomStream {

    private final String name;
    private final long seed;
    private final SplittableRandom generator;
    private long draws;

    RandomStream(String name, long seed) {
        this.name = name;
        this.seed = seed;
        this.generator = new SplittableRandom(seed);
    }

    public String name() {
        return name;
    }

    /**
     * @return the child seed derived from {@code (rootSeed, name)}
     */
    public long seed() {
        return seed;
    }

    /**
     * @return number of values drawn so far
     */
    public long draws() {
        return draws;
    }

    /** Uniform in [0, 1). */
    public double nextDouble() {
        draws++;
        return generator.nextDouble();
    }

    public long nextLong() {
        draws++;
        return generator.nextLong();
    }

    /** Uniform in [0, bound). */
    public long nextLong(long bound) {
        draws++;
        return generator.nextLong(bound);
    }

    /** Uniform in [origin, bound). */
    public long nextLong(long origin, long bound) {
        draws++;
        return generator.nextLong(origin, bound);
    }

    /** Uniform in [0, bound). */
    public int nextInt(int bound) {
        draws++;
        return generator.nextInt(bound);
    }

    public boolean nextBoolean() {
        draws++;
        return generator.nextBoolean();
    }

    public double nextGaussian() {
        draws++;
        return generator.nextGaussian();
    }

    @Override
    public String toString() {
        return "RandomStream{name='" + name + "', draws=" + draws + '}';
    }
}
