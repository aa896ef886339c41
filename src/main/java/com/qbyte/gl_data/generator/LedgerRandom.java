package com.qbyte.gl_data.generator;

import java.util.List;
import java.util.Random;

/**
 * Seeded pseudo-random source for record generation.
 *
 * Exactly one instance is owned by the generation engine. Generators receive
 * it as a method parameter and never keep a reference, so every draw that can
 * affect generated output goes through this object in a known order.
 *
 * Not thread-safe. Only the engine's writer path may use it.
 */
public final class LedgerRandom {

    private final Random random;

    public LedgerRandom(long seed) {
        this.random = new Random(seed);
    }

    /**
     * Uniform draw in {@code [0, 1)}.
     */
    public double nextDouble() {
        return random.nextDouble();
    }

    /**
     * Uniform draw in {@code [min, max)}.
     */
    public double uniform(double min, double max) {
        return min + (max - min) * random.nextDouble();
    }

    /**
     * Uniform integer draw in {@code [min, max]}, both ends inclusive.
     */
    public int nextInt(int min, int max) {
        if (max < min) {
            throw new IllegalArgumentException(
                String.format("Invalid bounds: min=%d, max=%d", min, max));
        }
        return min + random.nextInt(max - min + 1);
    }

    public <T> T choice(List<T> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Cannot choose from an empty list");
        }
        return values.get(random.nextInt(values.size()));
    }
}
