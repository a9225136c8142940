package com.gnovoa.fantasy.sim;

import java.util.Random;

/**
 * Reproducible randomness from a fixed seed.
 *
 * <p>Calls are synchronized, so a single instance can back concurrent scoring calls; the sequence
 * is then only reproducible per call order.
 */
public final class SeededRandomSource implements RandomSource {

    private final Random random;

    public SeededRandomSource(long seed) {
        this.random = new Random(seed);
    }

    @Override public synchronized int nextIntInclusive(int fromInclusive, int toInclusive) {
        return fromInclusive + random.nextInt(toInclusive - fromInclusive + 1);
    }
}
