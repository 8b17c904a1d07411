package com.spindle.core.worker;

import java.util.Random;

/**
 * Supplies the starting counter value of a worker spawned without an explicit one.
 */
@FunctionalInterface
public interface InitialValueSource {

    long nextInitialValue();

    /**
     * Pseudo-random non-negative values in {@code [0, Integer.MAX_VALUE)} from a generator
     * seeded once.
     */
    static InitialValueSource seeded(long seed) {
        Random random = new Random(seed);
        return () -> random.nextInt(Integer.MAX_VALUE);
    }
}
