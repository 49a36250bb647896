package com.riskmgmt.quant.engine.simulation;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Derives independent, reproducible random streams from a single seed.
 */
public final class SeedSequence {

    /** Stream index reserved for trajectory sub-sampling. */
    public static final int TRAJECTORY_STREAM = -1;

    private SeedSequence() {
    }

    /**
     * Generator for stream {@code stream} of {@code seed}. The same pair always yields the same
     * sequence, and distinct pairs yield unrelated sequences.
     */
    public static RandomGenerator stream(long seed, int stream) {
        return new Well19937c(new int[]{(int) (seed >>> 32), (int) seed, stream, 0x5EED});
    }

    /**
     * Child seed for the {@code index}-th item of a batch (SplitMix64 finalizer).
     */
    public static long derive(long seed, int index) {
        long z = seed + 0x9E3779B97F4A7C15L * (index + 1L);
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
