package com.riskmgmt.quant.engine.simulation;

import org.apache.commons.math3.random.RandomGenerator;

import java.util.function.DoubleSupplier;

/**
 * A prepared distribution. {@link #bind(RandomGenerator)} returns a draw source that reads
 * all of its randomness from the given generator, so the same generator state always
 * yields the same sequence.
 */
@FunctionalInterface
public interface SeverityModel {

    DoubleSupplier bind(RandomGenerator rng);

    static SeverityModel constant(double value) {
        return rng -> () -> value;
    }

    /**
     * Product of two independent models, both bound to the same generator.
     */
    static SeverityModel product(SeverityModel first, SeverityModel second) {
        return rng -> {
            DoubleSupplier a = first.bind(rng);
            DoubleSupplier b = second.bind(rng);
            return () -> a.getAsDouble() * b.getAsDouble();
        };
    }
}
