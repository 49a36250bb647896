package com.riskmgmt.quant.engine.simulation.distributions;

import com.riskmgmt.quant.exception.InvalidParameterException;
import com.riskmgmt.quant.model.DistributionType;

final class Parameters {

    private Parameters() {
    }

    static double require(String variable, DistributionType type, String name, Double value) {
        if (value == null) {
            throw new InvalidParameterException(variable,
                    String.format("%s distribution for '%s' requires '%s'", type, variable, name));
        }
        if (!Double.isFinite(value)) {
            throw new InvalidParameterException(variable,
                    String.format("%s distribution for '%s' has non-finite '%s'", type, variable, name));
        }
        return value;
    }

    static double orDefault(String variable, DistributionType type, String name, Double value, double fallback) {
        return value == null ? fallback : require(variable, type, name, value);
    }

    static void check(boolean condition, String variable, DistributionType type, String message) {
        if (!condition) {
            throw new InvalidParameterException(variable,
                    String.format("%s distribution for '%s': %s", type, variable, message));
        }
    }
}
