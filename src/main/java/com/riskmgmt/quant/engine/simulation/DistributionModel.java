package com.riskmgmt.quant.engine.simulation;

import com.riskmgmt.quant.model.DistributionType;
import com.riskmgmt.quant.model.VariableDistribution;

/**
 * One distribution family. Implementations are registered per {@link DistributionType}
 * by the {@link DistributionSampler}.
 */
public interface DistributionModel {

    /**
     * The distribution family this model handles.
     */
    DistributionType getSupportedType();

    /**
     * Whether the family can be anchored on a single mode and spread, which the sampler
     * needs for its default severity distribution.
     */
    default boolean supportsAnchoring() {
        return false;
    }

    /**
     * Distribution centred on {@code mode} with half-width {@code spread}. Callers handle the
     * degenerate {@code mode == 0} and {@code spread == 0} cases before calling.
     */
    default SeverityModel anchored(double mode, double spread) {
        throw new UnsupportedOperationException(getSupportedType() + " cannot be anchored on a mode");
    }

    /**
     * Distribution from explicit parameters.
     *
     * @param variable name of the variable being modelled, reported on invalid parameters
     * @param params     the parameters; only those relevant to this family are read
     * @throws com.riskmgmt.quant.exception.InvalidParameterException on missing or inconsistent parameters
     */
    SeverityModel explicit(String variable, VariableDistribution params);
}
