package com.riskmgmt.quant.engine.simulation.distributions;

import com.riskmgmt.quant.engine.simulation.DistributionModel;
import com.riskmgmt.quant.engine.simulation.SeverityModel;
import com.riskmgmt.quant.model.DistributionType;
import com.riskmgmt.quant.model.VariableDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Component;

/**
 * Normal distribution. Explicit only: negative draws are invalid severities, so the sampler
 * redraws them.
 */
@Component
public class NormalDistributionModel implements DistributionModel {

    private static final DistributionType TYPE = DistributionType.NORMAL;

    @Override
    public DistributionType getSupportedType() {
        return TYPE;
    }

    @Override
    public SeverityModel explicit(String variable, VariableDistribution params) {
        double mean = Parameters.require(variable, TYPE, "mean", params.getMean());
        double sd = Parameters.require(variable, TYPE, "stddev", params.getStddev());
        Parameters.check(sd >= 0, variable, TYPE, "requires stddev >= 0");
        if (sd == 0) {
            return SeverityModel.constant(mean);
        }
        return rng -> new NormalDistribution(rng, mean, sd)::sample;
    }
}
