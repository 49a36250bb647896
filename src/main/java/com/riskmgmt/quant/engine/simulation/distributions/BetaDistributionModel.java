package com.riskmgmt.quant.engine.simulation.distributions;

import com.riskmgmt.quant.engine.simulation.DistributionModel;
import com.riskmgmt.quant.engine.simulation.SeverityModel;
import com.riskmgmt.quant.model.DistributionType;
import com.riskmgmt.quant.model.VariableDistribution;
import org.apache.commons.math3.distribution.BetaDistribution;
import org.springframework.stereotype.Component;

/**
 * Beta(alpha, beta) rescaled to [min, max], which default to [0, 1].
 */
@Component
public class BetaDistributionModel implements DistributionModel {

    private static final DistributionType TYPE = DistributionType.BETA;

    @Override
    public DistributionType getSupportedType() {
        return TYPE;
    }

    @Override
    public SeverityModel explicit(String variable, VariableDistribution params) {
        double alpha = Parameters.require(variable, TYPE, "alpha", params.getAlpha());
        double beta = Parameters.require(variable, TYPE, "beta", params.getBeta());
        double min = Parameters.orDefault(variable, TYPE, "min", params.getMin(), 0.0);
        double max = Parameters.orDefault(variable, TYPE, "max", params.getMax(), 1.0);
        Parameters.check(alpha > 0 && beta > 0, variable, TYPE, "requires alpha > 0 and beta > 0");
        Parameters.check(min < max, variable, TYPE, "requires min < max");

        double width = max - min;
        return rng -> {
            BetaDistribution distribution = new BetaDistribution(rng, alpha, beta);
            return () -> min + width * distribution.sample();
        };
    }
}
