package com.riskmgmt.quant.engine.simulation.distributions;

import com.riskmgmt.quant.engine.simulation.DistributionModel;
import com.riskmgmt.quant.engine.simulation.SeverityModel;
import com.riskmgmt.quant.model.DistributionType;
import com.riskmgmt.quant.model.VariableDistribution;
import org.apache.commons.math3.distribution.UniformRealDistribution;
import org.springframework.stereotype.Component;

@Component
public class UniformDistributionModel implements DistributionModel {

    private static final DistributionType TYPE = DistributionType.UNIFORM;

    @Override
    public DistributionType getSupportedType() {
        return TYPE;
    }

    @Override
    public boolean supportsAnchoring() {
        return true;
    }

    @Override
    public SeverityModel anchored(double mode, double spread) {
        return of(Math.max(0.0, mode - spread), mode + spread);
    }

    @Override
    public SeverityModel explicit(String variable, VariableDistribution params) {
        double min = Parameters.require(variable, TYPE, "min", params.getMin());
        double max = Parameters.require(variable, TYPE, "max", params.getMax());
        Parameters.check(min <= max, variable, TYPE, "requires min <= max");
        if (min == max) {
            return SeverityModel.constant(min);
        }
        return of(min, max);
    }

    private static SeverityModel of(double lower, double upper) {
        return rng -> new UniformRealDistribution(rng, lower, upper)::sample;
    }
}
