package com.riskmgmt.quant.engine.simulation.distributions;

import com.riskmgmt.quant.engine.simulation.DistributionModel;
import com.riskmgmt.quant.engine.simulation.SeverityModel;
import com.riskmgmt.quant.model.DistributionType;
import com.riskmgmt.quant.model.VariableDistribution;
import org.apache.commons.math3.distribution.TriangularDistribution;
import org.springframework.stereotype.Component;

/**
 * Triangular distribution, the default severity family.
 *
 * Anchored form: [max(0, m - s), m, m + s]. The lower bound is cut at zero, so the
 * distribution is skewed right for low-severity risks.
 */
@Component
public class TriangularDistributionModel implements DistributionModel {

    private static final DistributionType TYPE = DistributionType.TRIANGULAR;

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
        return of(Math.max(0.0, mode - spread), mode, mode + spread);
    }

    @Override
    public SeverityModel explicit(String variable, VariableDistribution params) {
        double min = Parameters.require(variable, TYPE, "min", params.getMin());
        double max = Parameters.require(variable, TYPE, "max", params.getMax());
        double mode = Parameters.require(variable, TYPE, "mode", params.getMode());
        Parameters.check(min <= mode && mode <= max, variable, TYPE, "requires min <= mode <= max");
        if (min == max) {
            return SeverityModel.constant(min);
        }
        return of(min, mode, max);
    }

    private static SeverityModel of(double lower, double mode, double upper) {
        return rng -> new TriangularDistribution(rng, lower, mode, upper)::sample;
    }
}
