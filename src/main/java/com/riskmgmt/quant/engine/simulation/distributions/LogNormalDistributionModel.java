package com.riskmgmt.quant.engine.simulation.distributions;

import com.riskmgmt.quant.engine.simulation.DistributionModel;
import com.riskmgmt.quant.engine.simulation.SeverityModel;
import com.riskmgmt.quant.model.DistributionType;
import com.riskmgmt.quant.model.VariableDistribution;
import org.apache.commons.math3.distribution.LogNormalDistribution;
import org.springframework.stereotype.Component;

/**
 * Log-normal distribution for heavy right tails.
 *
 * Anchored form: shape sigma = s and location mu = ln(m) + sigma^2, which puts the mode at m.
 * Explicit form reads {@code mean} as the median (e^mu) and {@code stddev} as sigma.
 */
@Component
public class LogNormalDistributionModel implements DistributionModel {

    private static final DistributionType TYPE = DistributionType.LOG_NORMAL;

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
        double sigma = spread;
        double mu = Math.log(mode) + sigma * sigma;
        return of(mu, sigma);
    }

    @Override
    public SeverityModel explicit(String variable, VariableDistribution params) {
        double median = Parameters.require(variable, TYPE, "mean", params.getMean());
        double sigma = Parameters.require(variable, TYPE, "stddev", params.getStddev());
        Parameters.check(median > 0, variable, TYPE, "requires mean (median) > 0");
        Parameters.check(sigma >= 0, variable, TYPE, "requires stddev >= 0");
        if (sigma == 0) {
            return SeverityModel.constant(median);
        }
        return of(Math.log(median), sigma);
    }

    private static SeverityModel of(double mu, double sigma) {
        return rng -> new LogNormalDistribution(rng, mu, sigma)::sample;
    }
}
