package com.riskmgmt.quant.engine.simulation;

import com.riskmgmt.quant.config.QuantEngineProperties;
import com.riskmgmt.quant.exception.DistributionException;
import com.riskmgmt.quant.exception.InvalidParameterException;
import com.riskmgmt.quant.model.DistributionType;
import com.riskmgmt.quant.model.RiskInput;
import com.riskmgmt.quant.model.SimulationParameters;
import com.riskmgmt.quant.model.VariableDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.DoubleSupplier;

/**
 * Builds the severity distribution for a risk and draws from it.
 *
 * Without explicit variables the distribution is anchored on the risk itself: mode
 * m = probability/100 x impact/100, spread s = baseSpread x (1 - 0.5|2m - 1|), so extreme
 * risks get narrower distributions. Families are pluggable {@link DistributionModel}s keyed by
 * {@link DistributionType}.
 *
 * Every model returned here redraws invalid values (NaN, infinite, negative) up to
 * {@code maxSampleRetries} times before failing with {@link DistributionException}.
 */
@Component
public class DistributionSampler {

    private static final Logger log = LoggerFactory.getLogger(DistributionSampler.class);

    private static final Set<String> KNOWN_VARIABLES = Set.of(
            SimulationParameters.SEVERITY, SimulationParameters.LIKELIHOOD, SimulationParameters.IMPACT);

    private final Map<DistributionType, DistributionModel> models;
    private final DistributionType defaultType;
    private final double baseSpread;
    private final int maxRetries;

    public DistributionSampler(List<DistributionModel> distributionModels, QuantEngineProperties properties) {
        this.models = new EnumMap<>(DistributionType.class);
        for (DistributionModel model : distributionModels) {
            models.put(model.getSupportedType(), model);
            log.info("Registered distribution model: {} -> {}",
                    model.getSupportedType(), model.getClass().getSimpleName());
        }

        QuantEngineProperties.Simulation config = properties.getSimulation();
        this.defaultType = config.getDefaultDistribution();
        this.baseSpread = config.getBaseSpread();
        this.maxRetries = Math.max(0, config.getMaxSampleRetries());

        DistributionModel defaultModel = models.get(defaultType);
        if (defaultModel == null || !defaultModel.supportsAnchoring()) {
            throw new IllegalStateException("Default distribution " + defaultType
                    + " is not registered or cannot be anchored on a risk");
        }
    }

    /**
     * Single validated draw from the risk's default (anchored) distribution.
     */
    public double sample(RiskInput risk, RandomGenerator rng) {
        return model(risk, Map.of()).bind(rng).getAsDouble();
    }

    /**
     * Prepared severity model for a risk, honouring explicit variable distributions.
     *
     * <ul>
     *   <li>{@code severity}: replaces the anchored distribution outright.</li>
     *   <li>{@code likelihood} / {@code impact}: severity is their product; a missing side is
     *       anchored on probability/100 or impact/100 with the default family.</li>
     * </ul>
     */
    public SeverityModel model(RiskInput risk, Map<String, VariableDistribution> variables) {
        Map<String, VariableDistribution> vars = variables == null ? Map.of() : variables;
        for (Map.Entry<String, VariableDistribution> entry : vars.entrySet()) {
            if (!KNOWN_VARIABLES.contains(entry.getKey())) {
                throw new InvalidParameterException(entry.getKey(),
                        "Unknown simulation variable '" + entry.getKey()
                                + "'; expected one of severity, likelihood, impact");
            }
            if (entry.getValue() == null || entry.getValue().getType() == null) {
                throw new InvalidParameterException(entry.getKey(),
                        "Variable '" + entry.getKey() + "' has no distribution type");
            }
        }

        VariableDistribution severity = vars.get(SimulationParameters.SEVERITY);
        VariableDistribution likelihood = vars.get(SimulationParameters.LIKELIHOOD);
        VariableDistribution impact = vars.get(SimulationParameters.IMPACT);

        if (severity != null) {
            if (likelihood != null || impact != null) {
                throw new InvalidParameterException(SimulationParameters.SEVERITY,
                        "'severity' cannot be combined with 'likelihood' or 'impact'");
            }
            return validated(risk.getId(), severity.getType(),
                    explicit(SimulationParameters.SEVERITY, severity));
        }

        if (likelihood != null || impact != null) {
            SeverityModel likelihoodModel = likelihood != null
                    ? explicit(SimulationParameters.LIKELIHOOD, likelihood)
                    : anchored(risk.getProbability() / 100.0);
            SeverityModel impactModel = impact != null
                    ? explicit(SimulationParameters.IMPACT, impact)
                    : anchored(risk.getImpact() / 100.0);
            DistributionType label = likelihood != null ? likelihood.getType() : impact.getType();
            return validated(risk.getId(), label, SeverityModel.product(likelihoodModel, impactModel));
        }

        return validated(risk.getId(), defaultType, anchored(risk.severityScore()));
    }

    /**
     * Default-family distribution anchored on a unit-scale mode.
     */
    public SeverityModel anchored(double mode) {
        double spread = spreadFor(mode);
        if (mode <= 0.0 || spread <= 0.0) {
            return SeverityModel.constant(Math.max(0.0, mode));
        }
        return models.get(defaultType).anchored(mode, spread);
    }

    /**
     * Half-width of the anchored distribution: widest at m = 0.5, half as wide at the extremes.
     */
    public double spreadFor(double mode) {
        double extremeness = Math.min(1.0, Math.abs(2.0 * mode - 1.0));
        return baseSpread * (1.0 - 0.5 * extremeness);
    }

    public DistributionType getDefaultType() {
        return defaultType;
    }

    private SeverityModel explicit(String variable, VariableDistribution params) {
        DistributionModel model = models.get(params.getType());
        if (model == null) {
            throw new InvalidParameterException(variable, "No distribution model registered for " + params.getType());
        }
        return model.explicit(variable, params);
    }

    private SeverityModel validated(String riskId, DistributionType type, SeverityModel model) {
        return rng -> {
            DoubleSupplier raw = model.bind(rng);
            return () -> {
                for (int attempt = 0; attempt <= maxRetries; attempt++) {
                    double value = raw.getAsDouble();
                    if (Double.isFinite(value) && value >= 0.0) {
                        return value;
                    }
                }
                throw new DistributionException("distribution", String.format(
                        "%s distribution for risk %s produced %d consecutive invalid draws",
                        type, riskId, maxRetries + 1));
            };
        };
    }
}
