package com.riskmgmt.quant.testutil;

import com.riskmgmt.quant.config.MetricsConfig;
import com.riskmgmt.quant.config.QuantEngineProperties;
import com.riskmgmt.quant.engine.simulation.DistributionModel;
import com.riskmgmt.quant.engine.simulation.DistributionSampler;
import com.riskmgmt.quant.engine.simulation.SimulationEngine;
import com.riskmgmt.quant.engine.simulation.distributions.BetaDistributionModel;
import com.riskmgmt.quant.engine.simulation.distributions.LogNormalDistributionModel;
import com.riskmgmt.quant.engine.simulation.distributions.NormalDistributionModel;
import com.riskmgmt.quant.engine.simulation.distributions.TriangularDistributionModel;
import com.riskmgmt.quant.engine.simulation.distributions.UniformDistributionModel;
import com.riskmgmt.quant.engine.statistics.StatisticalSummarizer;
import com.riskmgmt.quant.model.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;
import java.util.concurrent.Executor;

/**
 * Shared test data builders and engine wiring to avoid repeating construction boilerplate.
 */
public final class TestDataFactory {

    private TestDataFactory() {}

    public static RiskInput createRisk(String id, RiskCategory category, double probability, double impact,
                                       String... factors) {
        return RiskInput.builder()
                .id(id)
                .title("Test risk " + id)
                .category(category)
                .probability(probability)
                .impact(impact)
                .factors(List.of(factors))
                .build();
    }

    public static RiskInput createRiskWithFinancials(String id, RiskCategory category, double probability,
                                                     double impact, double minLoss, double maxLoss) {
        return RiskInput.builder()
                .id(id)
                .title("Test risk " + id)
                .category(category)
                .probability(probability)
                .impact(impact)
                .financialImpact(FinancialImpactRange.builder().min(minLoss).max(maxLoss).currency("USD").build())
                .build();
    }

    public static SimulationParameters createParameters(int iterations, int timeframeDays) {
        return SimulationParameters.builder()
                .iterations(iterations)
                .timeframeDays(timeframeDays)
                .build();
    }

    public static QuantEngineProperties defaultProperties() {
        return new QuantEngineProperties();
    }

    public static MetricsConfig metrics() {
        return new MetricsConfig(new SimpleMeterRegistry());
    }

    public static List<DistributionModel> distributionModels() {
        return List.of(
                new TriangularDistributionModel(),
                new LogNormalDistributionModel(),
                new NormalDistributionModel(),
                new UniformDistributionModel(),
                new BetaDistributionModel());
    }

    public static DistributionSampler sampler(QuantEngineProperties properties) {
        return new DistributionSampler(distributionModels(), properties);
    }

    public static SimulationEngine simulationEngine(QuantEngineProperties properties, Executor executor) {
        return new SimulationEngine(sampler(properties), new StatisticalSummarizer(properties),
                executor, metrics(), properties);
    }

    /**
     * Runs every task on the calling thread.
     */
    public static Executor directExecutor() {
        return Runnable::run;
    }
}
