package com.riskmgmt.quant.engine.network;

import com.riskmgmt.quant.model.CorrelationAnalysis;
import com.riskmgmt.quant.model.RiskCategory;
import com.riskmgmt.quant.model.RiskCluster;
import com.riskmgmt.quant.model.RiskInput;
import com.riskmgmt.quant.model.SystemicRiskIndicators;
import com.riskmgmt.quant.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SystemicRiskCalculatorTest {

    private CorrelationEngine correlationEngine;
    private ClusterDetector clusterDetector;
    private SystemicRiskCalculator calculator;

    @BeforeEach
    void setUp() {
        correlationEngine = new CorrelationEngine(TestDataFactory.defaultProperties());
        clusterDetector = new ClusterDetector(TestDataFactory.defaultProperties());
        calculator = new SystemicRiskCalculator(TestDataFactory.defaultProperties());
    }

    @Test
    void calculate_tightlyCoupledHighRisks_highContagionLowResilience() {
        List<RiskInput> risks = List.of(
                TestDataFactory.createRisk("R-1", RiskCategory.CYBERSECURITY, 90, 90, "vendor"),
                TestDataFactory.createRisk("R-2", RiskCategory.CYBERSECURITY, 85, 90, "vendor"),
                TestDataFactory.createRisk("R-3", RiskCategory.CYBERSECURITY, 80, 95, "vendor"));

        SystemicRiskIndicators indicators = analyze(risks);

        // Complete graph: density 1; one cluster with aggregate ~0.99
        assertThat(indicators.getContagionRisk()).isGreaterThan(0.9);
        assertThat(indicators.getVulnerabilityIndex()).isEqualTo(1.0);
        assertThat(indicators.getResilience()).isLessThan(0.1);
        assertThat(indicators.getAmplificationFactor()).isGreaterThan(1.0);
    }

    @Test
    void calculate_unrelatedRisks_noContagion() {
        List<RiskInput> risks = List.of(
                TestDataFactory.createRisk("R-1", RiskCategory.CYBERSECURITY, 90, 90, "a"),
                TestDataFactory.createRisk("R-2", RiskCategory.STRATEGIC, 5, 5, "b"));

        SystemicRiskIndicators indicators = analyze(risks);

        assertThat(indicators.getContagionRisk()).isEqualTo(0.0);
        assertThat(indicators.getVulnerabilityIndex()).isEqualTo(0.0);
        assertThat(indicators.getResilience()).isEqualTo(1.0);
        assertThat(indicators.getAmplificationFactor()).isEqualTo(1.0);
    }

    @Test
    void calculate_allIndicatorsWithinUnitRange() {
        List<RiskInput> risks = List.of(
                TestDataFactory.createRisk("R-1", RiskCategory.FINANCIAL, 40, 70, "liquidity"),
                TestDataFactory.createRisk("R-2", RiskCategory.COMPLIANCE, 55, 60, "liquidity", "reporting"),
                TestDataFactory.createRisk("R-3", RiskCategory.OPERATIONAL, 30, 30, "reporting"),
                TestDataFactory.createRisk("R-4", RiskCategory.STRATEGIC, 70, 20));

        SystemicRiskIndicators indicators = analyze(risks);

        assertThat(indicators.getContagionRisk()).isBetween(0.0, 1.0);
        assertThat(indicators.getVulnerabilityIndex()).isBetween(0.0, 1.0);
        assertThat(indicators.getResilience()).isBetween(0.0, 1.0);
        assertThat(indicators.getAmplificationFactor()).isGreaterThanOrEqualTo(1.0);
        assertThat(indicators.getSystemicImportance()).containsOnlyKeys("R-1", "R-2", "R-3", "R-4");
        assertThat(indicators.getSystemicImportance().values()).allSatisfy(v -> assertThat(v).isBetween(0.0, 1.0));
    }

    @Test
    void calculate_resilienceFormula() {
        List<RiskInput> risks = List.of(
                TestDataFactory.createRisk("R-1", RiskCategory.OPERATIONAL, 50, 50, "x"),
                TestDataFactory.createRisk("R-2", RiskCategory.OPERATIONAL, 50, 50, "x"));

        SystemicRiskIndicators indicators = analyze(risks);

        // density 1, aggregate 1 - 0.75^2 = 0.4375 (< 0.7, so no vulnerability)
        assertThat(indicators.getContagionRisk()).isCloseTo(0.4 + 0.6 * 0.4375, within(1e-12));
        assertThat(indicators.getVulnerabilityIndex()).isEqualTo(0.0);
        assertThat(indicators.getResilience()).isCloseTo(1 - 0.6 * (0.4 + 0.6 * 0.4375), within(1e-12));
        assertThat(indicators.getAmplificationFactor()).isCloseTo(0.4375 / 0.25, within(1e-12));
    }

    private SystemicRiskIndicators analyze(List<RiskInput> risks) {
        CorrelationAnalysis analysis = correlationEngine.correlate(risks);
        List<RiskCluster> clusters = clusterDetector.cluster(risks, analysis.getMatrix());
        return calculator.calculate(risks, analysis, clusters);
    }
}
