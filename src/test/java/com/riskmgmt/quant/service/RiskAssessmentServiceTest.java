package com.riskmgmt.quant.service;

import com.riskmgmt.quant.config.MetricsConfig;
import com.riskmgmt.quant.config.QuantEngineProperties;
import com.riskmgmt.quant.engine.network.ClusterDetector;
import com.riskmgmt.quant.engine.network.CorrelationEngine;
import com.riskmgmt.quant.engine.network.SystemicRiskCalculator;
import com.riskmgmt.quant.engine.recommendation.RecommendationGenerator;
import com.riskmgmt.quant.engine.report.ReportAssembler;
import com.riskmgmt.quant.engine.simulation.CancellationToken;
import com.riskmgmt.quant.exception.InvalidParameterException;
import com.riskmgmt.quant.exception.SimulationCancelledException;
import com.riskmgmt.quant.model.*;
import com.riskmgmt.quant.testutil.TestDataFactory;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RiskAssessmentServiceTest {

    @Mock private MetricsConfig metricsConfig;

    private QuantEngineProperties properties;
    private AssessmentCache cache;
    private RiskAssessmentService service;

    private final RiskInput ransomware = TestDataFactory.createRisk(
            "R-1", RiskCategory.CYBERSECURITY, 78, 95, "legacy-systems", "third-party");
    private final RiskInput outage = TestDataFactory.createRisk(
            "R-2", RiskCategory.OPERATIONAL, 60, 70, "legacy-systems");
    private final RiskInput fxExposure = TestDataFactory.createRisk(
            "R-3", RiskCategory.FINANCIAL, 20, 30, "currency");

    @BeforeEach
    void setUp() {
        properties = TestDataFactory.defaultProperties();
        service = newService(properties);
    }

    private RiskAssessmentService newService(QuantEngineProperties properties) {
        cache = new AssessmentCache(properties);
        return new RiskAssessmentService(
                TestDataFactory.simulationEngine(properties, TestDataFactory.directExecutor()),
                new CorrelationEngine(properties),
                new ClusterDetector(properties),
                new SystemicRiskCalculator(properties),
                new RecommendationGenerator(properties, metricsConfig),
                new ReportAssembler(Clock.fixed(Instant.parse("2024-03-01T00:00:00Z"), ZoneOffset.UTC)),
                cache,
                metricsConfig,
                Tracer.NOOP,
                properties);
    }

    @Test
    void assessRisk_singleRisk_simulationAndRecommendationsOnly() {
        RiskAssessmentReport report = service.assessRisk(
                List.of(ransomware), TestDataFactory.createParameters(1000, 90), RiskFramework.NIST, 42L);

        assertThat(report.getRisks()).containsExactly(ransomware);
        assertThat(report.getSimulations()).hasSize(1);
        assertThat(report.getSimulations().get(0).getExpectedValue()).isBetween(0.38, 1.14);
        assertThat(report.getCorrelation()).isNull();
        assertThat(report.getSystemicRisk()).isNull();
        assertThat(report.getClusters()).isEmpty();
        assertThat(report.getRecommendations()).isNotEmpty();
        assertThat(report.getFramework()).isEqualTo(RiskFramework.NIST);
        assertThat(report.getId()).startsWith("RA-");
        assertThat(report.getFingerprint()).hasSize(64);
        verify(metricsConfig).recordAssessment("NIST", 1, 0);
    }

    @Test
    void assessRisk_portfolio_fullPipeline() {
        List<RiskInput> risks = List.of(ransomware, outage, fxExposure);

        RiskAssessmentReport report = service.assessRisk(
                risks, TestDataFactory.createParameters(2000, 90), RiskFramework.COSO, 7L);

        assertThat(report.getSimulations()).extracting(SimulationResult::getRiskId)
                .containsExactly("R-1", "R-2", "R-3");
        assertThat(report.getCorrelation().getMatrix().getRiskIds()).containsExactly("R-1", "R-2", "R-3");
        assertThat(report.getClusters()).hasSize(1);
        assertThat(report.getClusters().get(0).getRiskIds()).containsExactly("R-1", "R-2");
        assertThat(report.getSystemicRisk()).isNotNull();
        assertThat(report.getRecommendations()).anyMatch(r -> r.getId().equals("REC-CLUSTER-1"));
    }

    @Test
    void assessRisk_perRiskSeedsDiffer() {
        RiskInput twin = TestDataFactory.createRisk("R-9", RiskCategory.CYBERSECURITY, 78, 95,
                "legacy-systems", "third-party");

        RiskAssessmentReport report = service.assessRisk(
                List.of(ransomware, twin), TestDataFactory.createParameters(1000, 30), RiskFramework.COSO, 42L);

        List<SimulationResult> sims = report.getSimulations();
        assertThat(sims.get(0).getSeed()).isNotEqualTo(sims.get(1).getSeed());
        assertThat(sims.get(0).getExpectedValue()).isNotEqualTo(sims.get(1).getExpectedValue());
    }

    @Test
    void assessRisk_sameInputs_returnsMemoizedReport() {
        List<RiskInput> risks = List.of(ransomware, outage);
        SimulationParameters params = TestDataFactory.createParameters(1000, 90);

        RiskAssessmentReport first = service.assessRisk(risks, params, RiskFramework.ISO31000, 42L);
        RiskAssessmentReport second = service.assessRisk(risks, params, RiskFramework.ISO31000, 42L);

        assertThat(second).isSameAs(first);
        verify(metricsConfig).recordCacheLookup(false);
        verify(metricsConfig).recordCacheLookup(true);
    }

    @Test
    void assessRisk_cacheDisabled_recomputesIdenticalReport() {
        properties.getCache().setEnabled(false);
        service = newService(properties);
        SimulationParameters params = TestDataFactory.createParameters(1000, 90);

        RiskAssessmentReport first = service.assessRisk(List.of(ransomware), params, RiskFramework.COSO, 42L);
        RiskAssessmentReport second = service.assessRisk(List.of(ransomware), params, RiskFramework.COSO, 42L);

        assertThat(second).isNotSameAs(first);
        assertThat(second).isEqualTo(first);
    }

    @Test
    void assessRisk_differentSeed_differentFingerprint() {
        SimulationParameters params = TestDataFactory.createParameters(1000, 90);

        RiskAssessmentReport first = service.assessRisk(List.of(ransomware), params, RiskFramework.COSO, 42L);
        RiskAssessmentReport second = service.assessRisk(List.of(ransomware), params, RiskFramework.COSO, 43L);

        assertThat(second.getFingerprint()).isNotEqualTo(first.getFingerprint());
    }

    @Test
    void assessRisk_nullSeedAndFramework_useDefaults() {
        RiskAssessmentReport report = service.assessRisk(
                List.of(ransomware), TestDataFactory.createParameters(500, 30), null, null);

        assertThat(report.getSeed()).isEqualTo(42L);
        assertThat(report.getFramework()).isEqualTo(RiskFramework.COSO);
    }

    @Test
    void assessRisk_cancelled_propagatesAndIsNotCached() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        SimulationParameters params = TestDataFactory.createParameters(1000, 90);

        assertThatThrownBy(() -> service.assessRisk(List.of(ransomware), params, RiskFramework.COSO, 42L, token))
                .isInstanceOf(SimulationCancelledException.class);

        assertThat(cache.size()).isZero();
        verify(metricsConfig).recordAssessmentFailure("SimulationCancelledException");
        verify(metricsConfig, never()).recordAssessment(anyString(), anyInt(), anyInt());
    }

    @Test
    void assessRisk_emptyRisks_throwsInvalidParameter() {
        assertThatThrownBy(() -> service.assessRisk(
                List.of(), TestDataFactory.createParameters(1000, 90), RiskFramework.COSO, 42L))
                .isInstanceOf(InvalidParameterException.class)
                .hasFieldOrPropertyWithValue("parameter", "risks");
    }

    @Test
    void assessRisk_duplicateIds_throwsInvalidParameter() {
        RiskInput duplicate = TestDataFactory.createRisk("R-1", RiskCategory.FINANCIAL, 10, 10);

        assertThatThrownBy(() -> service.assessRisk(
                List.of(ransomware, duplicate), TestDataFactory.createParameters(1000, 90), RiskFramework.COSO, 42L))
                .isInstanceOf(InvalidParameterException.class)
                .hasFieldOrPropertyWithValue("parameter", "id");
    }

    @Test
    void simulate_nullSeed_usesDefaultSeed() {
        SimulationResult result = service.simulate(ransomware, TestDataFactory.createParameters(500, 30), null);

        assertThat(result.getSeed()).isEqualTo(42L);
    }
}
