package com.riskmgmt.quant.service;

import com.riskmgmt.quant.config.MetricsConfig;
import com.riskmgmt.quant.config.QuantEngineProperties;
import com.riskmgmt.quant.engine.RiskInputValidator;
import com.riskmgmt.quant.engine.network.ClusterDetector;
import com.riskmgmt.quant.engine.network.CorrelationEngine;
import com.riskmgmt.quant.engine.network.SystemicRiskCalculator;
import com.riskmgmt.quant.engine.recommendation.RecommendationGenerator;
import com.riskmgmt.quant.engine.report.ReportAssembler;
import com.riskmgmt.quant.engine.simulation.CancellationToken;
import com.riskmgmt.quant.engine.simulation.SeedSequence;
import com.riskmgmt.quant.engine.simulation.SimulationEngine;
import com.riskmgmt.quant.exception.InvalidParameterException;
import com.riskmgmt.quant.exception.QuantEngineException;
import com.riskmgmt.quant.model.CorrelationAnalysis;
import com.riskmgmt.quant.model.RiskAssessmentReport;
import com.riskmgmt.quant.model.RiskCluster;
import com.riskmgmt.quant.model.RiskFramework;
import com.riskmgmt.quant.model.RiskInput;
import com.riskmgmt.quant.model.RiskRecommendation;
import com.riskmgmt.quant.model.SimulationParameters;
import com.riskmgmt.quant.model.SimulationResult;
import com.riskmgmt.quant.model.SystemicRiskIndicators;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Main orchestrator for risk assessment.
 *
 * Flow:
 * 1. Validate the risks and parameters, fingerprint the request
 * 2. Return the memoized report if the fingerprint has been assessed before
 * 3. Simulate every risk (seed derived from the master seed and the risk's position)
 * 4. For two or more risks: correlation, clustering and systemic indicators
 * 5. Generate ranked recommendations
 * 6. Assemble, memoize and return the report
 */
@Service
public class RiskAssessmentService {

    private static final Logger log = LoggerFactory.getLogger(RiskAssessmentService.class);

    private final SimulationEngine simulationEngine;
    private final CorrelationEngine correlationEngine;
    private final ClusterDetector clusterDetector;
    private final SystemicRiskCalculator systemicRiskCalculator;
    private final RecommendationGenerator recommendationGenerator;
    private final ReportAssembler reportAssembler;
    private final AssessmentCache assessmentCache;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;
    private final QuantEngineProperties properties;

    public RiskAssessmentService(SimulationEngine simulationEngine,
                                 CorrelationEngine correlationEngine,
                                 ClusterDetector clusterDetector,
                                 SystemicRiskCalculator systemicRiskCalculator,
                                 RecommendationGenerator recommendationGenerator,
                                 ReportAssembler reportAssembler,
                                 AssessmentCache assessmentCache,
                                 MetricsConfig metricsConfig,
                                 Tracer tracer,
                                 QuantEngineProperties properties) {
        this.simulationEngine = simulationEngine;
        this.correlationEngine = correlationEngine;
        this.clusterDetector = clusterDetector;
        this.systemicRiskCalculator = systemicRiskCalculator;
        this.recommendationGenerator = recommendationGenerator;
        this.reportAssembler = reportAssembler;
        this.assessmentCache = assessmentCache;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
        this.properties = properties;
    }

    @Observed(name = "assessment.run", contextualName = "assess-risk")
    public RiskAssessmentReport assessRisk(List<RiskInput> risks, SimulationParameters parameters,
                                           RiskFramework framework, Long seed) {
        return assessRisk(risks, parameters, framework, seed, CancellationToken.none());
    }

    /**
     * Assess one or more risks.
     *
     * @param framework defaults to COSO when null
     * @param seed      defaults to {@code quant.simulation.default-seed} when null
     * @param token     forwarded to every simulation; cancelling aborts the whole assessment
     * @return the report; identical inputs return the identical (memoized) report
     */
    @Observed(name = "assessment.run", contextualName = "assess-risk")
    public RiskAssessmentReport assessRisk(List<RiskInput> risks, SimulationParameters parameters,
                                           RiskFramework framework, Long seed, CancellationToken token) {
        RiskInputValidator.validateAll(risks);
        if (parameters == null) {
            throw new InvalidParameterException("parameters", "Simulation parameters are required");
        }
        RiskFramework effectiveFramework = framework == null ? RiskFramework.COSO : framework;
        long masterSeed = seed == null ? properties.getSimulation().getDefaultSeed() : seed;

        String fingerprint = AssessmentFingerprint.of(risks, parameters, effectiveFramework, masterSeed);
        Optional<RiskAssessmentReport> cached = assessmentCache.get(fingerprint);
        metricsConfig.recordCacheLookup(cached.isPresent());
        if (cached.isPresent()) {
            log.debug("Returning memoized assessment {} for {} risks", cached.get().getId(), risks.size());
            return cached.get();
        }

        try {
            RiskAssessmentReport report = run(risks, parameters, effectiveFramework, masterSeed, fingerprint, token);
            assessmentCache.put(fingerprint, report);

            metricsConfig.recordAssessment(effectiveFramework.name(), risks.size(), report.getClusters().size());
            log.info("Assessment {} completed: {} risks, {} clusters, {} recommendations",
                    report.getId(), risks.size(), report.getClusters().size(), report.getRecommendations().size());
            return report;
        } catch (QuantEngineException e) {
            metricsConfig.recordAssessmentFailure(e.getClass().getSimpleName());
            throw e;
        }
    }

    /**
     * Single-risk simulation without the rest of the pipeline.
     */
    public SimulationResult simulate(RiskInput risk, SimulationParameters parameters, Long seed) {
        long masterSeed = seed == null ? properties.getSimulation().getDefaultSeed() : seed;
        return simulationEngine.simulate(risk, parameters, masterSeed);
    }

    /**
     * Correlation analysis without simulation.
     */
    public CorrelationAnalysis correlate(List<RiskInput> risks) {
        return correlationEngine.correlate(risks);
    }

    private RiskAssessmentReport run(List<RiskInput> risks, SimulationParameters parameters,
                                     RiskFramework framework, long masterSeed, String fingerprint,
                                     CancellationToken token) {
        List<SimulationResult> simulations = new ArrayList<>(risks.size());
        for (int i = 0; i < risks.size(); i++) {
            RiskInput risk = risks.get(i);
            long riskSeed = SeedSequence.derive(masterSeed, i);
            simulations.add(traced("assessment.simulate", risk.getId(),
                    () -> simulationEngine.simulate(risk, parameters, riskSeed, token)));
        }

        CorrelationAnalysis correlation = null;
        List<RiskCluster> clusters = List.of();
        SystemicRiskIndicators systemic = null;
        if (risks.size() > 1) {
            correlation = traced("assessment.correlate", fingerprint,
                    () -> correlationEngine.correlate(risks));
            CorrelationAnalysis analysis = correlation;
            clusters = traced("assessment.cluster", fingerprint,
                    () -> clusterDetector.cluster(risks, analysis.getMatrix()));
            List<RiskCluster> detected = clusters;
            systemic = traced("assessment.systemic", fingerprint,
                    () -> systemicRiskCalculator.calculate(risks, analysis, detected));
        }

        List<RiskRecommendation> recommendations =
                recommendationGenerator.generate(risks, clusters, systemic);

        return reportAssembler.assemble(new ReportAssembler.Parts(
                fingerprint, framework, masterSeed, risks, simulations,
                correlation, clusters, systemic, recommendations));
    }

    private <T> T traced(String name, String subject, Supplier<T> stage) {
        Span span = tracer.nextSpan()
                .name(name)
                .tag("assessment.subject", subject)
                .start();
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            return stage.get();
        } catch (RuntimeException e) {
            span.error(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
