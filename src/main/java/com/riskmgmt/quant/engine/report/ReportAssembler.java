package com.riskmgmt.quant.engine.report;

import com.riskmgmt.quant.model.CorrelationAnalysis;
import com.riskmgmt.quant.model.RiskAssessmentReport;
import com.riskmgmt.quant.model.RiskCluster;
import com.riskmgmt.quant.model.RiskFramework;
import com.riskmgmt.quant.model.RiskInput;
import com.riskmgmt.quant.model.RiskRecommendation;
import com.riskmgmt.quant.model.SimulationResult;
import com.riskmgmt.quant.model.SystemicRiskIndicators;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Composes analysis outputs into a {@link RiskAssessmentReport}. Performs no analysis itself;
 * incomplete inputs are a programming error upstream and raise {@link IllegalStateException}.
 */
@Component
public class ReportAssembler {

    private static final int REPORT_ID_LENGTH = 16;

    private final Clock clock;

    public ReportAssembler(Clock clock) {
        this.clock = clock;
    }

    /**
     * Parts of a single assessment, gathered before assembly.
     */
    public record Parts(String fingerprint,
                        RiskFramework framework,
                        long seed,
                        List<RiskInput> risks,
                        List<SimulationResult> simulations,
                        CorrelationAnalysis correlation,
                        List<RiskCluster> clusters,
                        SystemicRiskIndicators systemicRisk,
                        List<RiskRecommendation> recommendations) {
    }

    public RiskAssessmentReport assemble(Parts parts) {
        if (parts.fingerprint() == null || parts.fingerprint().isEmpty()) {
            throw new IllegalStateException("Report has no fingerprint");
        }
        if (parts.framework() == null) {
            throw new IllegalStateException("Report has no framework");
        }
        if (parts.risks() == null || parts.risks().isEmpty()) {
            throw new IllegalStateException("Report has no risks");
        }
        if (parts.recommendations() == null) {
            throw new IllegalStateException("Report has no recommendation list");
        }

        List<SimulationResult> simulations = simulationsInRiskOrder(parts.risks(), parts.simulations());

        boolean portfolio = parts.risks().size() > 1;
        if (portfolio && (parts.correlation() == null || parts.systemicRisk() == null || parts.clusters() == null)) {
            throw new IllegalStateException("Multi-risk report requires correlation, clusters and systemic indicators");
        }

        String fingerprint = parts.fingerprint();
        return RiskAssessmentReport.builder()
                .id("RA-" + fingerprint.substring(0, Math.min(REPORT_ID_LENGTH, fingerprint.length())))
                .framework(parts.framework())
                .assessedAt(clock.instant())
                .fingerprint(fingerprint)
                .seed(parts.seed())
                .risks(parts.risks())
                .simulations(simulations)
                .correlation(portfolio ? parts.correlation() : null)
                .clusters(portfolio ? parts.clusters() : List.of())
                .systemicRisk(portfolio ? parts.systemicRisk() : null)
                .recommendations(parts.recommendations())
                .build();
    }

    private static List<SimulationResult> simulationsInRiskOrder(List<RiskInput> risks,
                                                                  List<SimulationResult> simulations) {
        if (simulations == null) {
            throw new IllegalStateException("Report has no simulations");
        }
        Map<String, SimulationResult> byRisk = new LinkedHashMap<>();
        for (SimulationResult simulation : simulations) {
            byRisk.put(simulation.getRiskId(), simulation);
        }
        List<SimulationResult> ordered = new ArrayList<>(risks.size());
        for (RiskInput risk : risks) {
            SimulationResult simulation = byRisk.get(risk.getId());
            if (simulation == null) {
                throw new IllegalStateException("Missing simulation for risk " + risk.getId());
            }
            ordered.add(simulation);
        }
        return ordered;
    }
}
