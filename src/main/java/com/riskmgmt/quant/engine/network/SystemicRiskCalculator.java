package com.riskmgmt.quant.engine.network;

import com.riskmgmt.quant.config.QuantEngineProperties;
import com.riskmgmt.quant.model.CentralityMeasure;
import com.riskmgmt.quant.model.CorrelationAnalysis;
import com.riskmgmt.quant.model.RiskCluster;
import com.riskmgmt.quant.model.RiskInput;
import com.riskmgmt.quant.model.SystemicRiskIndicators;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Portfolio-level indicators derived from the correlation network and its clusters.
 *
 * <pre>
 * contagionRisk      = clamp(0.4 * density + 0.6 * mean cluster aggregate)
 * vulnerabilityIndex = risks in high-risk clusters / all risks
 * resilience         = 1 - (0.6 * contagion + 0.4 * vulnerability)
 * </pre>
 */
@Component
public class SystemicRiskCalculator {

    private final QuantEngineProperties.Systemic config;
    private final double highRiskThreshold;

    public SystemicRiskCalculator(QuantEngineProperties properties) {
        this.config = properties.getSystemic();
        this.highRiskThreshold = properties.getCluster().getHighRiskThreshold();
    }

    public SystemicRiskIndicators calculate(List<RiskInput> risks, CorrelationAnalysis correlation,
                                            List<RiskCluster> clusters) {
        int n = risks.size();
        double density = correlation.getNetworkMetrics().getDensity();

        double averageAggregate = clusters.stream()
                .mapToDouble(RiskCluster::getAggregateRisk)
                .average()
                .orElse(0.0);
        double contagion = clamp(config.getDensityWeight() * density
                + config.getClusterRiskWeight() * averageAggregate);

        long vulnerable = clusters.stream()
                .filter(c -> c.getAggregateRisk() >= highRiskThreshold)
                .mapToLong(c -> c.getRiskIds().size())
                .sum();
        double vulnerability = n == 0 ? 0.0 : clamp((double) vulnerable / n);

        double resilience = clamp(1.0 - (config.getContagionResilienceWeight() * contagion
                + config.getVulnerabilityResilienceWeight() * vulnerability));

        SystemicRiskIndicators.SystemicRiskIndicatorsBuilder builder = SystemicRiskIndicators.builder()
                .contagionRisk(contagion)
                .vulnerabilityIndex(vulnerability)
                .resilience(resilience)
                .amplificationFactor(amplification(risks, clusters));

        for (Map.Entry<String, CentralityMeasure> entry
                : correlation.getNetworkMetrics().getCentrality().entrySet()) {
            CentralityMeasure c = entry.getValue();
            builder.riskImportance(entry.getKey(), clamp((c.getDegree() + c.getBetweenness()) / 2.0));
        }
        return builder.build();
    }

    /**
     * Mean over clusters of aggregate risk / mean member severity. Aggregation never lowers
     * risk below its average member, so this is at least 1.
     */
    private static double amplification(List<RiskInput> risks, List<RiskCluster> clusters) {
        if (clusters.isEmpty()) {
            return 1.0;
        }
        Map<String, Double> severity = new HashMap<>();
        for (RiskInput risk : risks) {
            severity.put(risk.getId(), risk.severityScore());
        }

        double sum = 0.0;
        for (RiskCluster cluster : clusters) {
            double meanSeverity = cluster.getRiskIds().stream()
                    .mapToDouble(id -> severity.getOrDefault(id, 0.0))
                    .average()
                    .orElse(0.0);
            sum += meanSeverity > 0 ? Math.max(1.0, cluster.getAggregateRisk() / meanSeverity) : 1.0;
        }
        return sum / clusters.size();
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
