package com.riskmgmt.quant.engine.recommendation;

import com.riskmgmt.quant.config.MetricsConfig;
import com.riskmgmt.quant.config.QuantEngineProperties;
import com.riskmgmt.quant.model.RecommendationType;
import com.riskmgmt.quant.model.RiskCategory;
import com.riskmgmt.quant.model.RiskCluster;
import com.riskmgmt.quant.model.RiskInput;
import com.riskmgmt.quant.model.RiskLevel;
import com.riskmgmt.quant.model.RiskRecommendation;
import com.riskmgmt.quant.model.RiskTolerance;
import com.riskmgmt.quant.model.SystemicRiskIndicators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rule-based treatment recommendations.
 *
 * Per risk, by severity band: CRITICAL gets AVOIDANCE and MITIGATION, HIGH gets MITIGATION
 * plus TRANSFER for insurable categories, MEDIUM gets MITIGATION, LOW gets ACCEPTANCE.
 * Each cluster gets a shared MITIGATION, and a network-wide MITIGATION is added when contagion
 * risk reaches the configured threshold.
 *
 * Any recommendation costing more than the cost cap is escalated to CRITICAL so it goes to
 * the top of the list for sign-off.
 */
@Component
public class RecommendationGenerator {

    private static final Logger log = LoggerFactory.getLogger(RecommendationGenerator.class);

    private static final Comparator<RiskRecommendation> RANKING =
            Comparator.comparing(RiskRecommendation::getPriority).reversed()
                    .thenComparing(Comparator.comparingDouble(RiskRecommendation::getEffectiveness).reversed())
                    .thenComparingDouble(RiskRecommendation::getEstimatedCost)
                    .thenComparing(RiskRecommendation::getId);

    private static final Map<RecommendationType, TreatmentProfile> TREATMENTS = new EnumMap<>(Map.of(
            RecommendationType.MITIGATION, new TreatmentProfile(50_000, 0.15, 60, 0.70),
            RecommendationType.TRANSFER, new TreatmentProfile(25_000, 0.05, 30, 0.60),
            RecommendationType.AVOIDANCE, new TreatmentProfile(120_000, 0.30, 120, 0.90),
            RecommendationType.ACCEPTANCE, new TreatmentProfile(2_000, 0.01, 7, 0.20)));

    private static final Map<RiskCategory, CategoryProfile> CATEGORIES = new EnumMap<>(Map.of(
            RiskCategory.CYBERSECURITY, new CategoryProfile(1.5, 1.0, 0.95),
            RiskCategory.OPERATIONAL, new CategoryProfile(1.0, 1.0, 1.0),
            RiskCategory.FINANCIAL, new CategoryProfile(1.3, 1.0, 1.0),
            RiskCategory.COMPLIANCE, new CategoryProfile(1.2, 1.2, 1.05),
            RiskCategory.STRATEGIC, new CategoryProfile(1.4, 1.5, 0.85)));

    private static final double CLUSTER_COST_SHARE = 0.6;
    private static final double SYSTEMIC_BASE_COST = 75_000;
    private static final int SYSTEMIC_IMPLEMENTATION_DAYS = 90;
    private static final double SYSTEMIC_EFFECTIVENESS = 0.6;

    private final QuantEngineProperties.Recommendation config;
    private final MetricsConfig metricsConfig;

    public RecommendationGenerator(QuantEngineProperties properties, MetricsConfig metricsConfig) {
        this.config = properties.getRecommendation();
        this.metricsConfig = metricsConfig;
    }

    public List<RiskRecommendation> generate(List<RiskInput> risks, List<RiskCluster> clusters,
                                             SystemicRiskIndicators systemic) {
        return generate(risks, clusters, systemic, config.getRiskTolerance());
    }

    /**
     * Ranked recommendations: priority desc, effectiveness desc, cost asc, id asc.
     *
     * @param clusters  may be empty
     * @param systemic  null for single-risk assessments
     * @param tolerance sets the target score (current x 0.5/0.7/0.9) quoted in the expected benefit
     */
    public List<RiskRecommendation> generate(List<RiskInput> risks, List<RiskCluster> clusters,
                                             SystemicRiskIndicators systemic, RiskTolerance tolerance) {
        RiskTolerance effectiveTolerance = tolerance == null ? config.getRiskTolerance() : tolerance;
        List<RiskRecommendation> recommendations = new ArrayList<>();

        for (RiskInput risk : risks) {
            RiskLevel band = RiskLevel.fromSeverity(risk.severityScore());
            switch (band) {
                case CRITICAL -> {
                    recommendations.add(forRisk(risk, RecommendationType.AVOIDANCE, RiskLevel.CRITICAL, effectiveTolerance));
                    recommendations.add(forRisk(risk, RecommendationType.MITIGATION, RiskLevel.CRITICAL, effectiveTolerance));
                }
                case HIGH -> {
                    recommendations.add(forRisk(risk, RecommendationType.MITIGATION, RiskLevel.HIGH, effectiveTolerance));
                    if (risk.getCategory().isInsurable()) {
                        recommendations.add(forRisk(risk, RecommendationType.TRANSFER, RiskLevel.HIGH, effectiveTolerance));
                    }
                }
                case MEDIUM -> recommendations.add(
                        forRisk(risk, RecommendationType.MITIGATION, RiskLevel.MEDIUM, effectiveTolerance));
                case LOW -> recommendations.add(
                        forRisk(risk, RecommendationType.ACCEPTANCE, RiskLevel.LOW, effectiveTolerance));
            }
        }

        Map<String, RiskInput> byId = new HashMap<>();
        risks.forEach(r -> byId.put(r.getId(), r));
        for (RiskCluster cluster : clusters) {
            recommendations.add(forCluster(cluster, byId, effectiveTolerance));
        }

        if (systemic != null && systemic.getContagionRisk() >= config.getSystemicContagionThreshold()) {
            recommendations.add(forNetwork(risks, systemic));
        }

        return recommendations.stream()
                .map(this::applyCostCap)
                .sorted(RANKING)
                .toList();
    }

    private RiskRecommendation forRisk(RiskInput risk, RecommendationType type, RiskLevel priority,
                                       RiskTolerance tolerance) {
        TreatmentProfile treatment = TREATMENTS.get(type);
        CategoryProfile category = CATEGORIES.get(risk.getCategory());
        double score = risk.severityScore() * 100.0;
        double effectiveness = clamp(treatment.effectiveness() * category.effectivenessFactor());

        return RiskRecommendation.builder()
                .id("REC-" + risk.getId() + "-" + type.name())
                .riskId(risk.getId())
                .type(type)
                .priority(priority)
                .title(title(type, risk))
                .estimatedCost(cost(risk, type))
                .implementationTime((int) Math.round(treatment.days() * category.timeFactor()))
                .effectiveness(effectiveness)
                .rationale(String.format(Locale.ROOT, "%s risk with severity score %.1f (probability %.0f, impact %.0f)",
                        priority, score, risk.getProbability(), risk.getImpact()))
                .expectedBenefit(expectedBenefit(type, score, effectiveness, tolerance))
                .build();
    }

    private RiskRecommendation forCluster(RiskCluster cluster, Map<String, RiskInput> byId,
                                          RiskTolerance tolerance) {
        CategoryProfile category = CATEGORIES.get(cluster.getDominantCategory());
        TreatmentProfile mitigation = TREATMENTS.get(RecommendationType.MITIGATION);

        double memberCost = 0.0;
        for (String id : cluster.getRiskIds()) {
            memberCost += cost(byId.get(id), RecommendationType.MITIGATION);
        }
        double effectiveness = clamp(mitigation.effectiveness() * category.effectivenessFactor());
        double score = cluster.getAggregateRisk() * 100.0;

        return RiskRecommendation.builder()
                .id("REC-" + cluster.getId())
                .riskIds(cluster.getRiskIds())
                .type(RecommendationType.MITIGATION)
                .priority(RiskLevel.fromSeverity(cluster.getAggregateRisk()))
                .title("Joint mitigation for " + cluster.getName())
                .estimatedCost(CLUSTER_COST_SHARE * memberCost)
                .implementationTime((int) Math.round(mitigation.days() * category.timeFactor()))
                .effectiveness(effectiveness)
                .rationale(String.format(Locale.ROOT, "%d correlated risks (average correlation %.2f) with aggregate risk %.2f. %s",
                        cluster.getRiskIds().size(), cluster.getAverageCorrelation(),
                        cluster.getAggregateRisk(), cluster.getMitigationStrategy()))
                .expectedBenefit(expectedBenefit(RecommendationType.MITIGATION, score, effectiveness, tolerance))
                .build();
    }

    private RiskRecommendation forNetwork(List<RiskInput> risks, SystemicRiskIndicators systemic) {
        double contagion = systemic.getContagionRisk();
        RiskLevel priority = RiskLevel.fromSeverity(contagion);
        if (priority.compareTo(RiskLevel.HIGH) < 0) {
            priority = RiskLevel.HIGH;
        }

        return RiskRecommendation.builder()
                .id("REC-SYSTEMIC")
                .riskIds(risks.stream().map(RiskInput::getId).toList())
                .type(RecommendationType.MITIGATION)
                .priority(priority)
                .title("Reduce interdependence across the risk network")
                .estimatedCost(SYSTEMIC_BASE_COST * (1.0 + contagion))
                .implementationTime(SYSTEMIC_IMPLEMENTATION_DAYS)
                .effectiveness(SYSTEMIC_EFFECTIVENESS)
                .rationale(String.format(Locale.ROOT, "Contagion risk %.2f with resilience %.2f and amplification factor %.2f",
                        contagion, systemic.getResilience(), systemic.getAmplificationFactor()))
                .expectedBenefit(String.format(Locale.ROOT, "Lower contagion risk from %.2f towards %.2f",
                        contagion, contagion * (1.0 - SYSTEMIC_EFFECTIVENESS)))
                .build();
    }

    private RiskRecommendation applyCostCap(RiskRecommendation recommendation) {
        if (recommendation.getEstimatedCost() <= config.getCostCap()) {
            return recommendation;
        }
        log.warn("Recommendation {} costs {} above cap {}; escalating to CRITICAL",
                recommendation.getId(), Math.round(recommendation.getEstimatedCost()), Math.round(config.getCostCap()));
        metricsConfig.recordCostCapBreach(recommendation.getType().name());
        return RiskRecommendation.builder()
                .id(recommendation.getId())
                .riskIds(recommendation.getRiskIds())
                .type(recommendation.getType())
                .priority(RiskLevel.CRITICAL)
                .title(recommendation.getTitle())
                .estimatedCost(recommendation.getEstimatedCost())
                .implementationTime(recommendation.getImplementationTime())
                .effectiveness(recommendation.getEffectiveness())
                .rationale(recommendation.getRationale())
                .expectedBenefit(recommendation.getExpectedBenefit())
                .exceedsCostCap(true)
                .build();
    }

    /**
     * Share of the historical loss range when one is given, else base x category x (0.5 + impact/100).
     */
    private static double cost(RiskInput risk, RecommendationType type) {
        TreatmentProfile treatment = TREATMENTS.get(type);
        if (risk.getFinancialImpact() != null && risk.getFinancialImpact().getMax() > 0) {
            return treatment.financialShare() * risk.getFinancialImpact().getMax();
        }
        return treatment.baseCost() * CATEGORIES.get(risk.getCategory()).costMultiplier()
                * (0.5 + risk.getImpact() / 100.0);
    }

    private static String expectedBenefit(RecommendationType type, double score, double effectiveness,
                                          RiskTolerance tolerance) {
        double target = score * tolerance.getTargetMultiplier();
        if (type == RecommendationType.ACCEPTANCE) {
            return String.format(Locale.ROOT, "Score %.1f is within %s tolerance; monitor for change", score, tolerance);
        }
        double residual = score * (1.0 - effectiveness);
        return String.format(Locale.ROOT, "Reduce score from %.1f to %.1f (%s tolerance target %.1f)",
                score, residual, tolerance, target);
    }

    private static String title(RecommendationType type, RiskInput risk) {
        String subject = risk.getTitle() == null ? risk.getId() : risk.getTitle();
        return switch (type) {
            case MITIGATION -> "Strengthen controls: " + subject;
            case TRANSFER -> "Insure or hedge: " + subject;
            case AVOIDANCE -> "Discontinue exposed activity: " + subject;
            case ACCEPTANCE -> "Accept and monitor: " + subject;
        };
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private record TreatmentProfile(double baseCost, double financialShare, int days, double effectiveness) {
    }

    private record CategoryProfile(double costMultiplier, double timeFactor, double effectivenessFactor) {
    }
}
