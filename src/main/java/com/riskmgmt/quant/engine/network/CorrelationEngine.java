package com.riskmgmt.quant.engine.network;

import com.riskmgmt.quant.config.QuantEngineProperties;
import com.riskmgmt.quant.engine.RiskInputValidator;
import com.riskmgmt.quant.exception.InsufficientDataException;
import com.riskmgmt.quant.model.CorrelationAnalysis;
import com.riskmgmt.quant.model.CorrelationMatrix;
import com.riskmgmt.quant.model.CorrelationType;
import com.riskmgmt.quant.model.CriticalPath;
import com.riskmgmt.quant.model.NetworkMetrics;
import com.riskmgmt.quant.model.RiskCategory;
import com.riskmgmt.quant.model.RiskCorrelationPair;
import com.riskmgmt.quant.model.RiskInput;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Pairwise correlation of risks and the network metrics of the thresholded correlation graph.
 *
 * rho(i, j) = wF * Jaccard(factors) + wC * categoryAffinity + wS * (1 - |severity_i - severity_j|),
 * with the weights normalized to sum to 1. Every term is in [0, 1], so rho is too.
 */
@Component
public class CorrelationEngine {

    private static final Logger log = LoggerFactory.getLogger(CorrelationEngine.class);

    // Category pairs where one risk commonly triggers or amplifies the other.
    private static final List<Set<RiskCategory>> RELATED_CATEGORIES = List.of(
            EnumSet.of(RiskCategory.CYBERSECURITY, RiskCategory.OPERATIONAL),
            EnumSet.of(RiskCategory.FINANCIAL, RiskCategory.COMPLIANCE),
            EnumSet.of(RiskCategory.FINANCIAL, RiskCategory.STRATEGIC),
            EnumSet.of(RiskCategory.OPERATIONAL, RiskCategory.COMPLIANCE));

    private final QuantEngineProperties.Correlation config;
    private final double factorWeight;
    private final double categoryWeight;
    private final double severityWeight;

    public CorrelationEngine(QuantEngineProperties properties) {
        this.config = properties.getCorrelation();
        double total = config.getFactorWeight() + config.getCategoryWeight() + config.getSeverityWeight();
        if (!(total > 0) || config.getFactorWeight() < 0 || config.getCategoryWeight() < 0
                || config.getSeverityWeight() < 0) {
            throw new IllegalStateException("Correlation weights must be non-negative with a positive sum");
        }
        this.factorWeight = config.getFactorWeight() / total;
        this.categoryWeight = config.getCategoryWeight() / total;
        this.severityWeight = config.getSeverityWeight() / total;
    }

    /**
     * Correlation matrix, significant pairs and network metrics for two or more risks.
     *
     * @throws InsufficientDataException for fewer than two risks
     */
    @Observed(name = "correlation.analyze", contextualName = "correlate-risks")
    public CorrelationAnalysis correlate(List<RiskInput> risks) {
        if (risks == null || risks.size() < 2) {
            throw new InsufficientDataException("risks",
                    "Correlation analysis needs at least 2 risks, got " + (risks == null ? 0 : risks.size()));
        }
        RiskInputValidator.validateAll(risks);

        CorrelationMatrix matrix = matrix(risks);
        RiskNetwork network = RiskNetwork.of(matrix, config.getThreshold());

        List<RiskCorrelationPair> pairs = new ArrayList<>();
        for (int i = 0; i < risks.size(); i++) {
            for (int j = i + 1; j < risks.size(); j++) {
                if (network.adjacent(i, j)) {
                    pairs.add(pair(risks.get(i), risks.get(j), matrix.get(i, j)));
                }
            }
        }
        pairs.sort(Comparator.comparingDouble(RiskCorrelationPair::getStrength).reversed());

        NetworkMetrics metrics = NetworkMetrics.builder()
                .threshold(config.getThreshold())
                .edgeCount(network.edgeCount())
                .density(network.density())
                .clusteringCoefficient(network.clusteringCoefficient())
                .averagePathLength(network.averagePathLength())
                .criticalPaths(criticalPaths(risks, network))
                .centrality(network.centrality())
                .build();

        log.debug("Correlated {} risks: {} edges at threshold {}, density={}",
                risks.size(), network.edgeCount(), config.getThreshold(), metrics.getDensity());

        return CorrelationAnalysis.builder()
                .matrix(matrix)
                .pairs(pairs)
                .networkMetrics(metrics)
                .build();
    }

    /**
     * Symmetric, unit-diagonal matrix in input order.
     */
    public CorrelationMatrix matrix(List<RiskInput> risks) {
        int n = risks.size();
        double[][] values = new double[n][n];
        List<String> ids = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            ids.add(risks.get(i).getId());
            values[i][i] = 1.0;
            for (int j = i + 1; j < n; j++) {
                double rho = correlation(risks.get(i), risks.get(j));
                values[i][j] = rho;
                values[j][i] = rho;
            }
        }
        return new CorrelationMatrix(ids, values);
    }

    public double correlation(RiskInput a, RiskInput b) {
        double rho = factorWeight * jaccard(normalizedFactors(a), normalizedFactors(b))
                + categoryWeight * categoryAffinity(a.getCategory(), b.getCategory())
                + severityWeight * (1.0 - Math.abs(a.severityScore() - b.severityScore()));
        return Math.max(0.0, Math.min(1.0, rho));
    }

    public double categoryAffinity(RiskCategory a, RiskCategory b) {
        if (a == b) {
            return 1.0;
        }
        return related(a, b) ? config.getRelatedCategoryAffinity() : 0.0;
    }

    /**
     * |A n B| / |A u B|; two empty sets have nothing in common, so 0.
     */
    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new LinkedHashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new LinkedHashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }

    static Set<String> normalizedFactors(RiskInput risk) {
        Set<String> factors = new LinkedHashSet<>();
        if (risk.getFactors() != null) {
            for (String factor : risk.getFactors()) {
                if (factor != null && !factor.isBlank()) {
                    factors.add(factor.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return factors;
    }

    private static boolean related(RiskCategory a, RiskCategory b) {
        return RELATED_CATEGORIES.stream().anyMatch(pair -> pair.contains(a) && pair.contains(b));
    }

    private RiskCorrelationPair pair(RiskInput a, RiskInput b, double strength) {
        Set<String> shared = normalizedFactors(a);
        shared.retainAll(normalizedFactors(b));

        CorrelationType type;
        if (!shared.isEmpty()) {
            type = CorrelationType.COMMON_CAUSE;
        } else if (a.getCategory() == b.getCategory()) {
            type = CorrelationType.SYNERGISTIC;
        } else if (related(a.getCategory(), b.getCategory())) {
            type = CorrelationType.CASCADING;
        } else {
            type = CorrelationType.INDEPENDENT;
        }

        return RiskCorrelationPair.builder()
                .riskId1(a.getId())
                .riskId2(b.getId())
                .strength(strength)
                .correlationType(type)
                .sharedFactors(shared)
                .build();
    }

    /**
     * Longest shortest paths between high-severity risks: more hops first, then higher combined
     * endpoint severity, then endpoint ids.
     */
    private List<CriticalPath> criticalPaths(List<RiskInput> risks, RiskNetwork network) {
        List<Candidate> candidates = new ArrayList<>();
        for (int i = 0; i < risks.size(); i++) {
            if (risks.get(i).severityScore() < config.getHighSeverityThreshold()) {
                continue;
            }
            int[] dist = network.distancesFrom(i);
            for (int j = i + 1; j < risks.size(); j++) {
                if (dist[j] > 0 && risks.get(j).severityScore() >= config.getHighSeverityThreshold()) {
                    candidates.add(new Candidate(i, j, dist[j],
                            risks.get(i).severityScore() + risks.get(j).severityScore(),
                            risks.get(i).getId(), risks.get(j).getId()));
                }
            }
        }

        candidates.sort(Comparator.comparingInt(Candidate::hops).reversed()
                .thenComparing(Comparator.comparingDouble(Candidate::combinedSeverity).reversed())
                .thenComparing(Candidate::firstId)
                .thenComparing(Candidate::secondId));

        List<CriticalPath> paths = new ArrayList<>();
        for (Candidate candidate : candidates.subList(0, Math.min(config.getCriticalPathCount(), candidates.size()))) {
            List<Integer> nodes = network.shortestPath(candidate.from(), candidate.to());
            double totalImpact = 0.0;
            double probability = 1.0;
            CriticalPath.CriticalPathBuilder builder = CriticalPath.builder().hops(candidate.hops());
            for (int k = 0; k < nodes.size(); k++) {
                RiskInput risk = risks.get(nodes.get(k));
                builder.riskId(risk.getId());
                totalImpact += risk.severityScore();
                if (k > 0) {
                    probability *= network.getMatrix().get(nodes.get(k - 1), nodes.get(k));
                }
            }
            paths.add(builder.totalImpact(totalImpact).probability(probability).build());
        }
        return paths;
    }

    private record Candidate(int from, int to, int hops, double combinedSeverity,
                             String firstId, String secondId) {
    }
}
