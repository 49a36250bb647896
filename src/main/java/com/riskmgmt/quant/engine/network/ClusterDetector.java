package com.riskmgmt.quant.engine.network;

import com.riskmgmt.quant.config.QuantEngineProperties;
import com.riskmgmt.quant.exception.InvalidParameterException;
import com.riskmgmt.quant.model.CorrelationMatrix;
import com.riskmgmt.quant.model.RiskCategory;
import com.riskmgmt.quant.model.RiskCluster;
import com.riskmgmt.quant.model.RiskInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Groups risks into clusters: connected components of the correlation graph at the threshold.
 * Isolated risks are not clusters. Clusters come out in order of their first member's input
 * position and are numbered CLUSTER-1, CLUSTER-2, ...
 */
@Component
public class ClusterDetector {

    private static final Logger log = LoggerFactory.getLogger(ClusterDetector.class);

    private final double defaultThreshold;

    public ClusterDetector(QuantEngineProperties properties) {
        this.defaultThreshold = properties.getCorrelation().getThreshold();
    }

    public List<RiskCluster> cluster(List<RiskInput> risks, CorrelationMatrix matrix) {
        return cluster(risks, matrix, defaultThreshold);
    }

    public List<RiskCluster> cluster(List<RiskInput> risks, CorrelationMatrix matrix, double threshold) {
        if (matrix.size() != risks.size()) {
            throw new InvalidParameterException("matrix",
                    "Matrix covers " + matrix.size() + " risks but " + risks.size() + " were given");
        }
        for (int i = 0; i < risks.size(); i++) {
            if (!risks.get(i).getId().equals(matrix.getRiskIds().get(i))) {
                throw new InvalidParameterException("matrix",
                        "Matrix row " + i + " is " + matrix.getRiskIds().get(i)
                                + " but risk " + i + " is " + risks.get(i).getId());
            }
        }

        RiskNetwork network = RiskNetwork.of(matrix, threshold);
        List<RiskCluster> clusters = new ArrayList<>();
        for (List<Integer> component : network.components()) {
            if (component.size() < 2) {
                continue;
            }
            clusters.add(buildCluster("CLUSTER-" + (clusters.size() + 1), component, risks, matrix));
        }

        log.debug("Detected {} clusters among {} risks at threshold {}", clusters.size(), risks.size(), threshold);
        return clusters;
    }

    /**
     * 1 - prod(1 - s_i): the chance that at least one member materialises, treating members as
     * independent.
     */
    public static double aggregateRisk(List<RiskInput> members) {
        double survival = 1.0;
        for (RiskInput member : members) {
            survival *= 1.0 - Math.max(0.0, Math.min(1.0, member.severityScore()));
        }
        return 1.0 - survival;
    }

    private RiskCluster buildCluster(String id, List<Integer> component, List<RiskInput> risks,
                                     CorrelationMatrix matrix) {
        List<RiskInput> members = component.stream().map(risks::get).toList();

        double correlationSum = 0.0;
        int pairCount = 0;
        for (int a = 0; a < component.size(); a++) {
            for (int b = a + 1; b < component.size(); b++) {
                correlationSum += matrix.get(component.get(a), component.get(b));
                pairCount++;
            }
        }

        RiskCategory dominant = dominantCategory(members);
        List<String> commonFactors = commonFactors(members);

        return RiskCluster.builder()
                .id(id)
                .name(displayName(dominant) + " risk cluster")
                .riskIds(members.stream().map(RiskInput::getId).toList())
                .commonFactors(commonFactors)
                .aggregateRisk(aggregateRisk(members))
                .dominantCategory(dominant)
                .averageCorrelation(pairCount == 0 ? 0.0 : correlationSum / pairCount)
                .mitigationStrategy(commonFactors.isEmpty()
                        ? "Coordinate controls across the " + members.size() + " correlated "
                                + displayName(dominant).toLowerCase(Locale.ROOT) + " risks"
                        : "Address shared factors: " + String.join(", ", commonFactors))
                .build();
    }

    /**
     * Most frequent category; ties go to the category of the earliest member.
     */
    private static RiskCategory dominantCategory(List<RiskInput> members) {
        Map<RiskCategory, Integer> counts = new EnumMap<>(RiskCategory.class);
        for (RiskInput member : members) {
            counts.merge(member.getCategory(), 1, Integer::sum);
        }
        RiskCategory dominant = members.get(0).getCategory();
        for (RiskInput member : members) {
            if (counts.get(member.getCategory()) > counts.get(dominant)) {
                dominant = member.getCategory();
            }
        }
        return dominant;
    }

    /**
     * Factors held by at least two members, most shared first, then alphabetically.
     */
    private static List<String> commonFactors(List<RiskInput> members) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (RiskInput member : members) {
            for (String factor : CorrelationEngine.normalizedFactors(member)) {
                counts.merge(factor, 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
                .filter(e -> e.getValue() >= 2)
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<String, Integer>comparingByKey()))
                .map(Map.Entry::getKey)
                .toList();
    }

    private static String displayName(RiskCategory category) {
        String name = category.name().toLowerCase(Locale.ROOT);
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
