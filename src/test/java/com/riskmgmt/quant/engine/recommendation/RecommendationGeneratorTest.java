package com.riskmgmt.quant.engine.recommendation;

import com.riskmgmt.quant.model.RecommendationType;
import com.riskmgmt.quant.model.RiskCategory;
import com.riskmgmt.quant.model.RiskCluster;
import com.riskmgmt.quant.model.RiskInput;
import com.riskmgmt.quant.model.RiskLevel;
import com.riskmgmt.quant.model.RiskRecommendation;
import com.riskmgmt.quant.model.RiskTolerance;
import com.riskmgmt.quant.model.SystemicRiskIndicators;
import com.riskmgmt.quant.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Comparator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RecommendationGeneratorTest {

    private RecommendationGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new RecommendationGenerator(TestDataFactory.defaultProperties(), TestDataFactory.metrics());
    }

    @Test
    void generate_criticalRisk_avoidanceAndMitigation() {
        RiskInput critical = TestDataFactory.createRisk("R-1", RiskCategory.OPERATIONAL, 90, 90);

        List<RiskRecommendation> recs = generator.generate(List.of(critical), List.of(), null);

        assertThat(recs).extracting(RiskRecommendation::getType)
                .containsExactlyInAnyOrder(RecommendationType.AVOIDANCE, RecommendationType.MITIGATION);
        assertThat(recs).allSatisfy(r -> {
            assertThat(r.getPriority()).isEqualTo(RiskLevel.CRITICAL);
            assertThat(r.getRiskIds()).containsExactly("R-1");
        });
        RiskRecommendation avoidance = recs.stream()
                .filter(r -> r.getType() == RecommendationType.AVOIDANCE).findFirst().orElseThrow();
        // 120,000 x 1.0 x (0.5 + 0.9)
        assertThat(avoidance.getEstimatedCost()).isCloseTo(168_000.0, within(1e-6));
        assertThat(avoidance.isExceedsCostCap()).isFalse();
        // Most effective first within the same priority
        assertThat(recs.get(0).getType()).isEqualTo(RecommendationType.AVOIDANCE);
    }

    @Test
    void generate_highInsurableRisk_mitigationAndTransfer() {
        RiskInput high = TestDataFactory.createRisk("R-1", RiskCategory.FINANCIAL, 80, 80);

        List<RiskRecommendation> recs = generator.generate(List.of(high), List.of(), null);

        assertThat(recs).extracting(RiskRecommendation::getType)
                .containsExactly(RecommendationType.MITIGATION, RecommendationType.TRANSFER);
        assertThat(recs).extracting(RiskRecommendation::getPriority).containsOnly(RiskLevel.HIGH);
    }

    @Test
    void generate_highNonInsurableRisk_mitigationOnly() {
        RiskInput high = TestDataFactory.createRisk("R-1", RiskCategory.COMPLIANCE, 80, 80);

        List<RiskRecommendation> recs = generator.generate(List.of(high), List.of(), null);

        assertThat(recs).extracting(RiskRecommendation::getType).containsExactly(RecommendationType.MITIGATION);
    }

    @Test
    void generate_mediumAndLowRisks() {
        RiskInput medium = TestDataFactory.createRisk("R-M", RiskCategory.STRATEGIC, 60, 60);
        RiskInput low = TestDataFactory.createRisk("R-L", RiskCategory.STRATEGIC, 20, 20);

        List<RiskRecommendation> recs = generator.generate(List.of(low, medium), List.of(), null);

        assertThat(recs).extracting(RiskRecommendation::getId)
                .containsExactly("REC-R-M-MITIGATION", "REC-R-L-ACCEPTANCE");
        assertThat(recs.get(1).getPriority()).isEqualTo(RiskLevel.LOW);
        assertThat(recs.get(1).getExpectedBenefit()).contains("within MEDIUM tolerance");
    }

    @Test
    void generate_costAboveCap_forcedCriticalAndFlagged() {
        RiskInput medium = TestDataFactory.createRiskWithFinancials(
                "R-1", RiskCategory.FINANCIAL, 60, 60, 500_000, 2_000_000);

        List<RiskRecommendation> recs = generator.generate(List.of(medium), List.of(), null);

        assertThat(recs).hasSize(1);
        RiskRecommendation rec = recs.get(0);
        // 15% of the 2,000,000 historical maximum
        assertThat(rec.getEstimatedCost()).isCloseTo(300_000.0, within(1e-6));
        assertThat(rec.isExceedsCostCap()).isTrue();
        assertThat(rec.getPriority()).isEqualTo(RiskLevel.CRITICAL);
    }

    @Test
    void generate_clusterAndContagion_addsJointAndSystemicRecommendations() {
        RiskInput a = TestDataFactory.createRisk("R-1", RiskCategory.CYBERSECURITY, 50, 50, "vendor");
        RiskInput b = TestDataFactory.createRisk("R-2", RiskCategory.CYBERSECURITY, 50, 50, "vendor");
        RiskCluster cluster = RiskCluster.builder()
                .id("CLUSTER-1")
                .name("Cybersecurity risk cluster")
                .riskIds(List.of("R-1", "R-2"))
                .commonFactor("vendor")
                .aggregateRisk(0.4375)
                .dominantCategory(RiskCategory.CYBERSECURITY)
                .averageCorrelation(1.0)
                .mitigationStrategy("Address shared factors: vendor")
                .build();
        SystemicRiskIndicators systemic = SystemicRiskIndicators.builder()
                .contagionRisk(0.6625)
                .vulnerabilityIndex(0.0)
                .resilience(0.6025)
                .amplificationFactor(1.75)
                .build();

        List<RiskRecommendation> recs = generator.generate(List.of(a, b), List.of(cluster), systemic);

        RiskRecommendation joint = recs.stream()
                .filter(r -> r.getId().equals("REC-CLUSTER-1")).findFirst().orElseThrow();
        assertThat(joint.getRiskIds()).containsExactly("R-1", "R-2");
        assertThat(joint.getType()).isEqualTo(RecommendationType.MITIGATION);
        assertThat(joint.getPriority()).isEqualTo(RiskLevel.MEDIUM);

        RiskRecommendation network = recs.stream()
                .filter(r -> r.getId().equals("REC-SYSTEMIC")).findFirst().orElseThrow();
        assertThat(network.getPriority()).isEqualTo(RiskLevel.HIGH);
        assertThat(network.getRiskIds()).containsExactly("R-1", "R-2");
    }

    @Test
    void generate_lowContagion_noSystemicRecommendation() {
        RiskInput a = TestDataFactory.createRisk("R-1", RiskCategory.CYBERSECURITY, 50, 50);
        SystemicRiskIndicators systemic = SystemicRiskIndicators.builder()
                .contagionRisk(0.2).resilience(0.88).amplificationFactor(1.0).build();

        List<RiskRecommendation> recs = generator.generate(List.of(a), List.of(), systemic);

        assertThat(recs).noneMatch(r -> r.getId().equals("REC-SYSTEMIC"));
    }

    @Test
    void generate_rankedByPriorityEffectivenessCostAndId() {
        List<RiskInput> risks = List.of(
                TestDataFactory.createRisk("R-1", RiskCategory.STRATEGIC, 20, 20),
                TestDataFactory.createRisk("R-2", RiskCategory.CYBERSECURITY, 85, 95),
                TestDataFactory.createRisk("R-3", RiskCategory.FINANCIAL, 80, 80),
                TestDataFactory.createRisk("R-4", RiskCategory.COMPLIANCE, 60, 60),
                TestDataFactory.createRisk("R-5", RiskCategory.OPERATIONAL, 60, 60));

        List<RiskRecommendation> recs = generator.generate(risks, List.of(), null);

        Comparator<RiskRecommendation> expected = Comparator.comparing(RiskRecommendation::getPriority).reversed()
                .thenComparing(Comparator.comparingDouble(RiskRecommendation::getEffectiveness).reversed())
                .thenComparingDouble(RiskRecommendation::getEstimatedCost)
                .thenComparing(RiskRecommendation::getId);
        assertThat(recs).isSortedAccordingTo(expected);
        assertThat(recs.get(0).getPriority()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(recs.get(recs.size() - 1).getType()).isEqualTo(RecommendationType.ACCEPTANCE);
    }

    @Test
    void generate_isDeterministic() {
        List<RiskInput> risks = List.of(
                TestDataFactory.createRisk("R-1", RiskCategory.CYBERSECURITY, 85, 95),
                TestDataFactory.createRisk("R-2", RiskCategory.FINANCIAL, 80, 80));

        assertThat(generator.generate(risks, List.of(), null)).isEqualTo(generator.generate(risks, List.of(), null));
    }

    @Test
    void generate_toleranceSetsTargetInExpectedBenefit() {
        RiskInput medium = TestDataFactory.createRisk("R-1", RiskCategory.OPERATIONAL, 60, 60);

        RiskRecommendation strict = generator.generate(List.of(medium), List.of(), null, RiskTolerance.LOW).get(0);
        RiskRecommendation lenient = generator.generate(List.of(medium), List.of(), null, RiskTolerance.HIGH).get(0);

        // score 36.0 -> target 18.0 at LOW, 32.4 at HIGH
        assertThat(strict.getExpectedBenefit()).contains("target 18.0");
        assertThat(lenient.getExpectedBenefit()).contains("target 32.4");
        assertThat(strict.getEffectiveness()).isCloseTo(0.7, within(1e-12));
    }
}
