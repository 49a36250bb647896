package com.riskmgmt.quant.config;

import com.riskmgmt.quant.model.DistributionType;
import com.riskmgmt.quant.model.RiskTolerance;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "quant")
public class QuantEngineProperties {

    private Simulation simulation = new Simulation();

    private Statistics statistics = new Statistics();

    private Correlation correlation = new Correlation();

    private Cluster cluster = new Cluster();

    private Systemic systemic = new Systemic();

    private Recommendation recommendation = new Recommendation();

    private Cache cache = new Cache();

    @Data
    public static class Simulation {
        // Upper bound on iterations accepted per simulation.
        private int maxIterations = 100_000;

        // Samples per worker chunk. Chunk boundaries feed the per-chunk seeds, so changing this
        // changes results for a given seed.
        private int chunkSize = 5_000;

        // Threads in the simulation worker pool.
        private int parallelism = 4;

        // Redraws allowed for an invalid sample before DistributionException.
        private int maxSampleRetries = 10;

        // Samples drawn between two polls of the cancellation token.
        private int cancellationCheckInterval = 250;

        // Wall-clock budget per simulation; zero or null disables the deadline.
        private Duration timeout = Duration.ofSeconds(30);

        // Number of trajectory points over the timeframe (step = timeframe / points).
        private int trajectoryPoints = 10;

        // Draws per trajectory step.
        private int trajectorySubSampleSize = 200;

        private DistributionType defaultDistribution = DistributionType.TRIANGULAR;

        // Half-width of the anchored distribution for a mid-range (severity 0.5) risk.
        private double baseSpread = 0.35;

        private long defaultSeed = 42L;
    }

    @Data
    public static class Statistics {
        private List<Double> percentileRanks = List.of(0.0, 5.0, 10.0, 25.0, 50.0, 75.0, 90.0, 95.0, 99.0, 100.0);
        private List<Double> confidenceLevels = List.of(90.0, 95.0, 99.0);
        private List<Double> varLevels = List.of(90.0, 95.0, 99.0, 99.9);
        private int histogramBins = 20;
        private double bestCasePercentile = 5.0;
        private double worstCasePercentile = 99.0;
    }

    @Data
    public static class Correlation {
        // Minimum correlation for two risks to be connected in the network.
        private double threshold = 0.3;

        // Term weights, normalized to sum to 1 before use.
        private double factorWeight = 0.5;
        private double categoryWeight = 0.3;
        private double severityWeight = 0.2;

        // Category affinity for related (non-identical) categories.
        private double relatedCategoryAffinity = 0.5;

        private int criticalPathCount = 3;

        // Unit severity at or above which a risk is a critical-path endpoint.
        private double highSeverityThreshold = 0.5;
    }

    @Data
    public static class Cluster {
        // Aggregate risk at or above which a cluster counts as high-risk.
        private double highRiskThreshold = 0.7;
    }

    @Data
    public static class Systemic {
        private double densityWeight = 0.4;
        private double clusterRiskWeight = 0.6;
        private double contagionResilienceWeight = 0.6;
        private double vulnerabilityResilienceWeight = 0.4;
    }

    @Data
    public static class Recommendation {
        // Any recommendation costing more than this is forced to CRITICAL priority.
        private double costCap = 250_000.0;

        private RiskTolerance riskTolerance = RiskTolerance.MEDIUM;

        // Contagion risk at or above which a network-wide recommendation is added.
        private double systemicContagionThreshold = 0.5;
    }

    @Data
    public static class Cache {
        private boolean enabled = true;
        private long maximumSize = 500;
        private Duration expireAfterWrite = Duration.ofMinutes(30);
    }
}
