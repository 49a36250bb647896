package com.riskmgmt.quant.engine.statistics;

import com.riskmgmt.quant.config.QuantEngineProperties;
import com.riskmgmt.quant.exception.InsufficientDataException;
import com.riskmgmt.quant.model.ConfidenceInterval;
import com.riskmgmt.quant.model.DistributionStatistics;
import com.riskmgmt.quant.model.ExceedanceProbability;
import com.riskmgmt.quant.model.HistogramBin;
import com.riskmgmt.quant.model.PercentileValue;
import com.riskmgmt.quant.model.SimulationResult;
import com.riskmgmt.quant.model.ValueAtRisk;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Reduces a sample population to percentiles, confidence intervals, Value-at-Risk and
 * shape statistics.
 *
 * Percentiles use type-7 linear interpolation (h = (n - 1)p): rank 0 is the minimum and
 * rank 100 the maximum. Value-at-Risk at confidence C is the loss not exceeded with
 * probability C, i.e. the C-th percentile of the samples, so VaR grows with C.
 */
@Component
public class StatisticalSummarizer {

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0.0, 1.0);

    private final QuantEngineProperties.Statistics config;

    public StatisticalSummarizer(QuantEngineProperties properties) {
        this.config = properties.getStatistics();
    }

    /**
     * Statistics for the samples, returned as a partially filled result builder. The caller
     * adds the risk id, seed, timeframe and trajectory.
     */
    public SimulationResult.SimulationResultBuilder summarize(double[] samples) {
        requireSamples(samples);
        double[] sorted = samples.clone();
        Arrays.sort(sorted);

        DescriptiveStatistics stats = new DescriptiveStatistics(sorted);
        double mean = stats.getMean();
        double variance = sorted.length > 1 ? stats.getVariance() : 0.0;
        double sd = Math.sqrt(variance);

        SimulationResult.SimulationResultBuilder builder = SimulationResult.builder()
                .iterations(sorted.length)
                .expectedValue(mean)
                .standardDeviation(sd)
                .variance(variance)
                .bestCase(percentileOfSorted(sorted, config.getBestCasePercentile()))
                .worstCase(percentileOfSorted(sorted, config.getWorstCasePercentile()));

        for (double rank : sortedLevels(config.getPercentileRanks())) {
            builder.percentile(new PercentileValue(rank, percentileOfSorted(sorted, rank)));
        }
        for (double level : sortedLevels(config.getConfidenceLevels())) {
            builder.confidenceInterval(confidenceInterval(mean, sd, sorted.length, level));
        }
        for (double confidence : sortedLevels(config.getVarLevels())) {
            builder.valueAtRiskEntry(new ValueAtRisk(confidence, percentileOfSorted(sorted, confidence)));
        }
        for (double threshold : new double[]{mean, mean + sd, mean + 2 * sd}) {
            builder.exceedance(new ExceedanceProbability(threshold, exceedance(sorted, threshold)));
        }

        List<HistogramBin> histogram = histogram(sorted, config.getHistogramBins());
        return builder.distribution(DistributionStatistics.builder()
                .min(sorted[0])
                .max(sorted[sorted.length - 1])
                .median(percentileOfSorted(sorted, 50.0))
                .mode(mode(histogram))
                .skewness(finiteOrZero(stats.getSkewness()))
                .kurtosis(finiteOrZero(stats.getKurtosis()))
                .histogram(histogram)
                .build());
    }

    /**
     * Type-7 percentile of unsorted samples, rank in [0, 100].
     */
    public double percentile(double[] samples, double rank) {
        requireSamples(samples);
        double[] sorted = samples.clone();
        Arrays.sort(sorted);
        return percentileOfSorted(sorted, rank);
    }

    /**
     * Loss threshold not exceeded with probability {@code confidence}/100.
     */
    public double valueAtRisk(double[] samples, double confidence) {
        return percentile(samples, confidence);
    }

    /**
     * Interval of the mean: mean +/- z * sd / sqrt(n), z the two-sided standard normal quantile.
     */
    public ConfidenceInterval confidenceInterval(double mean, double sd, int n, double level) {
        if (level <= 0 || level >= 100) {
            throw new IllegalArgumentException("Confidence level must be in (0, 100): " + level);
        }
        double z = STANDARD_NORMAL.inverseCumulativeProbability(0.5 + level / 200.0);
        double halfWidth = n > 0 ? z * sd / Math.sqrt(n) : 0.0;
        return new ConfidenceInterval(level, mean - halfWidth, mean + halfWidth);
    }

    private double percentileOfSorted(double[] sorted, double rank) {
        if (rank < 0 || rank > 100) {
            throw new IllegalArgumentException("Percentile rank must be in [0, 100]: " + rank);
        }
        // Percentile rejects rank 0; type 7 puts it at the minimum.
        if (rank == 0.0) {
            return sorted[0];
        }
        Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
        return percentile.evaluate(sorted, rank);
    }

    private static double exceedance(double[] sorted, double threshold) {
        int idx = Arrays.binarySearch(sorted, threshold);
        int firstAbove;
        if (idx >= 0) {
            firstAbove = idx;
            while (firstAbove < sorted.length && sorted[firstAbove] <= threshold) {
                firstAbove++;
            }
        } else {
            firstAbove = -idx - 1;
        }
        return (double) (sorted.length - firstAbove) / sorted.length;
    }

    private static List<HistogramBin> histogram(double[] sorted, int bins) {
        int n = sorted.length;
        double min = sorted[0];
        double max = sorted[n - 1];
        if (bins <= 1 || max == min) {
            return List.of(new HistogramBin(min, n, 1.0));
        }

        double width = (max - min) / bins;
        int[] counts = new int[bins];
        for (double value : sorted) {
            int bin = (int) ((value - min) / width);
            counts[Math.min(bin, bins - 1)]++;
        }

        HistogramBin[] result = new HistogramBin[bins];
        int running = 0;
        for (int i = 0; i < bins; i++) {
            running += counts[i];
            result[i] = new HistogramBin(min + width * (i + 0.5), counts[i], (double) running / n);
        }
        return List.of(result);
    }

    private static double mode(List<HistogramBin> histogram) {
        HistogramBin modal = histogram.get(0);
        for (HistogramBin bin : histogram) {
            if (bin.getFrequency() > modal.getFrequency()) {
                modal = bin;
            }
        }
        return modal.getValue();
    }

    private static List<Double> sortedLevels(List<Double> levels) {
        return levels.stream().sorted().toList();
    }

    private static double finiteOrZero(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }

    private static void requireSamples(double[] samples) {
        if (samples == null || samples.length == 0) {
            throw new InsufficientDataException("samples", "Cannot summarize an empty sample population");
        }
    }
}
