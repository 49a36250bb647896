package com.riskmgmt.quant.engine.simulation;

import com.riskmgmt.quant.config.MetricsConfig;
import com.riskmgmt.quant.config.QuantEngineProperties;
import com.riskmgmt.quant.engine.RiskInputValidator;
import com.riskmgmt.quant.engine.statistics.StatisticalSummarizer;
import com.riskmgmt.quant.exception.InvalidParameterException;
import com.riskmgmt.quant.exception.SimulationCancelledException;
import com.riskmgmt.quant.model.RiskCategory;
import com.riskmgmt.quant.model.RiskInput;
import com.riskmgmt.quant.model.SimulationParameters;
import com.riskmgmt.quant.model.SimulationResult;
import com.riskmgmt.quant.model.TrajectoryPoint;
import io.micrometer.observation.annotation.Observed;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.DoubleSupplier;

/**
 * Seeded Monte Carlo simulation of a single risk.
 *
 * Iterations are split into fixed-size chunks. Chunk k draws from its own generator seeded
 * from (seed, k), and chunks are concatenated in chunk order, so a given seed produces the same
 * samples no matter how many workers the executor has.
 */
@Component
public class SimulationEngine {

    private static final Logger log = LoggerFactory.getLogger(SimulationEngine.class);

    // Relative growth of probability over the full timeframe; impact grows at half this rate.
    private static final Map<RiskCategory, Double> CATEGORY_DRIFT = new EnumMap<>(Map.of(
            RiskCategory.CYBERSECURITY, 0.15,
            RiskCategory.OPERATIONAL, 0.05,
            RiskCategory.FINANCIAL, 0.10,
            RiskCategory.COMPLIANCE, 0.08,
            RiskCategory.STRATEGIC, 0.12));

    private final DistributionSampler sampler;
    private final StatisticalSummarizer summarizer;
    private final Executor executor;
    private final MetricsConfig metricsConfig;
    private final QuantEngineProperties.Simulation config;

    public SimulationEngine(DistributionSampler sampler, StatisticalSummarizer summarizer,
                            @Qualifier("simulationExecutor") Executor executor,
                            MetricsConfig metricsConfig, QuantEngineProperties properties) {
        this.sampler = sampler;
        this.summarizer = summarizer;
        this.executor = executor;
        this.metricsConfig = metricsConfig;
        this.config = properties.getSimulation();
    }

    @Observed(name = "simulation.run", contextualName = "simulate-risk")
    public SimulationResult simulate(RiskInput risk, SimulationParameters params, long seed) {
        return simulate(risk, params, seed, CancellationToken.none());
    }

    /**
     * Run the simulation.
     *
     * @param risk   the risk to simulate
     * @param params iterations, timeframe and optional variable distributions
     * @param seed   master seed; equal inputs and seed give identical results
     * @param token  polled while sampling; cancelling it aborts the run
     * @throws InvalidParameterException     on invalid risk or parameters
     * @throws SimulationCancelledException  if the token is cancelled or the timeout expires
     */
    @Observed(name = "simulation.run", contextualName = "simulate-risk")
    public SimulationResult simulate(RiskInput risk, SimulationParameters params, long seed,
                                     CancellationToken token) {
        RiskInputValidator.validate(risk);
        validate(params);

        long startNanos = System.nanoTime();
        Deadline deadline = new Deadline(token, startNanos, config.getTimeout());
        SeverityModel model = sampler.model(risk, params.getVariables());

        try {
            double[] samples = sampleAll(model, params.getIterations(), seed, deadline);

            deadline.check("trajectory");
            List<TrajectoryPoint> trajectory = trajectory(risk, params.getTimeframeDays(), seed, deadline);

            deadline.check("summary");
            SimulationResult result = summarizer.summarize(samples)
                    .riskId(risk.getId())
                    .timeframeDays(params.getTimeframeDays())
                    .seed(seed)
                    .trajectory(trajectory)
                    .build();

            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            metricsConfig.recordSimulation(sampler.getDefaultType().name(), params.getIterations(), elapsed);
            log.debug("Simulated risk {}: {} iterations, mean={}, sd={} in {}ms",
                    risk.getId(), params.getIterations(), result.getExpectedValue(),
                    result.getStandardDeviation(), elapsed.toMillis());
            return result;
        } catch (SimulationCancelledException e) {
            metricsConfig.recordSimulationCancelled(e.getParameter());
            log.warn("Simulation of risk {} cancelled: {}", risk.getId(), e.getMessage());
            throw e;
        }
    }

    private void validate(SimulationParameters params) {
        if (params == null) {
            throw new InvalidParameterException("parameters", "Simulation parameters are required");
        }
        if (params.getIterations() <= 0) {
            throw new InvalidParameterException("iterations",
                    "iterations must be positive, got " + params.getIterations());
        }
        if (params.getIterations() > config.getMaxIterations()) {
            throw new InvalidParameterException("iterations", "iterations must not exceed "
                    + config.getMaxIterations() + ", got " + params.getIterations());
        }
        if (params.getTimeframeDays() <= 0) {
            throw new InvalidParameterException("timeframeDays",
                    "timeframeDays must be positive, got " + params.getTimeframeDays());
        }
    }

    private double[] sampleAll(SeverityModel model, int iterations, long seed, Deadline deadline) {
        int chunkSize = Math.max(1, config.getChunkSize());
        int chunkCount = (iterations + chunkSize - 1) / chunkSize;

        List<CompletableFuture<double[]>> chunks = new ArrayList<>(chunkCount);
        for (int k = 0; k < chunkCount; k++) {
            int chunk = k;
            int size = Math.min(chunkSize, iterations - k * chunkSize);
            try {
                chunks.add(CompletableFuture.supplyAsync(
                        () -> sampleChunk(model, SeedSequence.stream(seed, chunk), size, deadline), executor));
            } catch (RejectedExecutionException e) {
                // Chunks already queued see the abort on their next check.
                deadline.abort();
                throw new SimulationCancelledException("simulationExecutor", String.format(
                        "Simulation executor rejected chunk %d of %d", chunk + 1, chunkCount), e);
            }
        }

        double[] samples = new double[iterations];
        int offset = 0;
        try {
            for (CompletableFuture<double[]> chunk : chunks) {
                double[] values = join(chunk);
                System.arraycopy(values, 0, samples, offset, values.length);
                offset += values.length;
            }
        } catch (RuntimeException e) {
            RuntimeException first = deadline.failure();
            throw first != null ? first : e;
        }
        return samples;
    }

    private double[] sampleChunk(SeverityModel model, RandomGenerator rng, int size, Deadline deadline) {
        int interval = Math.max(1, config.getCancellationCheckInterval());
        DoubleSupplier draws = model.bind(rng);
        double[] values = new double[size];
        try {
            for (int i = 0; i < size; i++) {
                if (i % interval == 0) {
                    deadline.check("sampling");
                }
                values[i] = draws.getAsDouble();
            }
        } catch (RuntimeException e) {
            deadline.fail(e);
            throw e;
        }
        return values;
    }

    private static double[] join(CompletableFuture<double[]> chunk) {
        try {
            return chunk.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    /**
     * Mean probability and impact at evenly spaced days. Each point averages a sub-sample of
     * jittered draws around the category trend at that day.
     */
    private List<TrajectoryPoint> trajectory(RiskInput risk, int timeframeDays, long seed, Deadline deadline) {
        int points = Math.max(1, config.getTrajectoryPoints());
        int stepDays = Math.max(1, timeframeDays / points);
        int count = timeframeDays / stepDays;
        int subSamples = Math.max(1, config.getTrajectorySubSampleSize());
        double drift = CATEGORY_DRIFT.getOrDefault(risk.getCategory(), 0.0);

        RandomGenerator rng = SeedSequence.stream(seed, SeedSequence.TRAJECTORY_STREAM);
        List<TrajectoryPoint> trajectory = new ArrayList<>(count);
        for (int step = 1; step <= count; step++) {
            deadline.check("trajectory");
            int day = step * stepDays;
            double progress = (double) day / timeframeDays;
            double probabilityTrend = risk.getProbability() * (1.0 + drift * progress);
            double impactTrend = risk.getImpact() * (1.0 + 0.5 * drift * progress);

            double probabilitySum = 0.0;
            double impactSum = 0.0;
            for (int i = 0; i < subSamples; i++) {
                probabilitySum += clamp(probabilityTrend * (0.8 + 0.4 * rng.nextDouble()));
                impactSum += clamp(impactTrend * (0.7 + 0.6 * rng.nextDouble()));
            }
            trajectory.add(new TrajectoryPoint(day, probabilitySum / subSamples, impactSum / subSamples));
        }
        return trajectory;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }

    /**
     * The caller's token plus the configured timeout. Once any check fails, or a chunk fails,
     * every later check fails too so sibling chunks stop early. The first chunk failure that is
     * not itself such a cancellation is kept so it can be reported instead of a sibling's abort.
     */
    private static final class Deadline {

        private final CancellationToken token;
        private final long deadlineNanos;
        private final boolean bounded;
        private final AtomicReference<RuntimeException> failure = new AtomicReference<>();
        private volatile boolean aborted;

        Deadline(CancellationToken token, long startNanos, Duration timeout) {
            this.token = token == null ? CancellationToken.none() : token;
            this.bounded = timeout != null && !timeout.isZero() && !timeout.isNegative();
            this.deadlineNanos = bounded ? startNanos + timeout.toNanos() : 0L;
        }

        void abort() {
            aborted = true;
        }

        void fail(RuntimeException e) {
            if (!(e instanceof SimulationCancelledException)) {
                failure.compareAndSet(null, e);
            }
            aborted = true;
        }

        RuntimeException failure() {
            return failure.get();
        }

        void check(String stage) {
            if (aborted || token.isCancellationRequested()) {
                aborted = true;
                throw new SimulationCancelledException("cancellationToken",
                        "Simulation cancelled during " + stage);
            }
            if (bounded && System.nanoTime() - deadlineNanos > 0) {
                aborted = true;
                throw new SimulationCancelledException("timeout",
                        "Simulation exceeded its time budget during " + stage);
            }
        }
    }
}
