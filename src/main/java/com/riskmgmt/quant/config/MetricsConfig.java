package com.riskmgmt.quant.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSimulation(String distribution, int iterations, Duration elapsed) {
        Timer.builder("simulation.duration")
                .tag("distribution", distribution)
                .register(registry)
                .record(elapsed);

        DistributionSummary.builder("simulation.iterations")
                .tag("distribution", distribution)
                .register(registry)
                .record(iterations);
    }

    public void recordSimulationCancelled(String reason) {
        Counter.builder("simulation.cancelled.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordAssessment(String framework, int riskCount, int clusterCount) {
        Counter.builder("assessment.count")
                .tag("framework", framework)
                .tag("mode", riskCount > 1 ? "portfolio" : "single")
                .register(registry)
                .increment();

        DistributionSummary.builder("assessment.clusters")
                .tag("framework", framework)
                .register(registry)
                .record(clusterCount);
    }

    public void recordAssessmentFailure(String errorType) {
        Counter.builder("assessment.failed.count")
                .tag("error", errorType)
                .register(registry)
                .increment();
    }

    public void recordCacheLookup(boolean hit) {
        Counter.builder("assessment.cache.lookup")
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    public void recordCostCapBreach(String recommendationType) {
        Counter.builder("recommendation.cost_cap.breach.count")
                .tag("type", recommendationType)
                .register(registry)
                .increment();
    }
}
