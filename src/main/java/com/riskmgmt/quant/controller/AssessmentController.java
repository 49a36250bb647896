package com.riskmgmt.quant.controller;

import com.riskmgmt.quant.exception.InvalidParameterException;
import com.riskmgmt.quant.model.AssessmentRequest;
import com.riskmgmt.quant.model.CorrelationAnalysis;
import com.riskmgmt.quant.model.RiskAssessmentReport;
import com.riskmgmt.quant.model.RiskInput;
import com.riskmgmt.quant.model.SimulationRequest;
import com.riskmgmt.quant.model.SimulationResult;
import com.riskmgmt.quant.service.RiskAssessmentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/assessments")
@Tag(name = "Assessments", description = "Quantitative risk assessment: Monte Carlo simulation, correlation networks and recommendations")
public class AssessmentController {

    private final RiskAssessmentService assessmentService;

    public AssessmentController(RiskAssessmentService assessmentService) {
        this.assessmentService = assessmentService;
    }

    @Operation(summary = "Assess one or more risks",
            description = "Runs a seeded Monte Carlo simulation per risk and, for two or more risks, the correlation " +
                    "matrix, network metrics, clusters and systemic indicators. Returns the full report with ranked " +
                    "recommendations. Identical requests return the identical memoized report.")
    @PostMapping
    public ResponseEntity<RiskAssessmentReport> assess(@RequestBody AssessmentRequest request) {
        if (request.getRisks() == null || request.getRisks().isEmpty()) {
            throw new InvalidParameterException("risks", "At least one risk is required");
        }
        if (request.getParameters() == null) {
            throw new InvalidParameterException("parameters", "Simulation parameters are required");
        }

        RiskAssessmentReport report = assessmentService.assessRisk(request.getRisks(), request.getParameters(),
                request.getFramework(), request.getSeed());
        return ResponseEntity.ok(report);
    }

    @Operation(summary = "Simulate a single risk",
            description = "Monte Carlo simulation of one risk: percentiles, confidence intervals, Value-at-Risk, " +
                    "exceedance probabilities and the time trajectory.")
    @PostMapping("/simulations")
    public ResponseEntity<SimulationResult> simulate(@RequestBody SimulationRequest request) {
        if (request.getRisk() == null) {
            throw new InvalidParameterException("risk", "Risk is required");
        }
        if (request.getParameters() == null) {
            throw new InvalidParameterException("parameters", "Simulation parameters are required");
        }

        SimulationResult result = assessmentService.simulate(request.getRisk(), request.getParameters(), request.getSeed());
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Correlate risks",
            description = "Correlation matrix, significant pairs and network metrics for two or more risks. " +
                    "No simulation is run.")
    @PostMapping("/correlations")
    public ResponseEntity<CorrelationAnalysis> correlate(@RequestBody List<RiskInput> risks) {
        return ResponseEntity.ok(assessmentService.correlate(risks));
    }
}
