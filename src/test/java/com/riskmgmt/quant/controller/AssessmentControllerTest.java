package com.riskmgmt.quant.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskmgmt.quant.exception.DistributionException;
import com.riskmgmt.quant.exception.InsufficientDataException;
import com.riskmgmt.quant.exception.InvalidParameterException;
import com.riskmgmt.quant.exception.SimulationCancelledException;
import com.riskmgmt.quant.model.*;
import com.riskmgmt.quant.service.RiskAssessmentService;
import com.riskmgmt.quant.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AssessmentController.class)
class AssessmentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private RiskAssessmentService assessmentService;

    private final RiskInput risk = TestDataFactory.createRisk("R-1", RiskCategory.CYBERSECURITY, 78, 95, "vendor");

    @Test
    void assess_success() throws Exception {
        RiskAssessmentReport report = RiskAssessmentReport.builder()
                .id("RA-ab12cd34ef56ab12")
                .framework(RiskFramework.NIST)
                .assessedAt(Instant.parse("2024-03-01T00:00:00Z"))
                .fingerprint("ab12cd34ef56ab12")
                .seed(7L)
                .risk(risk)
                .simulation(SimulationResult.builder().riskId("R-1").iterations(1000).expectedValue(0.74).build())
                .recommendation(RiskRecommendation.builder()
                        .id("REC-R-1-AVOIDANCE").riskIds(List.of("R-1"))
                        .type(RecommendationType.AVOIDANCE).priority(RiskLevel.CRITICAL).build())
                .build();
        when(assessmentService.assessRisk(anyList(), any(SimulationParameters.class), eq(RiskFramework.NIST), eq(7L)))
                .thenReturn(report);

        AssessmentRequest request = AssessmentRequest.builder()
                .risks(List.of(risk))
                .parameters(TestDataFactory.createParameters(1000, 90))
                .framework(RiskFramework.NIST)
                .seed(7L)
                .build();

        mockMvc.perform(post("/api/v1/assessments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("RA-ab12cd34ef56ab12"))
                .andExpect(jsonPath("$.framework").value("NIST"))
                .andExpect(jsonPath("$.simulations[0].riskId").value("R-1"))
                .andExpect(jsonPath("$.simulations[0].expectedValue").value(0.74))
                .andExpect(jsonPath("$.recommendations[0].priority").value("CRITICAL"))
                .andExpect(jsonPath("$.correlation").doesNotExist());
    }

    @Test
    void assess_missingRisks_badRequest() throws Exception {
        AssessmentRequest request = AssessmentRequest.builder()
                .parameters(TestDataFactory.createParameters(1000, 90))
                .build();

        mockMvc.perform(post("/api/v1/assessments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("At least one risk is required"))
                .andExpect(jsonPath("$.parameter").value("risks"));

        verifyNoInteractions(assessmentService);
    }

    @Test
    void assess_missingParameters_badRequest() throws Exception {
        AssessmentRequest request = AssessmentRequest.builder().risks(List.of(risk)).build();

        mockMvc.perform(post("/api/v1/assessments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.parameter").value("parameters"));
    }

    @Test
    void assess_invalidParameter_badRequestNamingParameter() throws Exception {
        when(assessmentService.assessRisk(anyList(), any(), any(), any()))
                .thenThrow(new InvalidParameterException("iterations", "iterations must be positive, got 0"));

        mockMvc.perform(post("/api/v1/assessments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(AssessmentRequest.builder()
                                .risks(List.of(risk))
                                .parameters(TestDataFactory.createParameters(0, 90))
                                .build())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("iterations must be positive, got 0"))
                .andExpect(jsonPath("$.parameter").value("iterations"));
    }

    @Test
    void assess_cancelled_serviceUnavailable() throws Exception {
        when(assessmentService.assessRisk(anyList(), any(), any(), any()))
                .thenThrow(new SimulationCancelledException("timeout", "Simulation exceeded PT30S"));

        mockMvc.perform(post("/api/v1/assessments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(AssessmentRequest.builder()
                                .risks(List.of(risk))
                                .parameters(TestDataFactory.createParameters(1000, 90))
                                .build())))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.parameter").value("timeout"));
    }

    @Test
    void assess_malformedBody_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/assessments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"risks\": [ {\"id\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.parameter").value("body"));
    }

    @Test
    void simulate_success() throws Exception {
        SimulationResult result = SimulationResult.builder()
                .riskId("R-1").iterations(1000).timeframeDays(90).seed(42L)
                .expectedValue(0.74).worstCase(0.97)
                .valueAtRiskEntry(ValueAtRisk.builder().confidence(95.0).value(0.93).build())
                .build();
        when(assessmentService.simulate(any(RiskInput.class), any(SimulationParameters.class), isNull()))
                .thenReturn(result);

        SimulationRequest request = SimulationRequest.builder()
                .risk(risk)
                .parameters(TestDataFactory.createParameters(1000, 90))
                .build();

        mockMvc.perform(post("/api/v1/assessments/simulations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.riskId").value("R-1"))
                .andExpect(jsonPath("$.seed").value(42))
                .andExpect(jsonPath("$.valueAtRisk[0].confidence").value(95.0))
                .andExpect(jsonPath("$.valueAtRisk[0].value").value(0.93));
    }

    @Test
    void simulate_missingRisk_badRequest() throws Exception {
        SimulationRequest request = SimulationRequest.builder()
                .parameters(TestDataFactory.createParameters(1000, 90))
                .build();

        mockMvc.perform(post("/api/v1/assessments/simulations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.parameter").value("risk"));
    }

    @Test
    void simulate_distributionFailure_internalError() throws Exception {
        when(assessmentService.simulate(any(), any(), any()))
                .thenThrow(new DistributionException("distribution",
                        "TRIANGULAR distribution for risk R-1 produced 11 consecutive invalid draws"));

        mockMvc.perform(post("/api/v1/assessments/simulations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(SimulationRequest.builder()
                                .risk(risk)
                                .parameters(TestDataFactory.createParameters(1000, 90))
                                .build())))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.parameter").value("distribution"));
    }

    @Test
    void correlate_singleRisk_unprocessable() throws Exception {
        when(assessmentService.correlate(anyList()))
                .thenThrow(new InsufficientDataException("risks", "Correlation analysis needs at least 2 risks, got 1"));

        mockMvc.perform(post("/api/v1/assessments/correlations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(List.of(risk))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.parameter").value("risks"));
    }

    @Test
    void correlate_success() throws Exception {
        RiskInput other = TestDataFactory.createRisk("R-2", RiskCategory.OPERATIONAL, 60, 70, "vendor");
        CorrelationAnalysis analysis = CorrelationAnalysis.builder()
                .matrix(new CorrelationMatrix(List.of("R-1", "R-2"), new double[][]{{1.0, 0.6}, {0.6, 1.0}}))
                .build();
        when(assessmentService.correlate(anyList())).thenReturn(analysis);

        mockMvc.perform(post("/api/v1/assessments/correlations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(List.of(risk, other))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.matrix.riskIds[1]").value("R-2"))
                .andExpect(jsonPath("$.matrix.values[0][1]").value(0.6));

        verify(assessmentService).correlate(argThat(risks -> risks.size() == 2));
    }
}
