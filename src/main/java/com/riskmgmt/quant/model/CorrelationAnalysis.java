package com.riskmgmt.quant.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@Schema(description = "Correlation structure and network metrics of a risk set")
public class CorrelationAnalysis {

    CorrelationMatrix matrix;

    @Singular
    @Schema(description = "Pairs at or above the network threshold, strongest first")
    List<RiskCorrelationPair> pairs;

    NetworkMetrics networkMetrics;
}
