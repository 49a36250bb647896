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
@Schema(description = "Correlation between two risks and what drives it")
public class RiskCorrelationPair {

    @Schema(example = "RISK-001")
    String riskId1;

    @Schema(example = "RISK-002")
    String riskId2;

    @Schema(description = "Correlation strength (-1 to 1)", example = "0.82")
    double strength;

    @Schema(description = "Dominant driver of the correlation", example = "COMMON_CAUSE")
    CorrelationType correlationType;

    @Singular
    @Schema(description = "Factor tags both risks carry")
    List<String> sharedFactors;
}
