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
@Schema(description = "Shortest propagation path between two high-severity risks")
public class CriticalPath {

    @Singular
    @Schema(description = "Risk ids along the path, endpoints included")
    List<String> riskIds;

    @Schema(description = "Number of edges on the path", example = "2")
    int hops;

    @Schema(description = "Sum of the unit severities of the risks on the path; exceeds 1 for long paths", example = "1.93")
    double totalImpact;

    @Schema(description = "Product of edge correlations along the path", example = "0.41")
    double probability;
}
