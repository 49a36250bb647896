package com.riskmgmt.quant.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@AllArgsConstructor
@Schema(description = "Normalized centrality of a risk in the correlation network")
public class CentralityMeasure {

    @Schema(description = "Degree / (n - 1)", example = "0.5")
    double degree;

    @Schema(description = "Reachable nodes / sum of distances to them", example = "0.66")
    double closeness;

    @Schema(description = "Normalized betweenness (Brandes)", example = "0.33")
    double betweenness;
}
