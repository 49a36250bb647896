package com.riskmgmt.quant.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Jacksonized
@Schema(description = "Graph metrics of the thresholded correlation network")
public class NetworkMetrics {

    @Schema(description = "Correlation at or above which two risks are connected", example = "0.3")
    double threshold;

    @Schema(description = "Number of edges", example = "4")
    int edgeCount;

    @Schema(description = "Edges / possible edges (0-1)", example = "0.4")
    double density;

    @Schema(description = "Average local clustering coefficient (0-1)", example = "0.33")
    double clusteringCoefficient;

    @Schema(description = "Mean shortest-path length over all pairs; null when the network is disconnected", nullable = true)
    Double averagePathLength;

    @Singular
    @Schema(description = "Longest shortest paths between high-severity risks, longest first")
    List<CriticalPath> criticalPaths;

    @Singular("nodeCentrality")
    @Schema(description = "Centrality per risk id")
    Map<String, CentralityMeasure> centrality;
}
