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
@Schema(description = "Shape statistics of the simulated distribution")
public class DistributionStatistics {

    double min;
    double max;
    double median;

    @Schema(description = "Midpoint of the most populated histogram bin (lowest on ties)")
    double mode;

    @Schema(description = "Sample skewness (0 when undefined)")
    double skewness;

    @Schema(description = "Sample excess kurtosis (0 when undefined)")
    double kurtosis;

    @Singular("bin")
    List<HistogramBin> histogram;
}
