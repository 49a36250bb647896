package com.riskmgmt.quant.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Explicit distribution for a named simulation variable. Only the parameters relevant to
 * {@link #type} are read; the rest may be left null.
 */
@Value
@Builder
@Jacksonized
@Schema(description = "Distribution overriding the default model for a simulation variable")
public class VariableDistribution {

    @Schema(description = "Distribution family", example = "TRIANGULAR")
    DistributionType type;

    @Schema(description = "Lower bound (TRIANGULAR, UNIFORM, BETA)", example = "0.1")
    Double min;

    @Schema(description = "Upper bound (TRIANGULAR, UNIFORM, BETA)", example = "0.9")
    Double max;

    @Schema(description = "Mode (TRIANGULAR)", example = "0.6")
    Double mode;

    @Schema(description = "Mean (NORMAL); median (LOG_NORMAL)", example = "0.5")
    Double mean;

    @Schema(description = "Standard deviation (NORMAL); shape (LOG_NORMAL)", example = "0.1")
    Double stddev;

    @Schema(description = "Alpha shape (BETA)", example = "2")
    Double alpha;

    @Schema(description = "Beta shape (BETA)", example = "5")
    Double beta;
}
