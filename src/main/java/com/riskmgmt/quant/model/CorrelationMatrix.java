package com.riskmgmt.quant.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Square, symmetric correlation matrix indexed by risk identifiers.
 * Values are copied on the way in and on the way out.
 */
@EqualsAndHashCode
@ToString
@Schema(description = "Pairwise risk correlation matrix (symmetric, unit diagonal)")
public final class CorrelationMatrix {

    @Schema(description = "Row/column order of the matrix", example = "[\"RISK-001\", \"RISK-002\"]")
    private final List<String> riskIds;

    @Schema(description = "Correlation values, values[i][j] for riskIds[i] x riskIds[j]")
    private final double[][] values;

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private final Map<String, Integer> index;

    @JsonCreator
    public CorrelationMatrix(@JsonProperty("riskIds") List<String> riskIds,
                             @JsonProperty("values") double[][] values) {
        if (values.length != riskIds.size()) {
            throw new IllegalArgumentException("Matrix has " + values.length
                    + " rows for " + riskIds.size() + " risk ids");
        }
        this.riskIds = List.copyOf(riskIds);
        this.values = new double[values.length][];
        this.index = new HashMap<>();
        for (int i = 0; i < values.length; i++) {
            if (values[i].length != values.length) {
                throw new IllegalArgumentException("Matrix row " + i + " is not square");
            }
            this.values[i] = values[i].clone();
            this.index.put(this.riskIds.get(i), i);
        }
    }

    public List<String> getRiskIds() {
        return riskIds;
    }

    public double[][] getValues() {
        double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            copy[i] = values[i].clone();
        }
        return copy;
    }

    @JsonIgnore
    public int size() {
        return riskIds.size();
    }

    public double get(int i, int j) {
        return values[i][j];
    }

    public double get(String riskIdA, String riskIdB) {
        return values[indexOf(riskIdA)][indexOf(riskIdB)];
    }

    public int indexOf(String riskId) {
        Integer i = index.get(riskId);
        if (i == null) {
            throw new IllegalArgumentException("Unknown risk id: " + riskId);
        }
        return i;
    }
}
