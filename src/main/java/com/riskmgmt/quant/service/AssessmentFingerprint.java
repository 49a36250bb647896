package com.riskmgmt.quant.service;

import com.riskmgmt.quant.model.FinancialImpactRange;
import com.riskmgmt.quant.model.RiskFramework;
import com.riskmgmt.quant.model.RiskInput;
import com.riskmgmt.quant.model.SimulationParameters;
import com.riskmgmt.quant.model.VariableDistribution;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * SHA-256 over a canonical rendering of everything that determines a report: risk contents in
 * input order, simulation parameters, framework and seed. Equal fingerprints mean equal reports
 * (up to the assessment timestamp).
 */
public final class AssessmentFingerprint {

    private AssessmentFingerprint() {
    }

    public static String of(List<RiskInput> risks, SimulationParameters parameters,
                            RiskFramework framework, long seed) {
        StringBuilder canonical = new StringBuilder(256);
        field(canonical, "framework", framework);
        field(canonical, "seed", seed);
        field(canonical, "iterations", parameters.getIterations());
        field(canonical, "timeframeDays", parameters.getTimeframeDays());

        Map<String, VariableDistribution> variables = parameters.getVariables() == null
                ? Map.of() : new TreeMap<>(parameters.getVariables());
        field(canonical, "variables", variables.size());
        for (Map.Entry<String, VariableDistribution> entry : variables.entrySet()) {
            VariableDistribution v = entry.getValue();
            field(canonical, "variable", entry.getKey());
            field(canonical, "type", v.getType());
            field(canonical, "min", v.getMin());
            field(canonical, "max", v.getMax());
            field(canonical, "mode", v.getMode());
            field(canonical, "mean", v.getMean());
            field(canonical, "stddev", v.getStddev());
            field(canonical, "alpha", v.getAlpha());
            field(canonical, "beta", v.getBeta());
        }

        field(canonical, "risks", risks.size());
        for (RiskInput risk : risks) {
            field(canonical, "id", risk.getId());
            field(canonical, "title", risk.getTitle());
            field(canonical, "category", risk.getCategory());
            field(canonical, "probability", risk.getProbability());
            field(canonical, "impact", risk.getImpact());
            List<String> factors = risk.getFactors();
            field(canonical, "factors", factors == null ? null : factors.size());
            if (factors != null) {
                for (String factor : factors) {
                    field(canonical, "factor", factor);
                }
            }
            field(canonical, "owner", risk.getOwner());
            FinancialImpactRange range = risk.getFinancialImpact();
            field(canonical, "financialImpact", range == null ? null : "present");
            if (range != null) {
                field(canonical, "min", range.getMin());
                field(canonical, "max", range.getMax());
                field(canonical, "currency", range.getCurrency());
            }
        }

        return sha256(canonical.toString());
    }

    // name=<length>:<value>; or name=~; for null, so no value can be mistaken for a separator
    private static void field(StringBuilder canonical, String name, Object value) {
        canonical.append(name).append('=');
        if (value == null) {
            canonical.append('~');
        } else {
            String text = String.valueOf(value);
            canonical.append(text.length()).append(':').append(text);
        }
        canonical.append(';');
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256.
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
