package com.riskmgmt.quant.engine;

import com.riskmgmt.quant.exception.InvalidParameterException;
import com.riskmgmt.quant.model.RiskInput;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Shared checks on risk records, applied at every engine entry point.
 */
public final class RiskInputValidator {

    private RiskInputValidator() {
    }

    public static void validate(RiskInput risk) {
        if (risk == null) {
            throw new InvalidParameterException("risk", "Risk is required");
        }
        if (risk.getId() == null || risk.getId().isBlank()) {
            throw new InvalidParameterException("id", "Risk id is required");
        }
        if (risk.getCategory() == null) {
            throw new InvalidParameterException("category", "Risk " + risk.getId() + " has no category");
        }
        requireScale("probability", risk.getId(), risk.getProbability());
        requireScale("impact", risk.getId(), risk.getImpact());
        if (risk.getFinancialImpact() != null
                && risk.getFinancialImpact().getMin() > risk.getFinancialImpact().getMax()) {
            throw new InvalidParameterException("financialImpact",
                    "Risk " + risk.getId() + " has financial impact min above max");
        }
    }

    /**
     * Validates every risk and rejects duplicate ids.
     */
    public static void validateAll(List<RiskInput> risks) {
        if (risks == null || risks.isEmpty()) {
            throw new InvalidParameterException("risks", "At least one risk is required");
        }
        Set<String> seen = new HashSet<>();
        for (RiskInput risk : risks) {
            validate(risk);
            if (!seen.add(risk.getId())) {
                throw new InvalidParameterException("id", "Duplicate risk id: " + risk.getId());
            }
        }
    }

    private static void requireScale(String field, String riskId, double value) {
        if (!(value >= 0.0 && value <= 100.0)) {
            throw new InvalidParameterException(field,
                    String.format("Risk %s has %s %.2f outside [0, 100]", riskId, field, value));
        }
    }
}
