package com.riskmgmt.quant.model;

import java.util.EnumSet;
import java.util.Set;

public enum RiskCategory {
    CYBERSECURITY,
    OPERATIONAL,
    FINANCIAL,
    COMPLIANCE,
    STRATEGIC;

    /**
     * Categories whose losses are commonly insured or hedged, making TRANSFER a viable response.
     */
    private static final Set<RiskCategory> INSURABLE = EnumSet.of(CYBERSECURITY, FINANCIAL, OPERATIONAL);

    public boolean isInsurable() {
        return INSURABLE.contains(this);
    }
}
