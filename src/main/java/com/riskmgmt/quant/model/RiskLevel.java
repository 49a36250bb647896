package com.riskmgmt.quant.model;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Band for a score on the 0-100 scale.
     */
    public static RiskLevel fromScore(double score) {
        if (score >= 80) return CRITICAL;
        if (score >= 60) return HIGH;
        if (score >= 30) return MEDIUM;
        return LOW;
    }

    /**
     * Band for a unit severity (probability x impact, 0-1).
     */
    public static RiskLevel fromSeverity(double severity) {
        return fromScore(severity * 100.0);
    }
}
