package com.riskmgmt.quant.model;

public enum RiskTolerance {
    LOW(0.5),
    MEDIUM(0.7),
    HIGH(0.9);

    private final double targetMultiplier;

    RiskTolerance(double targetMultiplier) {
        this.targetMultiplier = targetMultiplier;
    }

    /**
     * Fraction of the current score considered acceptable after treatment.
     */
    public double getTargetMultiplier() {
        return targetMultiplier;
    }
}
