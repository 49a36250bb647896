package com.riskmgmt.quant.model;

public enum CorrelationType {
    // shared factor tags
    COMMON_CAUSE,
    // related categories, one tends to trigger the other
    CASCADING,
    // same category without shared factors
    SYNERGISTIC,
    INDEPENDENT
}
