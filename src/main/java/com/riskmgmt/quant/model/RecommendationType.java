package com.riskmgmt.quant.model;

public enum RecommendationType {
    MITIGATION,
    TRANSFER,
    AVOIDANCE,
    ACCEPTANCE
}
