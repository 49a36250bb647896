package com.riskmgmt.quant.model;

public enum DistributionType {
    TRIANGULAR,
    LOG_NORMAL,
    NORMAL,
    UNIFORM,
    BETA
}
