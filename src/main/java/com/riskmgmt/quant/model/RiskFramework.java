package com.riskmgmt.quant.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Risk management framework the assessment is reported under")
public enum RiskFramework {
    COSO("COSO Enterprise Risk Management", "2017"),
    ISO31000("ISO 31000:2018 Risk Management", "2018"),
    NIST("NIST Risk Management Framework", "SP 800-30 Rev. 1");

    private final String displayName;
    private final String version;

    RiskFramework(String displayName, String version) {
        this.displayName = displayName;
        this.version = version;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getVersion() {
        return version;
    }
}
