package org.dxworks.trustforge.model.risk;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskStatus {
    OPEN("Open"),
    ACCEPTED("Accepted"),
    MITIGATING("Mitigating"),
    RESOLVED("Resolved");

    private final String label;

    RiskStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
