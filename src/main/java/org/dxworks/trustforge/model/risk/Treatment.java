package org.dxworks.trustforge.model.risk;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Treatment {
    ACCEPT("Accept"),
    MITIGATE("Mitigate"),
    TRANSFER("Transfer"),
    AVOID("Avoid");

    private final String label;

    Treatment(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
