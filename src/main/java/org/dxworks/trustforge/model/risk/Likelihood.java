package org.dxworks.trustforge.model.risk;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Likelihood {
    UNLIKELY("Unlikely"),
    POSSIBLE("Possible"),
    LIKELY("Likely");

    private final String label;

    Likelihood(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
