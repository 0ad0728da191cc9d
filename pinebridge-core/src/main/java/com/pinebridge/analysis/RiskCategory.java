package com.pinebridge.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskCategory {
    REPAINT("repaint"),
    OVERFIT("overfit");

    private final String value;

    RiskCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
