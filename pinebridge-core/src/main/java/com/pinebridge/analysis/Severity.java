package com.pinebridge.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Risk severity, ordered from harmless to critical.
 */
public enum Severity {
    NONE("none", 0, 0),
    LOW("low", 5, 5),
    MEDIUM("medium", 15, 12),
    HIGH("high", 30, 25),
    CRITICAL("critical", 50, 40);

    private final String value;
    private final int repaintDeduction;
    private final int overfitDeduction;

    Severity(String value, int repaintDeduction, int overfitDeduction) {
        this.value = value;
        this.repaintDeduction = repaintDeduction;
        this.overfitDeduction = overfitDeduction;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Score points lost for one issue of this severity in the given category.
     */
    public int deduction(RiskCategory category) {
        return category == RiskCategory.REPAINT ? repaintDeduction : overfitDeduction;
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    public static Severity max(Severity a, Severity b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static Severity fromValue(String value) {
        if (value == null) return NONE;
        for (Severity severity : values()) {
            if (severity.value.equalsIgnoreCase(value)) {
                return severity;
            }
        }
        return NONE;
    }
}
