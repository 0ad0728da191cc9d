package com.pinebridge.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ReportMetrics(
    @JsonProperty("line_count") int lineCount,
    @JsonProperty("parameter_count") int parameterCount,
    @JsonProperty("indicator_count") int indicatorCount,
    @JsonProperty("condition_complexity") int conditionComplexity,
    @JsonProperty("script_version") int scriptVersion
) {
    public static ReportMetrics empty() {
        return new ReportMetrics(0, 0, 0, 0, 0);
    }
}
