package com.pinebridge.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.pinebridge.io.JsonSupport;

/**
 * Result of a static risk analysis. Serializes to exactly four keys:
 * {@code repainting}, {@code overfitting}, {@code metrics} and {@code error}.
 */
@JsonPropertyOrder({"repainting", "overfitting", "metrics", "error"})
public record AnalysisReport(
    RiskSection repainting,
    RiskSection overfitting,
    ReportMetrics metrics,
    String error
) {
    public static AnalysisReport failure(String error) {
        return new AnalysisReport(RiskSection.clean(), RiskSection.clean(), ReportMetrics.empty(), error);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null;
    }

    public String toJson() {
        return JsonSupport.toJson(this);
    }
}
