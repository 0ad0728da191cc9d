package com.pinebridge.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A single finding. Repaint issues point at a line; overfit issues are
 * aggregates with a count and a few example matches.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RiskIssue(
    RiskCategory category,
    String kind,
    Severity severity,
    Integer line,
    String snippet,
    Integer count,
    List<String> examples,
    String description,
    String recommendation
) {
    /** Examples kept per aggregate issue. */
    public static final int MAX_EXAMPLES = 5;

    public RiskIssue {
        examples = examples == null ? null : List.copyOf(examples.subList(0, Math.min(MAX_EXAMPLES, examples.size())));
    }

    public static RiskIssue atLine(RiskPattern pattern, int line, String snippet) {
        return new RiskIssue(RiskCategory.REPAINT, pattern.kind(), pattern.severity(), line, snippet,
            null, null, pattern.description(), pattern.recommendation());
    }

    public static RiskIssue aggregate(String kind, Severity severity, int count, List<String> examples,
                                      String description, String recommendation) {
        return new RiskIssue(RiskCategory.OVERFIT, kind, severity, null, null,
            count, examples, description, recommendation);
    }
}
