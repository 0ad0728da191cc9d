package com.pinebridge.analysis;

import java.util.List;

/**
 * Risk, score and issues of one category.
 */
public record RiskSection(Severity risk, int score, List<RiskIssue> issues) {

    public static final int MAX_SCORE = 100;

    public RiskSection {
        issues = List.copyOf(issues);
    }

    public static RiskSection clean() {
        return new RiskSection(Severity.NONE, MAX_SCORE, List.of());
    }

    /**
     * Risk is the highest severity present; the score loses each issue's
     * deduction and never drops below zero.
     */
    public static RiskSection of(RiskCategory category, List<RiskIssue> issues) {
        Severity risk = Severity.NONE;
        int penalty = 0;
        for (RiskIssue issue : issues) {
            risk = Severity.max(risk, issue.severity());
            penalty += issue.severity().deduction(category);
        }
        return new RiskSection(risk, Math.max(0, MAX_SCORE - penalty), issues);
    }
}
