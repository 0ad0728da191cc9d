package com.pinebridge.analysis;

import java.util.regex.Pattern;

/**
 * One row of the repaint pattern table. Patterns are matched case-insensitively
 * against a single source line.
 */
public record RiskPattern(
    Severity severity,
    String kind,
    Pattern pattern,
    String description,
    String recommendation
) {
    public static RiskPattern of(Severity severity, String kind, String regex,
                                 String description, String recommendation) {
        return new RiskPattern(severity, kind, Pattern.compile(regex, Pattern.CASE_INSENSITIVE),
            description, recommendation);
    }

    public boolean matches(String line) {
        return pattern.matcher(line).find();
    }
}
