package com.pinebridge.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text-only repainting and overfitting analysis. Works on raw source without
 * parsing it, so it accepts scripts the converter rejects. Never throws.
 */
public class RiskAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(RiskAnalyzer.class);

    /** Inputs shorter than this (after trimming) are rejected. */
    public static final int MIN_SOURCE_LENGTH = 10;
    public static final int DEFAULT_VERSION = 5;

    static final int MAGIC_NUMBER_THRESHOLD = 5;
    static final int MAGIC_NUMBER_HIGH = 15;
    static final int PARAMETER_THRESHOLD = 10;
    static final int PARAMETER_HIGH = 20;
    static final int CONDITION_THRESHOLD = 20;

    /** Round numbers that are too common to suggest tuning. */
    private static final Set<Double> SAFE_NUMBERS = Set.of(
        0.0, 1.0, 2.0, 3.0, 5.0, 10.0, 14.0, 20.0, 50.0, 100.0, 200.0);

    private static final List<RiskPattern> REPAINT_PATTERNS = List.of(
        // Critical
        RiskPattern.of(Severity.CRITICAL, "lookahead_on",
            "\\blookahead\\s*=\\s*(barmerge\\.lookahead_on|enable_on|true)\\b",
            "Look-ahead enabled: values from future bars leak into history",
            "Use lookahead=barmerge.lookahead_off."),
        RiskPattern.of(Severity.CRITICAL, "security_lookahead_on",
            "\\brequest\\.security\\s*\\([^)]*lookahead\\s*=\\s*barmerge\\.lookahead_on",
            "request.security called with look-ahead enabled",
            "Call request.security with lookahead_off."),
        // High
        RiskPattern.of(Severity.HIGH, "realtime_bar",
            "\\bbarstate\\.isrealtime\\b",
            "Logic depends on barstate.isrealtime and behaves differently on history",
            "Remove the realtime check or require barstate.isconfirmed."),
        RiskPattern.of(Severity.HIGH, "unconfirmed_bar",
            "\\bbarstate\\.isconfirmed\\s*==\\s*false\\b",
            "Logic acts on bars that are not yet confirmed",
            "Only act when barstate.isconfirmed is true."),
        RiskPattern.of(Severity.HIGH, "timenow",
            "\\btimenow\\b",
            "timenow reads the wall clock and changes on every tick",
            "Use time instead of timenow."),
        RiskPattern.of(Severity.HIGH, "security_without_lookahead",
            "(?<!\\.)\\bsecurity\\s*\\((?!.*\\blookahead\\b)",
            "v4 security() call without an explicit lookahead argument",
            "Upgrade to request.security and pass lookahead_off explicitly."),
        // Medium
        RiskPattern.of(Severity.MEDIUM, "varip",
            "\\bvarip\\b",
            "varip variables update intrabar in realtime only",
            "Consider var instead of varip."),
        RiskPattern.of(Severity.MEDIUM, "gaps_on",
            "\\brequest\\.security\\s*\\([^)]*gaps\\s*=\\s*barmerge\\.gaps_on",
            "request.security called with gaps_on",
            "Prefer gaps_off."),
        RiskPattern.of(Severity.MEDIUM, "pivot",
            "\\bta\\.pivothigh\\b|\\bta\\.pivotlow\\b",
            "Pivot functions confirm only after the right-hand bars have closed",
            "Account for the confirmation delay of pivots."),
        RiskPattern.of(Severity.MEDIUM, "valuewhen",
            "\\bta\\.valuewhen\\b",
            "ta.valuewhen returns the value from when a condition last held",
            "Check that the condition is evaluated on confirmed bars."),
        // Low
        RiskPattern.of(Severity.LOW, "historical_close",
            "\\bclose\\[\\d+\\]",
            "Historical close reference",
            "Verify the offset matches the intended bar."),
        RiskPattern.of(Severity.LOW, "historical_high_low",
            "\\bhigh\\[\\d+\\]|\\blow\\[\\d+\\]",
            "Historical high/low reference",
            "Verify the offset matches the intended bar.")
    );

    private static final Pattern LINE_COMMENT = Pattern.compile("//.*$", Pattern.MULTILINE);
    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern MAGIC_NUMBER = Pattern.compile("\\b(?<!\\.)\\d+\\.?\\d*(?!\\d)(?!\\s*[,)\\]])");
    private static final Pattern HARDCODED_DATE = Pattern.compile(
        "\\b(19|20)\\d{2}[-/](0?[1-9]|1[0-2])[-/](0?[1-9]|[12]\\d|3[01])\\b");
    private static final Pattern TIMESTAMP = Pattern.compile("\\btimestamp\\s*\\(\\s*\\d{4}");
    private static final Pattern INPUT_PARAM = Pattern.compile(
        "\\binput\\s*\\.\\s*(int|float|bool|string|source|timeframe)");
    private static final Pattern CONDITION = Pattern.compile("\\b(and|or)\\b");
    private static final Pattern INDICATOR = Pattern.compile("\\bta\\.(\\w+)");
    private static final Pattern VERSION = Pattern.compile("//@version\\s*=?\\s*(\\d{1,4})");

    /**
     * Analyze one script.
     *
     * @return a report; {@link AnalysisReport#error()} is set for empty or too short input
     */
    public AnalysisReport analyze(String source) {
        if (source == null || source.strip().length() < MIN_SOURCE_LENGTH) {
            log.debug("Rejecting script of length {}", source == null ? 0 : source.length());
            return AnalysisReport.failure("Source is empty or shorter than " + MIN_SOURCE_LENGTH + " characters");
        }

        List<RiskIssue> repaint = repaintIssues(source);
        String code = stripComments(source);
        List<RiskIssue> overfit = new ArrayList<>();

        List<String> magic = suspiciousNumbers(code);
        if (magic.size() > MAGIC_NUMBER_THRESHOLD) {
            overfit.add(RiskIssue.aggregate("magic_numbers",
                magic.size() < MAGIC_NUMBER_HIGH ? Severity.MEDIUM : Severity.HIGH,
                magic.size(), magic,
                magic.size() + " hardcoded numeric constants",
                "Expose tuned constants as inputs so they can be validated out of sample."));
        }

        List<String> dates = findAll(HARDCODED_DATE, code);
        if (!dates.isEmpty()) {
            overfit.add(RiskIssue.aggregate("hardcoded_dates", Severity.HIGH, dates.size(), dates,
                "Hardcoded calendar dates restrict the strategy to a specific period",
                "Remove the date filter or make it an input."));
        }

        List<String> timestamps = findAll(TIMESTAMP, code);
        if (!timestamps.isEmpty()) {
            overfit.add(RiskIssue.aggregate("timestamp_filter", Severity.HIGH, timestamps.size(), timestamps,
                "Fixed timestamp filter",
                "Filters on fixed points in time carry a high overfitting risk."));
        }

        int parameters = findAll(INPUT_PARAM, code).size();
        if (parameters > PARAMETER_THRESHOLD) {
            overfit.add(RiskIssue.aggregate("too_many_parameters",
                parameters < PARAMETER_HIGH ? Severity.MEDIUM : Severity.HIGH,
                parameters, List.of(),
                parameters + " input parameters",
                "Reduce the number of parameters to the core logic."));
        }

        int conditions = findAll(CONDITION, code).size();
        if (conditions > CONDITION_THRESHOLD) {
            overfit.add(RiskIssue.aggregate("complex_conditions", Severity.MEDIUM, conditions, List.of(),
                conditions + " boolean connectives in conditions",
                "Simplify the conditions and focus on the core signal."));
        }

        ReportMetrics metrics = new ReportMetrics(
            source.split("\n", -1).length,
            parameters,
            distinctIndicators(code),
            conditions,
            detectVersion(source));

        AnalysisReport report = new AnalysisReport(
            RiskSection.of(RiskCategory.REPAINT, repaint),
            RiskSection.of(RiskCategory.OVERFIT, overfit),
            metrics,
            null);
        log.debug("Risk analysis: repaint {} ({}), overfit {} ({})",
            report.repainting().risk(), report.repainting().score(),
            report.overfitting().risk(), report.overfitting().score());
        return report;
    }

    // ========== Repainting ==========

    /**
     * Every pattern is checked against every line, so one line can produce
     * several issues. Issues come out in table order, then line order.
     */
    private static List<RiskIssue> repaintIssues(String source) {
        String[] lines = source.split("\n", -1);
        List<RiskIssue> issues = new ArrayList<>();
        for (RiskPattern pattern : REPAINT_PATTERNS) {
            for (int i = 0; i < lines.length; i++) {
                String line = lines[i];
                if (line.strip().startsWith("//")) {
                    continue;
                }
                if (pattern.matches(line)) {
                    issues.add(RiskIssue.atLine(pattern, i + 1, snippet(line)));
                }
            }
        }
        return issues;
    }

    private static String snippet(String line) {
        String trimmed = line.strip();
        return trimmed.length() > 100 ? trimmed.substring(0, 100) : trimmed;
    }

    // ========== Overfitting ==========

    static String stripComments(String source) {
        String code = LINE_COMMENT.matcher(source).replaceAll("");
        return BLOCK_COMMENT.matcher(code).replaceAll("");
    }

    private static List<String> suspiciousNumbers(String code) {
        List<String> result = new ArrayList<>();
        for (String text : findAll(MAGIC_NUMBER, code)) {
            double value = Double.parseDouble(text);
            if (!SAFE_NUMBERS.contains(value) && value > 3) {
                result.add(text);
            }
        }
        return result;
    }

    private static int distinctIndicators(String code) {
        Set<String> names = new TreeSet<>();
        Matcher m = INDICATOR.matcher(code);
        while (m.find()) {
            names.add(m.group(1));
        }
        return names.size();
    }

    private static int detectVersion(String source) {
        Matcher m = VERSION.matcher(source);
        if (m.find()) {
            return Integer.parseInt(m.group(1));
        }
        if (source.contains("request.security") || source.contains("ta.")) {
            return 5;
        }
        if (source.contains("security(")) {
            return 4;
        }
        return DEFAULT_VERSION;
    }

    private static List<String> findAll(Pattern pattern, String text) {
        List<String> found = new ArrayList<>();
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            found.add(m.group());
        }
        return found;
    }
}
