package com.decisionledger.audit;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Aggregate of a batch replay against one version.
 */
public record BulkReplayReport(
    @JsonProperty("function_id") String functionId,
    @JsonProperty("version") String version,
    @JsonProperty("total") int total,
    @JsonProperty("identical") int identical,
    @JsonProperty("regressions") int regressions,
    @JsonProperty("improvements") int improvements,
    @JsonProperty("neutral") int neutral,
    @JsonProperty("violations") int violations,
    @JsonProperty("unavailable") int unavailable,
    @JsonProperty("reports") List<DriftReport> reports
) {

    public static final String SAFE_TO_ACTIVATE = "SAFE TO ACTIVATE";
    public static final String REVIEW_REQUIRED = "REVIEW REQUIRED";

    private static final double REGRESSION_THRESHOLD = 0.05;

    public BulkReplayReport {
        reports = List.copyOf(reports);
    }

    public static BulkReplayReport of(String functionId, String version, int requested, List<DriftReport> reports) {
        int identical = 0;
        int regressions = 0;
        int improvements = 0;
        int neutral = 0;
        int violations = 0;
        for (DriftReport report : reports) {
            switch (report.classification()) {
                case IDENTICAL -> identical++;
                case REGRESSION -> regressions++;
                case IMPROVEMENT -> improvements++;
                case NEUTRAL -> neutral++;
                case VIOLATION -> violations++;
            }
        }
        return new BulkReplayReport(functionId, version, requested, identical, regressions, improvements, neutral,
            violations, requested - reports.size(), reports);
    }

    public int replayed() {
        return total - unavailable;
    }

    public double matchRate() {
        return replayed() == 0 ? 0.0 : (double) identical / replayed();
    }

    public double regressionRate() {
        return replayed() == 0 ? 0.0 : (double) regressions / replayed();
    }

    /** Release recommendation for the replayed version. */
    public String recommendation() {
        if (replayed() == 0 || violations > 0 || regressionRate() >= REGRESSION_THRESHOLD) {
            return REVIEW_REQUIRED;
        }
        return SAFE_TO_ACTIVATE;
    }
}
