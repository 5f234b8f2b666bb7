package com.qgen.detector;

import java.util.Objects;

/**
 * One detected weakness.
 *
 * @param branch    function-name literal of the dispatch branch, or the duplicated name for structural findings
 * @param rationale human-readable reason; never carries line numbers so the canonical report is stable
 */
public record Finding(RuleId rule,
                      Severity severity,
                      String branch,
                      String rationale,
                      Confidence confidence) {

    public Finding {
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(branch, "branch");
        Objects.requireNonNull(rationale, "rationale");
        Objects.requireNonNull(confidence, "confidence");
    }

    public Finding withRationale(String translated) {
        return new Finding(rule, severity, branch, translated, confidence);
    }
}
