package com.qgen.report;

import com.qgen.detector.AuditPolicy;
import com.qgen.detector.Finding;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Orders findings and scores the report.
 *
 * <p>Order: severity (critical first), branch name, rule id, rationale. The order is total, so the
 * detector iteration order never leaks into the report.</p>
 */
public class ReportComposer {

    public static final int MAX_RISK_SCORE = 100;

    static final Comparator<Finding> CANONICAL_ORDER = Comparator
            .comparing(Finding::severity)
            .thenComparing(Finding::branch)
            .thenComparing(Finding::rule)
            .thenComparing(Finding::rationale)
            .thenComparing(Finding::confidence);

    private final AuditPolicy policy;

    public ReportComposer(AuditPolicy policy) {
        this.policy = policy;
    }

    public AuditReport compose(String contractId, List<Finding> findings, Instant timestamp) {
        List<Finding> ordered = findings.stream().sorted(CANONICAL_ORDER).toList();
        return new AuditReport(contractId, ordered, riskScore(ordered), timestamp);
    }

    public int riskScore(List<Finding> findings) {
        int sum = 0;
        for (Finding f : findings) {
            sum += policy.weightOf(f.severity());
            if (sum >= MAX_RISK_SCORE) return MAX_RISK_SCORE;
        }
        return sum;
    }
}
