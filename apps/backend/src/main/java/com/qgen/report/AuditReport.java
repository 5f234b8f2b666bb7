package com.qgen.report;

import com.qgen.detector.Finding;

import java.time.Instant;
import java.util.List;

/**
 * Findings in canonical order with the derived risk score.
 *
 * @param contractId lower-case hex SHA-256 of the audited source text
 * @param timestamp  when the report was composed; not part of the canonical form
 */
public record AuditReport(String contractId,
                          List<Finding> findings,
                          int riskScore,
                          Instant timestamp) {

    public AuditReport {
        findings = List.copyOf(findings);
    }

    public AuditReport withFindings(List<Finding> replaced) {
        return new AuditReport(contractId, replaced, riskScore, timestamp);
    }
}
