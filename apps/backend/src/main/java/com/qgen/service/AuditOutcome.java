package com.qgen.service;

import com.qgen.contract.model.AnalysisWarning;
import com.qgen.ledger.LedgerEntry;
import com.qgen.report.AuditReport;

import java.util.List;

/**
 * Result of one committed audit.
 *
 * @param canonicalReport the {@code qgen-report/1} encoding that {@code reportHash} covers
 */
public record AuditOutcome(AuditReport report,
                           String canonicalReport,
                           String reportHash,
                           LedgerEntry ledgerEntry,
                           List<AnalysisWarning> warnings) {

    public AuditOutcome {
        warnings = List.copyOf(warnings);
    }
}
