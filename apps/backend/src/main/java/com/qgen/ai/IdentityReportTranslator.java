package com.qgen.ai;

import com.qgen.report.AuditReport;

/** Keeps the English rationales. */
public class IdentityReportTranslator implements ReportTranslator {

    @Override
    public LocalizedReport translate(AuditReport report, String language) {
        return new LocalizedReport(DEFAULT_LANGUAGE, report.findings(), false);
    }
}
