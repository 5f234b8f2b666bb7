package com.qgen.ai;

import com.qgen.report.AuditReport;

/**
 * Renders report rationales in another language. Never touches rule, severity, branch or order.
 */
public interface ReportTranslator {

    String DEFAULT_LANGUAGE = "en";

    LocalizedReport translate(AuditReport report, String language);
}
