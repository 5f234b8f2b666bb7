package com.qgen.ai;

import com.qgen.detector.Finding;

import java.util.List;

/**
 * Presentation view of a report. Only rationales differ from the canonical findings.
 *
 * @param translated false when the English text was kept, either by request or after a failed translation
 */
public record LocalizedReport(String language, List<Finding> findings, boolean translated) {

    public LocalizedReport {
        findings = List.copyOf(findings);
    }
}
