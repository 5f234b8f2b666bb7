package com.qgen.service;

import com.qgen.contract.ast.ContractUnit;
import com.qgen.contract.model.AnalysisWarning;
import com.qgen.contract.model.ContractModel;
import com.qgen.contract.model.SemanticModelBuilder;
import com.qgen.contract.parser.ContractParseException;
import com.qgen.contract.parser.ContractParser;
import com.qgen.detector.AuditPolicy;
import com.qgen.detector.DetectorSet;
import com.qgen.detector.Finding;
import com.qgen.report.AuditReport;
import com.qgen.report.ReportCanonicalizer;
import com.qgen.report.ReportComposer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Source text to report, without touching the ledger. Safe to share between threads.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContractAnalyzer {

    private final ContractParser parser;
    private final SemanticModelBuilder modelBuilder;
    private final DetectorSet detectors;
    private final AuditPolicy policy;
    private final ReportComposer composer;
    private final Clock clock;

    public Analysis analyze(String sourceText) throws ContractParseException {
        ContractUnit unit = parser.parse(sourceText);
        ContractModel model = modelBuilder.build(unit);
        List<Finding> findings = detectors.run(model, policy);
        AuditReport report = composer.compose(ReportCanonicalizer.contractId(sourceText), findings, clock.instant());
        log.debug("Analyzed contract {}: branches={} findings={} risk={}",
                report.contractId(), model.branches().size(), findings.size(), report.riskScore());
        return new Analysis(report, model.warnings());
    }

    public record Analysis(AuditReport report, List<AnalysisWarning> warnings) {}
}
