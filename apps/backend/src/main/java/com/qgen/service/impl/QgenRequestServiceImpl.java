package com.qgen.service.impl;

import com.qgen.ai.ContractSourceGenerator;
import com.qgen.ai.GeneratedContract;
import com.qgen.ai.GenerationException;
import com.qgen.ai.LocalizedReport;
import com.qgen.ai.ReportTranslator;
import com.qgen.api.dto.AuditMeta;
import com.qgen.api.dto.BatchItem;
import com.qgen.api.dto.FindingView;
import com.qgen.api.dto.LedgerReceipt;
import com.qgen.api.dto.QgenRequest;
import com.qgen.api.dto.QgenResponse;
import com.qgen.api.dto.SecurityAudit;
import com.qgen.contract.model.AnalysisWarning;
import com.qgen.contract.parser.ContractParseException;
import com.qgen.ledger.LedgerException;
import com.qgen.ledger.OperationKind;
import com.qgen.report.ReportCanonicalizer;
import com.qgen.service.AuditOutcome;
import com.qgen.service.ContractAuditService;
import com.qgen.service.QgenRequestService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Slf4j
@Service
@RequiredArgsConstructor
public class QgenRequestServiceImpl implements QgenRequestService {

    static final String MODE_GENERATION = "GENERATION";
    static final String MODE_SCANNING = "SCANNING";

    private final ContractAuditService auditService;
    private final ContractSourceGenerator generator;
    private final ReportTranslator translator;
    private final Clock clock;

    @Override
    public QgenResponse generate(QgenRequest request) throws GenerationException, ContractParseException, LedgerException {
        long start = clock.millis();
        String prompt = request.prompt();
        log.info("MODE: GENERATION prompt={} chars ref={}", prompt.length(), request.clientRef());
        GeneratedContract generated = generator.generate(prompt);
        AuditOutcome outcome = auditService.audit(generated.code(), OperationKind.GENERATE);
        String codeHash = ReportCanonicalizer.contractId(generated.code());
        return new QgenResponse("success", MODE_GENERATION, generated.code(),
                view(outcome, request.language(), request.clientRef(), codeHash, MODE_GENERATION),
                outcome.ledgerEntry().transactionId(), codeHash, LedgerReceipt.of(outcome.ledgerEntry()),
                seconds(start));
    }

    @Override
    public QgenResponse scan(QgenRequest request) throws ContractParseException, LedgerException {
        long start = clock.millis();
        String code = request.code();
        log.info("MODE: SCANNING code={} chars lang={} ref={}", code.length(), request.language(), request.clientRef());
        AuditOutcome outcome = auditService.audit(code, OperationKind.SCAN);
        String codeHash = ReportCanonicalizer.contractId(code);
        return new QgenResponse("success", MODE_SCANNING, null,
                view(outcome, request.language(), request.clientRef(), codeHash, MODE_SCANNING),
                outcome.ledgerEntry().transactionId(), codeHash, LedgerReceipt.of(outcome.ledgerEntry()),
                seconds(start));
    }

    @Override
    public BatchItem scanOne(int index, String source, String language, String clientRef) throws LedgerException {
        String contractCode = source.strip();
        String codeHash = ReportCanonicalizer.contractId(contractCode);
        try {
            AuditOutcome outcome = auditService.audit(contractCode, OperationKind.SCAN);
            return new BatchItem(index, "success", view(outcome, language, clientRef, codeHash, MODE_SCANNING),
                    outcome.ledgerEntry().transactionId(), codeHash, null);
        } catch (ContractParseException e) {
            log.warn("Batch item {} rejected: {}", index, e.getMessage());
            return BatchItem.failed(index, codeHash, e.getMessage());
        }
    }

    private SecurityAudit view(AuditOutcome outcome, String language, String clientRef, String codeHash, String mode) {
        LocalizedReport localized = translator.translate(outcome.report(), language);
        return new SecurityAudit(
                outcome.report().contractId(),
                localized.language(),
                localized.translated(),
                outcome.report().riskScore(),
                outcome.reportHash(),
                localized.findings().stream().map(FindingView::of).toList(),
                outcome.warnings().stream().map(QgenRequestServiceImpl::describe).toList(),
                new AuditMeta(clientRef, codeHash, mode, outcome.report().timestamp().toString()));
    }

    private static String describe(AnalysisWarning w) {
        String where = w.branch() == null ? "line " + w.line() : w.branch() + " (line " + w.line() + ")";
        return where + ": " + w.message();
    }

    private double seconds(long startMillis) {
        return Math.round((clock.millis() - startMillis) / 10.0) / 100.0;
    }
}
