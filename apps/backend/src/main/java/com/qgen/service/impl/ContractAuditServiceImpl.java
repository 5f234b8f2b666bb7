package com.qgen.service.impl;

import com.qgen.contract.parser.ContractParseException;
import com.qgen.ledger.ChainVerificationResult;
import com.qgen.ledger.CommitmentLedger;
import com.qgen.ledger.LedgerEntry;
import com.qgen.ledger.LedgerException;
import com.qgen.ledger.OperationKind;
import com.qgen.report.ReportCanonicalizer;
import com.qgen.service.AuditOutcome;
import com.qgen.service.ContractAnalyzer;
import com.qgen.service.ContractAuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class ContractAuditServiceImpl implements ContractAuditService {

    private final ContractAnalyzer analyzer;
    private final ReportCanonicalizer canonicalizer;
    private final CommitmentLedger ledger;

    @Override
    public AuditOutcome audit(String sourceText, OperationKind kind) throws ContractParseException, LedgerException {
        ContractAnalyzer.Analysis analysis = analyzer.analyze(sourceText);
        String canonical = canonicalizer.canonicalize(analysis.report());
        String reportHash = canonicalizer.reportHash(analysis.report());
        LedgerEntry entry = ledger.append(reportHash, kind);
        log.info("Audit committed kind={} contract={} findings={} risk={} seq={}", kind,
                analysis.report().contractId(), analysis.report().findings().size(),
                analysis.report().riskScore(), entry.sequence());
        return new AuditOutcome(analysis.report(), canonical, reportHash, entry, analysis.warnings());
    }

    @Override
    public ChainVerificationResult verifyLedger() throws LedgerException {
        return ledger.verifyChain();
    }
}
