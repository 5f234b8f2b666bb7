package com.qgen.service.impl;

import com.qgen.ai.ContractSourceGenerator;
import com.qgen.ai.GeneratedContract;
import com.qgen.ai.GenerationException;
import com.qgen.ai.IdentityReportTranslator;
import com.qgen.api.dto.BatchItem;
import com.qgen.api.dto.QgenRequest;
import com.qgen.api.dto.QgenResponse;
import com.qgen.contract.model.AnalysisWarning;
import com.qgen.contract.parser.ContractParseException;
import com.qgen.detector.Confidence;
import com.qgen.detector.Finding;
import com.qgen.detector.RuleId;
import com.qgen.detector.Severity;
import com.qgen.ledger.LedgerEntry;
import com.qgen.ledger.LedgerHasher;
import com.qgen.ledger.OperationKind;
import com.qgen.report.AuditReport;
import com.qgen.report.ReportCanonicalizer;
import com.qgen.service.AuditOutcome;
import com.qgen.service.ContractAuditService;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class QgenRequestServiceImplTest {

    private static final Instant NOW = Instant.parse("2025-06-01T08:00:00Z");
    private static final String CODE = "outputStruct main(inputStruct in) { outputStruct out; return out; }";

    private final ContractAuditService auditService = mock(ContractAuditService.class);
    private final ContractSourceGenerator generator = mock(ContractSourceGenerator.class);
    private final QgenRequestServiceImpl service = new QgenRequestServiceImpl(auditService, generator,
            new IdentityReportTranslator(), Clock.fixed(NOW, ZoneOffset.UTC));

    private static AuditOutcome outcome(OperationKind kind) {
        AuditReport report = new AuditReport("cid", List.of(
                new Finding(RuleId.ACCESS_CONTROL, Severity.CRITICAL, "setFee", "unguarded", Confidence.CERTAIN)), 10, NOW);
        LedgerEntry entry = LedgerHasher.link(null, "r".repeat(64), kind, NOW);
        return new AuditOutcome(report, "{}", "r".repeat(64), entry,
                List.of(new AnalysisWarning("setFee", 4, "ambiguous")));
    }

    @Test
    void scanReturnsAuditAndLedgerReceipt() throws Exception {
        when(auditService.audit(CODE, OperationKind.SCAN)).thenReturn(outcome(OperationKind.SCAN));

        QgenResponse r = service.scan(new QgenRequest(null, CODE, "en", "ref-1"));

        assertEquals("success", r.status());
        assertEquals("SCANNING", r.mode());
        assertNull(r.generatedCode());
        assertThat(r.transactionId()).startsWith("QUBIC-SCAN-TX-");
        assertEquals(r.transactionId(), r.ledgerEntry().transactionId());
        assertEquals("ref-1", r.securityAudit().meta().clientRefId());
        assertEquals("critical", r.securityAudit().findings().get(0).severity());
        assertEquals(List.of("setFee (line 4): ambiguous"), r.securityAudit().warnings());
        assertEquals(0.0, r.durationSeconds());
    }

    @Test
    void scanAuditsAndHashesTheStrippedSource() throws Exception {
        when(auditService.audit(CODE, OperationKind.SCAN)).thenReturn(outcome(OperationKind.SCAN));

        QgenResponse r = service.scan(new QgenRequest(null, "\n\t  " + CODE + "  \n", "en", "ref-1"));

        verify(auditService).audit(CODE, OperationKind.SCAN);
        assertEquals(ReportCanonicalizer.contractId(CODE), r.codeHash());
        assertEquals(r.codeHash(), r.securityAudit().meta().codeHash());
    }

    @Test
    void generatePassesTheStrippedPrompt() throws Exception {
        when(generator.generate("make a vault")).thenReturn(new GeneratedContract(CODE, 1));
        when(auditService.audit(CODE, OperationKind.GENERATE)).thenReturn(outcome(OperationKind.GENERATE));

        service.generate(new QgenRequest("   make a vault\n", null, null, null));

        verify(generator).generate("make a vault");
    }

    @Test
    void whitespaceOnlyPromptDoesNotSelectGeneration() {
        QgenRequest request = new QgenRequest("            ", CODE, null, null);

        assertFalse(request.isGeneration());
        assertTrue(request.isScan());
    }

    @Test
    void generateAuditsTheGeneratedCode() throws Exception {
        when(generator.generate("make a vault")).thenReturn(new GeneratedContract(CODE, 1));
        when(auditService.audit(CODE, OperationKind.GENERATE)).thenReturn(outcome(OperationKind.GENERATE));

        QgenResponse r = service.generate(new QgenRequest("make a vault", null, null, null));

        assertEquals("GENERATION", r.mode());
        assertEquals(CODE, r.generatedCode());
        assertThat(r.transactionId()).startsWith("QUBIC-TX-");
        assertEquals(QgenRequest.DEFAULT_CLIENT_REF, r.securityAudit().meta().clientRefId());
    }

    @Test
    void generationFailureSkipsTheAudit() throws Exception {
        when(generator.generate(anyString()))
                .thenThrow(new GenerationException(GenerationException.Reason.NO_CODE, "nothing"));

        assertThrows(GenerationException.class,
                () -> service.generate(new QgenRequest("make a vault", null, null, null)));
        verifyNoInteractions(auditService);
    }

    @Test
    void batchItemCarriesParseErrors() throws Exception {
        when(auditService.audit(eq("bad"), eq(OperationKind.SCAN)))
                .thenThrow(new ContractParseException(ContractParseException.Reason.MALFORMED_DISPATCH, 1, "no entry"));

        BatchItem item = service.scanOne(3, "bad", "en", "ref");

        assertEquals(3, item.index());
        assertEquals("error", item.status());
        assertNull(item.securityAudit());
        assertThat(item.error()).contains("no entry");
    }
}
