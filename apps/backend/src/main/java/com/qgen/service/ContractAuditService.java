package com.qgen.service;

import com.qgen.contract.parser.ContractParseException;
import com.qgen.ledger.ChainVerificationResult;
import com.qgen.ledger.LedgerException;
import com.qgen.ledger.OperationKind;

public interface ContractAuditService {

    /**
     * Parses, analyzes, hashes the canonical report and commits it to the ledger. A parse failure
     * produces neither a report nor a ledger entry; a ledger failure fails the whole audit.
     */
    AuditOutcome audit(String sourceText, OperationKind kind) throws ContractParseException, LedgerException;

    ChainVerificationResult verifyLedger() throws LedgerException;
}
