package com.qgen.service;

import com.qgen.ai.GenerationException;
import com.qgen.api.dto.BatchItem;
import com.qgen.api.dto.QgenRequest;
import com.qgen.api.dto.QgenResponse;
import com.qgen.contract.parser.ContractParseException;
import com.qgen.ledger.LedgerException;

/**
 * The dual-mode request flow: generate-then-audit or audit supplied code.
 */
public interface QgenRequestService {

    QgenResponse generate(QgenRequest request) throws GenerationException, ContractParseException, LedgerException;

    QgenResponse scan(QgenRequest request) throws ContractParseException, LedgerException;

    /** Never throws for a bad contract; the failure is reported in the item. */
    BatchItem scanOne(int index, String contractCode, String language, String clientRef) throws LedgerException;
}
