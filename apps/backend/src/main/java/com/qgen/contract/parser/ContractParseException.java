package com.qgen.contract.parser;

import lombok.Getter;

/**
 * Source text cannot be modelled. No report and no ledger entry are produced for it.
 */
@Getter
public class ContractParseException extends Exception {

    public enum Reason { MALFORMED_DISPATCH, UNTERMINATED_BLOCK }

    private final Reason reason;
    private final int line;

    public ContractParseException(Reason reason, int line, String message) {
        super(reason + " at line " + line + ": " + message);
        this.reason = reason;
        this.line = line;
    }
}
