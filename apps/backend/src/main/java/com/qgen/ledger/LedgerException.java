package com.qgen.ledger;

import lombok.Getter;

@Getter
public class LedgerException extends Exception {

    public enum Reason {
        /** another writer committed the same sequence first */
        CONCURRENT_APPEND_CONFLICT,
        STORAGE_UNAVAILABLE
    }

    private final Reason reason;

    public LedgerException(Reason reason, String message) {
        super(reason + ": " + message);
        this.reason = reason;
    }

    public LedgerException(Reason reason, String message, Throwable cause) {
        super(reason + ": " + message, cause);
        this.reason = reason;
    }
}
