package com.qgen.ledger;

/** What produced the committed report. */
public enum OperationKind {
    GENERATE("QUBIC-TX-"),
    SCAN("QUBIC-SCAN-TX-");

    private final String transactionPrefix;

    OperationKind(String transactionPrefix) {
        this.transactionPrefix = transactionPrefix;
    }

    public String transactionPrefix() {
        return transactionPrefix;
    }
}
