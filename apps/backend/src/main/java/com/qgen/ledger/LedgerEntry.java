package com.qgen.ledger;

import java.time.Instant;
import java.util.Locale;

/**
 * One immutable commitment.
 *
 * @param sequence 1-based position in the chain
 * @param prevHash entry hash of the predecessor, {@link LedgerHasher#GENESIS} for the first entry
 */
public record LedgerEntry(long sequence,
                          OperationKind kind,
                          String reportHash,
                          String prevHash,
                          String entryHash,
                          Instant timestamp) {

    /** e.g. {@code QUBIC-SCAN-TX-3F9A0C...}: kind prefix plus the first 16 hex chars of the entry hash. */
    public String transactionId() {
        return kind.transactionPrefix() + entryHash.substring(0, 16).toUpperCase(Locale.ROOT);
    }
}
