package com.qgen.ledger;

import org.apache.commons.codec.digest.DigestUtils;

import java.time.Instant;

public final class LedgerHasher {
    private LedgerHasher() {}

    /** prev hash of the first entry */
    public static final String GENESIS = "0".repeat(64);

    /** 链式哈希：hash = SHA256(prev + reportHash + KIND + ISO-8601 instant) */
    public static String entryHash(String prevHash, String reportHash, OperationKind kind, Instant timestamp) {
        return DigestUtils.sha256Hex(prevHash + reportHash + kind.name() + timestamp.toString());
    }

    public static LedgerEntry link(LedgerEntry previous, String reportHash, OperationKind kind, Instant timestamp) {
        String prev = previous == null ? GENESIS : previous.entryHash();
        long seq = previous == null ? 1 : previous.sequence() + 1;
        return new LedgerEntry(seq, kind, reportHash, prev, entryHash(prev, reportHash, kind, timestamp), timestamp);
    }

    /** Recomputes the hash an entry should carry from its own stored fields. */
    public static String expectedHash(LedgerEntry entry) {
        return entryHash(entry.prevHash(), entry.reportHash(), entry.kind(), entry.timestamp());
    }
}
