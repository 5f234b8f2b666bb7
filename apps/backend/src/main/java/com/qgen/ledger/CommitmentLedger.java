package com.qgen.ledger;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only hash chain of audit commitments.
 *
 * <p>Appends are linearised by one lock per ledger instance; the cached head only advances after
 * the store accepted the new entry, so a failed append leaves the chain unchanged. When another
 * process won the sequence, the head is reloaded and the append retried.</p>
 */
@Slf4j
public class CommitmentLedger {

    @Getter
    private final String ledgerId;
    private final LedgerStore store;
    private final Clock clock;
    private final int maxAppendRetries;
    private final ReentrantLock lock = new ReentrantLock();

    private LedgerEntry head;
    private boolean headLoaded;

    public CommitmentLedger(String ledgerId, LedgerStore store, Clock clock, int maxAppendRetries) {
        this.ledgerId = ledgerId;
        this.store = store;
        this.clock = clock;
        this.maxAppendRetries = Math.max(0, maxAppendRetries);
    }

    public LedgerEntry append(String reportHash, OperationKind kind) throws LedgerException {
        return append(reportHash, kind, clock.instant());
    }

    public LedgerEntry append(String reportHash, OperationKind kind, Instant timestamp) throws LedgerException {
        lock.lock();
        try {
            if (!headLoaded) reloadHead();
            LedgerException conflict = null;
            for (int attempt = 0; attempt <= maxAppendRetries; attempt++) {
                LedgerEntry next = LedgerHasher.link(head, reportHash, kind, timestamp);
                try {
                    store.insert(ledgerId, next);
                } catch (LedgerException e) {
                    if (e.getReason() != LedgerException.Reason.CONCURRENT_APPEND_CONFLICT) throw e;
                    conflict = e;
                    log.warn("Append conflict ledger={} seq={} attempt={}", ledgerId, next.sequence(), attempt + 1);
                    reloadHead();
                    continue;
                }
                head = next;
                log.info("Ledger commit ledger={} seq={} kind={} tx={}",
                        ledgerId, next.sequence(), kind, next.transactionId());
                return next;
            }
            throw conflict;
        } finally {
            lock.unlock();
        }
    }

    /** Verifies the entries present when the call starts; later appends are not observed. */
    public ChainVerificationResult verifyChain() throws LedgerException {
        List<LedgerEntry> snapshot = store.load(ledgerId);
        ChainVerificationResult result = ChainVerifier.verify(ledgerId, snapshot);
        if (!result.valid()) {
            log.warn("Ledger {} broken at seq={} ({} break(s))", ledgerId, result.firstDivergentSequence(), result.breaks().size());
        }
        return result;
    }

    public List<LedgerEntry> entries() throws LedgerException {
        return store.load(ledgerId);
    }

    public String tailHash() throws LedgerException {
        lock.lock();
        try {
            if (!headLoaded) reloadHead();
            return head == null ? LedgerHasher.GENESIS : head.entryHash();
        } finally {
            lock.unlock();
        }
    }

    private void reloadHead() throws LedgerException {
        head = store.last(ledgerId).orElse(null);
        headLoaded = true;
    }
}
