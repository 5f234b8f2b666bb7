package com.qgen.ledger;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for ledger entries. Entries are only ever inserted, never updated.
 */
public interface LedgerStore {

    /**
     * Inserts the entry; fails with {@link LedgerException.Reason#CONCURRENT_APPEND_CONFLICT} when the
     * sequence is already taken or does not follow the stored head.
     */
    void insert(String ledgerId, LedgerEntry entry) throws LedgerException;

    /** All entries in sequence order, as a snapshot. */
    List<LedgerEntry> load(String ledgerId) throws LedgerException;

    Optional<LedgerEntry> last(String ledgerId) throws LedgerException;
}
