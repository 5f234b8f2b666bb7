package com.qgen.ledger;

import com.qgen.mapper.LedgerMapper;
import com.qgen.mapper.model.LedgerRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * MyBatis-backed store. The primary key (ledger_id, seq) turns a lost race into a duplicate key.
 */
@Component
@ConditionalOnProperty(name = "qgen.ledger.storage", havingValue = "database")
@RequiredArgsConstructor
@Slf4j
public class DatabaseLedgerStore implements LedgerStore {

    private final LedgerMapper ledgerMapper;

    @Override
    public void insert(String ledgerId, LedgerEntry entry) throws LedgerException {
        try {
            ledgerMapper.insertEntry(toRecord(ledgerId, entry));
        } catch (DuplicateKeyException e) {
            throw new LedgerException(LedgerException.Reason.CONCURRENT_APPEND_CONFLICT,
                    "sequence " + entry.sequence() + " already committed", e);
        } catch (DataAccessException e) {
            log.error("Ledger insert failed ledger={} seq={}", ledgerId, entry.sequence(), e);
            throw new LedgerException(LedgerException.Reason.STORAGE_UNAVAILABLE, "insert failed", e);
        }
    }

    @Override
    public List<LedgerEntry> load(String ledgerId) throws LedgerException {
        try {
            return ledgerMapper.selectChain(ledgerId).stream().map(DatabaseLedgerStore::toEntry).toList();
        } catch (DataAccessException e) {
            throw new LedgerException(LedgerException.Reason.STORAGE_UNAVAILABLE, "load failed", e);
        }
    }

    @Override
    public Optional<LedgerEntry> last(String ledgerId) throws LedgerException {
        try {
            return Optional.ofNullable(ledgerMapper.selectHead(ledgerId)).map(DatabaseLedgerStore::toEntry);
        } catch (DataAccessException e) {
            throw new LedgerException(LedgerException.Reason.STORAGE_UNAVAILABLE, "head lookup failed", e);
        }
    }

    static LedgerRecord toRecord(String ledgerId, LedgerEntry e) {
        LedgerRecord r = new LedgerRecord();
        r.setLedgerId(ledgerId);
        r.setSeq(e.sequence());
        r.setOperationKind(e.kind().name());
        r.setReportHash(e.reportHash());
        r.setPrevHash(e.prevHash());
        r.setEntryHash(e.entryHash());
        r.setTs(e.timestamp().toString());
        return r;
    }

    static LedgerEntry toEntry(LedgerRecord r) {
        return new LedgerEntry(r.getSeq(), OperationKind.valueOf(r.getOperationKind()),
                r.getReportHash(), r.getPrevHash(), r.getEntryHash(), Instant.parse(r.getTs()));
    }
}
