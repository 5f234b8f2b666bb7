package com.qgen.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(name = "qgen.ledger.storage", havingValue = "in-memory", matchIfMissing = true)
@Slf4j
public class InMemoryLedgerStore implements LedgerStore {

    private final Map<String, List<LedgerEntry>> ledgers = new ConcurrentHashMap<>();

    @Override
    public void insert(String ledgerId, LedgerEntry entry) throws LedgerException {
        List<LedgerEntry> entries = ledgers.computeIfAbsent(ledgerId, k -> new ArrayList<>());
        synchronized (entries) {
            if (entry.sequence() != entries.size() + 1L) {
                throw new LedgerException(LedgerException.Reason.CONCURRENT_APPEND_CONFLICT,
                        "sequence " + entry.sequence() + " does not follow head " + entries.size());
            }
            entries.add(entry);
        }
        log.debug("Stored ledger entry ledger={} seq={}", ledgerId, entry.sequence());
    }

    @Override
    public List<LedgerEntry> load(String ledgerId) {
        List<LedgerEntry> entries = ledgers.get(ledgerId);
        if (entries == null) return List.of();
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    @Override
    public Optional<LedgerEntry> last(String ledgerId) {
        List<LedgerEntry> entries = ledgers.get(ledgerId);
        if (entries == null) return Optional.empty();
        synchronized (entries) {
            return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
        }
    }
}
