package com.qgen.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.qgen.ledger.LedgerEntry;

public record LedgerReceipt(
        long sequence,
        @JsonProperty("operation_kind") String operationKind,
        @JsonProperty("report_hash") String reportHash,
        @JsonProperty("prev_hash") String prevHash,
        @JsonProperty("entry_hash") String entryHash,
        String timestamp,
        @JsonProperty("transaction_id") String transactionId
) {
    public static LedgerReceipt of(LedgerEntry e) {
        return new LedgerReceipt(e.sequence(), e.kind().name(), e.reportHash(), e.prevHash(), e.entryHash(),
                e.timestamp().toString(), e.transactionId());
    }
}
