package com.qgen.mapper.model;

import lombok.Data;

@Data
public class LedgerRecord {
    private String ledgerId;
    private Long seq;
    private String operationKind; // "GENERATE" / "SCAN"
    private String reportHash;
    private String prevHash;
    private String entryHash;
    private String ts;            // ISO-8601 instant，原样参与哈希
}
