package com.qgen.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record QgenResponse(
        String status,
        String mode,
        @JsonProperty("generated_code") String generatedCode,   // 仅生成模式
        @JsonProperty("security_audit") SecurityAudit securityAudit,
        @JsonProperty("qubic_transaction_id") String transactionId,
        @JsonProperty("code_hash") String codeHash,
        @JsonProperty("ledger_entry") LedgerReceipt ledgerEntry,
        @JsonProperty("duration_seconds") double durationSeconds
) {}
