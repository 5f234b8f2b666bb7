package com.qgen.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** 批量扫描中单个合约的结果；失败项只带 error */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchItem(
        int index,
        String status,              // success | error
        @JsonProperty("security_audit") SecurityAudit securityAudit,
        @JsonProperty("qubic_transaction_id") String transactionId,
        @JsonProperty("code_hash") String codeHash,
        String error
) {
    public static BatchItem failed(int index, String codeHash, String error) {
        return new BatchItem(index, "error", null, null, codeHash, error);
    }
}
