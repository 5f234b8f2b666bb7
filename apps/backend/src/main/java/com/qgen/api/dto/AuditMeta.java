package com.qgen.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AuditMeta(
        @JsonProperty("client_ref_id") String clientRefId,
        @JsonProperty("code_hash") String codeHash,
        String mode,                 // GENERATION | SCANNING
        @JsonProperty("audit_timestamp") String auditTimestamp
) {}
