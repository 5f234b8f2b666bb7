package com.qgen.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record BatchAuditRequest(
        @NotEmpty @Size(max = 20)
        List<@Size(min = 50, max = 50000) String> contracts,
        @JsonProperty("report_language")
        @Size(min = 2, max = 2) String reportLanguage,
        @JsonProperty("client_ref_id")
        String clientRefId
) {
    public String language() {
        return reportLanguage == null ? "en" : reportLanguage.strip();
    }

    public String clientRef() {
        return clientRefId == null ? QgenRequest.DEFAULT_CLIENT_REF : clientRefId;
    }
}
