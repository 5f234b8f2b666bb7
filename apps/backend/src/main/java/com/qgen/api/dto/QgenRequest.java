package com.qgen.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * 双模式请求：user_prompt（生成）与 contract_code（扫描）二选一
 */
public record QgenRequest(
        @JsonProperty("user_prompt")
        @Size(min = 10, max = 4000) String userPrompt,
        @JsonProperty("contract_code")
        @Size(min = 50, max = 50000) String contractCode,
        @JsonProperty("report_language")
        @Size(min = 2, max = 2) @Pattern(regexp = "[A-Za-z]{2}") String reportLanguage,
        @JsonProperty("client_ref_id")
        String clientRefId
) {
    public static final String DEFAULT_CLIENT_REF = "POC-HACKATHON-2025";

    /** 空白字符串视同未提供 */
    public boolean isGeneration() {
        return userPrompt != null && !userPrompt.isBlank();
    }

    public boolean isScan() {
        return contractCode != null && !contractCode.isBlank();
    }

    /** prompt with surrounding whitespace removed */
    public String prompt() {
        return userPrompt == null ? null : userPrompt.strip();
    }

    /** source as audited and hashed, surrounding whitespace removed */
    public String code() {
        return contractCode == null ? null : contractCode.strip();
    }

    public String language() {
        return reportLanguage == null ? "en" : reportLanguage.strip();
    }

    public String clientRef() {
        return clientRefId == null ? DEFAULT_CLIENT_REF : clientRefId;
    }
}
