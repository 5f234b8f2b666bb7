package com.qgen.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 报告的展示视图；report_hash 始终对应英文规范化报告
 */
public record SecurityAudit(
        @JsonProperty("contract_id") String contractId,
        String language,
        boolean translated,
        @JsonProperty("risk_score") int riskScore,
        @JsonProperty("report_hash") String reportHash,
        List<FindingView> findings,
        List<String> warnings,
        AuditMeta meta
) {}
