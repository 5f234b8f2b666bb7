package com.qgen.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.qgen.detector.Finding;
import org.apache.commons.codec.digest.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical encoding {@code qgen-report/1} and the report hash.
 *
 * <p>Compact JSON with sorted keys: {@code {contractId, findings:[{branch, rationale, rule, severity}],
 * riskScore, version}}. Timestamp, confidence and translations are excluded, so equal findings for
 * the same source always hash the same.</p>
 */
public class ReportCanonicalizer {

    public static final String VERSION = "qgen-report/1";

    // 独立实例，不受 Spring 全局 Jackson 配置影响；键序交给 Jackson 排
    private final ObjectMapper mapper = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    public String canonicalize(AuditReport report) {
        List<Map<String, Object>> findings = report.findings().stream()
                .map(ReportCanonicalizer::findingFields)
                .toList();
        Map<String, Object> root = new HashMap<>();
        root.put("version", VERSION);
        root.put("contractId", report.contractId());
        root.put("findings", findings);
        root.put("riskScore", report.riskScore());
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("canonical report encoding failed", e);
        }
    }

    private static Map<String, Object> findingFields(Finding f) {
        Map<String, Object> n = new HashMap<>();
        n.put("rule", f.rule().name());
        n.put("severity", f.severity().label());
        n.put("branch", f.branch());
        n.put("rationale", f.rationale());
        return n;
    }

    public byte[] canonicalBytes(AuditReport report) {
        return canonicalize(report).getBytes(StandardCharsets.UTF_8);
    }

    /** lower-case hex SHA-256 of the canonical bytes */
    public String reportHash(AuditReport report) {
        return DigestUtils.sha256Hex(canonicalBytes(report));
    }

    public static String contractId(String sourceText) {
        return DigestUtils.sha256Hex(sourceText.getBytes(StandardCharsets.UTF_8));
    }
}
