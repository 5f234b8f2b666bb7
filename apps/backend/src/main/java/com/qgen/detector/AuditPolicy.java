package com.qgen.detector;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Severity per rule, weight per severity and the state-key patterns treated as privileged.
 * Immutable; built from {@code qgen.audit.*}.
 */
public final class AuditPolicy {

    public static final List<String> DEFAULT_SENSITIVE_KEYS =
            List.of("owner", "admin", "balance", "fund", "supply", "paused", "fee", "treasury");

    private final Map<RuleId, Severity> severities;
    private final Map<Severity, Integer> weights;
    private final List<String> sensitiveKeys;

    public AuditPolicy(Map<RuleId, Severity> severities, Map<Severity, Integer> weights, List<String> sensitiveKeys) {
        EnumMap<RuleId, Severity> s = new EnumMap<>(defaultSeverities());
        if (severities != null) s.putAll(severities);
        EnumMap<Severity, Integer> w = new EnumMap<>(defaultWeights());
        if (weights != null) w.putAll(weights);
        this.severities = Map.copyOf(s);
        this.weights = Map.copyOf(w);
        this.sensitiveKeys = (sensitiveKeys == null ? DEFAULT_SENSITIVE_KEYS : sensitiveKeys).stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .toList();
    }

    public static AuditPolicy defaults() {
        return new AuditPolicy(null, null, null);
    }

    public static Map<RuleId, Severity> defaultSeverities() {
        return Map.of(
                RuleId.ACCESS_CONTROL, Severity.CRITICAL,
                RuleId.INTEGER_OVERFLOW, Severity.HIGH,
                RuleId.REENTRANCY, Severity.HIGH,
                RuleId.OVERLAPPING_DISPATCH, Severity.LOW);
    }

    public static Map<Severity, Integer> defaultWeights() {
        return Map.of(Severity.CRITICAL, 10, Severity.HIGH, 5, Severity.MEDIUM, 2, Severity.LOW, 1);
    }

    public Severity severityOf(RuleId rule) {
        return severities.get(rule);
    }

    public int weightOf(Severity severity) {
        return weights.get(severity);
    }

    /** A key is sensitive when it contains one of the configured patterns, case-insensitively. */
    public boolean isSensitiveKey(String key) {
        if (key == null) return false;
        String k = key.toLowerCase(Locale.ROOT);
        for (String pattern : sensitiveKeys) {
            if (k.contains(pattern)) return true;
        }
        return false;
    }

    public List<String> sensitiveKeys() {
        return sensitiveKeys;
    }
}
