package com.qgen.config;

import com.qgen.contract.ast.PrimitiveKind;
import com.qgen.detector.AuditPolicy;
import com.qgen.detector.RuleId;
import com.qgen.detector.Severity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "qgen.audit")
public class AuditProperties {
    /** 覆盖规则默认严重级别，如 REENTRANCY: critical */
    private Map<RuleId, Severity> severities = new EnumMap<>(RuleId.class);
    /** 风险分权重，缺省 critical 10 / high 5 / medium 2 / low 1 */
    private Map<Severity, Integer> weights = new EnumMap<>(Severity.class);
    /** 视为特权状态的键（子串匹配，不区分大小写） */
    private List<String> sensitiveKeys = new ArrayList<>(AuditPolicy.DEFAULT_SENSITIVE_KEYS);
    /** 追加到内置原语表的函数名 */
    private Map<PrimitiveKind, List<String>> primitives = new EnumMap<>(PrimitiveKind.class);

    public AuditPolicy toPolicy() {
        return new AuditPolicy(severities, weights, sensitiveKeys);
    }
}
