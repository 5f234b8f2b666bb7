package com.qgen.config;

import com.qgen.contract.ast.PrimitiveKind;
import com.qgen.contract.parser.PrimitiveCatalog;
import com.qgen.detector.AuditPolicy;
import com.qgen.detector.RuleId;
import com.qgen.detector.Severity;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "qgen.audit.severities.REENTRANCY=CRITICAL",
        "qgen.audit.weights.LOW=3",
        "qgen.audit.primitives.FUND_TRANSFER=payout,disburse"
})
class AuditPropertiesTest {

    @Autowired
    private AuditProperties props;

    @Autowired
    private AuditPolicy policy;

    @Autowired
    private PrimitiveCatalog catalog;

    @Autowired
    private LedgerProperties ledgerProperties;

    @Test
    void overridesBindIntoThePolicy() {
        assertEquals(Severity.CRITICAL, policy.severityOf(RuleId.REENTRANCY));
        assertEquals(Severity.CRITICAL, policy.severityOf(RuleId.ACCESS_CONTROL));
        assertEquals(3, policy.weightOf(Severity.LOW));
        assertEquals(5, policy.weightOf(Severity.HIGH));
        assertTrue(policy.isSensitiveKey("treasury_wallet"));
        assertFalse(policy.isSensitiveKey("proposal_text"));
    }

    @Test
    void extraPrimitivesAreRegistered() {
        assertEquals(2, props.getPrimitives().get(PrimitiveKind.FUND_TRANSFER).size());
        assertEquals(PrimitiveKind.FUND_TRANSFER, catalog.kindOf("disburse"));
        assertEquals(PrimitiveKind.FUND_TRANSFER, catalog.kindOf("send_funds"));
        assertEquals(PrimitiveKind.UNKNOWN, catalog.kindOf("nope"));
    }

    @Test
    void ledgerDefaults() {
        assertEquals("in-memory", ledgerProperties.getStorage());
        assertEquals("default", ledgerProperties.getName());
        assertEquals(3, ledgerProperties.getMaxAppendRetries());
    }
}
