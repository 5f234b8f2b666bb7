package com.qgen.detector;

import com.qgen.ContractFixtures;
import com.qgen.contract.model.ContractModel;
import com.qgen.contract.model.SemanticModelBuilder;
import com.qgen.contract.parser.ContractParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.qgen.ContractFixtures.contract;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class AccessControlDetectorTest {

    private final AccessControlDetector detector = new AccessControlDetector();
    private final AuditPolicy policy = AuditPolicy.defaults();

    private static ContractModel model(String source) throws Exception {
        return new SemanticModelBuilder().build(new ContractParser().parse(source));
    }

    @Test
    void unprotectedBalanceDrainIsOneCriticalFinding() throws Exception {
        List<Finding> findings = detector.detect(model(ContractFixtures.load(ContractFixtures.MALICIOUS)), policy);

        assertEquals(1, findings.size());
        Finding f = findings.get(0);
        assertEquals(RuleId.ACCESS_CONTROL, f.rule());
        assertEquals(Severity.CRITICAL, f.severity());
        assertEquals("wipe_contract_funds", f.branch());
        assertEquals(Confidence.CERTAIN, f.confidence());
        assertThat(f.rationale()).contains("send_funds(in.sender, contract_balance)").contains("drained");
        assertThat(f.rationale()).doesNotContainPattern("line \\d");
    }

    @Test
    void votingContractHasNoAccessControlFinding() throws Exception {
        assertThat(detector.detect(model(ContractFixtures.load(ContractFixtures.VOTING)), policy)).isEmpty();
    }

    @Test
    void ownerGatedPayoutAndCallerFundedWithdrawAreNotFlagged() throws Exception {
        List<Finding> findings = detector.detect(model(ContractFixtures.load(ContractFixtures.VAULT)), policy);

        assertThat(findings).extracting(Finding::branch).containsExactly("setFee");
    }

    @Test
    void callerKeyedBalanceReadIsNotAnAuthorizationCheck() throws Exception {
        assertSingleCritical("""
                if (in.functionName == "drain") {
                    long long mine = load_long_long_state(in.sender);
                    if (mine >= 0) {
                        send_funds(in.sender, get_contract_balance());
                    }
                }
                """);
    }

    @Test
    void callerKeyedFlagDoesNotGuardOwnerTakeover() throws Exception {
        assertSingleCritical("""
                if (in.functionName == "claim") {
                    bool has_voted = load_bool_state(in.sender);
                    if (has_voted) {
                        save_long_long_state("owner", in.sender);
                    }
                }
                """);
    }

    @Test
    void senderComparedWithItsOwnParameterIsNotAnAuthorizationCheck() throws Exception {
        assertSingleCritical("""
                if (in.functionName == "drain") {
                    if (in.sender == get_long_long_from_params(in.params, 0)) {
                        send_funds(in.sender, get_contract_balance());
                    }
                }
                """);
    }

    @Test
    void senderComparedWithStoredOwnerGuards() throws Exception {
        assertThat(detector.detect(model(contract("""
                if (in.functionName == "drain") {
                    if (in.sender == load_long_long_state("owner")) {
                        send_funds(in.sender, get_contract_balance());
                    }
                }
                """)), policy)).isEmpty();
    }

    private void assertSingleCritical(String arms) throws Exception {
        List<Finding> findings = detector.detect(model(contract(arms)), policy);

        assertEquals(1, findings.size());
        assertEquals(Severity.CRITICAL, findings.get(0).severity());
        assertEquals(Confidence.CERTAIN, findings.get(0).confidence());
    }

    @Test
    void severalUnguardedCallsInOneBranchGiveOneFinding() throws Exception {
        List<Finding> findings = detector.detect(model(contract("""
                if (in.functionName == "takeover") {
                    save_long_long_state("owner", in.sender);
                    save_long_long_state("treasury_fee", 0);
                    send_funds(in.sender, 10);
                }
                """)), policy);

        assertEquals(1, findings.size());
        assertThat(findings.get(0).rationale())
                .contains("save_long_long_state(\"owner\", in.sender)")
                .contains("send_funds(in.sender, 10)");
    }

    @Test
    void ambiguousAuthorizationDowngradesConfidence() throws Exception {
        List<Finding> findings = detector.detect(model(contract("""
                if (in.functionName == "mint") {
                    if (is_owner(in.sender) || in.amount > 0) {
                        save_long_long_state("supply", 100);
                    }
                }
                """)), policy);

        assertEquals(1, findings.size());
        assertEquals(Confidence.HEURISTIC, findings.get(0).confidence());
    }

    @Test
    void nonSensitiveKeysAreNotPrivileged() throws Exception {
        assertThat(detector.detect(model(contract("""
                if (in.functionName == "note") { save_string_state("memo", "hi"); }
                """)), policy)).isEmpty();
    }

    @Test
    void configuredSensitiveKeysAndSeverityApply() throws Exception {
        AuditPolicy custom = new AuditPolicy(Map.of(RuleId.ACCESS_CONTROL, Severity.HIGH), null, List.of("memo"));

        List<Finding> findings = detector.detect(model(contract("""
                if (in.functionName == "note") { save_string_state("memo", "hi"); }
                """)), custom);

        assertEquals(1, findings.size());
        assertEquals(Severity.HIGH, findings.get(0).severity());
    }
}
