package com.qgen.contract.model;

import com.qgen.ContractFixtures;
import com.qgen.contract.ast.PrimitiveKind;
import com.qgen.contract.parser.ContractParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.qgen.ContractFixtures.contract;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SemanticModelBuilderTest {

    private final ContractParser parser = new ContractParser();
    private final SemanticModelBuilder builder = new SemanticModelBuilder();

    private BranchModel single(String arms) throws Exception {
        ContractModel model = builder.build(parser.parse(contract(arms)));
        assertEquals(1, model.branches().size());
        return model.branches().get(0);
    }

    private static GuardedCall call(BranchModel b, PrimitiveKind kind) {
        return b.calls().stream().filter(c -> c.kind() == kind).findFirst().orElseThrow();
    }

    @Test
    void transferWithoutCheckIsUnguardedAndBalanceFunded() throws Exception {
        ContractModel model = builder.build(parser.parse(ContractFixtures.load(ContractFixtures.MALICIOUS)));

        GuardedCall send = call(model.branches().get(0), PrimitiveKind.FUND_TRANSFER);
        assertEquals(AuthorizationStatus.UNGUARDED, send.authorization().status());
        assertTrue(send.balanceFunded());
        assertFalse(send.callerScoped());
    }

    @Test
    void callerKeyedStateDoesNotGuardTheVotingWrites() throws Exception {
        ContractModel model = builder.build(parser.parse(ContractFixtures.load(ContractFixtures.VOTING)));
        BranchModel vote = model.branchesNamed("vote").get(0);

        assertThat(vote.calls()).hasSize(2);
        assertThat(vote.calls()).allSatisfy(c ->
                assertEquals(AuthorizationStatus.UNGUARDED, c.authorization().status()));
        assertTrue(vote.calls().get(1).callerScoped());
        assertThat(vote.warnings()).isEmpty();
    }

    @Test
    void callerComparedWithStoredOwnerGuards() throws Exception {
        BranchModel b = single("""
                if (in.functionName == "drain") {
                    long long owner = load_long_long_state("owner");
                    if (in.sender == owner) {
                        send_funds(in.sender, get_contract_balance());
                    }
                }
                """);

        GuardedCall send = call(b, PrimitiveKind.FUND_TRANSFER);
        assertTrue(send.authorization().isGuarded());
        assertEquals(AuthorizationFact.Basis.AUTHORIZATION_PRIMITIVE, send.authorization().basis());
    }

    @Test
    void callerComparedWithRequestParameterDoesNotGuard() throws Exception {
        BranchModel b = single("""
                if (in.functionName == "drain") {
                    long long claimed = get_long_long_from_params(in.params, 0);
                    if (in.sender == claimed) {
                        send_funds(in.sender, get_contract_balance());
                    }
                }
                """);

        assertEquals(AuthorizationStatus.UNGUARDED, call(b, PrimitiveKind.FUND_TRANSFER).authorization().status());
    }

    @Test
    void rangeGuardFollowsComparisonDirection() throws Exception {
        BranchModel b = single("""
                if (in.functionName == "move") {
                    long long balance = load_long_long_state("balance");
                    long long amount = get_long_long_from_params(in.params, 0);
                    if (amount > 0) {
                        save_long_long_state("total", balance + amount);
                    }
                    if (balance >= amount) {
                        save_long_long_state("balance", balance - amount);
                    }
                }
                """);

        assertThat(b.arithmeticOps()).extracting(ArithmeticOp::guard)
                .containsExactly(ArithmeticOp.Guard.NONE, ArithmeticOp.Guard.RANGE_COMPARISON);
    }

    @Test
    void negatedCheckWithEarlyReturnGuardsTheRest() throws Exception {
        BranchModel b = single("""
                if (in.functionName == "drain") {
                    if (!is_owner(in.sender)) {
                        return out;
                    }
                    send_funds(in.sender, get_contract_balance());
                }
                """);

        GuardedCall send = call(b, PrimitiveKind.FUND_TRANSFER);
        assertTrue(send.authorization().isGuarded());
        assertEquals(AuthorizationFact.Basis.AUTHORIZATION_PRIMITIVE, send.authorization().basis());
    }

    @Test
    void callInsideElseOfPositiveCheckIsNotGuarded() throws Exception {
        BranchModel b = single("""
                if (in.functionName == "drain") {
                    if (is_owner(in.sender)) {
                        out.success = true;
                    } else {
                        send_funds(in.sender, 5);
                    }
                }
                """);

        assertEquals(AuthorizationStatus.UNGUARDED, call(b, PrimitiveKind.FUND_TRANSFER).authorization().status());
        assertThat(b.warnings()).isEmpty();
    }

    @Test
    void disjunctionWithAuthorizationIsAmbiguous() throws Exception {
        BranchModel b = single("""
                if (in.functionName == "mint") {
                    if (is_owner(in.sender) || in.amount > 0) {
                        save_long_long_state("supply", 100);
                    }
                }
                """);

        assertEquals(AuthorizationStatus.AMBIGUOUS, call(b, PrimitiveKind.STATE_WRITE).authorization().status());
        assertThat(b.warnings()).hasSize(1);
        assertThat(b.warnings().get(0).message()).contains("save_long_long_state(\"supply\", 100)");
    }

    @Test
    void conjunctionAndBooleanComparisonsImplyAuthorization() throws Exception {
        BranchModel b = single("""
                if (in.functionName == "mint") {
                    bool ok = is_owner(in.sender);
                    if (ok == true && in.amount > 0) {
                        save_long_long_state("supply", 100);
                    }
                    if (in.sender != load_state("owner")) {
                        return out;
                    }
                    save_long_long_state("fee", 1);
                }
                """);

        assertThat(b.calls()).hasSize(2);
        assertThat(b.calls()).allMatch(c -> c.authorization().isGuarded());
    }

    @Test
    void assertionPrimitiveGuardsFollowingStatements() throws Exception {
        BranchModel b = single("""
                if (in.functionName == "pause") {
                    save_bool_state("paused_before", false);
                    require_owner(in.sender);
                    save_bool_state("paused", true);
                }
                """);

        assertFalse(b.calls().get(0).authorization().isGuarded());
        assertTrue(b.calls().get(1).authorization().isGuarded());
    }

    @Test
    void arithmeticOpsCarryWidthsAndGuards() throws Exception {
        BranchModel b = single("""
                if (in.functionName == "math") {
                    long long a = get_long_long_from_params(in.params, 0);
                    long long b = load_long_long_state("total");
                    if (a < 1000) {
                        save_long_long_state("total", b + a);
                    }
                    save_long_long_state("x", safe_add(b, 1) * 2);
                    save_long_long_state("y", b - 1);
                    save_long_long_state("z", 9223372036854775807 + 1);
                    save_long_long_state("w", 2 * 3);
                    save_long_long_state("u", in.amount + in.fee);
                }
                """);

        List<ArithmeticOp> ops = b.arithmeticOps();
        assertThat(ops).extracting(ArithmeticOp::expression)
                .containsExactly("b + a", "safe_add(b, 1) * 2", "b - 1", "9223372036854775807 + 1", "2 * 3", "in.amount + in.fee");

        assertEquals(ArithmeticOp.Guard.RANGE_COMPARISON, ops.get(0).guard());
        assertEquals(ArithmeticOp.Guard.NONE, ops.get(1).guard());
        assertTrue(ops.get(1).hasFixedWidthOperand());
        assertEquals(ArithmeticOp.Guard.NONE, ops.get(2).guard());
        assertEquals(ArithmeticOp.OperandWidth.FIXED, ops.get(2).leftWidth());
        assertEquals(ArithmeticOp.OperandWidth.LITERAL, ops.get(2).rightWidth());

        assertTrue(ops.get(3).literalOnly());
        assertTrue(ops.get(3).literalOverflow());
        assertTrue(ops.get(4).literalOnly());
        assertFalse(ops.get(4).literalOverflow());

        assertEquals(ArithmeticOp.OperandWidth.UNKNOWN, ops.get(5).leftWidth());
        assertFalse(ops.get(5).hasFixedWidthOperand());
    }

    @Test
    void opsInsideCheckedPrimitivesAreGuarded() throws Exception {
        BranchModel b = single("""
                if (in.functionName == "add") {
                    long long v = load_long_long_state("v");
                    save_long_long_state("v", safe_add(v + 1, 2));
                }
                """);

        assertEquals(ArithmeticOp.Guard.CHECKED_PRIMITIVE, b.arithmeticOps().get(0).guard());
    }

    @Test
    void stringConcatenationIsNotArithmetic() throws Exception {
        BranchModel b = single("""
                if (in.functionName == "name") {
                    char* s = get_string_from_params(in.params, 0);
                    save_string_state("label", s + "!");
                }
                """);

        assertThat(b.arithmeticOps()).isEmpty();
    }

    @Test
    void orderingTracksTaintIntoTransferDomains() throws Exception {
        ContractModel model = builder.build(parser.parse(ContractFixtures.load(ContractFixtures.VAULT)));
        BranchModel withdraw = model.branchesNamed("withdraw").get(0);

        List<CallOrdering.Event> events = withdraw.ordering().events();
        assertThat(events).extracting(CallOrdering.Event::type)
                .containsExactly(CallOrdering.EventType.FUND_TRANSFER, CallOrdering.EventType.STATE_WRITE);
        assertThat(events.get(0).domain()).containsExactly("in.sender");
        assertThat(events.get(1).domain()).containsExactly("in.sender");

        GuardedCall send = call(withdraw, PrimitiveKind.FUND_TRANSFER);
        assertTrue(send.callerScoped());
        assertFalse(send.balanceFunded());
    }

    @Test
    void parseNotesSurfaceAsModelWarnings() throws Exception {
        ContractModel model = builder.build(parser.parse(contract("""
                if (in.functionName == "w") {
                    while (true) { send_funds(in.sender, 1); }
                }
                """)));

        assertThat(model.warnings()).hasSize(1);
        assertNull(model.warnings().get(0).branch());
    }

    @Test
    void emptyContractProducesEmptyModel() throws Exception {
        ContractModel model = builder.build(parser.parse(contract("")));
        assertThat(model.branches()).isEmpty();
        assertThat(model.warnings()).isEmpty();
    }
}
