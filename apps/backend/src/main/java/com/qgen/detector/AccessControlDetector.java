package com.qgen.detector;

import com.qgen.contract.ast.PrimitiveKind;
import com.qgen.contract.model.AuthorizationStatus;
import com.qgen.contract.model.BranchModel;
import com.qgen.contract.model.ContractModel;
import com.qgen.contract.model.GuardedCall;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Flags branches in which a privileged call is reachable without a dominating authorization check.
 *
 * <p>Privileged: fund transfers not funded solely from the caller's own state, and writes to a
 * sensitive state key that is not keyed by the caller.</p>
 */
@Component
public class AccessControlDetector implements Detector {

    @Override
    public RuleId rule() {
        return RuleId.ACCESS_CONTROL;
    }

    @Override
    public List<Finding> detect(ContractModel model, AuditPolicy policy) {
        List<Finding> out = new ArrayList<>();
        for (BranchModel branch : model.branches()) {
            List<GuardedCall> exposed = branch.calls().stream()
                    .filter(c -> isPrivileged(c, policy))
                    .filter(c -> !c.authorization().isGuarded())
                    .toList();
            if (exposed.isEmpty()) continue;

            AuthorizationStatus status = BranchModel.aggregate(exposed);
            Confidence confidence = status == AuthorizationStatus.AMBIGUOUS ? Confidence.HEURISTIC : Confidence.CERTAIN;
            out.add(new Finding(rule(), policy.severityOf(rule()), branch.name(), rationale(exposed, status), confidence));
        }
        return out;
    }

    static boolean isPrivileged(GuardedCall call, AuditPolicy policy) {
        if (call.callerScoped()) return false;
        if (call.kind() == PrimitiveKind.FUND_TRANSFER) return true;
        if (call.kind() == PrimitiveKind.STATE_WRITE) {
            return call.domain().stream().anyMatch(policy::isSensitiveKey);
        }
        return false;
    }

    private static String rationale(List<GuardedCall> exposed, AuthorizationStatus status) {
        Set<String> rendered = new LinkedHashSet<>();
        exposed.forEach(c -> rendered.add(c.render()));
        StringBuilder sb = new StringBuilder();
        sb.append(status == AuthorizationStatus.AMBIGUOUS
                ? "Privileged operation guarded only by an inconclusive authorization condition: "
                : "Privileged operation reachable by any caller without an authorization check: ");
        sb.append(String.join("; ", rendered));
        if (exposed.stream().anyMatch(c -> c.kind() == PrimitiveKind.FUND_TRANSFER && c.balanceFunded())) {
            sb.append(". The transferred amount is derived from the contract balance, so the balance can be drained");
        }
        return sb.toString();
    }
}
