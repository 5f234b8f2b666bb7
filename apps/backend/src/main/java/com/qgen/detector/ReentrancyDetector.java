package com.qgen.detector;

import com.qgen.contract.model.BranchModel;
import com.qgen.contract.model.CallOrdering;
import com.qgen.contract.model.ContractModel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Flags a branch that writes state after a fund transfer or external call touching the same state.
 * An external effect whose arguments carry no known state, followed by any write, is reported with
 * heuristic confidence. At most one finding per branch.
 */
@Component
public class ReentrancyDetector implements Detector {

    @Override
    public RuleId rule() {
        return RuleId.REENTRANCY;
    }

    @Override
    public List<Finding> detect(ContractModel model, AuditPolicy policy) {
        List<Finding> out = new ArrayList<>();
        for (BranchModel branch : model.branches()) {
            Finding f = inspect(branch, policy.severityOf(rule()));
            if (f != null) out.add(f);
        }
        return out;
    }

    private Finding inspect(BranchModel branch, Severity severity) {
        List<CallOrdering.Event> events = branch.ordering().events();
        Finding heuristic = null;
        for (int i = 0; i < events.size(); i++) {
            CallOrdering.Event effect = events.get(i);
            if (!effect.isExternalEffect()) continue;
            for (int j = i + 1; j < events.size(); j++) {
                CallOrdering.Event write = events.get(j);
                if (write.type() != CallOrdering.EventType.STATE_WRITE) continue;
                Set<String> shared = new TreeSet<>(write.domain());
                shared.retainAll(effect.domain());
                if (!shared.isEmpty()) {
                    return new Finding(rule(), severity, branch.name(),
                            "State write " + write.call() + " happens after " + effect.call()
                                    + " on shared state " + String.join(", ", shared)
                                    + "; the external effect observes state that is not yet settled",
                            Confidence.CERTAIN);
                }
                if (effect.domain().isEmpty() && heuristic == null) {
                    heuristic = new Finding(rule(), severity, branch.name(),
                            "State write " + write.call() + " happens after " + effect.call()
                                    + " whose state dependencies are unknown",
                            Confidence.HEURISTIC);
                }
            }
        }
        return heuristic;
    }
}
