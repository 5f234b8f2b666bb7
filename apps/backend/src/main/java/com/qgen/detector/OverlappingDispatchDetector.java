package com.qgen.detector;

import com.qgen.contract.model.BranchModel;
import com.qgen.contract.model.ContractModel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Dispatch arms are not exclusive: every arm whose name matches runs. */
@Component
public class OverlappingDispatchDetector implements Detector {

    @Override
    public RuleId rule() {
        return RuleId.OVERLAPPING_DISPATCH;
    }

    @Override
    public List<Finding> detect(ContractModel model, AuditPolicy policy) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (BranchModel b : model.branches()) {
            counts.merge(b.name(), 1, Integer::sum);
        }
        List<Finding> out = new ArrayList<>();
        counts.forEach((name, n) -> {
            if (n > 1) {
                out.add(new Finding(rule(), policy.severityOf(rule()), name,
                        "Function name '" + name + "' is matched by " + n + " dispatch branches; all of them execute",
                        Confidence.CERTAIN));
            }
        });
        return out;
    }
}
