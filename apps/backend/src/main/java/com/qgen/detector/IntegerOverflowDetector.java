package com.qgen.detector;

import com.qgen.contract.model.ArithmeticOp;
import com.qgen.contract.model.BranchModel;
import com.qgen.contract.model.ContractModel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * One finding per add/sub/mul that neither a range comparison nor a checked primitive guards.
 */
@Component
public class IntegerOverflowDetector implements Detector {

    @Override
    public RuleId rule() {
        return RuleId.INTEGER_OVERFLOW;
    }

    @Override
    public List<Finding> detect(ContractModel model, AuditPolicy policy) {
        List<Finding> out = new ArrayList<>();
        Severity severity = policy.severityOf(rule());
        for (BranchModel branch : model.branches()) {
            for (ArithmeticOp op : branch.arithmeticOps()) {
                if (op.isGuarded()) continue;
                String label = op.kind().label();
                if (op.literalOnly()) {
                    if (op.literalOverflow()) {
                        out.add(new Finding(rule(), severity, branch.name(),
                                "Constant " + label + " '" + op.expression() + "' exceeds the 64-bit integer range",
                                Confidence.CERTAIN));
                    }
                } else if (op.hasFixedWidthOperand()) {
                    out.add(new Finding(rule(), severity, branch.name(),
                            "Unchecked " + label + " '" + op.expression() + "' on a fixed-width integer can wrap around",
                            Confidence.CERTAIN));
                } else {
                    out.add(new Finding(rule(), severity, branch.name(),
                            "Unchecked " + label + " '" + op.expression() + "' on operands of unknown width may overflow",
                            Confidence.HEURISTIC));
                }
            }
        }
        return out;
    }
}
