package com.qgen.contract.model;

import com.qgen.contract.ast.FunctionBranch;

import java.util.List;

/**
 * Analysis view of one dispatch branch.
 *
 * @param index position of the branch in the contract, stable across duplicate names
 */
public record BranchModel(FunctionBranch branch,
                          int index,
                          List<GuardedCall> calls,
                          List<ArithmeticOp> arithmeticOps,
                          CallOrdering ordering,
                          List<AnalysisWarning> warnings) {

    public BranchModel {
        calls = List.copyOf(calls);
        arithmeticOps = List.copyOf(arithmeticOps);
        warnings = List.copyOf(warnings);
    }

    public String name() {
        return branch.name();
    }

    /**
     * Branch-level fact over the given calls: unguarded if any call is, ambiguous if any call is
     * ambiguous, guarded otherwise (vacuously for no calls).
     */
    public static AuthorizationStatus aggregate(List<GuardedCall> calls) {
        AuthorizationStatus result = AuthorizationStatus.GUARDED;
        for (GuardedCall c : calls) {
            AuthorizationStatus s = c.authorization().status();
            if (s == AuthorizationStatus.UNGUARDED) return s;
            if (s == AuthorizationStatus.AMBIGUOUS) result = s;
        }
        return result;
    }
}
