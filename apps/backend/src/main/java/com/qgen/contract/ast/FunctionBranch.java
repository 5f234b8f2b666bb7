package com.qgen.contract.ast;

import java.util.List;
import java.util.Set;

/**
 * One {@code if (in.functionName == "...")} arm of the entry function.
 */
public record FunctionBranch(String name, List<Statement> statements, Set<String> stateKeys, int line) {
    public FunctionBranch {
        statements = List.copyOf(statements);
        stateKeys = Set.copyOf(stateKeys);
    }
}
