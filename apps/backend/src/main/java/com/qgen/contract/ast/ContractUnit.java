package com.qgen.contract.ast;

import java.util.List;

/**
 * A parsed contract. Branches keep source order and are never merged, even when two arms match
 * the same function name.
 *
 * @param entryFunction name of the dispatch entry function
 * @param inputParam    name of its single input record parameter, e.g. {@code in}
 * @param notes         constructs the parser skipped
 */
public record ContractUnit(String source,
                           String entryFunction,
                           String inputParam,
                           List<FunctionBranch> branches,
                           List<ParseNote> notes) {
    public ContractUnit {
        branches = List.copyOf(branches);
        notes = List.copyOf(notes);
    }

    /** Path that identifies the caller, e.g. {@code in.sender}. */
    public String callerPath() {
        return inputParam + ".sender";
    }

    public record ParseNote(int line, String message) {
    }
}
