package com.qgen.contract.model;

import com.qgen.contract.ast.ContractUnit;

import java.util.ArrayList;
import java.util.List;

public record ContractModel(ContractUnit unit, List<BranchModel> branches) {

    public ContractModel {
        branches = List.copyOf(branches);
    }

    public List<BranchModel> branchesNamed(String name) {
        return branches.stream().filter(b -> b.name().equals(name)).toList();
    }

    /** Branch warnings plus one warning per statement the parser skipped. */
    public List<AnalysisWarning> warnings() {
        List<AnalysisWarning> all = new ArrayList<>();
        unit.notes().forEach(n -> all.add(new AnalysisWarning(null, n.line(), n.message())));
        branches.forEach(b -> all.addAll(b.warnings()));
        return all;
    }
}
