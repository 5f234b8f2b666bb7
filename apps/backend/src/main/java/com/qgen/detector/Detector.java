package com.qgen.detector;

import com.qgen.contract.model.ContractModel;

import java.util.List;

/**
 * A pure rule over the semantic model. Implementations hold no per-audit state and never throw
 * for a model built from a successfully parsed contract.
 */
public interface Detector {

    RuleId rule();

    List<Finding> detect(ContractModel model, AuditPolicy policy);
}
