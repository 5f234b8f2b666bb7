package com.qgen.detector;

import com.qgen.contract.model.ContractModel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs every registered detector over one model and unions the results.
 */
@Slf4j
public class DetectorSet {

    private final List<Detector> detectors;

    public DetectorSet(List<Detector> detectors) {
        this.detectors = detectors.stream().sorted(Comparator.comparing(Detector::rule)).toList();
    }

    public static DetectorSet standard() {
        return new DetectorSet(List.of(
                new AccessControlDetector(),
                new IntegerOverflowDetector(),
                new ReentrancyDetector(),
                new OverlappingDispatchDetector()));
    }

    public List<Finding> run(ContractModel model, AuditPolicy policy) {
        List<Finding> all = new ArrayList<>();
        for (Detector d : detectors) {
            List<Finding> found = d.detect(model, policy);
            log.debug("Detector {} -> {} finding(s)", d.rule(), found.size());
            all.addAll(found);
        }
        return all;
    }

    public List<RuleId> rules() {
        return detectors.stream().map(Detector::rule).toList();
    }
}
