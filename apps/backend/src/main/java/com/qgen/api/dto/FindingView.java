package com.qgen.api.dto;

import com.qgen.detector.Finding;

import java.util.Locale;

public record FindingView(
        String rule,
        String severity,
        String branch,
        String rationale,
        String confidence
) {
    public static FindingView of(Finding f) {
        return new FindingView(f.rule().name(), f.severity().label(), f.branch(), f.rationale(),
                f.confidence().name().toLowerCase(Locale.ROOT));
    }
}
