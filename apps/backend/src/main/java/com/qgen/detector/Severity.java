package com.qgen.detector;

import java.util.Locale;

/**
 * Declared from most to least severe; ordinal order is the report order.
 */
public enum Severity {
    CRITICAL, HIGH, MEDIUM, LOW;

    /** Lower-case name used in the canonical report. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
