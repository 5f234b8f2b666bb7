package com.qgen.detector;

public enum RuleId {
    ACCESS_CONTROL,
    INTEGER_OVERFLOW,
    REENTRANCY,
    OVERLAPPING_DISPATCH
}
