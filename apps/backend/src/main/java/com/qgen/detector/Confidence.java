package com.qgen.detector;

public enum Confidence {
    /** the model proved the condition */
    CERTAIN,
    /** ambiguous authorization, unknown operand width or unknown call domain */
    HEURISTIC
}
