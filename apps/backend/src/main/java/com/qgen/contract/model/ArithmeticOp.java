package com.qgen.contract.model;

/**
 * One add/sub/mul occurrence inside a branch.
 *
 * @param expression       rendered expression, e.g. {@code current_votes + 1}
 * @param literalOnly      both operands are compile-time constants
 * @param literalOverflow  constant-folded result does not fit a signed 64-bit integer
 */
public record ArithmeticOp(Kind kind,
                           String expression,
                           OperandWidth leftWidth,
                           OperandWidth rightWidth,
                           boolean literalOnly,
                           boolean literalOverflow,
                           Guard guard,
                           int line) {

    public enum Kind {
        ADD("addition"), SUB("subtraction"), MUL("multiplication");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }

        public static Kind of(String op) {
            switch (op) {
                case "+":
                case "+=":
                    return ADD;
                case "-":
                case "-=":
                    return SUB;
                case "*":
                case "*=":
                    return MUL;
                default:
                    return null;
            }
        }
    }

    public enum OperandWidth { FIXED, LITERAL, NON_INTEGER, UNKNOWN }

    public enum Guard { NONE, RANGE_COMPARISON, CHECKED_PRIMITIVE }

    public boolean isGuarded() {
        return guard != Guard.NONE;
    }

    /** At least one operand is a known fixed-width integer. */
    public boolean hasFixedWidthOperand() {
        return leftWidth == OperandWidth.FIXED || rightWidth == OperandWidth.FIXED;
    }
}
