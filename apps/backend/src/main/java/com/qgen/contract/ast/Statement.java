package com.qgen.contract.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Statement tree of a dispatch branch. Branch bodies contain no loops, so a tagged tree of these
 * four shapes is enough for dominance checks.
 */
public sealed interface Statement permits Statement.Call, Statement.Assignment, Statement.Conditional, Statement.Return {

    int line();

    /** Expressions evaluated directly by this statement, not by nested statements. */
    List<Expr> expressions();

    /** Nested statements, in source order. */
    default List<Statement> children() {
        return List.of();
    }

    /** A primitive invoked for its effect, e.g. {@code send_funds(in.sender, amount);}. */
    record Call(Expr.Invocation invocation, int line) implements Statement {
        public PrimitiveKind kind() {
            return invocation.kind();
        }

        public List<Expr> args() {
            return invocation.args();
        }

        @Override
        public List<Expr> expressions() {
            return List.of(invocation);
        }
    }

    /**
     * Declaration or assignment. {@code declaredType} is null for plain assignments,
     * {@code value} is null for bare declarations. {@code operator} is {@code =} or a compound
     * operator such as {@code +=}; {@code x++} is recorded as {@code x += 1}.
     */
    record Assignment(String declaredType, String target, String operator, Expr value, int line) implements Statement {
        public boolean isCompound() {
            return !"=".equals(operator);
        }

        @Override
        public List<Expr> expressions() {
            return value == null ? List.of() : List.of(value);
        }
    }

    record Conditional(Expr condition, List<Statement> thenBranch, List<Statement> elseBranch, int line) implements Statement {
        public Conditional {
            thenBranch = List.copyOf(thenBranch);
            elseBranch = List.copyOf(elseBranch);
        }

        @Override
        public List<Expr> expressions() {
            return List.of(condition);
        }

        @Override
        public List<Statement> children() {
            List<Statement> all = new ArrayList<>(thenBranch);
            all.addAll(elseBranch);
            return all;
        }
    }

    record Return(Expr value, int line) implements Statement {
        @Override
        public List<Expr> expressions() {
            return value == null ? List.of() : List.of(value);
        }
    }
}
