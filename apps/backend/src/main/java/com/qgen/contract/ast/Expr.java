package com.qgen.contract.ast;

import java.util.List;
import java.util.function.Consumer;

/**
 * Expression tree of the contract language. Only the shapes the analysis needs are modelled;
 * casts are dropped by the parser and array indexing is folded into {@link Ref} paths.
 */
public sealed interface Expr permits Expr.Literal, Expr.Ref, Expr.Invocation, Expr.Unary, Expr.Binary {

    /** Deterministic source-like rendering, used in rationales and as state-domain identity. */
    String render();

    /** Pre-order traversal over this node and all sub-expressions. */
    default void visit(Consumer<Expr> visitor) {
        visitor.accept(this);
    }

    enum LiteralType { INTEGER, STRING, BOOLEAN }

    record Literal(LiteralType type, String value) implements Expr {
        @Override
        public String render() {
            return type == LiteralType.STRING ? "\"" + value + "\"" : value;
        }

        public boolean isTrue() {
            return type == LiteralType.BOOLEAN && "true".equals(value);
        }
    }

    /** Variable or dotted member path, e.g. {@code in.sender}. */
    record Ref(String path) implements Expr {
        @Override
        public String render() {
            return path;
        }
    }

    record Invocation(String name, PrimitiveKind kind, List<Expr> args) implements Expr {
        public Invocation {
            args = List.copyOf(args);
        }

        @Override
        public String render() {
            StringBuilder sb = new StringBuilder(name).append('(');
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(args.get(i).render());
            }
            return sb.append(')').toString();
        }

        @Override
        public void visit(Consumer<Expr> visitor) {
            visitor.accept(this);
            args.forEach(a -> a.visit(visitor));
        }

        /**
         * State key addressed by a state accessor: the literal value for string keys,
         * the rendered expression for symbolic keys. {@code null} when there is no argument.
         */
        public String stateKey() {
            if (args.isEmpty()) return null;
            Expr first = args.get(0);
            if (first instanceof Literal lit && lit.type() == LiteralType.STRING) {
                return lit.value();
            }
            return first.render();
        }
    }

    record Unary(String op, Expr operand) implements Expr {
        @Override
        public String render() {
            String inner = operand.render();
            return operand instanceof Binary ? op + "(" + inner + ")" : op + inner;
        }

        @Override
        public void visit(Consumer<Expr> visitor) {
            visitor.accept(this);
            operand.visit(visitor);
        }
    }

    record Binary(String op, Expr left, Expr right) implements Expr {
        @Override
        public String render() {
            return wrap(left) + " " + op + " " + wrap(right);
        }

        private static String wrap(Expr e) {
            return e instanceof Binary ? "(" + e.render() + ")" : e.render();
        }

        @Override
        public void visit(Consumer<Expr> visitor) {
            visitor.accept(this);
            left.visit(visitor);
            right.visit(visitor);
        }

        public boolean isArithmetic() {
            return "+".equals(op) || "-".equals(op) || "*".equals(op);
        }

        public boolean isRelational() {
            return "<".equals(op) || "<=".equals(op) || ">".equals(op) || ">=".equals(op);
        }
    }
}
