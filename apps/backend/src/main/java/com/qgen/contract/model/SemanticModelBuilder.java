package com.qgen.contract.model;

import com.qgen.contract.ast.ContractUnit;
import com.qgen.contract.ast.Expr;
import com.qgen.contract.ast.FunctionBranch;
import com.qgen.contract.ast.PrimitiveKind;
import com.qgen.contract.ast.Statement;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Walks each dispatch branch as a statement tree and derives authorization facts, arithmetic
 * operations and the write/effect ordering.
 *
 * <p>Dominance is decided on the tree, not on a control-flow graph: branch bodies have no loops,
 * so a call is guarded when an enclosing arm or an earlier early-exit guard can only be passed
 * after a successful authorization check. Variables are tracked flow-insensitively within a branch
 * in source order.</p>
 *
 * <p>Stateless; one builder can serve concurrent audits.</p>
 */
@Slf4j
public class SemanticModelBuilder {

    private static final Set<String> INT_TYPE_WORDS = Set.of(
            "int", "long", "short", "unsigned", "signed", "size_t",
            "uint8", "uint16", "uint32", "uint64", "sint8", "sint16", "sint32", "sint64",
            "int8_t", "int16_t", "int32_t", "int64_t", "uint8_t", "uint16_t", "uint32_t", "uint64_t");

    private static final Set<String> NON_INT_TYPE_WORDS = Set.of("bool", "string", "float", "double", "void");

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    public ContractModel build(ContractUnit unit) {
        List<BranchModel> branches = new ArrayList<>();
        List<FunctionBranch> source = unit.branches();
        for (int i = 0; i < source.size(); i++) {
            branches.add(new BranchWalker(unit, source.get(i), i).walk());
        }
        return new ContractModel(unit, branches);
    }

    /** Strength of what a condition proves about authorization; ordinal order matters. */
    private enum Implication { NONE, MENTION, AUTH }

    private static Implication strongest(Implication a, Implication b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    /** Both sides must hold: proof only if both prove something. */
    private static Implication both(Implication a, Implication b) {
        if (a == Implication.AUTH && b == Implication.AUTH) {
            return Implication.AUTH;
        }
        return strongest(a, b).ordinal() >= Implication.MENTION.ordinal() ? Implication.MENTION : Implication.NONE;
    }

    private static final class VarInfo {
        ArithmeticOp.OperandWidth width = ArithmeticOp.OperandWidth.UNKNOWN;
        Set<String> taint = new LinkedHashSet<>();
        boolean balance;
        boolean authResult;
        /** holds an identity the caller cannot choose: a literal or a fixed-key state read */
        boolean trustedIdentity;
    }

    /**
     * Facts that hold on the current path. {@code upperBounded}/{@code lowerBounded} hold operand
     * renders and variable names a dominating comparison bounds from above/below.
     */
    private record Scope(AuthorizationFact auth, String ambiguity, Set<String> upperBounded, Set<String> lowerBounded) {
        static Scope initial() {
            return new Scope(AuthorizationFact.UNGUARDED, null, Set.of(), Set.of());
        }

        Scope withAuth(AuthorizationFact fact, String why) {
            return new Scope(fact, why, upperBounded, lowerBounded);
        }
    }

    private static final class BranchWalker {
        private final FunctionBranch branch;
        private final int index;
        private final String callerPath;
        private final Map<String, VarInfo> vars = new HashMap<>();
        private final List<GuardedCall> calls = new ArrayList<>();
        private final List<ArithmeticOp> ops = new ArrayList<>();
        private final List<CallOrdering.Event> events = new ArrayList<>();
        private final List<AnalysisWarning> warnings = new ArrayList<>();

        BranchWalker(ContractUnit unit, FunctionBranch branch, int index) {
            this.branch = branch;
            this.index = index;
            this.callerPath = unit.callerPath();
        }

        BranchModel walk() {
            walkBlock(branch.statements(), Scope.initial());
            log.debug("Branch '{}' modelled: calls={} arithmetic={} events={} warnings={}",
                    branch.name(), calls.size(), ops.size(), events.size(), warnings.size());
            return new BranchModel(branch, index, calls, ops, new CallOrdering(events), warnings);
        }

        /** @return true when every path through the block returns */
        private boolean walkBlock(List<Statement> statements, Scope scope) {
            Scope current = scope;
            for (Statement s : statements) {
                if (s instanceof Statement.Return r) {
                    analyze(r.value(), current, r.line(), false);
                    return true;
                }
                if (s instanceof Statement.Assignment a) {
                    analyze(a.value(), current, a.line(), false);
                    assign(a, current);
                } else if (s instanceof Statement.Call c) {
                    analyze(c.invocation(), current, c.line(), false);
                    if (c.kind() == PrimitiveKind.AUTHORIZATION_ASSERT && !current.auth().isGuarded()) {
                        current = current.withAuth(
                                AuthorizationFact.guardedBy(AuthorizationFact.Basis.AUTHORIZATION_PRIMITIVE), null);
                    }
                } else if (s instanceof Statement.Conditional c) {
                    analyze(c.condition(), current, c.line(), false);
                    Scope thenScope = enter(current, c.condition(), true);
                    Scope elseScope = enter(current, c.condition(), false);
                    boolean thenExits = walkBlock(c.thenBranch(), thenScope);
                    boolean elseExits = !c.elseBranch().isEmpty() && walkBlock(c.elseBranch(), elseScope);
                    if (thenExits && elseExits) {
                        return true;
                    }
                    if (thenExits) {
                        // early-exit guard: what follows only runs when the condition was false
                        current = elseScope;
                    } else if (elseExits) {
                        current = thenScope;
                    }
                }
            }
            return false;
        }

        private Scope enter(Scope scope, Expr cond, boolean polarity) {
            AuthorizationFact auth = scope.auth();
            String ambiguity = scope.ambiguity();
            if (!auth.isGuarded()) {
                switch (implies(cond, polarity)) {
                    case AUTH:
                        auth = AuthorizationFact.guardedBy(AuthorizationFact.Basis.AUTHORIZATION_PRIMITIVE);
                        ambiguity = null;
                        break;
                    case MENTION:
                        auth = AuthorizationFact.AMBIGUOUS;
                        ambiguity = "condition '" + cond.render() + "' involves an authorization check without implying it";
                        break;
                    default:
                        break;
                }
            }
            Set<String> upper = new HashSet<>(scope.upperBounded());
            Set<String> lower = new HashSet<>(scope.lowerBounded());
            collectBounds(cond, polarity, upper, lower);
            return new Scope(auth, ambiguity, upper, lower);
        }

        // ====== authorization implication ======

        private Implication implies(Expr e, boolean polarity) {
            if (e instanceof Expr.Invocation inv) {
                if (inv.kind().isAuthorization()) {
                    // the failed-check path proves nothing
                    return polarity ? Implication.AUTH : Implication.NONE;
                }
                return mentionsAuth(e) ? Implication.MENTION : Implication.NONE;
            }
            if (e instanceof Expr.Ref ref) {
                VarInfo v = vars.get(ref.path());
                if (v != null && v.authResult) return polarity ? Implication.AUTH : Implication.NONE;
                return Implication.NONE;
            }
            if (e instanceof Expr.Unary u && "!".equals(u.op())) {
                return implies(u.operand(), !polarity);
            }
            if (e instanceof Expr.Binary b) {
                switch (b.op()) {
                    case "&&":
                        return polarity
                                ? strongest(implies(b.left(), true), implies(b.right(), true))
                                : both(implies(b.left(), false), implies(b.right(), false));
                    case "||":
                        return polarity
                                ? both(implies(b.left(), true), implies(b.right(), true))
                                : strongest(implies(b.left(), false), implies(b.right(), false));
                    case "==":
                    case "!=":
                        return impliesByEquality(b, polarity);
                    default:
                        break;
                }
            }
            return mentionsAuth(e) ? Implication.MENTION : Implication.NONE;
        }

        private Implication impliesByEquality(Expr.Binary b, boolean polarity) {
            boolean eq = "==".equals(b.op());
            if (b.right() instanceof Expr.Literal lit && lit.type() == Expr.LiteralType.BOOLEAN) {
                return implies(b.left(), polarity == (eq == lit.isTrue()));
            }
            if (b.left() instanceof Expr.Literal lit && lit.type() == Expr.LiteralType.BOOLEAN) {
                return implies(b.right(), polarity == (eq == lit.isTrue()));
            }
            Expr other = callerPath.equals(b.left().render()) ? b.right()
                    : callerPath.equals(b.right().render()) ? b.left() : null;
            if (other != null) {
                // in.sender == owner: only an identity the caller cannot supply proves anything
                return eq == polarity && isTrustedIdentity(other) ? Implication.AUTH : Implication.NONE;
            }
            return mentionsAuth(b) ? Implication.MENTION : Implication.NONE;
        }

        private boolean isTrustedIdentity(Expr e) {
            if (e instanceof Expr.Literal lit) {
                return lit.type() != Expr.LiteralType.BOOLEAN;
            }
            if (e instanceof Expr.Invocation inv) {
                return inv.kind() == PrimitiveKind.STATE_READ
                        && inv.args().size() == 1
                        && inv.args().get(0) instanceof Expr.Literal key
                        && key.type() == Expr.LiteralType.STRING;
            }
            if (e instanceof Expr.Ref ref) {
                VarInfo v = vars.get(ref.path());
                return v != null && v.trustedIdentity;
            }
            return false;
        }

        private boolean mentionsAuth(Expr e) {
            boolean[] found = {false};
            e.visit(node -> {
                if (node instanceof Expr.Invocation inv && inv.kind().isAuthorization()) found[0] = true;
                if (node instanceof Expr.Ref ref && vars.containsKey(ref.path()) && vars.get(ref.path()).authResult) found[0] = true;
            });
            return found[0];
        }

        // ====== range bounds ======

        /** What holding {@code cond == polarity} bounds. Disjunctions bound nothing. */
        private static void collectBounds(Expr cond, boolean polarity, Set<String> upper, Set<String> lower) {
            if (cond instanceof Expr.Unary u && "!".equals(u.op())) {
                collectBounds(u.operand(), !polarity, upper, lower);
            } else if (cond instanceof Expr.Binary b) {
                if (("&&".equals(b.op()) && polarity) || ("||".equals(b.op()) && !polarity)) {
                    collectBounds(b.left(), polarity, upper, lower);
                    collectBounds(b.right(), polarity, upper, lower);
                } else if (b.isRelational()) {
                    // !(a < b) is a >= b, so only the direction flips
                    boolean leftBelow = b.op().startsWith("<") == polarity;
                    bound(b.left(), leftBelow ? upper : lower);
                    bound(b.right(), leftBelow ? lower : upper);
                }
            }
        }

        private static void bound(Expr operand, Set<String> into) {
            if (operand instanceof Expr.Literal) return;
            into.add(operand.render());
            into.addAll(refsIn(operand));
        }

        private static Set<String> refsIn(Expr e) {
            Set<String> out = new HashSet<>();
            e.visit(node -> {
                if (node instanceof Expr.Ref r) out.add(r.path());
            });
            return out;
        }

        // ====== expression analysis ======

        private void analyze(Expr e, Scope scope, int line, boolean insideChecked) {
            if (e == null) return;
            if (e instanceof Expr.Invocation inv) {
                boolean checked = insideChecked || inv.kind() == PrimitiveKind.CHECKED_ARITHMETIC;
                for (Expr arg : inv.args()) {
                    analyze(arg, scope, line, checked);
                }
                recordCall(inv, scope, line);
            } else if (e instanceof Expr.Binary b) {
                analyze(b.left(), scope, line, insideChecked);
                analyze(b.right(), scope, line, insideChecked);
                if (b.isArithmetic()) {
                    recordOp(ArithmeticOp.Kind.of(b.op()), b.render(), b.left(), b.right(), scope, line, insideChecked);
                }
            } else if (e instanceof Expr.Unary u) {
                analyze(u.operand(), scope, line, insideChecked);
            }
        }

        private void recordCall(Expr.Invocation inv, Scope scope, int line) {
            PrimitiveKind kind = inv.kind();
            if (kind == PrimitiveKind.STATE_WRITE) {
                String key = inv.stateKey();
                Set<String> domain = key == null ? Set.of() : Set.of(key);
                boolean balance = inv.args().stream().anyMatch(this::balanceFunded);
                calls.add(new GuardedCall(inv, line, factFor(scope, inv, line), domain, balance, callerPath.equals(key)));
                events.add(new CallOrdering.Event(CallOrdering.EventType.STATE_WRITE, inv.render(), domain, line));
            } else if (kind.isExternalEffect()) {
                Set<String> domain = new LinkedHashSet<>();
                boolean balance = false;
                for (Expr arg : inv.args()) {
                    domain.addAll(taintOf(arg));
                    balance |= balanceFunded(arg);
                }
                boolean callerScoped = kind == PrimitiveKind.FUND_TRANSFER && !balance
                        && !domain.isEmpty() && domain.stream().allMatch(callerPath::equals);
                calls.add(new GuardedCall(inv, line, factFor(scope, inv, line), domain, balance, callerScoped));
                CallOrdering.EventType type = kind == PrimitiveKind.FUND_TRANSFER
                        ? CallOrdering.EventType.FUND_TRANSFER : CallOrdering.EventType.EXTERNAL_CALL;
                events.add(new CallOrdering.Event(type, inv.render(), domain, line));
            }
        }

        private AuthorizationFact factFor(Scope scope, Expr.Invocation inv, int line) {
            if (scope.auth().status() == AuthorizationStatus.AMBIGUOUS) {
                warnings.add(new AnalysisWarning(branch.name(), line,
                        "authorization of " + inv.render() + " is ambiguous: " + scope.ambiguity()));
            }
            return scope.auth();
        }

        private void recordOp(ArithmeticOp.Kind kind, String text, Expr left, Expr right,
                              Scope scope, int line, boolean insideChecked) {
            ArithmeticOp.OperandWidth lw = width(left);
            ArithmeticOp.OperandWidth rw = width(right);
            if (lw == ArithmeticOp.OperandWidth.NON_INTEGER || rw == ArithmeticOp.OperandWidth.NON_INTEGER) {
                return;
            }
            boolean literalOnly = constant(left) != null && constant(right) != null;
            boolean overflow = literalOnly && !fitsLong(fold(kind, constant(left), constant(right)));
            ArithmeticOp.Guard guard;
            if (insideChecked) {
                guard = ArithmeticOp.Guard.CHECKED_PRIMITIVE;
            } else if (rangeGuarded(kind, left, right, scope)) {
                guard = ArithmeticOp.Guard.RANGE_COMPARISON;
            } else {
                guard = ArithmeticOp.Guard.NONE;
            }
            ops.add(new ArithmeticOp(kind, text, lw, rw, literalOnly, overflow, guard, line));
        }

        /**
         * A sum or product is guarded by an upper bound on either operand; a difference by a lower
         * bound on the minuend or an upper bound on the subtrahend.
         */
        private static boolean rangeGuarded(ArithmeticOp.Kind kind, Expr left, Expr right, Scope scope) {
            if (kind == ArithmeticOp.Kind.SUB) {
                return within(left, scope.lowerBounded()) || within(right, scope.upperBounded());
            }
            return within(left, scope.upperBounded()) || within(right, scope.upperBounded());
        }

        private static boolean within(Expr operand, Set<String> bounded) {
            if (operand instanceof Expr.Literal) return false;
            if (bounded.contains(operand.render())) return true;
            for (String ref : refsIn(operand)) {
                if (bounded.contains(ref)) return true;
            }
            return false;
        }

        private void assign(Statement.Assignment a, Scope scope) {
            VarInfo prev = vars.get(a.target());
            VarInfo info = new VarInfo();
            Expr value = a.value();

            if (a.isCompound()) {
                ArithmeticOp.Kind kind = ArithmeticOp.Kind.of(a.operator());
                if (kind != null && value != null) {
                    recordOp(kind, a.target() + " " + a.operator() + " " + value.render(),
                            new Expr.Ref(a.target()), value, scope, a.line(), false);
                }
            }

            if (a.declaredType() != null) {
                info.width = typeWidth(a.declaredType());
                if (info.width == ArithmeticOp.OperandWidth.UNKNOWN && value != null) {
                    info.width = width(value);
                }
            } else if (prev != null) {
                info.width = prev.width;
            } else if (value != null) {
                info.width = width(value);
            }
            if (a.isCompound() && prev != null) {
                info.taint.addAll(prev.taint);
                info.balance = prev.balance;
            }
            if (value != null) {
                info.taint.addAll(taintOf(value));
                info.balance |= balanceFunded(value);
                info.authResult = !a.isCompound() && implies(value, true) == Implication.AUTH;
                info.trustedIdentity = !a.isCompound() && isTrustedIdentity(value);
            }
            vars.put(a.target(), info);
        }

        private Set<String> taintOf(Expr e) {
            Set<String> out = new LinkedHashSet<>();
            e.visit(node -> {
                if (node instanceof Expr.Invocation inv && inv.kind() == PrimitiveKind.STATE_READ && inv.stateKey() != null) {
                    out.add(inv.stateKey());
                } else if (node instanceof Expr.Ref ref && vars.containsKey(ref.path())) {
                    out.addAll(vars.get(ref.path()).taint);
                }
            });
            return out;
        }

        private boolean balanceFunded(Expr e) {
            boolean[] found = {false};
            e.visit(node -> {
                if (node instanceof Expr.Invocation inv && inv.kind() == PrimitiveKind.BALANCE_QUERY) found[0] = true;
                if (node instanceof Expr.Ref ref && vars.containsKey(ref.path()) && vars.get(ref.path()).balance) found[0] = true;
            });
            return found[0];
        }

        // ====== widths & constants ======

        private ArithmeticOp.OperandWidth width(Expr e) {
            if (e instanceof Expr.Literal lit) {
                return lit.type() == Expr.LiteralType.INTEGER ? ArithmeticOp.OperandWidth.LITERAL : ArithmeticOp.OperandWidth.NON_INTEGER;
            }
            if (e instanceof Expr.Ref ref) {
                VarInfo v = vars.get(ref.path());
                return v != null ? v.width : ArithmeticOp.OperandWidth.UNKNOWN;
            }
            if (e instanceof Expr.Invocation inv) {
                return invocationWidth(inv);
            }
            if (e instanceof Expr.Unary u) {
                return "!".equals(u.op()) ? ArithmeticOp.OperandWidth.NON_INTEGER : width(u.operand());
            }
            Expr.Binary b = (Expr.Binary) e;
            if (!b.isArithmetic() && !"/".equals(b.op()) && !"%".equals(b.op())) {
                return b.isRelational() || "==".equals(b.op()) || "!=".equals(b.op()) || "&&".equals(b.op()) || "||".equals(b.op())
                        ? ArithmeticOp.OperandWidth.NON_INTEGER : ArithmeticOp.OperandWidth.UNKNOWN;
            }
            ArithmeticOp.OperandWidth l = width(b.left());
            ArithmeticOp.OperandWidth r = width(b.right());
            if (l == ArithmeticOp.OperandWidth.NON_INTEGER || r == ArithmeticOp.OperandWidth.NON_INTEGER) {
                return ArithmeticOp.OperandWidth.NON_INTEGER;
            }
            if (l == ArithmeticOp.OperandWidth.FIXED || r == ArithmeticOp.OperandWidth.FIXED) {
                return ArithmeticOp.OperandWidth.FIXED;
            }
            if (l == ArithmeticOp.OperandWidth.LITERAL && r == ArithmeticOp.OperandWidth.LITERAL) {
                return ArithmeticOp.OperandWidth.LITERAL;
            }
            return ArithmeticOp.OperandWidth.UNKNOWN;
        }

        private static ArithmeticOp.OperandWidth invocationWidth(Expr.Invocation inv) {
            switch (inv.kind()) {
                case BALANCE_QUERY:
                case CHECKED_ARITHMETIC:
                    return ArithmeticOp.OperandWidth.FIXED;
                case AUTHORIZATION_CHECK:
                case AUTHORIZATION_ASSERT:
                    return ArithmeticOp.OperandWidth.NON_INTEGER;
                default:
                    break;
            }
            String name = inv.name().toLowerCase(Locale.ROOT);
            if (name.contains("string") || name.contains("bool")) return ArithmeticOp.OperandWidth.NON_INTEGER;
            if (name.contains("long") || name.contains("int")) return ArithmeticOp.OperandWidth.FIXED;
            return ArithmeticOp.OperandWidth.UNKNOWN;
        }

        private static ArithmeticOp.OperandWidth typeWidth(String declaredType) {
            if (declaredType.contains("*")) return ArithmeticOp.OperandWidth.NON_INTEGER;
            boolean integer = false;
            for (String word : declaredType.toLowerCase(Locale.ROOT).split("[\\s:&]+")) {
                if (NON_INT_TYPE_WORDS.contains(word)) return ArithmeticOp.OperandWidth.NON_INTEGER;
                if (INT_TYPE_WORDS.contains(word)) integer = true;
            }
            return integer ? ArithmeticOp.OperandWidth.FIXED : ArithmeticOp.OperandWidth.UNKNOWN;
        }

        /** Constant value of an integer-literal expression, or null. */
        private static BigInteger constant(Expr e) {
            if (e instanceof Expr.Literal lit && lit.type() == Expr.LiteralType.INTEGER) {
                return parseInteger(lit.value());
            }
            if (e instanceof Expr.Unary u && "-".equals(u.op())) {
                BigInteger v = constant(u.operand());
                return v == null ? null : v.negate();
            }
            if (e instanceof Expr.Binary b && b.isArithmetic()) {
                BigInteger l = constant(b.left());
                BigInteger r = constant(b.right());
                return l == null || r == null ? null : fold(ArithmeticOp.Kind.of(b.op()), l, r);
            }
            return null;
        }

        private static BigInteger parseInteger(String text) {
            String t = text.replaceAll("[uUlL]+$", "");
            try {
                boolean negative = t.startsWith("-");
                String digits = negative ? t.substring(1) : t;
                BigInteger v = digits.startsWith("0x") || digits.startsWith("0X")
                        ? new BigInteger(digits.substring(2), 16)
                        : new BigInteger(digits);
                return negative ? v.negate() : v;
            } catch (NumberFormatException e) {
                log.debug("Unparseable integer literal '{}'", text);
                return null;
            }
        }

        private static BigInteger fold(ArithmeticOp.Kind kind, BigInteger l, BigInteger r) {
            switch (kind) {
                case ADD:
                    return l.add(r);
                case SUB:
                    return l.subtract(r);
                default:
                    return l.multiply(r);
            }
        }

        private static boolean fitsLong(BigInteger v) {
            return v.compareTo(LONG_MIN) >= 0 && v.compareTo(LONG_MAX) <= 0;
        }
    }
}
