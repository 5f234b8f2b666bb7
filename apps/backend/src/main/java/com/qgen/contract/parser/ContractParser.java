package com.qgen.contract.parser;

import com.qgen.contract.ast.ContractUnit;
import com.qgen.contract.ast.Expr;
import com.qgen.contract.ast.FunctionBranch;
import com.qgen.contract.ast.PrimitiveKind;
import com.qgen.contract.ast.Statement;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses contract source restricted to the dispatch idiom:
 * one entry function taking the input record, and a chain of
 * {@code if (in.functionName == "...") { ... }} arms inside it.
 *
 * <p>Only two conditions fail the parse: no recognisable entry function, and unbalanced braces.
 * Everything else degrades: unknown calls become {@link PrimitiveKind#UNKNOWN}, unsupported
 * statements are skipped and recorded as parse notes.</p>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 */
@Slf4j
public class ContractParser {

    static final String DISPATCH_FIELD = "functionName";

    private static final Set<String> TYPE_WORDS = Set.of(
            "int", "long", "short", "char", "bool", "unsigned", "signed", "void", "const", "float", "double",
            "uint8", "uint16", "uint32", "uint64", "sint8", "sint16", "sint32", "sint64",
            "int8_t", "int16_t", "int32_t", "int64_t", "uint8_t", "uint16_t", "uint32_t", "uint64_t", "size_t");

    private static final Set<String> UNSUPPORTED_WORDS = Set.of(
            "while", "for", "do", "switch", "goto", "break", "continue", "case", "default", "try", "throw");

    private static final Set<String> ASSIGN_OPS = Set.of("=", "+=", "-=", "*=", "/=", "%=");

    private final PrimitiveCatalog catalog;

    public ContractParser(PrimitiveCatalog catalog) {
        this.catalog = catalog;
    }

    public ContractParser() {
        this(PrimitiveCatalog.defaults());
    }

    public ContractUnit parse(String source) throws ContractParseException {
        String text = source == null ? "" : source;
        List<Token> tokens = new Lexer(text).tokenize();
        checkBraces(tokens);

        FunctionDef entry = findEntry(tokens);
        List<ContractUnit.ParseNote> notes = new ArrayList<>();
        Cursor cursor = new Cursor(tokens, entry.bodyStart() + 1, entry.bodyEnd(), notes);
        List<Statement> body = cursor.parseStatements();

        List<FunctionBranch> branches = new ArrayList<>();
        for (Statement s : body) {
            if (s instanceof Statement.Conditional c) {
                collectDispatch(c, entry.param(), branches);
            }
        }
        log.debug("Parsed contract entry={} param={} branches={} notes={}",
                entry.name(), entry.param(), branches.size(), notes.size());
        return new ContractUnit(text, entry.name(), entry.param(), branches, notes);
    }

    // ====== structure checks ======

    private static void checkBraces(List<Token> tokens) throws ContractParseException {
        Deque<Integer> open = new ArrayDeque<>();
        for (Token t : tokens) {
            if (t.is(Token.Type.LBRACE)) {
                open.push(t.line());
            } else if (t.is(Token.Type.RBRACE)) {
                if (open.isEmpty()) {
                    throw new ContractParseException(ContractParseException.Reason.UNTERMINATED_BLOCK,
                            t.line(), "'}' without a matching '{'");
                }
                open.pop();
            }
        }
        if (!open.isEmpty()) {
            throw new ContractParseException(ContractParseException.Reason.UNTERMINATED_BLOCK,
                    open.peekLast(), "block is never closed");
        }
    }

    private record FunctionDef(String name, String param, int bodyStart, int bodyEnd, int line) {
    }

    private static FunctionDef findEntry(List<Token> tokens) throws ContractParseException {
        List<FunctionDef> candidates = new ArrayList<>();
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.is(Token.Type.LBRACE)) depth++;
            else if (t.is(Token.Type.RBRACE)) depth--;
            if (depth != 0 || !t.is(Token.Type.IDENT) || i == 0) continue;

            Token before = tokens.get(i - 1);
            boolean typed = before.is(Token.Type.IDENT) || before.isOp("*") || before.isOp("&");
            if (!typed || !tokens.get(i + 1).is(Token.Type.LPAREN)) continue;

            int close = matching(tokens, i + 1, Token.Type.LPAREN, Token.Type.RPAREN);
            if (close < 0 || !tokens.get(close + 1).is(Token.Type.LBRACE)) continue;
            int bodyEnd = matching(tokens, close + 1, Token.Type.LBRACE, Token.Type.RBRACE);
            if (bodyEnd < 0) continue;

            String param = singleParamName(tokens.subList(i + 2, close));
            if (param != null) {
                candidates.add(new FunctionDef(t.text(), param, close + 1, bodyEnd, t.line()));
            }
            i = bodyEnd;
        }

        for (FunctionDef def : candidates) {
            if ("main".equals(def.name())) return def;
        }
        if (candidates.size() == 1) return candidates.get(0);
        if (candidates.isEmpty()) {
            throw new ContractParseException(ContractParseException.Reason.MALFORMED_DISPATCH, 1,
                    "no entry function taking a single input record");
        }
        throw new ContractParseException(ContractParseException.Reason.MALFORMED_DISPATCH, candidates.get(1).line(),
                candidates.size() + " candidate entry functions and none is named 'main'");
    }

    private static int matching(List<Token> tokens, int openIdx, Token.Type open, Token.Type close) {
        int depth = 0;
        for (int j = openIdx; j < tokens.size(); j++) {
            Token t = tokens.get(j);
            if (t.is(open)) depth++;
            else if (t.is(close) && --depth == 0) return j;
        }
        return -1;
    }

    private static String singleParamName(List<Token> params) {
        if (params.size() < 2) return null;
        for (Token t : params) {
            if (t.is(Token.Type.COMMA)) return null;
        }
        Token last = params.get(params.size() - 1);
        return last.is(Token.Type.IDENT) ? last.text() : null;
    }

    // ====== dispatch extraction ======

    private record DispatchMatch(List<String> names, Expr guard) {
    }

    private static void collectDispatch(Statement.Conditional c, String param, List<FunctionBranch> out) {
        DispatchMatch match = matchDispatch(c.condition(), param);
        if (match == null) {
            return;
        }
        List<Statement> body = match.guard() == null
                ? c.thenBranch()
                : List.of(new Statement.Conditional(match.guard(), c.thenBranch(), List.of(), c.line()));
        Set<String> keys = new LinkedHashSet<>();
        collectStateKeys(body, keys);
        for (String name : match.names()) {
            out.add(new FunctionBranch(name, body, keys, c.line()));
        }
        // else-if 链上的分支同样是独立入口
        if (c.elseBranch().size() == 1 && c.elseBranch().get(0) instanceof Statement.Conditional next) {
            collectDispatch(next, param, out);
        }
    }

    private static DispatchMatch matchDispatch(Expr cond, String param) {
        List<String> names = nameComparisons(cond, param);
        if (names != null) {
            return new DispatchMatch(names, null);
        }
        if (!(cond instanceof Expr.Binary b) || !"&&".equals(b.op())) {
            return null;
        }
        List<Expr> conjuncts = new ArrayList<>();
        flattenAnd(cond, conjuncts);
        List<String> matched = null;
        Expr guard = null;
        for (Expr conjunct : conjuncts) {
            List<String> n = nameComparisons(conjunct, param);
            if (n != null && matched == null) {
                matched = n;
            } else {
                guard = guard == null ? conjunct : new Expr.Binary("&&", guard, conjunct);
            }
        }
        return matched == null ? null : new DispatchMatch(matched, guard);
    }

    private static void flattenAnd(Expr e, List<Expr> out) {
        if (e instanceof Expr.Binary b && "&&".equals(b.op())) {
            flattenAnd(b.left(), out);
            flattenAnd(b.right(), out);
        } else {
            out.add(e);
        }
    }

    private static List<String> nameComparisons(Expr e, String param) {
        if (!(e instanceof Expr.Binary b)) return null;
        if ("||".equals(b.op())) {
            List<String> l = nameComparisons(b.left(), param);
            List<String> r = nameComparisons(b.right(), param);
            if (l == null || r == null) return null;
            List<String> all = new ArrayList<>(l);
            all.addAll(r);
            return all;
        }
        if (!"==".equals(b.op())) return null;
        String field = param + "." + DISPATCH_FIELD;
        if (isRef(b.left(), field) && b.right() instanceof Expr.Literal lit && lit.type() == Expr.LiteralType.STRING) {
            return List.of(lit.value());
        }
        if (isRef(b.right(), field) && b.left() instanceof Expr.Literal lit && lit.type() == Expr.LiteralType.STRING) {
            return List.of(lit.value());
        }
        return null;
    }

    private static boolean isRef(Expr e, String path) {
        return e instanceof Expr.Ref r && r.path().equals(path);
    }

    private static void collectStateKeys(List<Statement> statements, Set<String> keys) {
        for (Statement s : statements) {
            for (Expr e : s.expressions()) {
                e.visit(node -> {
                    if (node instanceof Expr.Invocation inv
                            && (inv.kind() == PrimitiveKind.STATE_READ || inv.kind() == PrimitiveKind.STATE_WRITE)
                            && inv.stateKey() != null) {
                        keys.add(inv.stateKey());
                    }
                });
            }
            collectStateKeys(s.children(), keys);
        }
    }

    // ====== statement / expression parsing ======

    private static final class SyntaxError extends RuntimeException {
        SyntaxError(String message) {
            super(message, null, false, false);
        }
    }

    private final class Cursor {
        private final List<Token> tokens;
        private final int end;
        private final List<ContractUnit.ParseNote> notes;
        private int pos;

        Cursor(List<Token> tokens, int start, int end, List<ContractUnit.ParseNote> notes) {
            this.tokens = tokens;
            this.pos = start;
            this.end = end;
            this.notes = notes;
        }

        private Token peek() {
            return pos < tokens.size() ? tokens.get(pos) : tokens.get(tokens.size() - 1);
        }

        private Token peekAt(int ahead) {
            int i = pos + ahead;
            return i < tokens.size() ? tokens.get(i) : tokens.get(tokens.size() - 1);
        }

        private Token advance() {
            Token t = peek();
            pos++;
            return t;
        }

        private boolean atEnd() {
            return pos >= end || peek().is(Token.Type.EOF);
        }

        private Token expect(Token.Type type, String what) {
            Token t = peek();
            if (!t.is(type)) {
                throw new SyntaxError("expected " + what + " but found '" + t.text() + "'");
            }
            return advance();
        }

        List<Statement> parseStatements() {
            List<Statement> out = new ArrayList<>();
            while (!atEnd() && !peek().is(Token.Type.RBRACE)) {
                out.addAll(parseStatement());
            }
            return out;
        }

        private List<Statement> parseStatement() {
            int start = pos;
            Token t = peek();
            try {
                if (t.is(Token.Type.LBRACE)) {
                    advance();
                    List<Statement> inner = parseStatements();
                    expect(Token.Type.RBRACE, "'}'");
                    return inner;
                }
                if (t.is(Token.Type.SEMI)) {
                    advance();
                    return List.of();
                }
                if (t.isIdent("if")) {
                    return List.of(parseIf());
                }
                if (t.isIdent("return")) {
                    advance();
                    Expr value = peek().is(Token.Type.SEMI) ? null : parseExpr();
                    expect(Token.Type.SEMI, "';'");
                    return List.of(new Statement.Return(value, t.line()));
                }
                if (t.is(Token.Type.IDENT) && UNSUPPORTED_WORDS.contains(t.text())) {
                    skipUnsupported("unsupported statement '" + t.text() + "' skipped");
                    return List.of();
                }
                if (t.isOp("++") || t.isOp("--")) {
                    advance();
                    String target = parsePath(expect(Token.Type.IDENT, "identifier").text());
                    expect(Token.Type.SEMI, "';'");
                    return List.of(increment(target, t));
                }
                List<Statement> decl = tryDeclaration();
                if (decl != null) {
                    return decl;
                }
                return parseAssignmentOrCall();
            } catch (SyntaxError e) {
                pos = start;
                skipUnsupported(e.getMessage());
                return List.of();
            }
        }

        private Statement increment(String target, Token op) {
            String compound = op.isOp("++") ? "+=" : "-=";
            return new Statement.Assignment(null, target, compound, new Expr.Literal(Expr.LiteralType.INTEGER, "1"), op.line());
        }

        private Statement.Conditional parseIf() {
            Token ifTok = advance();
            expect(Token.Type.LPAREN, "'('");
            Expr cond = parseExpr();
            expect(Token.Type.RPAREN, "')'");
            List<Statement> then = parseBody();
            List<Statement> otherwise = List.of();
            if (peek().isIdent("else")) {
                advance();
                otherwise = peek().isIdent("if") ? List.of(parseIf()) : parseBody();
            }
            return new Statement.Conditional(cond, then, otherwise, ifTok.line());
        }

        private List<Statement> parseBody() {
            if (peek().is(Token.Type.LBRACE)) {
                advance();
                List<Statement> inner = parseStatements();
                expect(Token.Type.RBRACE, "'}'");
                return inner;
            }
            return parseStatement();
        }

        /** {@code long long x = expr;}, {@code char* s;}, {@code outputStruct out;} */
        private List<Statement> tryDeclaration() {
            int k = pos;
            int idents = 0;
            while (k < end) {
                Token tk = tokens.get(k);
                if (tk.is(Token.Type.IDENT)) idents++;
                else if (!(tk.isOp("*") || tk.isOp("&") || tk.isOp("::"))) break;
                k++;
            }
            Token after = tokens.get(k);
            boolean declarator = after.isOp("=") || after.is(Token.Type.SEMI)
                    || after.is(Token.Type.LBRACKET) || after.is(Token.Type.COMMA);
            if (idents < 2 || !declarator || !tokens.get(k - 1).is(Token.Type.IDENT)) {
                return null;
            }

            StringBuilder type = new StringBuilder();
            for (int j = pos; j < k - 1; j++) {
                String text = tokens.get(j).text();
                if (type.length() > 0 && !"*".equals(text) && !"&".equals(text) && !"::".equals(text)
                        && type.charAt(type.length() - 1) != ':') {
                    type.append(' ');
                }
                type.append(text);
            }
            pos = k - 1;

            List<Statement> out = new ArrayList<>();
            while (true) {
                Token name = expect(Token.Type.IDENT, "variable name");
                if (peek().is(Token.Type.LBRACKET)) {
                    while (!peek().is(Token.Type.RBRACKET) && !atEnd()) advance();
                    expect(Token.Type.RBRACKET, "']'");
                }
                Expr value = null;
                if (peek().isOp("=")) {
                    advance();
                    value = parseExpr();
                }
                out.add(new Statement.Assignment(type.toString(), name.text(), "=", value, name.line()));
                if (peek().is(Token.Type.COMMA)) {
                    advance();
                    continue;
                }
                expect(Token.Type.SEMI, "';'");
                return out;
            }
        }

        private List<Statement> parseAssignmentOrCall() {
            int start = pos;
            Token first = peek();
            if (first.is(Token.Type.IDENT)) {
                advance();
                String target = parsePath(first.text());
                Token op = peek();
                if (op.type() == Token.Type.OP && ASSIGN_OPS.contains(op.text())) {
                    advance();
                    Expr value = parseExpr();
                    expect(Token.Type.SEMI, "';'");
                    return List.of(new Statement.Assignment(null, target, op.text(), value, first.line()));
                }
                if (op.isOp("++") || op.isOp("--")) {
                    advance();
                    expect(Token.Type.SEMI, "';'");
                    return List.of(increment(target, op));
                }
                pos = start;
            }
            Expr expr = parseExpr();
            expect(Token.Type.SEMI, "';'");
            if (expr instanceof Expr.Invocation inv) {
                return List.of(new Statement.Call(inv, first.line()));
            }
            notes.add(new ContractUnit.ParseNote(first.line(), "expression statement without effect ignored"));
            return List.of();
        }

        /** Skips to the end of the current statement, keeping the enclosing block intact. */
        private void skipUnsupported(String message) {
            Token from = peek();
            notes.add(new ContractUnit.ParseNote(from.line(), message));
            log.debug("Skipping statement at line {}: {}", from.line(), message);
            int braces = 0;
            int parens = 0;
            boolean consumed = false;
            while (!atEnd()) {
                Token t = peek();
                if (t.is(Token.Type.RBRACE) && braces == 0) {
                    if (!consumed) advance();
                    return;
                }
                advance();
                consumed = true;
                if (t.is(Token.Type.LPAREN)) parens++;
                else if (t.is(Token.Type.RPAREN)) parens = Math.max(0, parens - 1);
                else if (t.is(Token.Type.LBRACE)) braces++;
                else if (t.is(Token.Type.RBRACE)) {
                    braces--;
                    if (braces == 0 && parens == 0 && !peek().isIdent("else") && !peek().isIdent("while")) return;
                } else if (t.is(Token.Type.SEMI) && braces == 0 && parens == 0) {
                    return;
                }
            }
        }

        // ---- expressions, lowest precedence first ----

        Expr parseExpr() {
            return parseBinary(0);
        }

        private static final String[][] LEVELS = {
                {"||"}, {"&&"}, {"|"}, {"^"}, {"&"}, {"==", "!="}, {"<", "<=", ">", ">="}, {"<<", ">>"}, {"+", "-"}, {"*", "/", "%"}
        };

        private Expr parseBinary(int level) {
            if (level == LEVELS.length) {
                return parseUnary();
            }
            Expr left = parseBinary(level + 1);
            while (true) {
                Token t = peek();
                String op = null;
                if (t.type() == Token.Type.OP) {
                    for (String candidate : LEVELS[level]) {
                        if (candidate.equals(t.text())) {
                            op = candidate;
                            break;
                        }
                    }
                }
                if (op == null) return left;
                advance();
                Expr right = parseBinary(level + 1);
                left = new Expr.Binary(op, left, right);
            }
        }

        private Expr parseUnary() {
            Token t = peek();
            if (t.isOp("!") || t.isOp("-") || t.isOp("+") || t.isOp("~")) {
                advance();
                Expr operand = parseUnary();
                if (t.isOp("-") && operand instanceof Expr.Literal lit && lit.type() == Expr.LiteralType.INTEGER) {
                    return new Expr.Literal(Expr.LiteralType.INTEGER, "-" + lit.value());
                }
                return t.isOp("+") ? operand : new Expr.Unary(t.text(), operand);
            }
            if (t.isOp("&") || t.isOp("*")) {
                advance();
                return parseUnary();
            }
            if (t.is(Token.Type.LPAREN) && isCast()) {
                while (!peek().is(Token.Type.RPAREN)) advance();
                advance();
                return parseUnary();
            }
            return parsePrimary();
        }

        private boolean isCast() {
            int j = 1;
            boolean sawType = false;
            while (true) {
                Token t = peekAt(j);
                if (t.is(Token.Type.IDENT) && TYPE_WORDS.contains(t.text())) {
                    sawType = true;
                } else if (!t.isOp("*")) {
                    return sawType && t.is(Token.Type.RPAREN);
                }
                j++;
            }
        }

        private Expr parsePrimary() {
            Token t = advance();
            switch (t.type()) {
                case NUMBER:
                    return new Expr.Literal(Expr.LiteralType.INTEGER, t.text());
                case STRING:
                    return new Expr.Literal(Expr.LiteralType.STRING, t.text());
                case LPAREN: {
                    Expr inner = parseExpr();
                    expect(Token.Type.RPAREN, "')'");
                    return inner;
                }
                case IDENT:
                    if ("true".equals(t.text()) || "false".equals(t.text())) {
                        return new Expr.Literal(Expr.LiteralType.BOOLEAN, t.text());
                    }
                    String path = parsePath(t.text());
                    if (peek().is(Token.Type.LPAREN)) {
                        advance();
                        return new Expr.Invocation(path, resolve(path), parseArgs());
                    }
                    return new Expr.Ref(path);
                default:
                    throw new SyntaxError("unexpected '" + t.text() + "'");
            }
        }

        private List<Expr> parseArgs() {
            List<Expr> args = new ArrayList<>();
            if (peek().is(Token.Type.RPAREN)) {
                advance();
                return args;
            }
            while (true) {
                args.add(parseExpr());
                if (peek().is(Token.Type.COMMA)) {
                    advance();
                    continue;
                }
                expect(Token.Type.RPAREN, "')'");
                return args;
            }
        }

        /** Member access and indexing after an identifier; {@code ->} and {@code ::} fold into dots. */
        private String parsePath(String head) {
            StringBuilder path = new StringBuilder(head);
            while (true) {
                Token t = peek();
                if (t.isOp(".") || t.isOp("->") || t.isOp("::")) {
                    advance();
                    path.append('.').append(expect(Token.Type.IDENT, "member name").text());
                } else if (t.is(Token.Type.LBRACKET)) {
                    advance();
                    Expr index = parseExpr();
                    expect(Token.Type.RBRACKET, "']'");
                    path.append('[').append(index.render()).append(']');
                } else {
                    return path.toString();
                }
            }
        }

        private PrimitiveKind resolve(String path) {
            PrimitiveKind kind = catalog.kindOf(path);
            if (kind == PrimitiveKind.UNKNOWN && path.indexOf('.') >= 0) {
                kind = catalog.kindOf(path.substring(path.lastIndexOf('.') + 1));
            }
            return kind;
        }
    }
}
