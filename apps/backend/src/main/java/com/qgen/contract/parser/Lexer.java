package com.qgen.contract.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for the C-like contract language. Comments and preprocessor lines are dropped, so
 * braces inside them never count towards block balance.
 */
final class Lexer {

    private static final String[] MULTI_OPS = {
            "==", "!=", "<=", ">=", "&&", "||", "++", "--", "+=", "-=", "*=", "/=", "%=", "->", "::", "<<", ">>"
    };

    private final String src;
    private int pos;
    private int line = 1;

    Lexer(String src) {
        this.src = src;
    }

    List<Token> tokenize() {
        List<Token> out = new ArrayList<>();
        boolean lineStart = true;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == '\n') {
                line++;
                pos++;
                lineStart = true;
                continue;
            }
            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }
            if (c == '#' && lineStart) {
                skipToLineEnd();
                continue;
            }
            lineStart = false;
            if (c == '/' && peek(1) == '/') {
                skipToLineEnd();
            } else if (c == '/' && peek(1) == '*') {
                skipBlockComment();
            } else if (Character.isLetter(c) || c == '_') {
                out.add(new Token(Token.Type.IDENT, readWhile(), line));
            } else if (Character.isDigit(c)) {
                out.add(new Token(Token.Type.NUMBER, readNumber(), line));
            } else if (c == '"' || c == '\'') {
                int startLine = line;
                out.add(new Token(Token.Type.STRING, readQuoted(c), startLine));
            } else {
                out.add(readPunct());
            }
        }
        out.add(new Token(Token.Type.EOF, "", line));
        return out;
    }

    private char peek(int ahead) {
        int i = pos + ahead;
        return i < src.length() ? src.charAt(i) : '\0';
    }

    private void skipToLineEnd() {
        while (pos < src.length() && src.charAt(pos) != '\n') pos++;
    }

    private void skipBlockComment() {
        pos += 2;
        while (pos < src.length() && !(src.charAt(pos) == '*' && peek(1) == '/')) {
            if (src.charAt(pos) == '\n') line++;
            pos++;
        }
        pos = Math.min(src.length(), pos + 2);
    }

    private String readWhile() {
        int start = pos;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_') {
                pos++;
            } else {
                break;
            }
        }
        return src.substring(start, pos);
    }

    private String readNumber() {
        String raw = readWhile();
        // 去掉 LL / ULL / u 之类的后缀，十六进制保持原样
        if (raw.startsWith("0x") || raw.startsWith("0X")) {
            return raw;
        }
        int end = 0;
        while (end < raw.length() && Character.isDigit(raw.charAt(end))) end++;
        return raw.substring(0, end);
    }

    private String readQuoted(char quote) {
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == '\\' && pos + 1 < src.length()) {
                sb.append(src.charAt(pos + 1));
                pos += 2;
                continue;
            }
            if (c == quote) {
                pos++;
                return sb.toString();
            }
            if (c == '\n') {
                // unterminated literal ends at the line break
                return sb.toString();
            }
            sb.append(c);
            pos++;
        }
        return sb.toString();
    }

    private Token readPunct() {
        for (String op : MULTI_OPS) {
            if (src.startsWith(op, pos)) {
                pos += op.length();
                return new Token(Token.Type.OP, op, line);
            }
        }
        char c = src.charAt(pos++);
        Token.Type type = switch (c) {
            case '{' -> Token.Type.LBRACE;
            case '}' -> Token.Type.RBRACE;
            case '(' -> Token.Type.LPAREN;
            case ')' -> Token.Type.RPAREN;
            case '[' -> Token.Type.LBRACKET;
            case ']' -> Token.Type.RBRACKET;
            case ';' -> Token.Type.SEMI;
            case ',' -> Token.Type.COMMA;
            default -> Token.Type.OP;
        };
        return new Token(type, String.valueOf(c), line);
    }
}
