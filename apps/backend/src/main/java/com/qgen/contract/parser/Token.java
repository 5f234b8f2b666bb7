package com.qgen.contract.parser;

record Token(Type type, String text, int line) {

    enum Type { IDENT, NUMBER, STRING, OP, LBRACE, RBRACE, LPAREN, RPAREN, LBRACKET, RBRACKET, SEMI, COMMA, EOF }

    boolean is(Type t) {
        return type == t;
    }

    boolean isOp(String op) {
        return type == Type.OP && text.equals(op);
    }

    boolean isIdent(String word) {
        return type == Type.IDENT && text.equals(word);
    }
}
