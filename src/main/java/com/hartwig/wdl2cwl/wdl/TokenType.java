package com.hartwig.wdl2cwl.wdl;

public enum TokenType {
    IDENTIFIER,
    INT,
    FLOAT,
    STRING,
    COMMAND,
    LBRACE("{"),
    RBRACE("}"),
    LPAREN("("),
    RPAREN(")"),
    LBRACKET("["),
    RBRACKET("]"),
    COMMA(","),
    COLON(":"),
    DOT("."),
    QUESTION("?"),
    ASSIGN("="),
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    PERCENT("%"),
    BANG("!"),
    AND("&&"),
    OR("||"),
    EQ("=="),
    NEQ("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    EOF;

    private final String symbol;

    TokenType() {
        this.symbol = null;
    }

    TokenType(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol != null ? symbol : name().toLowerCase();
    }
}
