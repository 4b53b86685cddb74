package com.hartwig.wdl2cwl.wdl;

import com.hartwig.wdl2cwl.diagnostic.SourceLocation;

/**
 * A lexical token. For strings the text is the raw content between the quotes, for commands the raw body between the
 * delimiters; {@code start} and {@code end} are offsets into the source text.
 */
final class Token {
    private final TokenType type;
    private final String text;
    private final SourceLocation location;
    private final int start;
    private final int end;
    private final boolean heredoc;

    Token(TokenType type, String text, SourceLocation location, int start, int end, boolean heredoc) {
        this.type = type;
        this.text = text;
        this.location = location;
        this.start = start;
        this.end = end;
        this.heredoc = heredoc;
    }

    TokenType type() {
        return type;
    }

    String text() {
        return text;
    }

    SourceLocation location() {
        return location;
    }

    int start() {
        return start;
    }

    int end() {
        return end;
    }

    /**
     * For command tokens: whether the body was delimited by {@code <<< >>>}.
     */
    boolean heredoc() {
        return heredoc;
    }

    boolean is(TokenType type) {
        return this.type == type;
    }

    boolean isKeyword(String keyword) {
        return type == TokenType.IDENTIFIER && text.equals(keyword);
    }

    @Override
    public String toString() {
        return String.format("<%s %s \"%s\">", location.describe(), type, text);
    }
}
