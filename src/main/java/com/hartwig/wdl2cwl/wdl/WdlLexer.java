package com.hartwig.wdl2cwl.wdl;

import java.util.ArrayList;
import java.util.List;

import com.hartwig.wdl2cwl.diagnostic.SourceLocation;
import com.hartwig.wdl2cwl.diagnostic.WdlParseException;

/**
 * Turns WDL source text into tokens. Comments and whitespace are dropped. After the {@code command} keyword the lexer
 * captures the command body verbatim as a single {@link TokenType#COMMAND} token.
 */
final class WdlLexer {
    private final String file;
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int offset;
    private int line;
    private int column;

    WdlLexer(String file, String source) {
        this(file, source, 1, 1);
    }

    /**
     * Lexes a fragment of a larger document; locations are reported relative to where the fragment starts.
     */
    WdlLexer(String file, String source, int line, int column) {
        this.file = file;
        this.source = source;
        this.line = line;
        this.column = column;
    }

    List<Token> tokenize() throws WdlParseException {
        while (true) {
            skipWhitespaceAndComments();
            if (offset >= source.length()) {
                tokens.add(new Token(TokenType.EOF, "", location(), offset, offset, false));
                return tokens;
            }
            var c = source.charAt(offset);
            if (isIdentifierStart(c)) {
                var token = identifier();
                tokens.add(token);
                if (token.text().equals("command") && !followsDot() && commandBodyFollows()) {
                    tokens.add(command());
                }
            } else if (Character.isDigit(c)) {
                tokens.add(number());
            } else if (c == '"' || c == '\'') {
                tokens.add(string());
            } else {
                tokens.add(operator());
            }
        }
    }

    private Token identifier() {
        var start = offset;
        var location = location();
        while (offset < source.length() && isIdentifierPart(source.charAt(offset))) {
            advance(1);
        }
        return new Token(TokenType.IDENTIFIER, source.substring(start, offset), location, start, offset, false);
    }

    private Token number() {
        var start = offset;
        var location = location();
        var type = TokenType.INT;
        skipDigits();
        if (offset + 1 < source.length() && source.charAt(offset) == '.' && Character.isDigit(source.charAt(offset + 1))) {
            type = TokenType.FLOAT;
            advance(1);
            skipDigits();
        }
        if (offset < source.length() && (source.charAt(offset) == 'e' || source.charAt(offset) == 'E')) {
            var exponent = offset + 1;
            if (exponent < source.length() && (source.charAt(exponent) == '+' || source.charAt(exponent) == '-')) {
                exponent++;
            }
            if (exponent < source.length() && Character.isDigit(source.charAt(exponent))) {
                type = TokenType.FLOAT;
                advance(exponent - offset);
                skipDigits();
            }
        }
        return new Token(type, source.substring(start, offset), location, start, offset, false);
    }

    private Token string() throws WdlParseException {
        var start = offset;
        var location = location();
        var end = CommandScanner.findQuoteEnd(source, offset);
        if (end < 0 || hasBareNewline(start + 1, end)) {
            throw new WdlParseException(location, "Unterminated string " + CommandScanner.abbreviate(source.substring(start)));
        }
        var text = source.substring(start + 1, end);
        advance(end + 1 - offset);
        return new Token(TokenType.STRING, text, location, start, offset, false);
    }

    /**
     * Placeholders may span lines inside a string, bare text may not.
     */
    private boolean hasBareNewline(int from, int to) {
        var i = from;
        while (i < to) {
            if (CommandScanner.isPlaceholderStart(source, i, true)) {
                i = CommandScanner.findPlaceholderEnd(source, i + 1) + 1;
            } else if (source.charAt(i) == '\n') {
                return true;
            } else {
                i++;
            }
        }
        return false;
    }

    private Token operator() throws WdlParseException {
        var start = offset;
        var location = location();
        var c = source.charAt(offset);
        var next = offset + 1 < source.length() ? source.charAt(offset + 1) : '\0';
        TokenType type;
        var length = 2;
        if (c == '&' && next == '&') {
            type = TokenType.AND;
        } else if (c == '|' && next == '|') {
            type = TokenType.OR;
        } else if (c == '=' && next == '=') {
            type = TokenType.EQ;
        } else if (c == '!' && next == '=') {
            type = TokenType.NEQ;
        } else if (c == '<' && next == '=') {
            type = TokenType.LE;
        } else if (c == '>' && next == '=') {
            type = TokenType.GE;
        } else {
            length = 1;
            type = singleCharacter(c);
            if (type == null) {
                throw new WdlParseException(location, String.format("Unexpected character '%s'", c));
            }
        }
        advance(length);
        return new Token(type, source.substring(start, offset), location, start, offset, false);
    }

    private static TokenType singleCharacter(char c) {
        switch (c) {
            case '{':
                return TokenType.LBRACE;
            case '}':
                return TokenType.RBRACE;
            case '(':
                return TokenType.LPAREN;
            case ')':
                return TokenType.RPAREN;
            case '[':
                return TokenType.LBRACKET;
            case ']':
                return TokenType.RBRACKET;
            case ',':
                return TokenType.COMMA;
            case ':':
                return TokenType.COLON;
            case '.':
                return TokenType.DOT;
            case '?':
                return TokenType.QUESTION;
            case '=':
                return TokenType.ASSIGN;
            case '+':
                return TokenType.PLUS;
            case '-':
                return TokenType.MINUS;
            case '*':
                return TokenType.STAR;
            case '/':
                return TokenType.SLASH;
            case '%':
                return TokenType.PERCENT;
            case '!':
                return TokenType.BANG;
            case '<':
                return TokenType.LT;
            case '>':
                return TokenType.GT;
            default:
                return null;
        }
    }

    private boolean followsDot() {
        return tokens.size() >= 2 && tokens.get(tokens.size() - 2).is(TokenType.DOT);
    }

    private boolean commandBodyFollows() {
        var i = offset;
        while (i < source.length() && Character.isWhitespace(source.charAt(i))) {
            i++;
        }
        return source.startsWith("<<<", i) || source.startsWith("{", i);
    }

    private Token command() throws WdlParseException {
        skipWhitespace();
        var commandLocation = location();
        var heredoc = source.startsWith("<<<", offset);
        advance(heredoc ? 3 : 1);
        var bodyStart = offset;
        var bodyLocation = location();
        var bodyEnd = heredoc ? heredocEnd(bodyStart) : braceEnd(bodyStart);
        if (bodyEnd < 0) {
            throw new WdlParseException(commandLocation,
                    String.format("Unterminated command section: missing closing '%s'", heredoc ? ">>>" : "}"));
        }
        var body = source.substring(bodyStart, bodyEnd);
        advance(bodyEnd - bodyStart);
        advance(heredoc ? 3 : 1);
        return new Token(TokenType.COMMAND, body, bodyLocation, bodyStart, bodyEnd, heredoc);
    }

    private int heredocEnd(int from) {
        var i = from;
        while (i < source.length()) {
            if (source.startsWith(">>>", i)) {
                return i;
            }
            if (CommandScanner.isPlaceholderStart(source, i, false)) {
                i = CommandScanner.findPlaceholderEnd(source, i + 1);
                if (i < 0) {
                    return -1;
                }
            }
            i++;
        }
        return -1;
    }

    private int braceEnd(int from) {
        var depth = 1;
        var i = from;
        while (i < source.length()) {
            var c = source.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (CommandScanner.isPlaceholderStart(source, i, true)) {
                i = CommandScanner.findPlaceholderEnd(source, i + 1);
                if (i < 0) {
                    return -1;
                }
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
            i++;
        }
        return -1;
    }

    private void skipWhitespaceAndComments() {
        while (offset < source.length()) {
            var c = source.charAt(offset);
            if (Character.isWhitespace(c)) {
                advance(1);
            } else if (c == '#') {
                while (offset < source.length() && source.charAt(offset) != '\n') {
                    advance(1);
                }
            } else {
                return;
            }
        }
    }

    private void skipWhitespace() {
        while (offset < source.length() && Character.isWhitespace(source.charAt(offset))) {
            advance(1);
        }
    }

    private void skipDigits() {
        while (offset < source.length() && Character.isDigit(source.charAt(offset))) {
            advance(1);
        }
    }

    private void advance(int count) {
        for (int i = 0; i < count && offset < source.length(); i++) {
            if (source.charAt(offset) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            offset++;
        }
    }

    private SourceLocation location() {
        return SourceLocation.of(file, line, column);
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
