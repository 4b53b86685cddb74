package com.hartwig.wdl2cwl.wdl;

import java.util.ArrayList;
import java.util.List;

import com.hartwig.wdl2cwl.diagnostic.SourceLocation;
import com.hartwig.wdl2cwl.diagnostic.WdlParseException;

/**
 * Splits command bodies and string literals into literal text and placeholders, and finds the ends of delimited regions
 * for the lexer. Placeholders are matched with their own braces, including braces inside quoted strings within them.
 */
final class CommandScanner {

    private CommandScanner() {
    }

    static final class Segment {
        private final boolean placeholder;
        private final String text;
        private final String marker;
        private final SourceLocation location;

        private Segment(boolean placeholder, String text, String marker, SourceLocation location) {
            this.placeholder = placeholder;
            this.text = text;
            this.marker = marker;
            this.location = location;
        }

        boolean isPlaceholder() {
            return placeholder;
        }

        /**
         * Literal text, or the content between the braces of a placeholder.
         */
        String text() {
            return text;
        }

        String marker() {
            return marker;
        }

        SourceLocation location() {
            return location;
        }
    }

    /**
     * @param dollarPlaceholders whether {@code ${...}} is a placeholder, which it is everywhere except in heredoc commands
     */
    static List<Segment> split(String text, SourceLocation start, boolean dollarPlaceholders) throws WdlParseException {
        var segments = new ArrayList<Segment>();
        var literalStart = 0;
        var line = start.line();
        var column = start.column();
        var i = 0;
        while (i < text.length()) {
            if (isPlaceholderStart(text, i, dollarPlaceholders)) {
                var location = SourceLocation.of(start.file(), line, column);
                var end = findPlaceholderEnd(text, i + 1);
                if (end < 0) {
                    throw new WdlParseException(location, "Unterminated placeholder '" + abbreviate(text.substring(i)) + "'");
                }
                if (i > literalStart) {
                    segments.add(new Segment(false, text.substring(literalStart, i), null, null));
                }
                segments.add(new Segment(true, text.substring(i + 2, end), text.substring(i, end + 1), location));
                for (int j = i; j <= end; j++) {
                    if (text.charAt(j) == '\n') {
                        line++;
                        column = 1;
                    } else {
                        column++;
                    }
                }
                i = end + 1;
                literalStart = i;
            } else {
                if (text.charAt(i) == '\n') {
                    line++;
                    column = 1;
                } else {
                    column++;
                }
                i++;
            }
        }
        if (literalStart < text.length()) {
            segments.add(new Segment(false, text.substring(literalStart), null, null));
        }
        return segments;
    }

    static boolean isPlaceholderStart(String text, int index, boolean dollarPlaceholders) {
        if (index + 1 >= text.length() || text.charAt(index + 1) != '{') {
            return false;
        }
        var c = text.charAt(index);
        return c == '~' || (dollarPlaceholders && c == '$');
    }

    /**
     * @param openBrace index of the opening brace of a placeholder
     * @return index of the matching closing brace, or -1
     */
    static int findPlaceholderEnd(String text, int openBrace) {
        var depth = 0;
        var i = openBrace;
        while (i < text.length()) {
            var c = text.charAt(i);
            if (c == '"' || c == '\'') {
                i = findQuoteEnd(text, i);
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

    /**
     * @param quote index of an opening quote
     * @return index of the matching closing quote, or -1
     */
    static int findQuoteEnd(String text, int quote) {
        var quoteChar = text.charAt(quote);
        var i = quote + 1;
        while (i < text.length()) {
            var c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quoteChar) {
                return i;
            }
            if (isPlaceholderStart(text, i, true)) {
                i = findPlaceholderEnd(text, i + 1);
                if (i < 0) {
                    return -1;
                }
            }
            i++;
        }
        return -1;
    }

    /**
     * Resolves the escape sequences of a WDL string literal.
     */
    static String unescape(String text) {
        if (text.indexOf('\\') < 0) {
            return text;
        }
        var builder = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            var c = text.charAt(i);
            if (c != '\\' || i + 1 == text.length()) {
                builder.append(c);
                continue;
            }
            var next = text.charAt(++i);
            switch (next) {
                case 'n':
                    builder.append('\n');
                    break;
                case 't':
                    builder.append('\t');
                    break;
                case 'r':
                    builder.append('\r');
                    break;
                default:
                    builder.append(next);
            }
        }
        return builder.toString();
    }

    static String abbreviate(String text) {
        var firstLine = text.lines().findFirst().orElse("");
        return firstLine.length() > 40 ? firstLine.substring(0, 40) + "..." : firstLine;
    }
}
