package io.hearthwarrio.locatium.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Default {@link Tokenizer} for the supported XPath subset.
 * <p>
 * Stateless: the read position lives in {@link #tokenize(String)} only, so one instance
 * can be shared between threads.
 */
public final class XPathLexer implements Tokenizer {

    private static final String DELIMITERS = "/[]@=!<>*";

    @Override
    public List<Token> tokenize(String xpath) {
        Objects.requireNonNull(xpath, "xpath must not be null");

        List<Token> tokens = new ArrayList<>();
        int length = xpath.length();
        int pos = 0;

        while (pos < length) {
            char c = xpath.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }

            switch (c) {
                case '/':
                    if (pos + 1 < length && xpath.charAt(pos + 1) == '/') {
                        tokens.add(new Token(TokenKind.SLASH, "//", pos));
                        pos += 2;
                    } else {
                        tokens.add(new Token(TokenKind.SLASH, "/", pos));
                        pos++;
                    }
                    continue;
                case '@':
                    tokens.add(new Token(TokenKind.ATTRIBUTE, "@", pos++));
                    continue;
                case '[':
                    tokens.add(new Token(TokenKind.PREDICATE_OPEN, "[", pos++));
                    continue;
                case ']':
                    tokens.add(new Token(TokenKind.PREDICATE_CLOSE, "]", pos++));
                    continue;
                case '*':
                    tokens.add(new Token(TokenKind.WILDCARD, "*", pos++));
                    continue;
                case '"':
                case '\'':
                    pos = readLiteral(xpath, pos, tokens);
                    continue;
                case '=':
                case '!':
                case '<':
                case '>':
                    pos = readOperator(xpath, pos, tokens);
                    continue;
                default:
                    break;
            }

            int axisEnd = axisEnd(xpath, pos);
            if (axisEnd > pos) {
                tokens.add(new Token(TokenKind.AXIS, xpath.substring(pos, axisEnd), pos));
                pos = axisEnd + 2;
                continue;
            }

            int start = pos;
            while (pos < length && !isBoundary(xpath.charAt(pos))) {
                pos++;
            }
            tokens.add(new Token(TokenKind.TAG, xpath.substring(start, pos), start));
        }

        tokens.add(new Token(TokenKind.END, "", pos));
        return Collections.unmodifiableList(tokens);
    }

    private static int readLiteral(String xpath, int quotePos, List<Token> tokens) {
        char quote = xpath.charAt(quotePos);
        int start = quotePos + 1;
        int pos = start;
        while (pos < xpath.length() && xpath.charAt(pos) != quote) {
            if (xpath.charAt(pos) == '\\' && pos + 1 < xpath.length()) {
                pos++;
            }
            pos++;
        }
        if (pos >= xpath.length()) {
            throw new XPathLexicalException("Unterminated string literal", start);
        }
        tokens.add(new Token(TokenKind.LITERAL, xpath.substring(start, pos), start));
        return pos + 1;
    }

    private static int readOperator(String xpath, int pos, List<Token> tokens) {
        int start = pos;
        pos++;
        if (pos < xpath.length() && xpath.charAt(pos) == '=') {
            pos++;
        }
        tokens.add(new Token(TokenKind.OPERATOR, xpath.substring(start, pos), start));
        return pos;
    }

    /**
     * Returns the end of an axis name starting at {@code pos} when the name is directly
     * followed by "::", otherwise {@code pos}.
     */
    private static int axisEnd(String xpath, int pos) {
        int end = pos;
        while (end < xpath.length() && !isBoundary(xpath.charAt(end)) && xpath.charAt(end) != ':') {
            end++;
        }
        if (end > pos && xpath.startsWith("::", end)) {
            return end;
        }
        return pos;
    }

    private static boolean isBoundary(char c) {
        return Character.isWhitespace(c) || DELIMITERS.indexOf(c) >= 0;
    }
}
