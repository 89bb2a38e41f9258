package io.hearthwarrio.locatium.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Recursive-descent {@link StepParser} for the supported XPath subset.
 * <p>
 * Supported per step: optional axis ({@code child::}), a tag or {@code *} node test and one
 * predicate made of attribute tests ({@code @a='v'}), bare comparisons ({@code price>35}),
 * positions ({@code [2]}) and the connectives {@code and}/{@code or}.
 * <p>
 * Stateless: every call works on its own {@link Cursor}.
 */
public final class XPathParser implements StepParser {

    @Override
    public List<LocationStep> parse(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenKind.END)) {
            throw new IllegalArgumentException("tokens must be terminated by an END token");
        }

        Cursor cursor = new Cursor(tokens);
        List<LocationStep> steps = new ArrayList<>();
        while (!cursor.isAtEnd()) {
            boolean absolute = false;
            if (cursor.match(TokenKind.SLASH)) {
                absolute = true;
                if (cursor.match(TokenKind.SLASH)) {
                    steps.add(LocationStep.descendantOrSelf());
                    continue;
                }
            }
            steps.add(parseStep(cursor, absolute));
        }
        return Collections.unmodifiableList(steps);
    }

    private static LocationStep parseStep(Cursor cursor, boolean absolute) {
        String axis = cursor.match(TokenKind.AXIS) ? cursor.previous().getText() : LocationStep.DEFAULT_AXIS;

        String nodeTest;
        if (cursor.match(TokenKind.WILDCARD)) {
            nodeTest = LocationStep.WILDCARD;
        } else if (cursor.match(TokenKind.TAG)) {
            nodeTest = cursor.previous().getText();
        } else {
            throw new XPathSyntaxException("Expected tag or '*'", cursor.current().getOffset());
        }

        Predicate predicate = null;
        if (cursor.match(TokenKind.PREDICATE_OPEN)) {
            predicate = parsePredicate(cursor);
            if (!cursor.match(TokenKind.PREDICATE_CLOSE)) {
                throw new XPathSyntaxException("Expected closing ']'", cursor.current().getOffset());
            }
        }

        if (cursor.match(TokenKind.NAMESPACE)) {
            nodeTest = cursor.previous().getText() + ":" + nodeTest;
        }

        return new LocationStep(axis, nodeTest, predicate, absolute);
    }

    private static Predicate parsePredicate(Cursor cursor) {
        List<PredicateCondition> conditions = new ArrayList<>();
        while (!cursor.check(TokenKind.PREDICATE_CLOSE)) {
            if (cursor.isAtEnd()) {
                throw new XPathSyntaxException("Expected closing ']'", cursor.current().getOffset());
            }

            // unprefixed comparison, e.g. price>35
            if (cursor.check(TokenKind.TAG)
                    && cursor.peek(1).is(TokenKind.OPERATOR)
                    && (cursor.peek(2).is(TokenKind.LITERAL) || cursor.peek(2).is(TokenKind.TAG))) {
                String name = cursor.advance().getText();
                ComparisonOperator op = operator(cursor.advance());
                String raw = cursor.advance().getText();
                conditions.add(new AttributeCondition(name, raw, op));
                continue;
            }

            if (cursor.match(TokenKind.ATTRIBUTE)) {
                String name = cursor.consume(TokenKind.TAG, "Expected attribute name").getText();
                ComparisonOperator op = operator(cursor.consume(TokenKind.OPERATOR, "Expected comparison operator"));
                String value = cursor.consume(TokenKind.LITERAL, "Expected quoted value").getText();
                conditions.add(new AttributeCondition(name, unescape(value), op));
            } else if (cursor.check(TokenKind.TAG) && startsWithDigit(cursor.current().getText())) {
                Token number = cursor.advance();
                conditions.add(new PositionCondition(leadingInt(number)));
            } else if (cursor.check(TokenKind.TAG)
                    && ("and".equals(cursor.current().getText()) || "or".equals(cursor.current().getText()))) {
                cursor.advance();
            } else {
                throw new XPathSyntaxException("Unexpected token in predicate", cursor.current().getOffset());
            }
        }
        return new Predicate(conditions);
    }

    private static ComparisonOperator operator(Token token) {
        ComparisonOperator op = ComparisonOperator.fromSymbol(token.getText());
        if (op == null) {
            throw new XPathSyntaxException("Unsupported operator '" + token.getText() + "'", token.getOffset());
        }
        return op;
    }

    private static boolean startsWithDigit(String text) {
        return !text.isEmpty() && text.charAt(0) >= '0' && text.charAt(0) <= '9';
    }

    private static int leadingInt(Token token) {
        String text = token.getText();
        int end = 0;
        while (end < text.length() && text.charAt(end) >= '0' && text.charAt(end) <= '9') {
            end++;
        }
        try {
            return Integer.parseInt(text.substring(0, end));
        } catch (NumberFormatException e) {
            throw new XPathSyntaxException("Position out of range '" + text + "'", token.getOffset());
        }
    }

    static String unescape(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' && i + 1 < value.length()) {
                sb.append(value.charAt(++i));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Read position over one token list. Never reads past the END token.
     */
    private static final class Cursor {
        private final List<Token> tokens;
        private int pos;

        private Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        boolean match(TokenKind kind) {
            if (check(kind)) {
                advance();
                return true;
            }
            return false;
        }

        boolean check(TokenKind kind) {
            return !isAtEnd() && current().is(kind);
        }

        Token consume(TokenKind kind, String message) {
            if (check(kind)) {
                return advance();
            }
            throw new XPathSyntaxException(message, current().getOffset());
        }

        Token advance() {
            if (!isAtEnd()) {
                pos++;
            }
            return previous();
        }

        Token peek(int n) {
            return tokens.get(Math.min(pos + n, tokens.size() - 1));
        }

        Token current() {
            return tokens.get(pos);
        }

        Token previous() {
            return tokens.get(pos - 1);
        }

        boolean isAtEnd() {
            return current().is(TokenKind.END);
        }
    }
}
