package io.hearthwarrio.locatium.core;

import java.util.Objects;

/**
 * Single lexed unit of an XPath expression.
 */
public final class Token {

    private final TokenKind kind;
    private final String text;
    private final int offset;

    public Token(TokenKind kind, String text, int offset) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.offset = offset;
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    /**
     * Zero-based position in the source where this token starts. Diagnostics only.
     */
    public int getOffset() {
        return offset;
    }

    public boolean is(TokenKind k) {
        return kind == k;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Token)) {
            return false;
        }
        Token other = (Token) o;
        return offset == other.offset && kind == other.kind && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, offset);
    }

    @Override
    public String toString() {
        return kind + "('" + text + "')@" + offset;
    }
}
