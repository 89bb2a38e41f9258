package io.hearthwarrio.locatium.core;

/**
 * Kinds of tokens emitted by a {@link Tokenizer}.
 */
public enum TokenKind {
    /** Element name or any other bare identifier (e.g. "book", "1", "and"). */
    TAG,
    /** '@' starting an attribute test. */
    ATTRIBUTE,
    /** Axis name followed by "::" (text excludes the "::"). */
    AXIS,
    /** '['. */
    PREDICATE_OPEN,
    /** ']'. */
    PREDICATE_CLOSE,
    /** One of =, !=, &lt;, &gt;, &lt;=, &gt;=. */
    OPERATOR,
    /** Content of a quoted string, quotes stripped, escapes kept. */
    LITERAL,
    /** '*'. */
    WILDCARD,
    /** Namespace prefix of the preceding node test. */
    NAMESPACE,
    /** '/' or '//'. */
    SLASH,
    /** End of input. Always the last token. */
    END
}
