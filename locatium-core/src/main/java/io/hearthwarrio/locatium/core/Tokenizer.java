package io.hearthwarrio.locatium.core;

import java.util.List;

/**
 * Turns raw path text into tokens.
 */
@FunctionalInterface
public interface Tokenizer {

    /**
     * Tokenize the given expression.
     *
     * @param xpath raw path text
     * @return immutable token list, always terminated by a {@link TokenKind#END} token
     * @throws XPathLexicalException if a quoted literal is not terminated
     */
    List<Token> tokenize(String xpath);
}
