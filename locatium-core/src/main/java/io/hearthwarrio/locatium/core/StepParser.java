package io.hearthwarrio.locatium.core;

import java.util.List;

/**
 * Builds path steps from a token sequence.
 */
@FunctionalInterface
public interface StepParser {

    /**
     * Parse tokens into steps.
     *
     * @param tokens token list terminated by {@link TokenKind#END}
     * @return steps in source order
     * @throws XPathSyntaxException if the tokens do not form a valid path
     */
    List<LocationStep> parse(List<Token> tokens);
}
