package io.hearthwarrio.locatium.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class XPathLexerTest {
    private final Tokenizer lexer = new XPathLexer();

    @Test
    void tokenizesAttributePredicate() {
        List<Token> tokens = lexer.tokenize("//div[@class='header']");

        assertEquals(List.of(
                new Token(TokenKind.SLASH, "//", 0),
                new Token(TokenKind.TAG, "div", 2),
                new Token(TokenKind.PREDICATE_OPEN, "[", 5),
                new Token(TokenKind.ATTRIBUTE, "@", 6),
                new Token(TokenKind.TAG, "class", 7),
                new Token(TokenKind.OPERATOR, "=", 12),
                new Token(TokenKind.LITERAL, "header", 14),
                new Token(TokenKind.PREDICATE_CLOSE, "]", 21),
                new Token(TokenKind.END, "", 22)
        ), tokens);
    }

    @Test
    void alwaysEndsWithEndMarker() {
        List<Token> empty = lexer.tokenize("");
        assertEquals(1, empty.size());
        assertTrue(empty.get(0).is(TokenKind.END));

        List<Token> blank = lexer.tokenize("   ");
        assertEquals(List.of(new Token(TokenKind.END, "", 3)), blank);
    }

    @Test
    void singleAndDoubleSlashAreSeparateForms() {
        List<Token> tokens = lexer.tokenize("/a//b");

        assertEquals("/", tokens.get(0).getText());
        assertEquals("//", tokens.get(2).getText());
        assertEquals(2, tokens.get(2).getOffset());
        assertEquals(TokenKind.TAG, tokens.get(3).getKind());
    }

    @Test
    void readsTwoCharacterOperatorsGreedily() {
        List<Token> tokens = lexer.tokenize("a!=b<=c>=d<e>f=g");

        assertEquals("!=", tokens.get(1).getText());
        assertEquals(1, tokens.get(1).getOffset());
        assertEquals("<=", tokens.get(3).getText());
        assertEquals(">=", tokens.get(5).getText());
        assertEquals("<", tokens.get(7).getText());
        assertEquals(">", tokens.get(9).getText());
        assertEquals("=", tokens.get(11).getText());
        for (int i = 1; i < 12; i += 2) {
            assertEquals(TokenKind.OPERATOR, tokens.get(i).getKind());
        }
    }

    @Test
    void recognizesAxisSpecifier() {
        List<Token> tokens = lexer.tokenize("child::div/following-sibling::span");

        assertEquals(new Token(TokenKind.AXIS, "child", 0), tokens.get(0));
        assertEquals(new Token(TokenKind.TAG, "div", 7), tokens.get(1));
        assertEquals(new Token(TokenKind.AXIS, "following-sibling", 11), tokens.get(3));
        assertEquals(new Token(TokenKind.TAG, "span", 30), tokens.get(4));
    }

    @Test
    void singleColonStaysInsideTag() {
        List<Token> tokens = lexer.tokenize("ns:item");

        assertEquals(new Token(TokenKind.TAG, "ns:item", 0), tokens.get(0));
        assertTrue(tokens.get(1).is(TokenKind.END));
    }

    @Test
    void keepsEscapesInsideLiteral() {
        List<Token> tokens = lexer.tokenize("[@title=\"say \\\"hi\\\"\"]");

        Token literal = tokens.get(4);
        assertEquals(TokenKind.LITERAL, literal.getKind());
        assertEquals("say \\\"hi\\\"", literal.getText());
        assertEquals(9, literal.getOffset());
    }

    @Test
    void wildcardAndFunctionLikeTags() {
        List<Token> tokens = lexer.tokenize("/*/text()");

        assertEquals(TokenKind.WILDCARD, tokens.get(1).getKind());
        assertEquals(new Token(TokenKind.TAG, "text()", 3), tokens.get(3));
    }

    @Test
    void skipsWhitespaceBetweenTokens() {
        List<Token> tokens = lexer.tokenize(" a [ 2 ] ");

        assertEquals(new Token(TokenKind.TAG, "a", 1), tokens.get(0));
        assertEquals(new Token(TokenKind.PREDICATE_OPEN, "[", 3), tokens.get(1));
        assertEquals(new Token(TokenKind.TAG, "2", 5), tokens.get(2));
        assertEquals(new Token(TokenKind.PREDICATE_CLOSE, "]", 7), tokens.get(3));
        assertEquals(new Token(TokenKind.END, "", 9), tokens.get(4));
    }

    @Test
    void throwsOnUnterminatedLiteral() {
        XPathLexicalException ex = assertThrows(
                XPathLexicalException.class,
                () -> lexer.tokenize("//button[@name='x]")
        );

        assertEquals(16, ex.getOffset());
        assertTrue(ex.getMessage().contains("Unterminated string literal"));
    }

    @Test
    void escapedQuoteDoesNotTerminateLiteral() {
        assertThrows(XPathLexicalException.class, () -> lexer.tokenize("[@a='x\\']"));
    }
}
