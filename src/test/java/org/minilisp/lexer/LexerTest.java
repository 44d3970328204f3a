package org.minilisp.lexer;

import org.minilisp.api.LispErrorCode;
import org.minilisp.api.LispException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that the lexer converts source strings into a flat token sequence,
 * classifying parens, numbers and symbols and rejecting unknown characters.
 */
public class LexerTest {

    @Test
    @Tag("unit")
    void testLexerTokenization() {
        // Arrange
        Lexer lexer = new Lexer("(define square (lambda (x) (* x x)))");

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(tokens).extracting(Token::text).containsExactly(
                "(", "define", "square", "(", "lambda", "(", "x", ")", "(", "*", "x", "x", ")", ")", ")");
        assertThat(tokens.get(0)).extracting(Token::type, Token::column).containsExactly(TokenType.PAREN_OPEN, 1);
        assertThat(tokens.get(1)).extracting(Token::type, Token::column).containsExactly(TokenType.SYMBOL, 2);
        assertThat(tokens.get(9)).extracting(Token::type, Token::text).containsExactly(TokenType.SYMBOL, "*");
        assertThat(tokens.get(14).type()).isEqualTo(TokenType.PAREN_CLOSE);
    }

    @Test
    @Tag("unit")
    void testNumbersIncludingNegativeAndFractional() {
        List<Token> tokens = new Lexer("42 -7 2.5").scanTokens();

        assertThat(tokens).extracting(Token::type)
                .containsOnly(TokenType.NUMBER);
        assertThat(tokens).extracting(Token::text).containsExactly("42", "-7", "2.5");
    }

    /**
     * A minus that is not directly followed by a digit is a symbol, so it can name subtraction.
     */
    @Test
    @Tag("unit")
    void testMinusWithoutDigitIsSymbol() {
        List<Token> tokens = new Lexer("(- 5 3)").scanTokens();

        assertThat(tokens.get(1)).extracting(Token::type, Token::text).containsExactly(TokenType.SYMBOL, "-");
        assertThat(tokens.get(2)).extracting(Token::type, Token::text).containsExactly(TokenType.NUMBER, "5");
    }

    @Test
    @Tag("unit")
    void testMalformedNumberIsAcceptedLexically() {
        List<Token> tokens = new Lexer("1.2.3").scanTokens();

        assertThat(tokens).singleElement()
                .extracting(Token::type, Token::text).containsExactly(TokenType.NUMBER, "1.2.3");
    }

    @Test
    @Tag("unit")
    void testOperatorSymbolsAndMixedCharacters() {
        List<Token> tokens = new Lexer("== <= != a-1 x2 -a").scanTokens();

        assertThat(tokens).extracting(Token::type).containsOnly(TokenType.SYMBOL);
        assertThat(tokens).extracting(Token::text).containsExactly("==", "<=", "!=", "a-1", "x2", "-a");
    }

    /**
     * A number literal stops at the first character that is neither a digit nor a dot.
     */
    @Test
    @Tag("unit")
    void testNumberFollowedBySymbolSplitsIntoTwoTokens() {
        List<Token> tokens = new Lexer("5abc").scanTokens();

        assertThat(tokens).extracting(Token::type, Token::text).containsExactly(
                org.assertj.core.groups.Tuple.tuple(TokenType.NUMBER, "5"),
                org.assertj.core.groups.Tuple.tuple(TokenType.SYMBOL, "abc"));
    }

    @Test
    @Tag("unit")
    void testWhitespaceOnlyProducesNoTokens() {
        assertThat(new Lexer(" \t\r\n ").scanTokens()).isEmpty();
        assertThat(new Lexer("").scanTokens()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testUnexpectedCharacterFails() {
        Lexer lexer = new Lexer("(+ 1 \"a\")");

        assertThatThrownBy(lexer::scanTokens)
                .isInstanceOf(LispException.class)
                .hasMessage("Unexpected character: \"")
                .extracting(e -> ((LispException) e).getCode())
                .isEqualTo(LispErrorCode.LEX_UNEXPECTED_CHARACTER);
    }

    @Test
    @Tag("unit")
    void testUnderscoreIsNotASymbolCharacter() {
        assertThatThrownBy(() -> new Lexer("foo_bar").scanTokens())
                .isInstanceOf(LispException.class)
                .hasMessageContaining("_");
    }
}
