package org.minilisp.lexer;

import org.minilisp.api.LispErrorCode;
import org.minilisp.api.LispException;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer converts a line of source text into a flat sequence of tokens.
 * <p>
 * Tokenization covers the whole string at once. The first character that cannot start a
 * token aborts the pass with a {@link LispException}; no partial token list is returned.
 */
public class Lexer {

    private static final String OPERATOR_CHARS = "+-*/%<>=!";

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    /**
     * Creates a new Lexer.
     * @param source The source text.
     */
    public Lexer(String source) {
        this.source = source;
    }

    /**
     * Performs the tokenization of the entire source text.
     * @return The recognized tokens in order.
     * @throws LispException if an unexpected character is found.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.PAREN_OPEN); break;
            case ')': addToken(TokenType.PAREN_CLOSE); break;
            case ' ', '\r', '\t', '\n', '\f', '\013':
                break;
            default:
                if (isDigit(c) || (c == '-' && isDigit(peek()))) {
                    number();
                } else if (isSymbolStart(c)) {
                    symbol();
                } else {
                    throw new LispException(LispErrorCode.LEX_UNEXPECTED_CHARACTER,
                            "Unexpected character: " + c);
                }
                break;
        }
    }

    private void number() {
        // Digits and dots are consumed greedily; the parser validates the literal.
        while (isDigit(peek()) || peek() == '.') advance();
        addToken(TokenType.NUMBER);
    }

    private void symbol() {
        while (isSymbolPart(peek())) advance();
        addToken(TokenType.SYMBOL);
    }

    private void addToken(TokenType type) {
        tokens.add(new Token(type, source.substring(start, current), start + 1));
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private boolean isOperator(char c) {
        return c != '\0' && OPERATOR_CHARS.indexOf(c) >= 0;
    }

    private boolean isSymbolStart(char c) {
        return isAlpha(c) || isOperator(c);
    }

    private boolean isSymbolPart(char c) {
        return isAlpha(c) || isDigit(c) || isOperator(c);
    }
}
