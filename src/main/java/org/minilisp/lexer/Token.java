package org.minilisp.lexer;

/**
 * Represents a single token extracted from the source text by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source.
 * @param column The 1-based column where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        int column
) {
}
