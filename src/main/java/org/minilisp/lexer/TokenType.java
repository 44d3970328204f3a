package org.minilisp.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    /** The '(' character, which opens a list. */
    PAREN_OPEN,
    /** The ')' character, which closes a list. */
    PAREN_CLOSE,

    // Literals.
    /** A numeric literal such as {@code 42}, {@code -3} or {@code 2.5}. */
    NUMBER,
    /** A symbol such as {@code define}, {@code square} or {@code +}. */
    SYMBOL
}
