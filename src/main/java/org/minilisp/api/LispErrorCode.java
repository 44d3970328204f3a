package org.minilisp.api;

/**
 * Defines unique, testable error codes for every failure a top-level expression can run into.
 * This decouples tests and callers from the exact wording of the messages.
 */
public enum LispErrorCode {
    // region Lexer Errors
    /** A character that cannot start any token. */
    LEX_UNEXPECTED_CHARACTER(Category.LEX),
    // endregion

    // region Parser Errors
    /** The token sequence ended before a list was closed. */
    PARSE_MISSING_CLOSING_PAREN(Category.PARSE),
    /** A close-paren or end of input where an expression must start. */
    PARSE_UNEXPECTED_TOKEN(Category.PARSE),
    /** A number literal that does not form a valid floating-point value, e.g. {@code 1.2.3}. */
    PARSE_INVALID_NUMBER(Category.PARSE),
    // endregion

    // region Special Form Errors
    /** The first element of a non-empty list is not a symbol. */
    SYNTAX_HEAD_NOT_SYMBOL(Category.SYNTAX),
    /** {@code define} with the wrong shape. */
    SYNTAX_INVALID_DEFINE(Category.SYNTAX),
    /** {@code lambda} with the wrong shape. */
    SYNTAX_INVALID_LAMBDA(Category.SYNTAX),
    /** A lambda parameter that is not a symbol. */
    SYNTAX_LAMBDA_PARAMETER(Category.SYNTAX),
    /** {@code if} with the wrong number of elements. */
    SYNTAX_INVALID_IF(Category.SYNTAX),
    // endregion

    // region Runtime Errors
    /** A symbol that is bound in no enclosing scope. */
    NAME_UNDEFINED_SYMBOL(Category.NAME),
    /** The head of an application did not evaluate to a function. */
    TYPE_NOT_A_FUNCTION(Category.TYPE),
    /** A built-in received a non-number argument. */
    TYPE_ARGUMENT_NOT_NUMBER(Category.TYPE),
    /** A function was applied to the wrong number of arguments. */
    ARITY_MISMATCH(Category.ARITY),
    /** Evaluation nested deeper than the configured limit or the host stack allows. */
    RESOURCE_EXHAUSTED(Category.RESOURCE);
    // endregion

    /**
     * The coarse class an error code belongs to.
     */
    public enum Category {
        /** Raised while tokenizing. */
        LEX,
        /** Raised while building the expression tree. */
        PARSE,
        /** A malformed special form. */
        SYNTAX,
        /** An unresolved name. */
        NAME,
        /** A value of the wrong kind. */
        TYPE,
        /** A wrong argument count. */
        ARITY,
        /** Host resources ran out. */
        RESOURCE
    }

    private final Category category;

    LispErrorCode(Category category) {
        this.category = category;
    }

    /**
     * @return The category this code belongs to.
     */
    public Category category() {
        return category;
    }
}
