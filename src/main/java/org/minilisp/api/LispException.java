package org.minilisp.api;

/**
 * Signals a failure while lexing, parsing or evaluating a top-level expression.
 * <p>
 * It carries a {@link LispErrorCode} so callers can branch on the kind of failure without
 * matching message text. The exception is unchecked because it unwinds through arbitrarily
 * deep recursive evaluation and is only handled at the interpreter boundary.
 */
public class LispException extends RuntimeException {

    private final LispErrorCode code;

    /**
     * Constructs a new exception.
     * @param code The error code.
     * @param message The user-facing message.
     */
    public LispException(LispErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    /**
     * Constructs a new exception with a cause.
     * @param code The error code.
     * @param message The user-facing message.
     * @param cause The underlying cause.
     */
    public LispException(LispErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * @return The error code of this failure.
     */
    public LispErrorCode getCode() {
        return code;
    }
}
