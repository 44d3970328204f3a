package org.minilisp.api;

import org.minilisp.model.Expression;

/**
 * The outcome of evaluating one line of source text: either a value or a tagged error.
 */
public sealed interface EvaluationResult permits EvaluationResult.Success, EvaluationResult.Failure {

    /**
     * @return {@code true} if evaluation produced a value.
     */
    boolean isSuccess();

    /**
     * A successful evaluation.
     * @param value The resulting expression.
     */
    record Success(Expression value) implements EvaluationResult {
        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * A failed evaluation.
     * @param code The error code.
     * @param message The message describing the failure.
     */
    record Failure(LispErrorCode code, String message) implements EvaluationResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public String toString() {
            return String.format("[%s] %s", code, message);
        }
    }
}
