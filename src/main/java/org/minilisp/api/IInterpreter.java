package org.minilisp.api;

import org.minilisp.runtime.Environment;

/**
 * Defines the public interface of the interpreter. It is the single entry point
 * used by the command line and by embedding code.
 */
public interface IInterpreter {

    /**
     * Evaluates the first top-level expression of a line of source text against the
     * interpreter's persistent global environment. Language errors never escape as exceptions;
     * they are returned as {@link EvaluationResult.Failure}.
     *
     * @param line One line of source text.
     * @return The result of the evaluation.
     */
    EvaluationResult evaluate(String line);

    /**
     * @return The global environment that survives across calls to {@link #evaluate(String)}.
     */
    Environment globalEnvironment();
}
