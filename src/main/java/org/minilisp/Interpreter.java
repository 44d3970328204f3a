package org.minilisp;

import com.typesafe.config.Config;
import org.minilisp.api.EvaluationResult;
import org.minilisp.api.IInterpreter;
import org.minilisp.api.LispErrorCode;
import org.minilisp.api.LispException;
import org.minilisp.lexer.Lexer;
import org.minilisp.lexer.Token;
import org.minilisp.model.Expression;
import org.minilisp.parser.Parser;
import org.minilisp.runtime.Environment;
import org.minilisp.runtime.Evaluator;
import org.minilisp.runtime.EvaluatorOptions;
import org.minilisp.runtime.builtins.Builtins;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The main interpreter implementation. It owns the global environment, created once and
 * pre-populated with the built-ins, and drives each line through lexing, parsing and evaluation.
 * <p>
 * Every failure aborts the current line only. Bindings made before the failure point are kept.
 * <p>
 * Each line is evaluated on a dedicated thread whose stack is sized from
 * {@link EvaluatorOptions#maxDepth()}, so the depth limit trips before the host stack runs out.
 * The calling thread waits for it, so evaluation stays sequential. It is not thread-safe.
 */
public class Interpreter implements IInterpreter {

    private static final Logger log = LoggerFactory.getLogger(Interpreter.class);

    /** Stack reserved per unit of evaluation depth; one unit takes a handful of Java frames. */
    static final long STACK_BYTES_PER_DEPTH = 4 * 1024;
    /** Lower bound for the evaluation thread's stack. */
    static final long MIN_STACK_BYTES = 1024 * 1024;

    private final Environment globalEnv = new Environment();
    private final Evaluator evaluator;
    private final long stackBytes;

    /**
     * Creates an interpreter with default evaluation options.
     */
    public Interpreter() {
        this(EvaluatorOptions.defaults());
    }

    /**
     * Creates an interpreter.
     * @param options The evaluation options.
     */
    public Interpreter(EvaluatorOptions options) {
        this.evaluator = new Evaluator(options);
        this.stackBytes = stackBytesFor(options.maxDepth());
        Builtins.installInto(globalEnv);
    }

    /**
     * Creates an interpreter from the {@code minilisp} configuration block.
     * @param config The application configuration.
     * @return The configured interpreter.
     * @throws com.typesafe.config.ConfigException if a setting has the wrong type.
     * @throws IllegalArgumentException if a setting is out of range.
     */
    public static Interpreter fromConfig(Config config) {
        if (config.hasPath("minilisp.evaluator")) {
            return new Interpreter(EvaluatorOptions.fromConfig(config.getConfig("minilisp.evaluator")));
        }
        return new Interpreter();
    }

    @Override
    public EvaluationResult evaluate(String line) {
        try {
            return new EvaluationResult.Success(evaluateOrThrow(line));
        } catch (LispException e) {
            log.debug("Evaluation of '{}' failed with {}: {}", line, e.getCode(), e.getMessage());
            return new EvaluationResult.Failure(e.getCode(), e.getMessage());
        } catch (StackOverflowError e) {
            evaluator.reset();
            log.warn("Host stack exhausted while evaluating '{}'", line);
            return new EvaluationResult.Failure(LispErrorCode.RESOURCE_EXHAUSTED, "Stack overflow during evaluation");
        }
    }

    /**
     * Evaluates a line and lets failures propagate as {@link LispException}.
     *
     * @param line One line of source text.
     * @return The value of its first top-level expression.
     * @throws LispException if lexing, parsing or evaluation fails.
     */
    public Expression evaluateOrThrow(String line) {
        final AtomicReference<Expression> value = new AtomicReference<>();
        final AtomicReference<Throwable> failure = new AtomicReference<>();
        final Thread worker = new Thread(null, () -> {
            try {
                value.set(evaluateOnCurrentThread(line));
            } catch (Throwable t) {
                // Handed back to the caller below.
                failure.set(t);
            }
        }, "minilisp-eval", stackBytes);
        worker.start();
        joinUninterruptibly(worker);

        final Throwable t = failure.get();
        if (t instanceof RuntimeException runtimeException) {
            throw runtimeException;
        }
        if (t instanceof Error error) {
            throw error;
        }
        return value.get();
    }

    private Expression evaluateOnCurrentThread(String line) {
        List<Token> tokens = new Lexer(line).scanTokens();
        Parser parser = new Parser(tokens);
        Expression expression = parser.parseExpression();
        if (parser.hasRemainingTokens()) {
            log.debug("Ignoring input after the first expression in '{}'", line);
        }
        return evaluator.evaluate(expression, globalEnv);
    }

    private static void joinUninterruptibly(Thread worker) {
        boolean interrupted = false;
        while (true) {
            try {
                worker.join();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * @param maxDepth The configured evaluation depth limit.
     * @return The stack size requested for the evaluation thread.
     */
    static long stackBytesFor(int maxDepth) {
        return Math.max(MIN_STACK_BYTES, maxDepth * STACK_BYTES_PER_DEPTH);
    }

    /**
     * @return The stack size requested for the evaluation thread.
     */
    long getStackBytes() {
        return stackBytes;
    }

    @Override
    public Environment globalEnvironment() {
        return globalEnv;
    }
}
