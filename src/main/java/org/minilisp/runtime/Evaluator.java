package org.minilisp.runtime;

import org.minilisp.api.LispErrorCode;
import org.minilisp.api.LispException;
import org.minilisp.model.Expression;
import org.minilisp.model.Expression.Closure;
import org.minilisp.model.Expression.ListVal;
import org.minilisp.model.Expression.Native;
import org.minilisp.model.Expression.Num;
import org.minilisp.model.Expression.Sym;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates expression trees against an {@link Environment}.
 * <p>
 * Numbers, functions and the empty list evaluate to themselves, symbols are looked up, and a
 * non-empty list is either one of the special forms {@code define}, {@code lambda} and {@code if}
 * (recognized by the spelling of its leading symbol) or a function application.
 * <p>
 * Evaluation is directly recursive. The nesting depth is counted and capped by
 * {@link EvaluatorOptions#maxDepth()}. An instance is not thread-safe.
 */
public class Evaluator {

    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    static final String DEFINE = "define";
    static final String LAMBDA = "lambda";
    static final String IF = "if";

    private final EvaluatorOptions options;
    private int depth = 0;

    /**
     * Creates an evaluator with default options.
     */
    public Evaluator() {
        this(EvaluatorOptions.defaults());
    }

    /**
     * Creates an evaluator.
     * @param options The evaluation limits.
     */
    public Evaluator(EvaluatorOptions options) {
        this.options = options;
    }

    /**
     * Evaluates an expression.
     *
     * @param expression The expression to evaluate.
     * @param env The environment to evaluate it in.
     * @return The resulting value.
     * @throws LispException if evaluation fails.
     */
    public Expression evaluate(Expression expression, Environment env) {
        if (++depth > options.maxDepth()) {
            depth--;
            throw new LispException(LispErrorCode.RESOURCE_EXHAUSTED,
                    "Maximum evaluation depth of " + options.maxDepth() + " exceeded");
        }
        try {
            if (expression instanceof Sym sym) {
                return env.lookup(sym.name());
            }
            if (expression instanceof ListVal list) {
                return evaluateList(list, env);
            }
            // Numbers and functions are self-evaluating.
            return expression;
        } finally {
            depth--;
        }
    }

    /**
     * Resets the depth counter. Used by the interpreter after a host stack overflow unwound
     * evaluation without passing through every {@code finally}.
     */
    public void reset() {
        depth = 0;
    }

    private Expression evaluateList(ListVal list, Environment env) {
        if (list.isEmpty()) {
            return list;
        }
        if (!(list.get(0) instanceof Sym head)) {
            throw new LispException(LispErrorCode.SYNTAX_HEAD_NOT_SYMBOL, "First element must be a symbol");
        }
        switch (head.name()) {
            case DEFINE:
                return define(list, env);
            case LAMBDA:
                return lambda(list, env);
            case IF:
                return conditional(list, env);
            default:
                return application(head, list, env);
        }
    }

    private Expression define(ListVal list, Environment env) {
        if (list.size() != 3 || !(list.get(1) instanceof Sym name)) {
            throw new LispException(LispErrorCode.SYNTAX_INVALID_DEFINE, "Invalid define syntax");
        }
        Expression value = evaluate(list.get(2), env);
        env.define(name.name(), value);
        return value;
    }

    private Expression lambda(ListVal list, Environment env) {
        if (list.size() != 3 || !(list.get(1) instanceof ListVal parameterList)) {
            throw new LispException(LispErrorCode.SYNTAX_INVALID_LAMBDA, "Invalid lambda syntax");
        }
        List<String> parameters = new ArrayList<>(parameterList.size());
        for (Expression parameter : parameterList.elements()) {
            if (!(parameter instanceof Sym sym)) {
                throw new LispException(LispErrorCode.SYNTAX_LAMBDA_PARAMETER, "Lambda parameters must be symbols");
            }
            parameters.add(sym.name());
        }
        return new Closure(parameters, list.get(2), env);
    }

    private Expression conditional(ListVal list, Environment env) {
        if (list.size() != 4) {
            throw new LispException(LispErrorCode.SYNTAX_INVALID_IF, "Invalid if syntax");
        }
        Expression condition = evaluate(list.get(1), env);
        return evaluate(isTruthy(condition) ? list.get(2) : list.get(3), env);
    }

    private Expression application(Sym head, ListVal list, Environment env) {
        Expression callee = evaluate(head, env);
        if (!(callee instanceof Expression.Fn function)) {
            throw new LispException(LispErrorCode.TYPE_NOT_A_FUNCTION, "First element is not a function");
        }

        List<Expression> arguments = new ArrayList<>(list.size() - 1);
        for (int i = 1; i < list.size(); i++) {
            arguments.add(evaluate(list.get(i), env));
        }
        return apply(function, arguments);
    }

    /**
     * Applies a function value to already-evaluated arguments.
     *
     * @param function The function to apply.
     * @param arguments The evaluated arguments in order.
     * @return The result of the call.
     * @throws LispException if the call fails.
     */
    public Expression apply(Expression.Fn function, List<Expression> arguments) {
        if (function instanceof Native nativeFunction) {
            return nativeFunction.apply(arguments);
        }
        Closure closure = (Closure) function;
        if (arguments.size() != closure.arity()) {
            throw new LispException(LispErrorCode.ARITY_MISMATCH, String.format(
                    "Incorrect number of arguments: expected %d, got %d", closure.arity(), arguments.size()));
        }
        Environment callEnv = closure.env().extend();
        for (int i = 0; i < closure.arity(); i++) {
            callEnv.define(closure.parameters().get(i), arguments.get(i));
        }
        if (log.isTraceEnabled()) {
            log.trace("Applying closure {} at depth {}", closure.parameters(), depth);
        }
        return evaluate(closure.body(), callEnv);
    }

    /**
     * The truthiness rule of {@code if}: only a nonzero number is true.
     * @param value An evaluated condition.
     * @return {@code true} if the value is a nonzero number.
     */
    public static boolean isTruthy(Expression value) {
        return value instanceof Num num && num.value() != 0;
    }
}
