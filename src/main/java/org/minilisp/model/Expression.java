package org.minilisp.model;

import org.minilisp.runtime.Environment;

import java.util.List;

/**
 * The single recursive value type of the language. The same representation is used for code
 * (the tree produced by the parser) and for runtime data (the values produced by evaluation).
 * <p>
 * Expressions are immutable once built and may be shared freely; only {@link Environment}s
 * are mutable.
 */
public sealed interface Expression permits Expression.Num, Expression.Sym, Expression.ListVal, Expression.Fn {

    /**
     * A 64-bit floating-point number.
     * @param value The numeric value.
     */
    record Num(double value) implements Expression {}

    /**
     * An identifier, used as a name reference when evaluated.
     * @param name The symbol's name.
     */
    record Sym(String name) implements Expression {}

    /**
     * An ordered, possibly empty sequence of expressions. A non-empty list is a call or a
     * special form when evaluated; the empty list evaluates to itself.
     * @param elements The elements in source order.
     */
    record ListVal(List<Expression> elements) implements Expression {
        /** The shared empty list. */
        public static final ListVal EMPTY = new ListVal(List.of());

        public ListVal {
            elements = List.copyOf(elements);
        }

        /**
         * @return {@code true} if the list has no elements.
         */
        public boolean isEmpty() {
            return elements.isEmpty();
        }

        /**
         * @return The number of elements.
         */
        public int size() {
            return elements.size();
        }

        /**
         * @param index The element index.
         * @return The element at the index.
         */
        public Expression get(int index) {
            return elements.get(index);
        }
    }

    /**
     * A first-class function value, either user-defined or native.
     */
    sealed interface Fn extends Expression permits Closure, Native {}

    /**
     * A user-defined function created by {@code lambda}.
     * @param parameters The parameter names, bound positionally on application.
     * @param body The unevaluated body.
     * @param env The environment active where the lambda was evaluated, shared by reference.
     */
    record Closure(List<String> parameters, Expression body, Environment env) implements Fn {
        public Closure {
            parameters = List.copyOf(parameters);
        }

        /**
         * @return The number of parameters this closure must be applied to.
         */
        public int arity() {
            return parameters.size();
        }

        @Override
        public String toString() {
            return "Closure" + parameters;
        }
    }

    /**
     * A built-in function implemented in Java.
     * @param name The name the function is installed under, used in error messages.
     * @param body The implementation.
     */
    record Native(String name, NativeBody body) implements Fn {

        /**
         * Invokes the implementation with already-evaluated arguments.
         * @param arguments The evaluated arguments in order.
         * @return The result.
         */
        public Expression apply(List<Expression> arguments) {
            return body.apply(arguments);
        }

        @Override
        public String toString() {
            return "Native[" + name + "]";
        }
    }

    /**
     * The implementation of a {@link Native} function. It receives evaluated arguments and may
     * fail with a {@link org.minilisp.api.LispException}.
     */
    @FunctionalInterface
    interface NativeBody {
        /**
         * @param arguments The evaluated arguments in order.
         * @return The result expression.
         */
        Expression apply(List<Expression> arguments);
    }
}
