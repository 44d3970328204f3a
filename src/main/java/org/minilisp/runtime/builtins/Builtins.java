package org.minilisp.runtime.builtins;

import org.minilisp.api.LispErrorCode;
import org.minilisp.api.LispException;
import org.minilisp.model.Expression;
import org.minilisp.model.Expression.Native;
import org.minilisp.model.Expression.Num;
import org.minilisp.runtime.Environment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * The table of native functions installed into the global environment.
 * <p>
 * Every native receives its arguments already evaluated and requires all of them to be numbers.
 * Comparisons return {@code 1} for true and {@code 0} for false, matching the truthiness rule
 * of {@code if}.
 */
public final class Builtins {

    private static final Logger log = LoggerFactory.getLogger(Builtins.class);

    private static final Num TRUE = new Num(1);
    private static final Num FALSE = new Num(0);

    private Builtins() {}

    /**
     * Creates all built-in functions, keyed by the name they are installed under.
     * @return The built-ins in a stable order.
     */
    public static Map<String, Native> all() {
        Map<String, Native> table = new LinkedHashMap<>();
        register(table, "+", args -> fold("+", args, 0, Double::sum));
        register(table, "*", args -> fold("*", args, 1, (a, b) -> a * b));
        register(table, "-", args -> foldFromFirst("-", args, v -> -v, (a, b) -> a - b));
        register(table, "/", args -> foldFromFirst("/", args, v -> 1 / v, (a, b) -> a / b));
        register(table, "%", Builtins::remainder);
        register(table, "<", args -> compare("<", args, (a, b) -> a < b));
        register(table, ">", args -> compare(">", args, (a, b) -> a > b));
        register(table, "==", args -> compare("==", args, (a, b) -> a == b));
        return table;
    }

    /**
     * Installs every built-in into the given environment.
     * @param env The environment, normally the global one.
     */
    public static void installInto(Environment env) {
        Map<String, Native> table = all();
        table.forEach(env::define);
        log.debug("Installed {} built-in functions: {}", table.size(), table.keySet());
    }

    private static void register(Map<String, Native> table, String name, Expression.NativeBody body) {
        table.put(name, new Native(name, body));
    }

    private static Expression fold(String op, List<Expression> args, double identity, DoubleBinaryOperator combine) {
        double result = identity;
        for (Expression arg : args) {
            result = combine.applyAsDouble(result, number(op, arg));
        }
        return new Num(result);
    }

    private static Expression foldFromFirst(String op, List<Expression> args,
                                            DoubleUnaryOperator single,
                                            DoubleBinaryOperator combine) {
        if (args.isEmpty()) {
            throw new LispException(LispErrorCode.ARITY_MISMATCH, "'" + op + "' requires at least one argument");
        }
        double result = number(op, args.get(0));
        if (args.size() == 1) {
            return new Num(single.applyAsDouble(result));
        }
        for (int i = 1; i < args.size(); i++) {
            result = combine.applyAsDouble(result, number(op, args.get(i)));
        }
        return new Num(result);
    }

    private static Expression remainder(List<Expression> args) {
        if (args.size() != 2) {
            throw new LispException(LispErrorCode.ARITY_MISMATCH, "'%' requires exactly two arguments");
        }
        // Java's % on doubles truncates toward zero, like C fmod.
        return new Num(number("%", args.get(0)) % number("%", args.get(1)));
    }

    private static Expression compare(String op, List<Expression> args, DoubleRelation relation) {
        if (args.size() < 2) {
            throw new LispException(LispErrorCode.ARITY_MISMATCH, "'" + op + "' requires at least two arguments");
        }
        boolean holds = true;
        double previous = number(op, args.get(0));
        for (int i = 1; i < args.size(); i++) {
            double next = number(op, args.get(i));
            holds &= relation.test(previous, next);
            previous = next;
        }
        return holds ? TRUE : FALSE;
    }

    private static double number(String op, Expression arg) {
        if (arg instanceof Num num) {
            return num.value();
        }
        throw new LispException(LispErrorCode.TYPE_ARGUMENT_NOT_NUMBER, "Arguments to '" + op + "' must be numbers");
    }

    @FunctionalInterface
    private interface DoubleRelation {
        boolean test(double left, double right);
    }
}
