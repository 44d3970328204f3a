package org.minilisp.runtime;

import org.minilisp.api.LispErrorCode;
import org.minilisp.api.LispException;
import org.minilisp.model.Expression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A mutable mapping from symbol names to values, chained to an optional outer environment.
 * The chain implements lexical scoping: lookups walk outward, definitions only ever touch
 * the innermost scope.
 * <p>
 * This class is not thread-safe.
 */
public class Environment {

    private final Map<String, Expression> bindings = new LinkedHashMap<>();
    private final Environment outer;

    /**
     * Creates a root environment with no outer scope.
     */
    public Environment() {
        this(null);
    }

    private Environment(Environment outer) {
        this.outer = outer;
    }

    /**
     * Resolves a name by walking the chain from this scope outward.
     *
     * @param name The symbol name.
     * @return The value of the innermost binding.
     * @throws LispException with {@link LispErrorCode#NAME_UNDEFINED_SYMBOL} if no scope binds the name.
     */
    public Expression lookup(String name) {
        for (Environment env = this; env != null; env = env.outer) {
            Expression value = env.bindings.get(name);
            if (value != null) {
                return value;
            }
        }
        throw new LispException(LispErrorCode.NAME_UNDEFINED_SYMBOL, "Undefined symbol: " + name);
    }

    /**
     * Creates or overwrites a binding in this scope. Outer scopes are never modified, so a
     * binding of the same name further out is shadowed rather than replaced.
     *
     * @param name The symbol name.
     * @param value The value to bind.
     */
    public void define(String name, Expression value) {
        bindings.put(name, value);
    }

    /**
     * Creates a new, empty scope whose outer scope is this environment.
     * @return The child environment.
     */
    public Environment extend() {
        return new Environment(this);
    }

    /**
     * @param name The symbol name.
     * @return {@code true} if any scope in the chain binds the name.
     */
    public boolean isDefined(String name) {
        for (Environment env = this; env != null; env = env.outer) {
            if (env.bindings.containsKey(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return The bindings of this scope only, in definition order.
     */
    public Map<String, Expression> localBindings() {
        return Collections.unmodifiableMap(bindings);
    }

    /**
     * @return The enclosing scope, or empty for the root.
     */
    public Optional<Environment> outer() {
        return Optional.ofNullable(outer);
    }
}
