package org.minilisp;

import org.minilisp.model.Expression;

import java.math.BigDecimal;

/**
 * Renders evaluation results the way the read-eval-print loop shows them.
 * Lists and functions have no inspectable representation and print as placeholders.
 */
public final class ExpressionPrinter {

    /** Placeholder printed for function values. */
    public static final String FUNCTION_PLACEHOLDER = "<function>";
    /** Placeholder printed for list values. */
    public static final String LIST_PLACEHOLDER = "<list>";

    private ExpressionPrinter() {}

    /**
     * @param value An evaluated expression.
     * @return Its user-facing text.
     */
    public static String render(Expression value) {
        if (value instanceof Expression.Num num) {
            return renderNumber(num.value());
        }
        if (value instanceof Expression.Sym sym) {
            return sym.name();
        }
        if (value instanceof Expression.Fn) {
            return FUNCTION_PLACEHOLDER;
        }
        return LIST_PLACEHOLDER;
    }

    /**
     * Formats a number in plain decimal notation, never scientific. Integral values print
     * without a fractional part; infinities and NaN use their Java names.
     * @param value The number.
     * @return The decimal text.
     */
    public static String renderNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        // -0.0 prints as 0
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
