package com.afterlands.aftervariant.core.template;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Converts parameter values to the text that selectors compare and templates show.
 *
 * <p>Numbers are written the way message producers write them: integral values
 * without a fraction and other values in their shortest plain decimal form, so
 * a value of {@code 5.0} matches the key {@code count=5} and renders as
 * {@code "5"}.</p>
 *
 * <pre>
 * 5      -> "5"
 * 5.0    -> "5"
 * 2.50   -> "2.5"
 * -0.0   -> "0"
 * NaN    -> "NaN"
 * true   -> "true"
 * </pre>
 */
public final class ParamFormatter {

    private ParamFormatter() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    @NotNull
    public static String format(@Nullable Object value) {
        if (value instanceof Number number) {
            return formatNumber(number);
        }
        return String.valueOf(value);
    }

    @NotNull
    private static String formatNumber(@NotNull Number number) {
        if (number instanceof Integer || number instanceof Long
                || number instanceof Short || number instanceof Byte
                || number instanceof BigInteger) {
            return number.toString();
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d)) {
                return "NaN";
            }
            if (Double.isInfinite(d)) {
                return d > 0 ? "Infinity" : "-Infinity";
            }
            String text = number instanceof Float ? Float.toString(number.floatValue()) : Double.toString(d);
            return plain(new BigDecimal(text));
        }
        if (number instanceof BigDecimal decimal) {
            return plain(decimal);
        }

        // Lazily parsed JSON numbers and other Number types
        try {
            return plain(new BigDecimal(number.toString().trim()));
        } catch (NumberFormatException e) {
            return number.toString();
        }
    }

    @NotNull
    private static String plain(@NotNull BigDecimal decimal) {
        if (decimal.signum() == 0) {
            return "0";
        }
        return decimal.stripTrailingZeros().toPlainString();
    }
}
