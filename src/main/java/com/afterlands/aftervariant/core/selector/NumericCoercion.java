package com.afterlands.aftervariant.core.selector;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.util.OptionalDouble;

/**
 * Coerces plural source parameters to numbers.
 *
 * <h3>Rules:</h3>
 * <ul>
 *     <li>{@link Number} - its value, unless NaN or infinite</li>
 *     <li>{@link Boolean} - 1 or 0</li>
 *     <li>{@link CharSequence} - decimal text such as {@code "5"}, {@code " -2.5 "},
 *     {@code "1e3"}; blank text is 0</li>
 *     <li>anything else, including null - not a number</li>
 * </ul>
 *
 * <p>"Not a number" is returned as an empty {@link OptionalDouble}; callers map it
 * to the {@code other} category.</p>
 */
public final class NumericCoercion {

    private NumericCoercion() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    @NotNull
    public static OptionalDouble toNumber(@Nullable Object value) {
        if (value instanceof Number number) {
            return finite(number.doubleValue());
        }
        if (value instanceof Boolean bool) {
            return OptionalDouble.of(bool ? 1 : 0);
        }
        if (value instanceof CharSequence text) {
            return parse(text.toString());
        }
        return OptionalDouble.empty();
    }

    @NotNull
    private static OptionalDouble parse(@NotNull String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return OptionalDouble.of(0);
        }
        try {
            return finite(new BigDecimal(trimmed).doubleValue());
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    @NotNull
    private static OptionalDouble finite(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(value);
    }
}
