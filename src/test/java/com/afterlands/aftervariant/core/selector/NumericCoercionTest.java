package com.afterlands.aftervariant.core.selector;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NumericCoercionTest {

    @Test
    void numbersPassThrough() {
        assertThat(NumericCoercion.toNumber(5)).hasValue(5.0);
        assertThat(NumericCoercion.toNumber(2.5f)).hasValue(2.5);
        assertThat(NumericCoercion.toNumber(new BigDecimal("-3"))).hasValue(-3.0);
    }

    @Test
    void numericTextIsParsed() {
        assertThat(NumericCoercion.toNumber("5")).hasValue(5.0);
        assertThat(NumericCoercion.toNumber(" -2.5 ")).hasValue(-2.5);
        assertThat(NumericCoercion.toNumber("1e3")).hasValue(1000.0);
        assertThat(NumericCoercion.toNumber(new StringBuilder("7"))).hasValue(7.0);
    }

    @Test
    void blankTextAndBooleansFollowLooseNumericConversion() {
        assertThat(NumericCoercion.toNumber("")).hasValue(0.0);
        assertThat(NumericCoercion.toNumber("   ")).hasValue(0.0);
        assertThat(NumericCoercion.toNumber(true)).hasValue(1.0);
        assertThat(NumericCoercion.toNumber(false)).hasValue(0.0);
    }

    @Test
    void nonNumbersAreEmpty() {
        assertThat(NumericCoercion.toNumber(null)).isEmpty();
        assertThat(NumericCoercion.toNumber("five")).isEmpty();
        assertThat(NumericCoercion.toNumber(Double.NaN)).isEmpty();
        assertThat(NumericCoercion.toNumber(Double.POSITIVE_INFINITY)).isEmpty();
        assertThat(NumericCoercion.toNumber(List.of(1))).isEmpty();
    }
}
