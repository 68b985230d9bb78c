package com.flagship.pos_core.sale;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Currency arithmetic: two decimals, HALF_UP, applied after every step.
 */
public final class Money {

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, ROUNDING);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Money() {
    }

    public static BigDecimal of(BigDecimal amount) {
        return amount == null ? ZERO : amount.setScale(SCALE, ROUNDING);
    }

    public static BigDecimal of(String amount) {
        return of(new BigDecimal(amount));
    }

    /**
     * {@code amount * percent / 100}, rounded.
     */
    public static BigDecimal percentOf(BigDecimal amount, BigDecimal percent) {
        if (percent == null || percent.signum() == 0) {
            return ZERO;
        }
        return amount.multiply(percent).divide(HUNDRED, SCALE, ROUNDING);
    }

    public static BigDecimal nonNegative(BigDecimal amount) {
        return amount.signum() < 0 ? ZERO : of(amount);
    }
}
