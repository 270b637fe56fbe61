package com.jay.alm.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Rounding rules for amounts (scale 2) and percentages (scale 4), both HALF_EVEN. */
public final class Money {

    public static final int SCALE = 2;
    public static final int PCT_SCALE = 4;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Money() {}

    public static BigDecimal of(BigDecimal amount) {
        return amount == null ? null : amount.setScale(SCALE, RoundingMode.HALF_EVEN);
    }

    public static BigDecimal of(String amount) {
        return of(new BigDecimal(amount));
    }

    /** {@code numerator / denominator} as a percentage; null when the denominator is null or zero. */
    public static BigDecimal percent(BigDecimal numerator, BigDecimal denominator) {
        if (numerator == null || denominator == null || denominator.signum() == 0) return null;
        return numerator.multiply(HUNDRED).divide(denominator, PCT_SCALE, RoundingMode.HALF_EVEN);
    }
}
