package com.wmevs.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public class Rounding {

    /**
     * Rounds to one decimal place, ties to even (same as {@code round(x * 10) / 10}
     * in the legacy analysis scripts).
     */
    public static double round1(double value) {
        return Math.rint(value * 10.0) / 10.0;
    }

    public static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }

    /**
     * Formats a value rounded to two decimals in its shortest plain form:
     * 0 -> "0", 0.50 -> "0.5", 12.345 -> "12.34".
     */
    public static String format2(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Cannot format non-finite value: " + value);
        }
        BigDecimal rounded = BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_EVEN).stripTrailingZeros();
        if (rounded.signum() == 0) {
            return "0";
        }
        return rounded.toPlainString();
    }
}
