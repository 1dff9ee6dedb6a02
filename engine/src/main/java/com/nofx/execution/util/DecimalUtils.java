package com.nofx.execution.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class DecimalUtils {

    public static final int DIVISION_SCALE = 8;
    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private DecimalUtils() {
    }

    /**
     * Parses an exchange decimal string. Missing values read as zero.
     */
    public static BigDecimal bd(String value) {
        if (value == null || value.isBlank()) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(value.trim());
    }

    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        return dividend.divide(divisor, DIVISION_SCALE, RoundingMode.HALF_UP).stripTrailingZeros();
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
