package com.lynkvertx.lcce.service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Rounding and guarded division helpers shared by the cost engines.
 * Divisions use DECIMAL64 precision; every rounding step rounds up.
 */
public final class CostMath {

    public static final MathContext MC = MathContext.DECIMAL64;

    private CostMath() {
    }

    /** Null-safe value: null becomes zero */
    public static BigDecimal nz(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    public static BigDecimal nz(Integer value) {
        return value != null ? BigDecimal.valueOf(value) : BigDecimal.ZERO;
    }

    public static BigDecimal nz(Long value) {
        return value != null ? BigDecimal.valueOf(value) : BigDecimal.ZERO;
    }

    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        return dividend.divide(divisor, MC);
    }

    /**
     * Divide, returning zero when the divisor is missing or not positive.
     */
    public static BigDecimal divideOrZero(BigDecimal dividend, BigDecimal divisor) {
        if (divisor == null || divisor.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return nz(dividend).divide(divisor, MC);
    }

    public static BigDecimal ceil(BigDecimal value) {
        return value.setScale(0, RoundingMode.CEILING);
    }

    /**
     * Round up to the next whole multiple, e.g. 134.4 to 140 for a multiple of 10.
     */
    public static BigDecimal ceilToMultiple(BigDecimal value, BigDecimal multiple) {
        if (multiple == null || multiple.signum() <= 0) {
            return ceil(value);
        }
        return ceil(value.divide(multiple, MC)).multiply(multiple);
    }

    public static BigDecimal ceilToScale(BigDecimal value, int scale) {
        return value.setScale(scale, RoundingMode.CEILING);
    }

    public static BigDecimal max0(BigDecimal value) {
        return value.signum() < 0 ? BigDecimal.ZERO.setScale(value.scale()) : value;
    }

    /**
     * Per-piece figure: rounded up to the given scale, never negative.
     */
    public static BigDecimal perPiece(BigDecimal value, int scale) {
        return max0(ceilToScale(value, scale));
    }
}
