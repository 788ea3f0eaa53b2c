package com.familyportfolio.domain.service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Decimal helpers shared by the position, ledger and aggregation calculators.
 * Rounding is HALF_EVEN throughout.
 */
public final class DecimalMath {

    /** Precision used for intermediate divisions (average costs, weights, ratios). */
    public static final MathContext PRECISION = MathContext.DECIMAL128;

    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private DecimalMath() {
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    public static BigDecimal orOne(BigDecimal value) {
        return value != null ? value : BigDecimal.ONE;
    }

    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        return dividend.divide(divisor, PRECISION);
    }

    public static BigDecimal round(BigDecimal value, int scale) {
        return value.setScale(scale, RoundingMode.HALF_EVEN);
    }

    public static BigDecimal floor(BigDecimal value) {
        return value.setScale(0, RoundingMode.FLOOR);
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    public static boolean isNegative(BigDecimal value) {
        return value != null && value.signum() < 0;
    }

    public static BigDecimal max(BigDecimal value, BigDecimal floor) {
        return value.compareTo(floor) < 0 ? floor : value;
    }

    /**
     * Removes trailing zeros without switching to an exponent notation for whole numbers.
     */
    public static BigDecimal normalize(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    /**
     * Source-currency subtotal of a trade. Taiwan settlements drop the fractional dollar, every
     * other market keeps full precision.
     */
    public static BigDecimal tradeSubtotal(BigDecimal shares, BigDecimal price, boolean taiwanMarket) {
        BigDecimal subtotal = shares.multiply(price);
        return taiwanMarket ? floor(subtotal) : subtotal;
    }
}
